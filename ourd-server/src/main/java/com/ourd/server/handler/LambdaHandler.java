package com.ourd.server.handler;

import com.ourd.hook.LambdaRegistry;
import com.ourd.router.ActionException;
import com.ourd.router.ErrorCode;
import com.ourd.router.Handler;
import com.ourd.router.RequestContext;

import java.util.Map;

/**
 * Exposes a registered lambda as an action of the same name. The lambda receives the payload's
 * {@code args} object.
 */
public final class LambdaHandler implements Handler {

    public static final String ARGS_KEY = "args";

    private final LambdaRegistry registry;
    private final String name;

    public LambdaHandler(LambdaRegistry registry, String name) {
        this.registry = registry;
        this.name = name;
    }

    @Override
    @SuppressWarnings("unchecked")
    public Object handle(RequestContext context) {
        Object args = context.getPayload().get(ARGS_KEY);
        if (args != null && !(args instanceof Map)) {
            throw new ActionException(ErrorCode.INVALID_ARGUMENT, "args must be an object");
        }
        return registry.invoke(name, (Map<String, Object>) args, context);
    }
}
