package com.ourd.plugin;

import com.ourd.hook.Lambda;
import com.ourd.plugin.process.PluginProcessPool;
import com.ourd.router.ActionException;
import com.ourd.router.RequestContext;

import java.util.Map;

public final class PluginLambda implements Lambda {

    private final PluginProcessPool pool;
    private final String name;
    private final PluginContextSerializer serializer;

    public PluginLambda(PluginProcessPool pool, String name, PluginContextSerializer serializer) {
        this.pool = pool;
        this.name = name;
        this.serializer = serializer;
    }

    @Override
    public Object call(Map<String, Object> args, RequestContext context) {
        try {
            return serializer.toValue(pool.call(name, serializer.lambda(args, context)));
        } catch (PluginException e) {
            throw new ActionException(PluginErrors.toActionError(e), e);
        }
    }
}
