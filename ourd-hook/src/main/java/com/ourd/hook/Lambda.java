package com.ourd.hook;

import com.ourd.router.RequestContext;

import java.util.Map;

/**
 * Named, directly callable function. Fails by throwing {@link com.ourd.router.ActionException}.
 */
@FunctionalInterface
public interface Lambda {

    /**
     * @param args    call arguments
     * @param context calling request; null when called outside a request
     * @return call result (any JSON-compatible value)
     */
    Object call(Map<String, Object> args, RequestContext context);
}
