package com.ourd.router;

/**
 * Gate run before a handler, in registration order. A preprocessor either mutates the context
 * (attach a principal, a storage connection, a registry) or aborts the request with
 * {@link RequestContext#abort(ActionError)} (throwing {@link ActionException} has the same effect).
 * Implementations keep no per-request state of their own.
 */
@FunctionalInterface
public interface Preprocessor {

    /**
     * @param context the request being dispatched
     */
    void process(RequestContext context);
}
