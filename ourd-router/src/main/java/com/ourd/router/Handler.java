package com.ourd.router;

/**
 * Business logic behind an action; runs once, after every preprocessor of its route passed.
 * Returns the result, or fails by throwing {@link ActionException} (or by aborting the context).
 * Handlers never authenticate or open connections themselves; the preprocessor chain did that.
 */
@FunctionalInterface
public interface Handler {

    Object handle(RequestContext context);
}
