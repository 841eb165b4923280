package com.ourd.hook;

import java.util.Map;

/**
 * Invocable bound to a (record type, trigger point) pair.
 * <p>
 * A {@code before-*} hook fails the write by throwing {@link com.ourd.router.ActionException}; it may also
 * return a replacement record which later hooks and the write itself then see. For {@code after-*} hooks
 * the return value is ignored.
 */
@FunctionalInterface
public interface Hook {

    /**
     * @param event record, trigger and originating request
     * @return replacement record, or null to keep the record unchanged
     */
    Map<String, Object> invoke(HookEvent event);
}
