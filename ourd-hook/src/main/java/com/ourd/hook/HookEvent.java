package com.ourd.hook;

import com.ourd.router.RequestContext;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * What a hook is invoked with: the record being written, its type, the trigger point and the request
 * it belongs to (null for writes that do not originate from a request).
 */
public record HookEvent(String recordType, TriggerPoint trigger, Map<String, Object> record, RequestContext context) {

    public HookEvent {
        Objects.requireNonNull(recordType, "recordType");
        Objects.requireNonNull(trigger, "trigger");
        record = record != null ? Collections.unmodifiableMap(new LinkedHashMap<>(record)) : Map.of();
    }

    HookEvent withRecord(Map<String, Object> replacement) {
        return new HookEvent(recordType, trigger, replacement, context);
    }
}
