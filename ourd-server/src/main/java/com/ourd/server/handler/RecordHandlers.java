package com.ourd.server.handler;

import com.ourd.hook.HookRegistry;
import com.ourd.router.ActionError;
import com.ourd.router.ActionException;
import com.ourd.router.ErrorCode;
import com.ourd.router.Handler;
import com.ourd.router.RequestContext;
import com.ourd.server.storage.RecordConnection;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Minimal record actions over a {@link RecordConnection}: {@code record:save}, {@code record:fetch}
 * and {@code record:delete}. Payload: {@code {"type": "note", "record": {...}}} for saves,
 * {@code {"type": "note", "id": "..."}} otherwise.
 * <p>
 * Saves and deletes go through {@link HookRegistry#executeWrite} and {@link HookRegistry#executeDelete},
 * so before-hooks can veto them.
 */
public final class RecordHandlers {

    public static final String OWNER_FIELD = "_ownerID";

    private RecordHandlers() {
    }

    public static Handler save() {
        return context -> {
            String type = requiredString(context, "type");
            Map<String, Object> record = new LinkedHashMap<>(requiredObject(context, "record"));
            if (context.getPrincipal().isUser()) {
                record.putIfAbsent(OWNER_FIELD, context.getPrincipal().userId());
            }
            RecordConnection connection = connection(context);
            return hooks(context).executeWrite(type, record, context, r -> connection.save(type, r));
        };
    }

    public static Handler fetch() {
        return context -> {
            String type = requiredString(context, "type");
            String id = requiredString(context, "id");
            return connection(context).fetch(type, id).orElseThrow(() -> notFound(type, id));
        };
    }

    public static Handler delete() {
        return context -> {
            String type = requiredString(context, "type");
            String id = requiredString(context, "id");
            RecordConnection connection = connection(context);
            Map<String, Object> existing = connection.fetch(type, id).orElseThrow(() -> notFound(type, id));
            hooks(context).executeDelete(type, existing, context, r -> {
                connection.delete(type, id);
                return r;
            });
            return Map.of("_id", id, "deleted", true);
        };
    }

    private static RecordConnection connection(RequestContext context) {
        if (context.getStorage() instanceof RecordConnection connection) {
            return connection;
        }
        throw new IllegalStateException("record actions need a record connection; is the connection preprocessor in the chain?");
    }

    private static HookRegistry hooks(RequestContext context) {
        HookRegistry registry = context.getAttribute(HookRegistry.CONTEXT_ATTRIBUTE, HookRegistry.class);
        if (registry == null) {
            throw new IllegalStateException("hook registry preprocessor must run before record writes");
        }
        return registry;
    }

    private static String requiredString(RequestContext context, String key) {
        String value = context.getPayloadString(key);
        if (value == null) {
            throw new ActionException(ActionError.of(ErrorCode.INVALID_ARGUMENT, "missing '" + key + "'", Map.of("arguments", key)));
        }
        return value;
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> requiredObject(RequestContext context, String key) {
        Object value = context.getPayload().get(key);
        if (!(value instanceof Map)) {
            throw new ActionException(ActionError.of(ErrorCode.INVALID_ARGUMENT, "'" + key + "' must be an object", Map.of("arguments", key)));
        }
        return (Map<String, Object>) value;
    }

    private static ActionException notFound(String type, String id) {
        return new ActionException(ActionError.of(ErrorCode.RESOURCE_NOT_FOUND, "record not found",
                Map.of("type", type, "id", id)));
    }
}
