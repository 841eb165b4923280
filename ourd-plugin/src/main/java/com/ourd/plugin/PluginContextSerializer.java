package com.ourd.plugin;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ourd.hook.HookEvent;
import com.ourd.router.AuthPrincipal;
import com.ourd.router.RequestContext;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Builds the {@code context} object of {@code op} messages and converts result data back to
 * plain Java values (maps, lists, strings, numbers, booleans).
 */
public final class PluginContextSerializer {

    private final ObjectMapper mapper;

    public PluginContextSerializer(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public Map<String, Object> action(RequestContext context) {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("action", context.getAction());
        out.put("payload", context.getPayload());
        out.put("principal", principal(context));
        return out;
    }

    public Map<String, Object> hook(HookEvent event) {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("recordType", event.recordType());
        out.put("trigger", event.trigger().getWireName());
        out.put("record", event.record());
        out.put("principal", principal(event.context()));
        return out;
    }

    public Map<String, Object> lambda(Map<String, Object> args, RequestContext context) {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("args", args != null ? args : Map.of());
        out.put("principal", principal(context));
        return out;
    }

    public Map<String, Object> timer(String schedule) {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("schedule", schedule);
        return out;
    }

    public Object toValue(JsonNode data) {
        if (data == null || data.isNull() || data.isMissingNode()) {
            return null;
        }
        return mapper.convertValue(data, Object.class);
    }

    @SuppressWarnings("unchecked")
    public Map<String, Object> toRecord(JsonNode data) {
        return data != null && data.isObject() ? mapper.convertValue(data, Map.class) : null;
    }

    private static Map<String, Object> principal(RequestContext context) {
        AuthPrincipal principal = context != null ? context.getPrincipal() : AuthPrincipal.none();
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("kind", principal.kind().name().toLowerCase(Locale.ROOT));
        if (principal.userId() != null) {
            out.put("userId", principal.userId());
        }
        return out;
    }
}
