package com.ourd.plugin;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ourd.router.ActionError;
import com.ourd.router.ErrorCode;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Converts plugin failures into client-facing {@link ActionError}s.
 */
public final class PluginErrors {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private PluginErrors() {
    }

    public static ActionError toActionError(PluginException e) {
        if (e instanceof PluginCallException call) {
            return call.getError();
        }
        Map<String, Object> info = new LinkedHashMap<>();
        if (e.getPluginName() != null) {
            info.put("plugin", e.getPluginName());
        }
        if (e instanceof PluginTimeoutException) {
            return ActionError.of(ErrorCode.PLUGIN_TIMEOUT, e.getMessage(), info);
        }
        if (e instanceof PluginUnavailableException) {
            return ActionError.of(ErrorCode.PLUGIN_UNAVAILABLE, e.getMessage(), info);
        }
        return ActionError.of(ErrorCode.UNEXPECTED_ERROR, "plugin failure: " + e.getMessage(), info);
    }

    /**
     * Decodes the {@code data} of an {@code error} message, expected as {@code {code, message, info}}.
     * Anything else becomes an {@link ErrorCode#UNEXPECTED_ERROR} whose message is the raw data.
     */
    @SuppressWarnings("unchecked")
    public static ActionError decodeError(JsonNode data) {
        if (data == null || data.isNull() || data.isMissingNode()) {
            return ActionError.of(ErrorCode.UNEXPECTED_ERROR, "plugin returned an error without data");
        }
        if (!data.isObject()) {
            return ActionError.of(ErrorCode.UNEXPECTED_ERROR, data.isTextual() ? data.asText() : data.toString());
        }
        int code = data.path("code").canConvertToInt() ? data.path("code").asInt() : ErrorCode.UNEXPECTED_ERROR.getCode();
        String name = data.hasNonNull("name")
                ? data.get("name").asText()
                : ErrorCode.fromCode(code).map(ErrorCode::getErrorName).orElse(ErrorCode.UNEXPECTED_ERROR.getErrorName());
        String message = data.path("message").asText("");
        Map<String, Object> info = data.path("info").isObject()
                ? MAPPER.convertValue(data.get("info"), Map.class)
                : null;
        return new ActionError(code, name, message, info);
    }
}
