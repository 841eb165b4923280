package com.ourd.plugin.protocol;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;

/**
 * Process to client message: {@code {"id":n,"kind":"result"|"error","data":...}}.
 */
public record PluginResponse(long id, String kind, JsonNode data) {

    public static final String KIND_RESULT = "result";
    public static final String KIND_ERROR = "error";

    public PluginResponse {
        data = data != null ? data : NullNode.getInstance();
    }

    public boolean isError() {
        return KIND_ERROR.equals(kind);
    }
}
