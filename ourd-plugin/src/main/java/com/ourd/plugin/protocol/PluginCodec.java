package com.ourd.plugin.protocol;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.Objects;

/**
 * Line codec for the plugin protocol. One JSON object per line; the encoder never emits a newline
 * inside a message.
 */
public final class PluginCodec {

    private final ObjectMapper mapper;

    public PluginCodec(ObjectMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    public String encode(PluginRequest request) throws JsonProcessingException {
        return mapper.writeValueAsString(request);
    }

    /**
     * Parses one line sent by a plugin.
     *
     * @throws IllegalArgumentException when the line is not a valid response message
     */
    public PluginResponse decode(String line) {
        JsonNode root;
        try {
            root = mapper.readTree(line);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("not JSON: " + e.getOriginalMessage(), e);
        }
        if (root == null || !root.isObject()) {
            throw new IllegalArgumentException("message must be a JSON object");
        }
        JsonNode id = root.path("id");
        if (!id.isIntegralNumber() || !id.canConvertToLong() || id.asLong() < 0) {
            throw new IllegalArgumentException("message id must be a non-negative integer: " + id);
        }
        String kind = root.path("kind").asText(null);
        if (!PluginResponse.KIND_RESULT.equals(kind) && !PluginResponse.KIND_ERROR.equals(kind)) {
            throw new IllegalArgumentException("unknown message kind: " + kind);
        }
        return new PluginResponse(id.asLong(), kind, root.get("data"));
    }
}
