package com.ourd.plugin.protocol;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

/**
 * Client to process message: {@code {"id":n,"kind":"init"|"op","name":"...","context":{...}}}.
 * {@code init} carries no context.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"id", "kind", "name", "context"})
public record PluginRequest(long id, String kind, String name, Object context) {

    public static final String KIND_INIT = "init";
    public static final String KIND_OP = "op";

    public PluginRequest {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(name, "name");
    }

    public static PluginRequest init(long id) {
        return new PluginRequest(id, KIND_INIT, KIND_INIT, null);
    }

    public static PluginRequest op(long id, String name, Object context) {
        return new PluginRequest(id, KIND_OP, name, context);
    }
}
