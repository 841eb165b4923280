package com.ourd.plugin;

import com.fasterxml.jackson.databind.JsonNode;
import com.ourd.hook.TriggerPoint;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * What a plugin declared in its {@code init} result: the actions, hooks, lambdas and timers it provides.
 */
public record PluginRegistrationInfo(List<String> handlers,
                                     List<HookDeclaration> hooks,
                                     List<String> lambdas,
                                     List<TimerDeclaration> timers) {

    public PluginRegistrationInfo {
        handlers = handlers != null ? List.copyOf(handlers) : List.of();
        hooks = hooks != null ? List.copyOf(hooks) : List.of();
        lambdas = lambdas != null ? List.copyOf(lambdas) : List.of();
        timers = timers != null ? List.copyOf(timers) : List.of();
    }

    /**
     * @param name op name sent when the hook fires; defaults to {@code <type>:<trigger>}
     */
    public record HookDeclaration(String recordType, TriggerPoint trigger, String name) {

        public HookDeclaration {
            Objects.requireNonNull(recordType, "recordType");
            Objects.requireNonNull(trigger, "trigger");
            if (name == null || name.isBlank()) {
                name = recordType + ":" + trigger.getWireName();
            }
        }
    }

    public record TimerDeclaration(String schedule, String name) {

        public TimerDeclaration {
            Objects.requireNonNull(schedule, "schedule");
            Objects.requireNonNull(name, "name");
        }
    }

    public boolean isEmpty() {
        return handlers.isEmpty() && hooks.isEmpty() && lambdas.isEmpty() && timers.isEmpty();
    }

    /**
     * Reads the handshake {@code data}. Missing lists are empty; any other shape is rejected.
     *
     * @throws IllegalArgumentException when the data is malformed
     */
    public static PluginRegistrationInfo fromJson(JsonNode data) {
        if (data == null || !data.isObject()) {
            throw new IllegalArgumentException("handshake data must be an object");
        }
        List<HookDeclaration> hooks = new ArrayList<>();
        for (JsonNode hook : array(data, "hooks")) {
            if (!hook.isObject()) {
                throw new IllegalArgumentException("hook declaration must be an object: " + hook);
            }
            hooks.add(new HookDeclaration(
                    requiredText(hook, "type"),
                    TriggerPoint.fromWireName(requiredText(hook, "trigger")),
                    hook.hasNonNull("name") ? hook.get("name").asText() : null));
        }
        List<TimerDeclaration> timers = new ArrayList<>();
        for (JsonNode timer : array(data, "timers")) {
            if (!timer.isObject()) {
                throw new IllegalArgumentException("timer declaration must be an object: " + timer);
            }
            timers.add(new TimerDeclaration(requiredText(timer, "schedule"), requiredText(timer, "name")));
        }
        return new PluginRegistrationInfo(names(data, "handlers"), hooks, names(data, "lambdas"), timers);
    }

    private static List<String> names(JsonNode data, String field) {
        List<String> names = new ArrayList<>();
        for (JsonNode n : array(data, field)) {
            if (!n.isTextual() || n.asText().isBlank()) {
                throw new IllegalArgumentException(field + " entries must be non-empty strings: " + n);
            }
            names.add(n.asText());
        }
        return names;
    }

    private static Iterable<JsonNode> array(JsonNode data, String field) {
        JsonNode node = data.path(field);
        if (node.isMissingNode() || node.isNull()) {
            return List.of();
        }
        if (!node.isArray()) {
            throw new IllegalArgumentException(field + " must be an array");
        }
        return node;
    }

    private static String requiredText(JsonNode node, String field) {
        JsonNode value = node.path(field);
        if (!value.isTextual() || value.asText().isBlank()) {
            throw new IllegalArgumentException("missing '" + field + "' in " + node);
        }
        return value.asText();
    }
}
