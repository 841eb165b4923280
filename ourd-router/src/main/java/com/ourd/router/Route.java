package com.ourd.router;

import java.util.List;
import java.util.Objects;

/**
 * One registered action: handler plus its ordered preprocessor chain. Immutable once built.
 *
 * @param action        unique action key (e.g. {@code record:save}); empty string is the home action
 * @param handler       handler run after the chain passes
 * @param preprocessors chain, in the exact order given at registration
 * @param kind          whether the handler runs in-process or in a plugin process
 * @param owner         plugin name for {@link Kind#PLUGIN} routes; null for native routes
 */
public record Route(String action, Handler handler, List<Preprocessor> preprocessors, Kind kind, String owner) {

    /** Closed set of handler origins, fixed at registration time. */
    public enum Kind {
        NATIVE, PLUGIN
    }

    public Route {
        Objects.requireNonNull(action, "action");
        Objects.requireNonNull(handler, "handler");
        Objects.requireNonNull(kind, "kind");
        preprocessors = preprocessors != null ? List.copyOf(preprocessors) : List.of();
        if (kind == Kind.PLUGIN && (owner == null || owner.isBlank())) {
            throw new IllegalArgumentException("Plugin route requires an owner: " + action);
        }
    }

    public static Route nativeRoute(String action, Handler handler, List<Preprocessor> preprocessors) {
        return new Route(action, handler, preprocessors, Kind.NATIVE, null);
    }

    public static Route pluginRoute(String action, Handler handler, List<Preprocessor> preprocessors, String plugin) {
        return new Route(action, handler, preprocessors, Kind.PLUGIN, plugin);
    }
}
