package com.ourd.config;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable server configuration, as loaded by {@link ConfigLoader}.
 */
public record OurdConfig(HttpConfig http,
                         AppConfig app,
                         DbConfig db,
                         TokenStoreConfig tokenStore,
                         LogConfig log,
                         List<PluginConfig> plugins) {

    public OurdConfig {
        Objects.requireNonNull(http, "http");
        Objects.requireNonNull(app, "app");
        Objects.requireNonNull(db, "db");
        Objects.requireNonNull(tokenStore, "tokenStore");
        Objects.requireNonNull(log, "log");
        plugins = plugins != null ? List.copyOf(plugins) : List.of();
    }

    public Optional<PluginConfig> getPlugin(String name) {
        return plugins.stream().filter(p -> p.name().equals(name)).findFirst();
    }

    /** Listen address in {@code host:port} form; an empty host binds all interfaces. */
    public record HttpConfig(String host, long drainTimeoutMillis) {

        public static final String DEFAULT_HOST = ":3000";
        public static final long DEFAULT_DRAIN_TIMEOUT_MILLIS = 10_000;

        public String bindHost() {
            int colon = host.lastIndexOf(':');
            String h = colon >= 0 ? host.substring(0, colon) : host;
            return h.isBlank() ? "0.0.0.0" : h;
        }

        public int port() {
            int colon = host.lastIndexOf(':');
            if (colon < 0) {
                throw new ConfigurationException("http.host must be host:port, got '" + host + "'");
            }
            try {
                return Integer.parseInt(host.substring(colon + 1));
            } catch (NumberFormatException e) {
                throw new ConfigurationException("http.host has an invalid port: '" + host + "'", e);
            }
        }
    }

    public record AppConfig(String name, String apiKey, String masterKey) {
    }

    public record DbConfig(String implName, String option) {

        public static final String DEFAULT_IMPL = "memory";
    }

    public record TokenStoreConfig(String path) {

        public static final String DEFAULT_PATH = "data/token";
    }

    public record LogConfig(String level) {

        public static final String DEFAULT_LEVEL = "debug";
    }

    /**
     * One plugin entry. Only the {@code exec} transport is supported: the process is started from
     * {@code path} with {@code args}.
     */
    public record PluginConfig(String name,
                               String transport,
                               String path,
                               List<String> args,
                               int poolWidth,
                               long callTimeoutMillis,
                               long handshakeTimeoutMillis,
                               long acquireTimeoutMillis) {

        public static final String TRANSPORT_EXEC = "exec";
        public static final int DEFAULT_POOL_WIDTH = 1;
        public static final long DEFAULT_CALL_TIMEOUT_MILLIS = 30_000;
        public static final long DEFAULT_HANDSHAKE_TIMEOUT_MILLIS = 10_000;
        public static final long DEFAULT_ACQUIRE_TIMEOUT_MILLIS = 5_000;

        public PluginConfig {
            Objects.requireNonNull(name, "name");
            Objects.requireNonNull(path, "path");
            transport = transport != null ? transport : TRANSPORT_EXEC;
            args = args != null ? List.copyOf(args) : List.of();
        }

        /** Entry with default pool width and timeouts. */
        public static PluginConfig exec(String name, String path, List<String> args) {
            return new PluginConfig(name, TRANSPORT_EXEC, path, args, DEFAULT_POOL_WIDTH,
                    DEFAULT_CALL_TIMEOUT_MILLIS, DEFAULT_HANDSHAKE_TIMEOUT_MILLIS, DEFAULT_ACQUIRE_TIMEOUT_MILLIS);
        }
    }
}
