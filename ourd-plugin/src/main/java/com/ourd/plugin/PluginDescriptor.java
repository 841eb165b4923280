package com.ourd.plugin;

import com.ourd.config.OurdConfig;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.stream.Stream;

/**
 * Static description of one configured plugin.
 */
public record PluginDescriptor(String name,
                               TransportKind transport,
                               String path,
                               List<String> args,
                               int poolWidth,
                               Duration callTimeout,
                               Duration handshakeTimeout,
                               Duration acquireTimeout) {

    public PluginDescriptor {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(transport, "transport");
        Objects.requireNonNull(path, "path");
        Objects.requireNonNull(callTimeout, "callTimeout");
        Objects.requireNonNull(handshakeTimeout, "handshakeTimeout");
        Objects.requireNonNull(acquireTimeout, "acquireTimeout");
        args = args != null ? List.copyOf(args) : List.of();
        if (poolWidth < 1) {
            throw new IllegalArgumentException("poolWidth must be at least 1: " + poolWidth);
        }
    }

    public static PluginDescriptor fromConfig(OurdConfig.PluginConfig config) {
        return new PluginDescriptor(
                config.name(),
                TransportKind.fromConfig(config.transport()),
                config.path(),
                config.args(),
                config.poolWidth(),
                Duration.ofMillis(config.callTimeoutMillis()),
                Duration.ofMillis(config.handshakeTimeoutMillis()),
                Duration.ofMillis(config.acquireTimeoutMillis()));
    }

    /** Command line used to start one instance. */
    public List<String> command() {
        return Stream.concat(Stream.of(path), args.stream()).toList();
    }
}
