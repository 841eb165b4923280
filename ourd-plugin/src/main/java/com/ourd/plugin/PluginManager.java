package com.ourd.plugin;

import com.ourd.plugin.process.PluginProcessPool;
import com.ourd.plugin.process.ProcessLauncher;
import com.ourd.plugin.process.ReplacementPolicy;
import com.ourd.plugin.protocol.PluginCodec;
import com.ourd.router.DuplicateRegistrationException;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Owns one {@link PluginProcessPool} per configured plugin, from startup to shutdown.
 * Plugins whose handshake fails are logged and skipped; the server keeps serving without them.
 */
public final class PluginManager implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(PluginManager.class);

    private final ProcessLauncher launcher;
    private final PluginCodec codec;
    private final MeterRegistry meterRegistry;
    private final Supplier<ReplacementPolicy> policies;
    private final Map<String, PluginProcessPool> pools = new LinkedHashMap<>();
    private final List<String> failed = new ArrayList<>();

    public PluginManager(ProcessLauncher launcher, PluginCodec codec, MeterRegistry meterRegistry) {
        this(launcher, codec, meterRegistry, ReplacementPolicy::defaults);
    }

    public PluginManager(ProcessLauncher launcher, PluginCodec codec, MeterRegistry meterRegistry,
                         Supplier<ReplacementPolicy> policies) {
        this.launcher = launcher;
        this.codec = codec;
        this.meterRegistry = meterRegistry;
        this.policies = policies;
    }

    /**
     * Starts and registers every plugin in order.
     *
     * @return number of plugins that started
     */
    public synchronized int startAll(List<PluginDescriptor> descriptors, PluginRegistrar registrar) {
        int started = 0;
        for (PluginDescriptor descriptor : descriptors) {
            if (pools.containsKey(descriptor.name())) {
                throw new DuplicateRegistrationException("plugin", descriptor.name());
            }
            PluginProcessPool pool = new PluginProcessPool(descriptor, launcher, codec, meterRegistry, policies.get());
            pools.put(descriptor.name(), pool);
            if (registrar.register(pool)) {
                started++;
            } else {
                failed.add(descriptor.name());
            }
        }
        if (!failed.isEmpty()) {
            log.warn("Started {} of {} plugin(s); unavailable: {}", started, descriptors.size(), failed);
        } else if (started > 0) {
            log.info("Started {} plugin(s)", started);
        }
        return started;
    }

    public synchronized Optional<PluginProcessPool> getPool(String name) {
        return Optional.ofNullable(pools.get(name));
    }

    public synchronized List<PluginProcessPool> getPools() {
        return new ArrayList<>(pools.values());
    }

    /** Names of plugins whose handshake failed at startup. */
    public synchronized List<String> getFailedPlugins() {
        return new ArrayList<>(failed);
    }

    /** Terminates every plugin process. */
    public synchronized void shutdown() {
        for (PluginProcessPool pool : pools.values()) {
            try {
                pool.shutdown();
            } catch (RuntimeException e) {
                log.warn("Shutting down plugin {} failed: {}", pool.getName(), e.getMessage(), e);
            }
        }
    }

    @Override
    public void close() {
        shutdown();
    }
}
