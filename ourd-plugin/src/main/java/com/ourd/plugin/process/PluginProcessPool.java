package com.ourd.plugin.process;

import com.fasterxml.jackson.databind.JsonNode;
import com.ourd.plugin.PluginCallException;
import com.ourd.plugin.PluginDescriptor;
import com.ourd.plugin.PluginException;
import com.ourd.plugin.PluginHandshakeException;
import com.ourd.plugin.PluginProtocolException;
import com.ourd.plugin.PluginRegistrationInfo;
import com.ourd.plugin.PluginTimeoutException;
import com.ourd.plugin.PluginTransportException;
import com.ourd.plugin.PluginUnavailableException;
import com.ourd.plugin.protocol.PluginCodec;
import com.ourd.plugin.protocol.StreamTransport;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.Collection;
import java.util.Set;
import java.util.concurrent.BlockingDeque;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingDeque;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Fixed-width set of processes for one plugin.
 * <p>
 * Ready processes wait in a FIFO queue: checkout takes the head, checkin appends to the tail.
 * Dead processes are dropped and replaced asynchronously until the {@link ReplacementPolicy}
 * reports too many deaths, after which the pool is disabled and every call fails with
 * {@link PluginUnavailableException}.
 */
public final class PluginProcessPool implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(PluginProcessPool.class);
    private static final long POLL_SLICE_NANOS = TimeUnit.MILLISECONDS.toNanos(100);

    private final PluginDescriptor descriptor;
    private final ProcessLauncher launcher;
    private final PluginCodec codec;
    private final MeterRegistry meterRegistry;
    private final ReplacementPolicy replacementPolicy;
    private final BlockingDeque<PluginProcess> ready = new LinkedBlockingDeque<>();
    private final Set<PluginProcess> live = ConcurrentHashMap.newKeySet();
    private final AtomicInteger nextInstanceId = new AtomicInteger();
    private final ExecutorService replacer;
    private final Counter replacements;
    private volatile boolean disabled;
    private volatile boolean shutdown;

    public PluginProcessPool(PluginDescriptor descriptor,
                             ProcessLauncher launcher,
                             PluginCodec codec,
                             MeterRegistry meterRegistry,
                             ReplacementPolicy replacementPolicy) {
        this.descriptor = descriptor;
        this.launcher = launcher;
        this.codec = codec;
        this.meterRegistry = meterRegistry;
        this.replacementPolicy = replacementPolicy;
        this.replacer = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "ourd-plugin-replacer-" + descriptor.name());
            t.setDaemon(true);
            return t;
        });
        this.replacements = Counter.builder("ourd.plugin.replacements")
                .tag("plugin", descriptor.name())
                .register(meterRegistry);
        Gauge.builder("ourd.plugin.ready", ready, Collection::size)
                .tag("plugin", descriptor.name())
                .register(meterRegistry);
    }

    public String getName() {
        return descriptor.name();
    }

    /**
     * Spawns {@code poolWidth} processes and handshakes each one.
     *
     * @return the registrations declared by the first process
     * @throws PluginHandshakeException if any instance fails; the pool is shut down
     */
    public PluginRegistrationInfo start() throws PluginHandshakeException {
        PluginRegistrationInfo declared = null;
        for (int i = 0; i < descriptor.poolWidth(); i++) {
            PluginProcess process;
            PluginRegistrationInfo info;
            try {
                process = spawn();
                info = handshake(process);
            } catch (PluginHandshakeException e) {
                shutdown();
                throw e;
            }
            if (declared == null) {
                declared = info;
            } else if (!declared.equals(info)) {
                log.warn("Plugin {} instance {} declared different registrations; using the first instance's",
                        getName(), process.getInstanceId());
            }
            ready.offerLast(process);
        }
        log.info("Plugin {} ready: {} process(es)", getName(), descriptor.poolWidth());
        return declared;
    }

    /**
     * Checks out the least recently used Ready process, waiting up to {@code timeout}.
     * Processes found to have exited while idle are dropped and replaced.
     */
    public PluginProcess acquire(Duration timeout) throws PluginUnavailableException {
        long deadline = System.nanoTime() + timeout.toNanos();
        while (true) {
            ensureAvailable();
            long remaining = deadline - System.nanoTime();
            PluginProcess process;
            try {
                process = remaining > 0
                        ? ready.pollFirst(Math.min(remaining, POLL_SLICE_NANOS), TimeUnit.NANOSECONDS)
                        : ready.pollFirst();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new PluginUnavailableException(getName(), "interrupted while waiting for a process", e);
            }
            if (process == null) {
                if (System.nanoTime() - deadline >= 0) {
                    ensureAvailable();
                    throw new PluginUnavailableException(getName(),
                            "no ready process within " + timeout.toMillis() + "ms");
                }
                continue;
            }
            if (!process.isAlive()) {
                log.warn("Plugin {} exited while idle", process);
                handleDeath(process);
                continue;
            }
            if (process.checkOut()) {
                return process;
            }
            handleDeath(process);
        }
    }

    /** Returns a checked-out process: healthy ones go to the tail of the queue, dead ones are replaced. */
    public void release(PluginProcess process) {
        if (process.isAlive() && process.checkIn()) {
            if (shutdown || disabled) {
                process.kill();
                live.remove(process);
                return;
            }
            ready.offerLast(process);
            return;
        }
        handleDeath(process);
    }

    /**
     * Acquires a process, sends one {@code op}, and checks the process back in.
     */
    public JsonNode call(String name, Object context) throws PluginException {
        PluginProcess process;
        try {
            process = acquire(descriptor.acquireTimeout());
        } catch (PluginUnavailableException e) {
            countCall("unavailable");
            throw e;
        }
        try {
            JsonNode result = process.call(name, context, descriptor.callTimeout());
            countCall("success");
            return result;
        } catch (PluginException e) {
            countCall(outcomeOf(e));
            throw e;
        } finally {
            release(process);
        }
    }

    public boolean isDisabled() {
        return disabled;
    }

    public boolean isShutdown() {
        return shutdown;
    }

    public int getReadyCount() {
        return ready.size();
    }

    /** Processes that are not dead: ready, busy or starting. */
    public int getLiveCount() {
        return live.size();
    }

    /** Kills every process and stops replacing them. */
    public void shutdown() {
        if (shutdown) {
            return;
        }
        shutdown = true;
        replacer.shutdownNow();
        for (PluginProcess process : live) {
            process.kill();
        }
        live.clear();
        ready.clear();
        log.info("Plugin {} shut down", getName());
    }

    @Override
    public void close() {
        shutdown();
    }

    private PluginProcess spawn() throws PluginHandshakeException {
        int instanceId = nextInstanceId.getAndIncrement();
        LaunchedProcess launched;
        try {
            launched = launcher.launch(descriptor, instanceId);
        } catch (IOException e) {
            throw new PluginHandshakeException(getName(), "cannot start " + descriptor.command() + ": " + e.getMessage(), e);
        }
        StreamTransport transport = new StreamTransport(getName() + "#" + instanceId,
                launched.getInputStream(), launched.getOutputStream(), codec);
        PluginProcess process = new PluginProcess(getName(), instanceId, launched, transport);
        live.add(process);
        return process;
    }

    private PluginRegistrationInfo handshake(PluginProcess process) throws PluginHandshakeException {
        try {
            return process.handshake(descriptor.handshakeTimeout());
        } catch (PluginHandshakeException e) {
            live.remove(process);
            throw e;
        }
    }

    private void handleDeath(PluginProcess process) {
        process.kill();
        if (!live.remove(process) || shutdown || disabled) {
            return;
        }
        if (replacementPolicy.recordDeath()) {
            disable("processes die too often");
            return;
        }
        scheduleReplacement();
    }

    private void scheduleReplacement() {
        try {
            replacer.execute(this::replace);
        } catch (RejectedExecutionException e) {
            log.debug("Replacement for plugin {} not scheduled: pool is shutting down", getName());
        }
    }

    private void replace() {
        if (shutdown || disabled) {
            return;
        }
        try {
            PluginProcess process = spawn();
            handshake(process);
            if (shutdown || disabled) {
                process.kill();
                live.remove(process);
                return;
            }
            ready.offerLast(process);
            replacements.increment();
            log.info("Plugin {} replaced a dead process with {}", getName(), process);
        } catch (PluginHandshakeException e) {
            log.warn("Replacement process for plugin {} failed: {}", getName(), e.getMessage());
            if (replacementPolicy.recordDeath()) {
                disable("replacement processes keep failing");
            } else {
                scheduleReplacement();
            }
        }
    }

    private void disable(String reason) {
        disabled = true;
        log.error("Plugin {} disabled: {}", getName(), reason);
        PluginProcess process;
        while ((process = ready.pollFirst()) != null) {
            process.kill();
            live.remove(process);
        }
    }

    private void ensureAvailable() throws PluginUnavailableException {
        if (shutdown) {
            throw new PluginUnavailableException(getName(), "plugin " + getName() + " is shut down");
        }
        if (disabled) {
            throw new PluginUnavailableException(getName(), "plugin " + getName() + " is disabled");
        }
    }

    private void countCall(String outcome) {
        Counter.builder("ourd.plugin.calls")
                .tag("plugin", getName())
                .tag("outcome", outcome)
                .register(meterRegistry)
                .increment();
    }

    private static String outcomeOf(PluginException e) {
        if (e instanceof PluginCallException) return "error";
        if (e instanceof PluginTimeoutException) return "timeout";
        if (e instanceof PluginProtocolException) return "protocol";
        if (e instanceof PluginTransportException) return "transport";
        if (e instanceof PluginUnavailableException) return "unavailable";
        return "error";
    }
}
