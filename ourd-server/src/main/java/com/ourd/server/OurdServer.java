package com.ourd.server;

import com.ourd.config.OurdConfig;
import com.ourd.hook.HookRegistry;
import com.ourd.hook.LambdaRegistry;
import com.ourd.hook.TimerRegistry;
import com.ourd.hook.TimerScheduler;
import com.ourd.plugin.PluginManager;
import com.ourd.router.Router;
import com.ourd.server.http.ActionHttpServer;
import com.ourd.server.http.RequestDrain;
import com.ourd.server.storage.StorageDriver;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * A fully registered server. {@link #start()} schedules timers and opens the HTTP listener;
 * {@link #stop()} drains in-flight requests, then stops timers and plugin processes.
 */
public final class OurdServer implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(OurdServer.class);

    private final OurdConfig config;
    private final Router router;
    private final HookRegistry hookRegistry;
    private final LambdaRegistry lambdaRegistry;
    private final TimerRegistry timerRegistry;
    private final TimerScheduler timerScheduler;
    private final PluginManager pluginManager;
    private final StorageDriver storageDriver;
    private final MeterRegistry meterRegistry;
    private final RequestDrain drain;
    private final ActionHttpServer httpServer;
    private final AtomicBoolean started = new AtomicBoolean();
    private final AtomicBoolean stopped = new AtomicBoolean();

    OurdServer(OurdConfig config,
               Router router,
               HookRegistry hookRegistry,
               LambdaRegistry lambdaRegistry,
               TimerRegistry timerRegistry,
               TimerScheduler timerScheduler,
               PluginManager pluginManager,
               StorageDriver storageDriver,
               MeterRegistry meterRegistry,
               RequestDrain drain,
               ActionHttpServer httpServer) {
        this.config = config;
        this.router = router;
        this.hookRegistry = hookRegistry;
        this.lambdaRegistry = lambdaRegistry;
        this.timerRegistry = timerRegistry;
        this.timerScheduler = timerScheduler;
        this.pluginManager = pluginManager;
        this.storageDriver = storageDriver;
        this.meterRegistry = meterRegistry;
        this.drain = drain;
        this.httpServer = httpServer;
    }

    public void start() {
        if (!started.compareAndSet(false, true)) {
            throw new IllegalStateException("server already started");
        }
        int timers = timerRegistry.start(timerScheduler);
        log.info("Scheduled {} timer(s)", timers);
        httpServer.start(config.http().bindHost(), config.http().port());
    }

    /** Listening port once started. */
    public int getPort() {
        return httpServer.getPort();
    }

    /** Graceful shutdown. Safe to call more than once and from a shutdown hook. */
    public void stop() {
        if (!stopped.compareAndSet(false, true)) {
            return;
        }
        log.info("Shutting down: draining in-flight requests");
        Duration timeout = Duration.ofMillis(config.http().drainTimeoutMillis());
        try {
            if (!drain.drain(timeout)) {
                log.warn("{} request(s) still in flight after {}ms; stopping anyway", drain.getInFlight(), timeout.toMillis());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while draining requests; stopping anyway");
        }
        if (started.get()) {
            httpServer.stop();
        }
        timerScheduler.close();
        pluginManager.shutdown();
        storageDriver.close();
        log.info("Shutdown complete");
    }

    @Override
    public void close() {
        stop();
    }

    public Router getRouter() {
        return router;
    }

    public HookRegistry getHookRegistry() {
        return hookRegistry;
    }

    public LambdaRegistry getLambdaRegistry() {
        return lambdaRegistry;
    }

    public PluginManager getPluginManager() {
        return pluginManager;
    }

    public MeterRegistry getMeterRegistry() {
        return meterRegistry;
    }
}
