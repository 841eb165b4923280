package com.ourd.plugin;

import com.ourd.hook.HookRegistry;
import com.ourd.hook.LambdaRegistry;
import com.ourd.hook.TimerRegistry;
import com.ourd.plugin.process.PluginProcessPool;
import com.ourd.router.Preprocessor;
import com.ourd.router.Route;
import com.ourd.router.Router;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * Starts a plugin's pool and installs what the plugin declared into the router and registries.
 * <p>
 * A handshake failure disables only that plugin: it is logged and the server continues without
 * its registrations. A declaration that collides with an existing registration is fatal
 * ({@link com.ourd.router.DuplicateRegistrationException} propagates).
 */
public final class PluginRegistrar {

    private static final Logger log = LoggerFactory.getLogger(PluginRegistrar.class);

    private final Router router;
    private final HookRegistry hookRegistry;
    private final LambdaRegistry lambdaRegistry;
    private final TimerRegistry timerRegistry;
    private final List<Preprocessor> actionPreprocessors;
    private final PluginContextSerializer serializer;

    /**
     * @param actionPreprocessors chain run before every plugin-backed action
     */
    public PluginRegistrar(Router router,
                           HookRegistry hookRegistry,
                           LambdaRegistry lambdaRegistry,
                           TimerRegistry timerRegistry,
                           List<Preprocessor> actionPreprocessors,
                           PluginContextSerializer serializer) {
        this.router = Objects.requireNonNull(router, "router");
        this.hookRegistry = Objects.requireNonNull(hookRegistry, "hookRegistry");
        this.lambdaRegistry = Objects.requireNonNull(lambdaRegistry, "lambdaRegistry");
        this.timerRegistry = Objects.requireNonNull(timerRegistry, "timerRegistry");
        this.actionPreprocessors = List.copyOf(actionPreprocessors);
        this.serializer = Objects.requireNonNull(serializer, "serializer");
    }

    /**
     * @return true when the plugin was started and installed; false when its handshake failed
     */
    public boolean register(PluginProcessPool pool) {
        PluginRegistrationInfo info;
        try {
            info = pool.start();
        } catch (PluginHandshakeException e) {
            log.error("Plugin {} disabled, continuing without it: {}", pool.getName(), e.getMessage(), e);
            return false;
        }
        install(pool, info);
        return true;
    }

    void install(PluginProcessPool pool, PluginRegistrationInfo info) {
        String plugin = pool.getName();
        for (String action : info.handlers()) {
            router.register(Route.pluginRoute(action, new PluginHandler(pool, action, serializer), actionPreprocessors, plugin));
        }
        for (PluginRegistrationInfo.HookDeclaration hook : info.hooks()) {
            hookRegistry.registerHook(hook.recordType(), hook.trigger(), hook.name(),
                    new PluginHook(pool, hook.name(), serializer), plugin);
        }
        for (String lambda : info.lambdas()) {
            lambdaRegistry.registerLambda(lambda, new PluginLambda(pool, lambda, serializer), plugin);
        }
        for (PluginRegistrationInfo.TimerDeclaration timer : info.timers()) {
            timerRegistry.registerTimer(timer.schedule(), timer.name(),
                    new PluginTimerJob(pool, timer.name(), timer.schedule(), serializer), plugin);
        }
        log.info("Plugin {} registered {} handler(s), {} hook(s), {} lambda(s), {} timer(s)", plugin,
                info.handlers().size(), info.hooks().size(), info.lambdas().size(), info.timers().size());
    }
}
