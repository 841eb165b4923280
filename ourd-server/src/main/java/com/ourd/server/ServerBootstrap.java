package com.ourd.server;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.ourd.config.OurdConfig;
import com.ourd.hook.ExecutorTimerScheduler;
import com.ourd.hook.HookRegistry;
import com.ourd.hook.LambdaRegistry;
import com.ourd.hook.TimerRegistry;
import com.ourd.hook.TimerScheduler;
import com.ourd.plugin.PluginContextSerializer;
import com.ourd.plugin.PluginDescriptor;
import com.ourd.plugin.PluginManager;
import com.ourd.plugin.PluginRegistrar;
import com.ourd.plugin.process.ExecProcessLauncher;
import com.ourd.plugin.process.ProcessLauncher;
import com.ourd.plugin.protocol.PluginCodec;
import com.ourd.router.Preprocessor;
import com.ourd.router.Route;
import com.ourd.router.Router;
import com.ourd.server.auth.FileTokenStore;
import com.ourd.server.handler.HomeHandler;
import com.ourd.server.handler.LambdaHandler;
import com.ourd.server.handler.RecordHandlers;
import com.ourd.server.http.ActionHttpServer;
import com.ourd.server.http.RequestDrain;
import com.ourd.server.preprocess.ApiKeyPreprocessor;
import com.ourd.server.preprocess.ConnectionPreprocessor;
import com.ourd.server.preprocess.HookRegistryPreprocessor;
import com.ourd.server.preprocess.RequireUserPreprocessor;
import com.ourd.server.preprocess.TokenStorePreprocessor;
import com.ourd.server.preprocess.UserAuthenticator;
import com.ourd.server.storage.StorageDriver;
import com.ourd.server.storage.StorageDrivers;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Clock;
import java.util.List;

/**
 * Registration phase of the server: builds the preprocessor chains, registers native routes,
 * starts and registers plugins, then freezes the router and registries. Nothing is registered
 * after {@link #initialize} returns.
 */
public final class ServerBootstrap {

    private static final Logger log = LoggerFactory.getLogger(ServerBootstrap.class);

    private ServerBootstrap() {
    }

    public static OurdServer initialize(OurdConfig config) {
        return initialize(config, new ExecProcessLauncher(), new ExecutorTimerScheduler(), Clock.systemUTC());
    }

    public static OurdServer initialize(OurdConfig config, ProcessLauncher launcher, TimerScheduler timerScheduler, Clock clock) {
        ObjectMapper mapper = new ObjectMapper();
        MeterRegistry meterRegistry = new SimpleMeterRegistry();
        StorageDriver storageDriver = StorageDrivers.forName(config.db().implName());
        FileTokenStore tokenStore = new FileTokenStore(Path.of(config.tokenStore().path()), mapper).init();

        ApiKeyPreprocessor apiKey = new ApiKeyPreprocessor(config.app().name(), config.app().apiKey(), config.app().masterKey());
        TokenStorePreprocessor tokenStorePreprocessor = new TokenStorePreprocessor(tokenStore);
        UserAuthenticator authenticator = new UserAuthenticator(apiKey, clock);
        ConnectionPreprocessor connection = new ConnectionPreprocessor(storageDriver, config.app().name(), config.db().option());
        HookRegistry hookRegistry = new HookRegistry();

        List<Preprocessor> readChain = List.of(tokenStorePreprocessor, authenticator, connection);
        List<Preprocessor> writeChain = List.of(new HookRegistryPreprocessor(hookRegistry), tokenStorePreprocessor,
                authenticator, connection, new RequireUserPreprocessor());
        List<Preprocessor> pluginChain = readChain;

        Router router = new Router();
        router.register("", new HomeHandler());
        router.register("record:fetch", RecordHandlers.fetch(), readChain);
        router.register("record:save", RecordHandlers.save(), writeChain);
        router.register("record:delete", RecordHandlers.delete(), writeChain);

        LambdaRegistry lambdaRegistry = new LambdaRegistry();
        TimerRegistry timerRegistry = new TimerRegistry();
        PluginManager pluginManager = new PluginManager(launcher, new PluginCodec(mapper), meterRegistry);
        PluginRegistrar registrar = new PluginRegistrar(router, hookRegistry, lambdaRegistry, timerRegistry,
                pluginChain, new PluginContextSerializer(mapper));
        try {
            List<PluginDescriptor> descriptors = config.plugins().stream().map(PluginDescriptor::fromConfig).toList();
            pluginManager.startAll(descriptors, registrar);
            for (String name : lambdaRegistry.getNames()) {
                String owner = lambdaRegistry.get(name).map(LambdaRegistry.LambdaEntry::owner).orElse(null);
                LambdaHandler handler = new LambdaHandler(lambdaRegistry, name);
                router.register(owner != null
                        ? Route.pluginRoute(name, handler, pluginChain, owner)
                        : Route.nativeRoute(name, handler, pluginChain));
            }
        } catch (RuntimeException e) {
            pluginManager.shutdown();
            timerScheduler.close();
            throw e;
        }

        router.freeze();
        hookRegistry.freeze();
        lambdaRegistry.freeze();
        log.info("Registration complete: {} action(s), {} hook(s), {} lambda(s), {} timer(s)",
                router.getActions().size(), hookRegistry.size(), lambdaRegistry.getNames().size(),
                timerRegistry.getTimers().size());

        RequestDrain drain = new RequestDrain();
        ActionHttpServer httpServer = new ActionHttpServer(router, mapper, drain);
        return new OurdServer(config, router, hookRegistry, lambdaRegistry, timerRegistry, timerScheduler,
                pluginManager, storageDriver, meterRegistry, drain, httpServer);
    }
}
