package com.ourd.server;

import com.ourd.config.ConfigLoader;
import com.ourd.config.ConfigurationException;
import com.ourd.config.OurdConfig;
import com.ourd.router.DuplicateRegistrationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;
import java.nio.file.Path;
import java.util.Map;

/**
 * Server entry point: {@code ourd [<config file>]}, or the path in {@code OD_CONFIG}.
 * <p>
 * The main thread blocks after startup; a shutdown hook drains requests and stops plugins.
 */
public final class OurdServerApplication {

    private static final Logger log = LoggerFactory.getLogger(OurdServerApplication.class);

    static final String USAGE = "Usage: ourd [<config file>]";

    private OurdServerApplication() {
    }

    public static void main(String[] args) {
        Path configPath = resolveConfigPath(args, System.getenv(), System.out);
        if (configPath == null) {
            return;
        }
        OurdServer server;
        try {
            OurdConfig config = new ConfigLoader().load(configPath);
            LoggingSetup.apply(config.log().level());
            server = ServerBootstrap.initialize(config);
        } catch (ConfigurationException e) {
            log.error("Cannot start: {}", e.getMessage());
            System.exit(1);
            return;
        } catch (DuplicateRegistrationException e) {
            log.error("Cannot start: {}", e.getMessage(), e);
            System.exit(1);
            return;
        }
        Runtime.getRuntime().addShutdownHook(new Thread(server::stop, "ourd-shutdown"));
        server.start();

        try {
            Thread.currentThread().join();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.info("Interrupted, shutting down...");
            server.stop();
        }
    }

    /** Config path from the first argument or {@code OD_CONFIG}; prints the usage line and returns null otherwise. */
    static Path resolveConfigPath(String[] args, Map<String, String> env, PrintStream out) {
        Path path = ConfigLoader.resolvePath(args.length > 0 ? args[0] : null, env);
        if (path == null) {
            out.println(USAGE);
        }
        return path;
    }
}
