package com.ourd.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Reads the JSON configuration file. Unknown fields are ignored; missing optional fields take their
 * defaults. Every validation failure is a {@link ConfigurationException}.
 */
public final class ConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);

    /** Environment variable naming the config file when no path argument is given. */
    public static final String ENV_CONFIG = "OD_CONFIG";

    private final ObjectMapper mapper;

    public ConfigLoader() {
        this(new ObjectMapper());
    }

    public ConfigLoader(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    /**
     * Resolves the config path: the explicit argument wins, then {@value #ENV_CONFIG}.
     *
     * @return the path, or null when neither is set
     */
    public static Path resolvePath(String argument, Map<String, String> env) {
        if (argument != null && !argument.isBlank()) {
            return Paths.get(argument.trim());
        }
        String fromEnv = env.get(ENV_CONFIG);
        if (fromEnv != null && !fromEnv.isBlank()) {
            return Paths.get(fromEnv.trim());
        }
        return null;
    }

    public OurdConfig load(Path file) {
        String json;
        try {
            json = Files.readString(file);
        } catch (IOException e) {
            throw new ConfigurationException("Cannot read config file " + file + ": " + e.getMessage(), e);
        }
        OurdConfig config = parse(json);
        log.info("Loaded config from {}: app={}, plugins={}", file, config.app().name(), config.plugins().size());
        return config;
    }

    public OurdConfig parse(String json) {
        JsonNode root;
        try {
            root = mapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new ConfigurationException("Malformed config: " + e.getOriginalMessage(), e);
        }
        if (root == null || !root.isObject()) {
            throw new ConfigurationException("Config must be a JSON object");
        }

        JsonNode http = root.path("http");
        OurdConfig.HttpConfig httpConfig = new OurdConfig.HttpConfig(
                text(http, "host", OurdConfig.HttpConfig.DEFAULT_HOST),
                positiveLong(http, "drainTimeoutMillis", OurdConfig.HttpConfig.DEFAULT_DRAIN_TIMEOUT_MILLIS, "http.drainTimeoutMillis"));
        httpConfig.port();

        JsonNode app = root.path("app");
        String appName = text(app, "name", null);
        if (appName == null) {
            throw new ConfigurationException("app.name is required");
        }
        String apiKey = text(app, "apiKey", null);
        if (apiKey == null) {
            throw new ConfigurationException("app.apiKey is required");
        }
        OurdConfig.AppConfig appConfig = new OurdConfig.AppConfig(appName, apiKey, text(app, "masterKey", null));

        JsonNode db = root.path("db");
        OurdConfig.DbConfig dbConfig = new OurdConfig.DbConfig(
                text(db, "implName", OurdConfig.DbConfig.DEFAULT_IMPL), text(db, "option", ""));

        OurdConfig.TokenStoreConfig tokenStoreConfig = new OurdConfig.TokenStoreConfig(
                text(root.path("tokenStore"), "path", OurdConfig.TokenStoreConfig.DEFAULT_PATH));
        OurdConfig.LogConfig logConfig = new OurdConfig.LogConfig(
                text(root.path("log"), "level", OurdConfig.LogConfig.DEFAULT_LEVEL));

        return new OurdConfig(httpConfig, appConfig, dbConfig, tokenStoreConfig, logConfig, plugins(root.path("plugins")));
    }

    private List<OurdConfig.PluginConfig> plugins(JsonNode node) {
        if (node.isMissingNode() || node.isNull()) {
            return List.of();
        }
        if (!node.isArray()) {
            throw new ConfigurationException("plugins must be an array");
        }
        List<OurdConfig.PluginConfig> plugins = new ArrayList<>();
        Set<String> names = new HashSet<>();
        int index = 0;
        for (JsonNode entry : node) {
            String where = "plugins[" + index++ + "]";
            String path = text(entry, "path", null);
            if (path == null) {
                throw new ConfigurationException(where + ".path is required");
            }
            String transport = text(entry, "transport", OurdConfig.PluginConfig.TRANSPORT_EXEC);
            if (!OurdConfig.PluginConfig.TRANSPORT_EXEC.equals(transport)) {
                throw new ConfigurationException(where + ": unsupported transport '" + transport + "'");
            }
            String name = text(entry, "name", defaultName(path));
            if (!names.add(name)) {
                throw new ConfigurationException("Duplicate plugin name: " + name);
            }
            List<String> args = new ArrayList<>();
            JsonNode argsNode = entry.path("args");
            if (argsNode.isArray()) {
                argsNode.forEach(a -> args.add(a.asText()));
            } else if (!argsNode.isMissingNode() && !argsNode.isNull()) {
                throw new ConfigurationException(where + ".args must be an array of strings");
            }
            plugins.add(new OurdConfig.PluginConfig(
                    name,
                    transport,
                    path,
                    args,
                    positiveInt(entry, "poolWidth", OurdConfig.PluginConfig.DEFAULT_POOL_WIDTH, where + ".poolWidth"),
                    positiveLong(entry, "callTimeoutMillis", OurdConfig.PluginConfig.DEFAULT_CALL_TIMEOUT_MILLIS, where + ".callTimeoutMillis"),
                    positiveLong(entry, "handshakeTimeoutMillis", OurdConfig.PluginConfig.DEFAULT_HANDSHAKE_TIMEOUT_MILLIS, where + ".handshakeTimeoutMillis"),
                    positiveLong(entry, "acquireTimeoutMillis", OurdConfig.PluginConfig.DEFAULT_ACQUIRE_TIMEOUT_MILLIS, where + ".acquireTimeoutMillis")));
        }
        return plugins;
    }

    static String defaultName(String path) {
        Path fileName = Paths.get(path).getFileName();
        return fileName != null ? fileName.toString() : path;
    }

    private static String text(JsonNode parent, String field, String defaultValue) {
        JsonNode node = parent.path(field);
        if (node.isMissingNode() || node.isNull()) {
            return defaultValue;
        }
        String value = node.asText("").trim();
        return value.isEmpty() ? defaultValue : value;
    }

    private static int positiveInt(JsonNode parent, String field, int defaultValue, String label) {
        long value = positiveLong(parent, field, defaultValue, label);
        if (value > Integer.MAX_VALUE) {
            throw new ConfigurationException(label + " must be at most " + Integer.MAX_VALUE + ", got " + value);
        }
        return (int) value;
    }

    private static long positiveLong(JsonNode parent, String field, long defaultValue, String label) {
        JsonNode node = parent.path(field);
        if (node.isMissingNode() || node.isNull()) {
            return defaultValue;
        }
        if (!node.canConvertToLong() || !node.isIntegralNumber()) {
            throw new ConfigurationException(label + " must be an integer");
        }
        long value = node.asLong();
        if (value <= 0) {
            throw new ConfigurationException(label + " must be positive, got " + value);
        }
        return value;
    }
}
