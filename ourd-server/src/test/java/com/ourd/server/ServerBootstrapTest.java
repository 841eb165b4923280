package com.ourd.server;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ourd.config.ConfigLoader;
import com.ourd.config.ConfigurationException;
import com.ourd.config.OurdConfig;
import com.ourd.hook.ExecutorTimerScheduler;
import com.ourd.hook.TriggerPoint;
import com.ourd.plugin.process.ProcessLauncher;
import com.ourd.router.Route;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ServerBootstrapTest {

    private static final String SH_PLUGIN = """
            #!/bin/sh
            while IFS= read -r line; do
              id=$(printf '%s' "$line" | sed -n 's/^{"id":\\([0-9]*\\).*/\\1/p')
              case "$line" in
                *'"kind":"init"'*) printf '{"id":%s,"kind":"result","data":{"handlers":["sh:echo"],"lambdas":["sh:hello"]}}\\n' "$id" ;;
                *) printf '{"id":%s,"kind":"result","data":{"ok":true}}\\n' "$id" ;;
              esac
            done
            """;

    private final ObjectMapper mapper = new ObjectMapper();
    private final HttpClient client = HttpClient.newHttpClient();

    private OurdConfig config(Path dir, String plugins) {
        return new ConfigLoader().parse("""
                {
                  "http": {"host": "127.0.0.1:0", "drainTimeoutMillis": 2000},
                  "app": {"name": "app", "apiKey": "secret"},
                  "tokenStore": {"path": "%s"},
                  "plugins": %s
                }
                """.formatted(dir.resolve("token").toString().replace("\\", "\\\\"), plugins));
    }

    private HttpResponse<String> post(OurdServer server, String path, String body) throws Exception {
        HttpRequest request = HttpRequest.newBuilder(URI.create("http://127.0.0.1:" + server.getPort() + path))
                .timeout(Duration.ofSeconds(10))
                .header("X-Ourd-Api-Key", "secret")
                .POST(HttpRequest.BodyPublishers.ofString(body))
                .build();
        return client.send(request, HttpResponse.BodyHandlers.ofString());
    }

    @Test
    void initialize_registersNativeActionsAndFreezes(@TempDir Path dir) {
        OurdServer server = ServerBootstrap.initialize(config(dir, "[]"));
        try {
            assertTrue(server.getRouter().getActions().containsAll(List.of("", "record:fetch", "record:save", "record:delete")));
            assertTrue(server.getRouter().isFrozen());
            assertThrows(IllegalStateException.class,
                    () -> server.getHookRegistry().registerHook("note", TriggerPoint.BEFORE_SAVE, "late", event -> null));
            assertThrows(IllegalStateException.class,
                    () -> server.getLambdaRegistry().registerLambda("late", (args, context) -> null));
            assertTrue(Files.isDirectory(dir.resolve("token")));
            assertThrows(IllegalStateException.class,
                    () -> server.getRouter().register("late:action", context -> null));
        } finally {
            server.stop();
        }
    }

    @Test
    void failingPlugin_isSkippedAndServerStillServes(@TempDir Path dir) throws Exception {
        ProcessLauncher failing = (descriptor, instanceId) -> {
            throw new IOException("no such executable");
        };
        OurdServer server = ServerBootstrap.initialize(config(dir, """
                [{"name": "broken", "path": "/nowhere/broken"}]
                """), failing, new ExecutorTimerScheduler(), Clock.systemUTC());
        try {
            server.start();

            assertEquals(List.of("broken"), server.getPluginManager().getFailedPlugins());
            HttpResponse<String> response = post(server, "/", "{}");
            assertEquals(200, response.statusCode());
            assertEquals("OK", mapper.readTree(response.body()).path("result").path("status").asText());
        } finally {
            server.stop();
        }
    }

    @Test
    void recordWrite_withoutUser_isNotAuthenticated(@TempDir Path dir) throws Exception {
        OurdServer server = ServerBootstrap.initialize(config(dir, "[]"));
        try {
            server.start();

            HttpResponse<String> response = post(server, "/record/save", """
                    {"type": "note", "record": {"title": "x"}}
                    """);

            assertEquals(401, response.statusCode());
        } finally {
            server.stop();
        }
    }

    @Test
    void unknownStorageDriver_failsStartup(@TempDir Path dir) {
        OurdConfig base = config(dir, "[]");
        OurdConfig config = new OurdConfig(base.http(), base.app(), new OurdConfig.DbConfig("pq", ""),
                base.tokenStore(), base.log(), base.plugins());

        assertThrows(ConfigurationException.class, () -> ServerBootstrap.initialize(config));
    }

    @Test
    @EnabledOnOs({OS.LINUX, OS.MAC})
    void shellPlugin_actionsAndLambdasAreServed(@TempDir Path dir) throws Exception {
        Path script = dir.resolve("plugin.sh");
        Files.writeString(script, SH_PLUGIN);
        OurdServer server = ServerBootstrap.initialize(config(dir, """
                [{"name": "sh", "path": "sh", "args": ["%s"]}]
                """.formatted(script.toString())));
        try {
            server.start();

            JsonNode action = mapper.readTree(post(server, "/sh/echo", "{}").body());
            JsonNode lambda = mapper.readTree(post(server, "/", """
                    {"action": "sh:hello", "args": {"name": "x"}}
                    """).body());

            assertTrue(action.path("result").path("ok").asBoolean());
            assertTrue(lambda.path("result").path("ok").asBoolean());
            assertEquals(Route.Kind.PLUGIN, server.getRouter().getRoute("sh:hello").orElseThrow().kind());
            assertEquals("sh", server.getLambdaRegistry().get("sh:hello").orElseThrow().owner());
            assertEquals(2.0, server.getMeterRegistry().get("ourd.plugin.calls")
                    .tag("plugin", "sh").tag("outcome", "success").counter().count());
        } finally {
            server.stop();
        }
        assertTrue(server.getPluginManager().getPools().stream().allMatch(pool -> pool.isShutdown()));
    }

    @Test
    void stop_isIdempotent(@TempDir Path dir) {
        OurdServer server = ServerBootstrap.initialize(config(dir, "[]"));
        server.start();
        server.stop();
        server.stop();

        assertFalse(server.getRouter().getActions().isEmpty());
    }
}
