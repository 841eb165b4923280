package com.ourd.server.http;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ourd.router.ErrorCode;
import com.ourd.router.HttpMethod;
import com.ourd.router.Router;
import com.ourd.server.handler.HomeHandler;
import com.ourd.server.preprocess.ApiKeyPreprocessor;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ActionHttpServerTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private final HttpClient client = HttpClient.newHttpClient();
    private final RequestDrain drain = new RequestDrain();
    private ActionHttpServer server;

    @BeforeEach
    void setUp() {
        Router router = new Router();
        router.register("", new HomeHandler());
        router.register("test:echo", context -> context.getPayload());
        router.register("test:secure", context -> context.getPrincipal().kind().name(),
                new ApiKeyPreprocessor("app", "secret", null));
        router.registerPath(HttpMethod.GET, "files/(.+)", context -> Map.of(
                "action", context.getAction(),
                "params", context.getPathParams(),
                "q", String.valueOf(context.getPayload().get("q"))));
        router.freeze();
        server = new ActionHttpServer(router, mapper, drain);
        server.start("127.0.0.1", 0);
    }

    @AfterEach
    void tearDown() {
        server.stop();
    }

    private HttpResponse<String> post(String path, String body, String... headers) throws Exception {
        HttpRequest.Builder builder = HttpRequest.newBuilder(uri(path))
                .timeout(Duration.ofSeconds(10))
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(body));
        if (headers.length > 0) {
            builder.headers(headers);
        }
        return client.send(builder.build(), HttpResponse.BodyHandlers.ofString());
    }

    private HttpResponse<String> get(String path) throws Exception {
        return client.send(HttpRequest.newBuilder(uri(path)).timeout(Duration.ofSeconds(10)).GET().build(),
                HttpResponse.BodyHandlers.ofString());
    }

    private URI uri(String path) {
        return URI.create("http://127.0.0.1:" + server.getPort() + path);
    }

    @Test
    void home_returnsOk() throws Exception {
        HttpResponse<String> response = post("/", "{}");

        assertEquals(200, response.statusCode());
        assertEquals("OK", mapper.readTree(response.body()).path("result").path("status").asText());
    }

    @Test
    void actionInBody_isDispatched() throws Exception {
        HttpResponse<String> response = post("/", """
                {"action": "test:echo", "value": 7}
                """);

        JsonNode result = mapper.readTree(response.body()).path("result");
        assertEquals(200, response.statusCode());
        assertEquals(7, result.path("value").asInt());
    }

    @Test
    void actionDerivedFromPath() throws Exception {
        HttpResponse<String> response = post("/test/echo", """
                {"value": "x"}
                """);

        assertEquals(200, response.statusCode());
        assertEquals("x", mapper.readTree(response.body()).path("result").path("value").asText());
    }

    @Test
    void unknownAction_is404WithErrorBody() throws Exception {
        HttpResponse<String> response = post("/", """
                {"action": "no:such"}
                """);

        JsonNode error = mapper.readTree(response.body()).path("error");
        assertEquals(404, response.statusCode());
        assertEquals(ErrorCode.UNDEFINED_OPERATION.getCode(), error.path("code").asInt());
        assertEquals("UndefinedOperation", error.path("name").asText());
    }

    @Test
    void malformedBody_isBadRequest() throws Exception {
        HttpResponse<String> response = post("/", "{not json");

        assertEquals(400, response.statusCode());
        assertEquals(ErrorCode.BAD_REQUEST.getCode(), mapper.readTree(response.body()).path("error").path("code").asInt());
    }

    @Test
    void nonObjectBody_isBadRequest() throws Exception {
        HttpResponse<String> response = post("/", "[1,2]");

        assertEquals(400, response.statusCode());
    }

    @Test
    void apiKeyHeader_isCopiedIntoPayload() throws Exception {
        HttpResponse<String> withHeader = post("/test/secure", "{}", ActionHttpServer.HEADER_API_KEY, "secret");
        HttpResponse<String> without = post("/test/secure", "{}");

        assertEquals(200, withHeader.statusCode());
        assertEquals("API_KEY", mapper.readTree(withHeader.body()).path("result").asText());
        assertEquals(401, without.statusCode());
    }

    @Test
    void pathRoute_receivesCaptureGroupsAndQuery() throws Exception {
        HttpResponse<String> response = get("/files/a/b.txt?q=1");

        JsonNode result = mapper.readTree(response.body()).path("result");
        assertEquals(200, response.statusCode());
        assertEquals("a/b.txt", result.path("params").path(0).asText());
        assertEquals("1", result.path("q").asText());
        assertEquals("GET files/(.+)", result.path("action").asText());
    }

    @Test
    void getWithoutPathRoute_isUndefined() throws Exception {
        HttpResponse<String> response = get("/nothing/here");

        assertEquals(404, response.statusCode());
    }

    @Test
    void draining_rejectsNewRequests() throws Exception {
        assertTrue(drain.drain(Duration.ofSeconds(1)));
        assertTrue(drain.isDraining());

        HttpResponse<String> response = post("/", "{}");

        assertEquals(503, response.statusCode());
        assertEquals(ErrorCode.SERVICE_UNAVAILABLE.getCode(), mapper.readTree(response.body()).path("error").path("code").asInt());
    }

    @Test
    void actionFromPath_mapsSlashesToColons() {
        assertEquals("record:save", ActionHttpServer.actionFromPath("/record/save"));
        assertEquals("record:save", ActionHttpServer.actionFromPath("/record/save/"));
        assertEquals("", ActionHttpServer.actionFromPath("/"));
    }
}
