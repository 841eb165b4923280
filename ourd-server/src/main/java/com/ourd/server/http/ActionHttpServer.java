package com.ourd.server.http;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ourd.router.ActionError;
import com.ourd.router.ActionResponse;
import com.ourd.router.ErrorCode;
import com.ourd.router.HttpMethod;
import com.ourd.router.PathMatch;
import com.ourd.router.RequestContext;
import com.ourd.router.Router;
import com.ourd.router.UnknownActionException;
import com.ourd.server.preprocess.ApiKeyPreprocessor;
import com.ourd.server.preprocess.UserAuthenticator;
import io.javalin.Javalin;
import io.javalin.http.Context;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * HTTP front of the router.
 * <p>
 * {@code POST /} with a JSON object body dispatches the body's {@code action}; without one the action
 * is derived from the path ({@code POST /record/save} is {@code record:save}). Other methods, and POSTs
 * whose path matches a path route, go to the path routes. Responses are {@code {"result": ...}} or
 * {@code {"error": {...}}} with the error's HTTP status.
 */
public final class ActionHttpServer {

    private static final Logger log = LoggerFactory.getLogger(ActionHttpServer.class);
    private static final TypeReference<LinkedHashMap<String, Object>> PAYLOAD_TYPE = new TypeReference<>() {
    };

    public static final String HEADER_API_KEY = "X-Ourd-Api-Key";
    public static final String HEADER_ACCESS_TOKEN = "X-Ourd-Access-Token";

    private final Router router;
    private final ObjectMapper mapper;
    private final RequestDrain drain;
    private Javalin app;

    public ActionHttpServer(Router router, ObjectMapper mapper, RequestDrain drain) {
        this.router = router;
        this.mapper = mapper;
        this.drain = drain;
    }

    public synchronized void start(String host, int port) {
        if (app != null) {
            throw new IllegalStateException("HTTP server already started");
        }
        app = Javalin.create(config -> config.showJavalinBanner = false);
        app.post("/", this::handle);
        app.post("/*", this::handle);
        app.get("/*", this::handle);
        app.put("/*", this::handle);
        app.delete("/*", this::handle);
        app.patch("/*", this::handle);
        app.exception(Exception.class, (e, ctx) -> {
            log.error("Unhandled failure for {} {}: {}", ctx.method(), ctx.path(), e.getMessage(), e);
            write(ctx, ActionResponse.failure(ActionError.of(ErrorCode.UNEXPECTED_ERROR, "unexpected error")));
        });
        app.start(host, port);
        log.info("Listening on {}:{}", host, app.port());
    }

    /** Actual listening port (useful when started on port 0). */
    public synchronized int getPort() {
        if (app == null) {
            throw new IllegalStateException("HTTP server not started");
        }
        return app.port();
    }

    public synchronized void stop() {
        if (app != null) {
            app.stop();
            app = null;
        }
    }

    private void handle(Context ctx) {
        if (!drain.enter()) {
            write(ctx, ActionResponse.failure(ActionError.of(ErrorCode.SERVICE_UNAVAILABLE, "server is shutting down")));
            return;
        }
        try {
            if (log.isDebugEnabled()) {
                log.debug("{} {} headers={} body={}", ctx.method(), ctx.path(), ctx.headerMap().keySet(), ctx.body());
            }
            ActionResponse response = dispatch(ctx);
            String json = write(ctx, response);
            log.debug("Response {}: {}", ctx.statusCode(), json);
        } finally {
            drain.exit();
        }
    }

    private ActionResponse dispatch(Context ctx) {
        HttpMethod method = HttpMethod.valueOf(ctx.method().name());
        Optional<PathMatch> pathMatch = router.matchPath(method, ctx.path());
        if (pathMatch.isPresent()) {
            Map<String, Object> payload = new LinkedHashMap<>();
            ctx.queryParamMap().forEach((k, v) -> payload.put(k, v.isEmpty() ? null : v.get(0)));
            copyHeaders(ctx, payload);
            try (RequestContext context = new RequestContext(pathMatch.get().route().key(), payload, pathMatch.get().params())) {
                return router.dispatch(pathMatch.get(), context);
            }
        }
        if (method != HttpMethod.POST) {
            return ActionResponse.failure(new UnknownActionException(method, ctx.path()).getError());
        }
        Map<String, Object> payload;
        try {
            payload = parseBody(ctx.body());
        } catch (JsonProcessingException e) {
            return ActionResponse.failure(ActionError.of(ErrorCode.BAD_REQUEST, "fails to decode the request body: " + e.getOriginalMessage()));
        }
        if (payload == null) {
            return ActionResponse.failure(ActionError.of(ErrorCode.BAD_REQUEST, "request body must be a JSON object"));
        }
        copyHeaders(ctx, payload);
        Object action = payload.get("action");
        String actionName = action instanceof String s ? s : actionFromPath(ctx.path());
        try (RequestContext context = new RequestContext(actionName, payload)) {
            return router.dispatch(context);
        }
    }

    /** @return the body as a map, or null when it is JSON but not an object */
    private Map<String, Object> parseBody(String body) throws JsonProcessingException {
        if (body == null || body.isBlank()) {
            return new LinkedHashMap<>();
        }
        JsonNode node = mapper.readTree(body);
        if (node == null || !node.isObject()) {
            return null;
        }
        return mapper.convertValue(node, PAYLOAD_TYPE);
    }

    /** {@code /record/save} to {@code record:save}; {@code /} to the home action {@code ""}. */
    static String actionFromPath(String path) {
        String trimmed = path.startsWith("/") ? path.substring(1) : path;
        if (trimmed.endsWith("/")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        return trimmed.replace('/', ':');
    }

    private static void copyHeaders(Context ctx, Map<String, Object> payload) {
        copyHeader(ctx, HEADER_API_KEY, ApiKeyPreprocessor.PAYLOAD_KEY, payload);
        copyHeader(ctx, HEADER_ACCESS_TOKEN, UserAuthenticator.PAYLOAD_KEY, payload);
    }

    private static void copyHeader(Context ctx, String header, String key, Map<String, Object> payload) {
        String value = ctx.header(header);
        if (value != null && !value.isBlank() && payload.get(key) == null) {
            payload.put(key, value);
        }
    }

    private String write(Context ctx, ActionResponse response) {
        Map<String, Object> body = new LinkedHashMap<>();
        int status = 200;
        if (response.isError()) {
            body.put("error", errorBody(response.error()));
            status = response.error().httpStatus();
        } else {
            body.put("result", response.result());
        }
        String json;
        try {
            json = mapper.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            log.error("Cannot serialize response: {}", e.getOriginalMessage(), e);
            status = 500;
            json = "{\"error\":{\"code\":" + ErrorCode.UNEXPECTED_ERROR.getCode()
                    + ",\"name\":\"" + ErrorCode.UNEXPECTED_ERROR.getErrorName()
                    + "\",\"message\":\"cannot serialize response\"}}";
        }
        ctx.status(status);
        ctx.contentType("application/json");
        ctx.result(json);
        return json;
    }

    private static Map<String, Object> errorBody(ActionError error) {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("code", error.code());
        out.put("name", error.name());
        out.put("message", error.message());
        if (!error.info().isEmpty()) {
            out.put("info", error.info());
        }
        return out;
    }
}
