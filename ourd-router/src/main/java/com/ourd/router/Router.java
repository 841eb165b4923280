package com.ourd.router;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Maps action names (and path patterns) to a handler plus its ordered preprocessor chain, and dispatches.
 * <p>
 * Two phases: during startup, routes are added with {@code register*}; {@link #freeze()} then turns the
 * tables into immutable copies. After freezing, registration fails and lookups need no synchronization,
 * so any number of request threads may call {@link #dispatch(RequestContext)} concurrently.
 * <p>
 * Dispatch contract: preprocessors run one by one in registration order; the first one that leaves an error
 * on the context stops the chain and its error is the response (the handler never runs). Otherwise the
 * handler runs exactly once and its result or error is the response.
 */
public final class Router {

    private static final Logger log = LoggerFactory.getLogger(Router.class);

    private volatile Map<String, Route> routes = new LinkedHashMap<>();
    private volatile List<PathRoute> pathRoutes = new ArrayList<>();
    private volatile boolean frozen;

    /**
     * Registers a native action.
     *
     * @throws DuplicateRegistrationException if the action is already bound
     * @throws IllegalStateException          if the router is frozen
     */
    public void register(String action, Handler handler, Preprocessor... preprocessors) {
        register(action, handler, Arrays.asList(preprocessors));
    }

    public void register(String action, Handler handler, List<Preprocessor> preprocessors) {
        register(Route.nativeRoute(action, handler, preprocessors));
    }

    /**
     * Registers a route. The chain order of {@code route} is kept verbatim.
     *
     * @throws DuplicateRegistrationException if the action is already bound; the existing route is kept
     * @throws IllegalStateException          if the router is frozen
     */
    public synchronized void register(Route route) {
        Objects.requireNonNull(route, "route");
        ensureOpen();
        if (routes.putIfAbsent(route.action(), route) != null) {
            throw new DuplicateRegistrationException("Action", route.action());
        }
        log.debug("Registered {} action '{}' with {} preprocessor(s)", route.kind(), route.action(), route.preprocessors().size());
    }

    /**
     * Registers a path rule. Rules are tried in registration order and the first match wins.
     *
     * @param regex pattern matched against the whole path without its leading slash (e.g. {@code files/(.+)})
     * @throws DuplicateRegistrationException if the same method and pattern are already bound
     */
    public void registerPath(HttpMethod method, String regex, Handler handler, Preprocessor... preprocessors) {
        registerPath(new PathRoute(method, Pattern.compile(regex), handler, Arrays.asList(preprocessors)));
    }

    public synchronized void registerPath(PathRoute route) {
        Objects.requireNonNull(route, "route");
        ensureOpen();
        for (PathRoute existing : pathRoutes) {
            if (existing.key().equals(route.key())) {
                throw new DuplicateRegistrationException("Path rule", route.key());
            }
        }
        pathRoutes.add(route);
        log.debug("Registered path rule {} with {} preprocessor(s)", route.key(), route.preprocessors().size());
    }

    /**
     * Ends the registration phase. Idempotent.
     */
    public synchronized void freeze() {
        if (frozen) return;
        routes = Collections.unmodifiableMap(new LinkedHashMap<>(routes));
        pathRoutes = List.copyOf(pathRoutes);
        frozen = true;
        log.info("Router ready: {} action(s), {} path rule(s)", routes.size(), pathRoutes.size());
    }

    public boolean isFrozen() {
        return frozen;
    }

    public Optional<Route> getRoute(String action) {
        return Optional.ofNullable(routes.get(action));
    }

    public boolean hasAction(String action) {
        return routes.containsKey(action);
    }

    /** Registered actions in registration order. */
    public List<String> getActions() {
        return List.copyOf(routes.keySet());
    }

    /**
     * Dispatches by the context's action. An unknown action yields {@link ErrorCode#UNDEFINED_OPERATION}.
     * Never throws for per-request failures; the returned response (and the context) carry the error.
     */
    public ActionResponse dispatch(RequestContext context) {
        Objects.requireNonNull(context, "context");
        Route route = routes.get(context.getAction());
        if (route == null) {
            context.abort(new UnknownActionException(context.getAction()).getError());
            return ActionResponse.of(context);
        }
        return run(context.getAction(), route.handler(), route.preprocessors(), context);
    }

    /**
     * Finds the first path rule for {@code method} that fully matches {@code path}.
     */
    public Optional<PathMatch> matchPath(HttpMethod method, String path) {
        for (PathRoute route : pathRoutes) {
            List<String> params = route.match(method, path);
            if (params != null) {
                return Optional.of(new PathMatch(route, params));
            }
        }
        return Optional.empty();
    }

    /**
     * Dispatches a matched path rule with the same chain semantics as actions.
     * The context should have been created with {@code match.params()} as its path parameters.
     */
    public ActionResponse dispatch(PathMatch match, RequestContext context) {
        Objects.requireNonNull(match, "match");
        Objects.requireNonNull(context, "context");
        PathRoute route = match.route();
        return run(route.key(), route.handler(), route.preprocessors(), context);
    }

    private ActionResponse run(String key, Handler handler, List<Preprocessor> chain, RequestContext context) {
        for (Preprocessor preprocessor : chain) {
            try {
                preprocessor.process(context);
            } catch (ActionException e) {
                context.abort(e.getError());
            } catch (RuntimeException e) {
                log.error("Preprocessor failed for {}: {}", key, e.getMessage(), e);
                context.abort(ActionError.of(ErrorCode.UNEXPECTED_ERROR, "Unexpected error: " + e.getMessage()));
            }
            if (context.hasError()) {
                log.debug("Request {} aborted by preprocessor: {}", key, context.getError().message());
                return ActionResponse.of(context);
            }
        }
        try {
            Object result = handler.handle(context);
            if (!context.hasError()) {
                context.setResult(result);
            }
        } catch (ActionException e) {
            context.abort(e.getError());
        } catch (RuntimeException e) {
            log.error("Handler failed for {}: {}", key, e.getMessage(), e);
            context.abort(ActionError.of(ErrorCode.UNEXPECTED_ERROR, "Unexpected error: " + e.getMessage()));
        }
        return ActionResponse.of(context);
    }

    private void ensureOpen() {
        if (frozen) {
            throw new IllegalStateException("Router is frozen; routes can only be registered during startup");
        }
    }
}
