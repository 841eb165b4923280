package com.ourd.hook;

import com.ourd.router.ActionException;
import com.ourd.router.DuplicateRegistrationException;
import com.ourd.router.ErrorCode;
import com.ourd.router.RequestContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Named lambdas contributed by plugins (or natively). Names are unique; registration only during startup.
 */
public final class LambdaRegistry {

    private static final Logger log = LoggerFactory.getLogger(LambdaRegistry.class);

    private volatile Map<String, LambdaEntry> byName = new LinkedHashMap<>();
    private volatile boolean frozen;

    /** Registered lambda with its owner (plugin name, or null for native lambdas). */
    public record LambdaEntry(String name, Lambda lambda, String owner) {
        public LambdaEntry {
            Objects.requireNonNull(name, "name");
            Objects.requireNonNull(lambda, "lambda");
        }
    }

    public void registerLambda(String name, Lambda lambda) {
        registerLambda(name, lambda, null);
    }

    /**
     * @throws DuplicateRegistrationException if a lambda with this name exists
     * @throws IllegalStateException          if the registry is frozen
     */
    public synchronized void registerLambda(String name, Lambda lambda, String owner) {
        Objects.requireNonNull(name, "name");
        String n = name.trim();
        if (n.isEmpty()) throw new IllegalArgumentException("Lambda name must be non-blank");
        if (frozen) {
            throw new IllegalStateException("Lambda registry is frozen; lambdas can only be registered during startup");
        }
        if (byName.putIfAbsent(n, new LambdaEntry(n, lambda, owner)) != null) {
            throw new DuplicateRegistrationException("Lambda", n);
        }
        log.debug("Registered lambda {} (owner={})", n, owner != null ? owner : "native");
    }

    public synchronized void freeze() {
        if (frozen) return;
        byName = Collections.unmodifiableMap(new LinkedHashMap<>(byName));
        frozen = true;
    }

    public Optional<LambdaEntry> get(String name) {
        return name == null ? Optional.empty() : Optional.ofNullable(byName.get(name));
    }

    public List<String> getNames() {
        return List.copyOf(byName.keySet());
    }

    /**
     * Calls a lambda by name.
     *
     * @throws ActionException {@link ErrorCode#UNDEFINED_OPERATION} for unknown names, or the lambda's own error
     */
    public Object invoke(String name, Map<String, Object> args, RequestContext context) {
        LambdaEntry entry = byName.get(name);
        if (entry == null) {
            throw new ActionException(ErrorCode.UNDEFINED_OPERATION, "Undefined lambda: " + name);
        }
        return entry.lambda().call(args != null ? args : Map.of(), context);
    }
}
