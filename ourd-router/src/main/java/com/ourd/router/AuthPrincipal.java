package com.ourd.router;

import java.util.Objects;

/**
 * Who the current request acts as. Set by authentication preprocessors; handlers only read it.
 *
 * @param kind   how the request was authenticated
 * @param userId user id for {@link Kind#USER}; null otherwise
 */
public record AuthPrincipal(Kind kind, String userId) {

    private static final AuthPrincipal NONE = new AuthPrincipal(Kind.NONE, null);
    private static final AuthPrincipal API_KEY = new AuthPrincipal(Kind.API_KEY, null);
    private static final AuthPrincipal MASTER = new AuthPrincipal(Kind.MASTER, null);

    public enum Kind {
        NONE, API_KEY, MASTER, USER
    }

    public AuthPrincipal {
        Objects.requireNonNull(kind, "kind");
        if (kind == Kind.USER && (userId == null || userId.isBlank())) {
            throw new IllegalArgumentException("USER principal requires a user id");
        }
    }

    public static AuthPrincipal none() {
        return NONE;
    }

    public static AuthPrincipal apiKey() {
        return API_KEY;
    }

    public static AuthPrincipal master() {
        return MASTER;
    }

    public static AuthPrincipal user(String userId) {
        return new AuthPrincipal(Kind.USER, userId);
    }

    public boolean isUser() {
        return kind == Kind.USER;
    }

    public boolean isMaster() {
        return kind == Kind.MASTER;
    }
}
