package com.ourd.server.auth;

import java.util.Optional;

/**
 * Persists access tokens.
 */
public interface TokenStore {

    Optional<AccessToken> get(String accessToken);

    void put(AccessToken token);

    /** @return true when a token was removed */
    boolean delete(String accessToken);
}
