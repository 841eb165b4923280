package com.ourd.server.preprocess;

import com.ourd.router.AuthPrincipal;
import com.ourd.router.ErrorCode;
import com.ourd.router.Preprocessor;
import com.ourd.router.RequestContext;
import com.ourd.server.auth.AccessToken;
import com.ourd.server.auth.TokenStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Optional;

/**
 * Authenticates the request.
 * <p>
 * With an {@code access_token}: the token must exist in the token store attached by
 * {@link TokenStorePreprocessor} and must not be expired; the principal becomes that user.
 * Without one: the API key rules of {@link ApiKeyPreprocessor} apply.
 */
public final class UserAuthenticator implements Preprocessor {

    private static final Logger log = LoggerFactory.getLogger(UserAuthenticator.class);

    public static final String PAYLOAD_KEY = "access_token";

    private final ApiKeyPreprocessor apiKeys;
    private final Clock clock;

    public UserAuthenticator(ApiKeyPreprocessor apiKeys, Clock clock) {
        this.apiKeys = apiKeys;
        this.clock = clock;
    }

    @Override
    public void process(RequestContext context) {
        String tokenValue = context.getPayloadString(PAYLOAD_KEY);
        if (tokenValue == null) {
            apiKeys.process(context);
            return;
        }
        TokenStore store = context.getAttribute(TokenStorePreprocessor.ATTRIBUTE, TokenStore.class);
        if (store == null) {
            throw new IllegalStateException("token store preprocessor must run before the authenticator");
        }
        Optional<AccessToken> token = store.get(tokenValue);
        if (token.isEmpty()) {
            context.abort(ErrorCode.ACCESS_TOKEN_NOT_ACCEPTED, "token does not exist or it has expired");
            return;
        }
        if (token.get().isExpired(clock.instant())) {
            log.debug("Rejected expired token of user {}", token.get().userInfoID());
            context.abort(ErrorCode.ACCESS_TOKEN_NOT_ACCEPTED, "token does not exist or it has expired");
            return;
        }
        context.setPrincipal(AuthPrincipal.user(token.get().userInfoID()));
    }
}
