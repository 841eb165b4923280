package com.ourd.server.preprocess;

import com.ourd.router.AuthPrincipal;
import com.ourd.router.ErrorCode;
import com.ourd.router.Preprocessor;
import com.ourd.router.RequestContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;

/**
 * Accepts requests whose {@code api_key} is the application's API key (principal API_KEY) or its
 * master key (principal MASTER).
 */
public final class ApiKeyPreprocessor implements Preprocessor {

    private static final Logger log = LoggerFactory.getLogger(ApiKeyPreprocessor.class);

    public static final String PAYLOAD_KEY = "api_key";

    private final String appName;
    private final String apiKey;
    private final String masterKey;

    public ApiKeyPreprocessor(String appName, String apiKey, String masterKey) {
        this.appName = appName;
        this.apiKey = apiKey;
        this.masterKey = masterKey;
    }

    @Override
    public void process(RequestContext context) {
        AuthPrincipal principal = resolve(context.getPayloadString(PAYLOAD_KEY));
        if (principal == null) {
            log.debug("Rejected api key for app {} on action {}", appName, context.getAction());
            context.abort(ErrorCode.ACCESS_KEY_NOT_ACCEPTED, "Cannot verify api key");
            return;
        }
        context.setPrincipal(principal);
    }

    /** @return the principal for {@code key}, or null when it matches neither key */
    AuthPrincipal resolve(String key) {
        if (key == null) {
            return null;
        }
        if (masterKey != null && matches(masterKey, key)) {
            return AuthPrincipal.master();
        }
        if (matches(apiKey, key)) {
            return AuthPrincipal.apiKey();
        }
        return null;
    }

    private static boolean matches(String expected, String actual) {
        return MessageDigest.isEqual(expected.getBytes(StandardCharsets.UTF_8), actual.getBytes(StandardCharsets.UTF_8));
    }
}
