package com.ourd.server.preprocess;

import com.ourd.router.Preprocessor;
import com.ourd.router.RequestContext;
import com.ourd.server.auth.TokenStore;

/** Attaches the token store to the request. */
public final class TokenStorePreprocessor implements Preprocessor {

    public static final String ATTRIBUTE = "ourd.tokenStore";

    private final TokenStore store;

    public TokenStorePreprocessor(TokenStore store) {
        this.store = store;
    }

    @Override
    public void process(RequestContext context) {
        context.setAttribute(ATTRIBUTE, store);
    }
}
