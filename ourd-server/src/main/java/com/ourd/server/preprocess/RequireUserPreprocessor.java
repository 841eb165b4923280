package com.ourd.server.preprocess;

import com.ourd.router.AuthPrincipal;
import com.ourd.router.ErrorCode;
import com.ourd.router.Preprocessor;
import com.ourd.router.RequestContext;

/** Writes need a user (or the master key). */
public final class RequireUserPreprocessor implements Preprocessor {

    @Override
    public void process(RequestContext context) {
        AuthPrincipal principal = context.getPrincipal();
        if (!principal.isUser() && !principal.isMaster()) {
            context.abort(ErrorCode.NOT_AUTHENTICATED, "writing requires an authenticated user");
        }
    }
}
