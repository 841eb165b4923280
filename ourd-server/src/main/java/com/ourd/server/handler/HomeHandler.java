package com.ourd.server.handler;

import com.ourd.router.Handler;
import com.ourd.router.RequestContext;

import java.util.Map;

/** Action {@code ""}: liveness answer. */
public final class HomeHandler implements Handler {

    @Override
    public Object handle(RequestContext context) {
        return Map.of("status", "OK");
    }
}
