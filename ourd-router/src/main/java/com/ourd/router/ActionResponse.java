package com.ourd.router;

import java.util.Objects;

/**
 * Outcome of one dispatch: exactly one of {@code result} (may be null for "no result") or {@code error}.
 */
public record ActionResponse(Object result, ActionError error) {

    public static ActionResponse success(Object result) {
        return new ActionResponse(result, null);
    }

    public static ActionResponse failure(ActionError error) {
        return new ActionResponse(null, Objects.requireNonNull(error, "error"));
    }

    static ActionResponse of(RequestContext context) {
        return context.hasError() ? failure(context.getError()) : success(context.getResult());
    }

    public boolean isError() {
        return error != null;
    }
}
