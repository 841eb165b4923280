package com.ourd.router;

import java.util.Objects;

/**
 * Unchecked carrier for an {@link ActionError}. Preprocessors, handlers and hooks throw it to
 * fail the current request; the router turns it back into the error slot of the context.
 */
public class ActionException extends RuntimeException {

    private final transient ActionError error;

    public ActionException(ActionError error) {
        super(Objects.requireNonNull(error, "error").message());
        this.error = error;
    }

    public ActionException(ActionError error, Throwable cause) {
        super(Objects.requireNonNull(error, "error").message(), cause);
        this.error = error;
    }

    public ActionException(ErrorCode code, String message) {
        this(ActionError.of(code, message));
    }

    public ActionError getError() {
        return error;
    }
}
