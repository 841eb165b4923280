package com.ourd.router;

/**
 * No route is bound to the requested action (or no path rule matches). Surfaces as a not-found class error.
 */
public class UnknownActionException extends ActionException {

    public UnknownActionException(String action) {
        super(ActionError.of(ErrorCode.UNDEFINED_OPERATION, "Undefined operation: " + action)
                .withInfo("action", action));
    }

    public UnknownActionException(HttpMethod method, String path) {
        super(ActionError.of(ErrorCode.RESOURCE_NOT_FOUND, "No route for " + method + " " + path)
                .withInfo("path", path));
    }
}
