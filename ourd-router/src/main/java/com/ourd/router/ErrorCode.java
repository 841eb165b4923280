package com.ourd.router;

import java.util.Optional;

/**
 * Client-facing error codes. Each code belongs to an HTTP status class so the transport layer
 * can answer without knowing which component raised the error.
 */
public enum ErrorCode {

    NOT_AUTHENTICATED(101, "NotAuthenticated", 401),
    PERMISSION_DENIED(102, "PermissionDenied", 403),
    ACCESS_KEY_NOT_ACCEPTED(103, "AccessKeyNotAccepted", 401),
    ACCESS_TOKEN_NOT_ACCEPTED(104, "AccessTokenNotAccepted", 401),
    BAD_REQUEST(107, "BadRequest", 400),
    INVALID_ARGUMENT(108, "InvalidArgument", 400),
    RESOURCE_NOT_FOUND(110, "ResourceNotFound", 404),
    UNDEFINED_OPERATION(117, "UndefinedOperation", 404),
    PLUGIN_UNAVAILABLE(118, "PluginUnavailable", 503),
    PLUGIN_TIMEOUT(119, "PluginTimeout", 503),
    SERVICE_UNAVAILABLE(122, "ServiceUnavailable", 503),
    UNEXPECTED_ERROR(10000, "UnexpectedError", 500);

    private final int code;
    private final String errorName;
    private final int httpStatus;

    ErrorCode(int code, String errorName, int httpStatus) {
        this.code = code;
        this.errorName = errorName;
        this.httpStatus = httpStatus;
    }

    public int getCode() {
        return code;
    }

    /** Name sent to clients next to the numeric code (e.g. {@code UndefinedOperation}). */
    public String getErrorName() {
        return errorName;
    }

    public int getHttpStatus() {
        return httpStatus;
    }

    /** Looks up a code by its numeric value; empty for codes the core does not know (e.g. plugin-defined). */
    public static Optional<ErrorCode> fromCode(int code) {
        for (ErrorCode c : values()) {
            if (c.code == code) return Optional.of(c);
        }
        return Optional.empty();
    }
}
