package com.ourd.router;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Structured, caller-visible error: numeric code, error name, message and optional info.
 * Codes raised by the core come from {@link ErrorCode}; plugins may send codes the core does not know,
 * which are kept as-is and served with status 500.
 */
public record ActionError(int code, String name, String message, Map<String, Object> info) {

    public ActionError {
        Objects.requireNonNull(name, "name");
        message = message != null ? message : "";
        info = info != null ? Collections.unmodifiableMap(new LinkedHashMap<>(info)) : Map.of();
    }

    public static ActionError of(ErrorCode code, String message) {
        return new ActionError(code.getCode(), code.getErrorName(), message, null);
    }

    public static ActionError of(ErrorCode code, String message, Map<String, Object> info) {
        return new ActionError(code.getCode(), code.getErrorName(), message, info);
    }

    /** Returns a copy with one more info entry. */
    public ActionError withInfo(String key, Object value) {
        Map<String, Object> copy = new LinkedHashMap<>(info);
        copy.put(key, value);
        return new ActionError(code, name, message, copy);
    }

    /** HTTP status of this error's class; 500 for codes outside {@link ErrorCode}. */
    public int httpStatus() {
        return ErrorCode.fromCode(code).map(ErrorCode::getHttpStatus).orElse(500);
    }

    public boolean is(ErrorCode errorCode) {
        return errorCode != null && errorCode.getCode() == code;
    }
}
