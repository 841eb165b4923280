package com.ourd.router;

/**
 * A second registration claimed a key that is already bound (action, path rule, hook, lambda or timer).
 * Raised during startup registration and treated as fatal: bindings are never silently shadowed.
 */
public class DuplicateRegistrationException extends IllegalArgumentException {

    private final String kind;
    private final String key;

    public DuplicateRegistrationException(String kind, String key) {
        super(kind + " already registered: " + key);
        this.kind = kind;
        this.key = key;
    }

    /** What was registered twice (e.g. "Action", "Lambda"). */
    public String getKind() {
        return kind;
    }

    public String getKey() {
        return key;
    }
}
