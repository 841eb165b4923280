package com.ourd.plugin;

import java.util.Locale;

/** How the server reaches a plugin. Only process-based transport exists. */
public enum TransportKind {

    /** Spawn the executable and speak the protocol over its stdin/stdout. */
    EXEC;

    public static TransportKind fromConfig(String value) {
        if (value == null || value.isBlank()) {
            return EXEC;
        }
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
