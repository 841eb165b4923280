package com.ourd.config;

/**
 * Thrown when the server configuration file cannot be read or fails validation.
 * Always fatal at startup.
 */
public class ConfigurationException extends RuntimeException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
