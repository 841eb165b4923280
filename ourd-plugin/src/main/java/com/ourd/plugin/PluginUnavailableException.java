package com.ourd.plugin;

/**
 * No Ready process could be checked out: pool exhausted, disabled or shut down.
 */
public class PluginUnavailableException extends PluginException {

    public PluginUnavailableException(String pluginName, String message) {
        super(pluginName, message);
    }

    public PluginUnavailableException(String pluginName, String message, Throwable cause) {
        super(pluginName, message, cause);
    }
}
