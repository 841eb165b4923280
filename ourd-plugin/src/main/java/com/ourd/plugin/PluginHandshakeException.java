package com.ourd.plugin;

/**
 * The process did not complete the {@code init} exchange.
 */
public class PluginHandshakeException extends PluginException {

    public PluginHandshakeException(String pluginName, String message) {
        super(pluginName, message);
    }

    public PluginHandshakeException(String pluginName, String message, Throwable cause) {
        super(pluginName, message, cause);
    }
}
