package com.ourd.plugin;

/**
 * The process sent a message that does not parse or carries an unexpected id.
 */
public class PluginProtocolException extends PluginException {

    public PluginProtocolException(String pluginName, String message) {
        super(pluginName, message);
    }

    public PluginProtocolException(String pluginName, String message, Throwable cause) {
        super(pluginName, message, cause);
    }
}
