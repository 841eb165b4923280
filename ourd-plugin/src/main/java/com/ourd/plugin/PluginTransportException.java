package com.ourd.plugin;

/**
 * Writing to the process failed, or its output closed (usually because it exited).
 */
public class PluginTransportException extends PluginException {

    public PluginTransportException(String pluginName, String message) {
        super(pluginName, message);
    }

    public PluginTransportException(String pluginName, String message, Throwable cause) {
        super(pluginName, message, cause);
    }
}
