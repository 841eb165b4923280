package com.ourd.plugin;

/**
 * No response within the call deadline. The process is killed and never reused.
 */
public class PluginTimeoutException extends PluginException {

    public PluginTimeoutException(String pluginName, String message) {
        super(pluginName, message);
    }

    public PluginTimeoutException(String pluginName, String message, Throwable cause) {
        super(pluginName, message, cause);
    }
}
