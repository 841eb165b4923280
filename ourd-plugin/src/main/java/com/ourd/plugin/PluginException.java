package com.ourd.plugin;

/**
 * Base of every failure that can happen while talking to a plugin process.
 * Mapped to client-facing errors by {@link PluginErrors#toActionError(PluginException)}.
 */
public class PluginException extends Exception {

    private final String pluginName;

    public PluginException(String pluginName, String message) {
        super(message);
        this.pluginName = pluginName;
    }

    public PluginException(String pluginName, String message, Throwable cause) {
        super(message, cause);
        this.pluginName = pluginName;
    }

    public String getPluginName() {
        return pluginName;
    }
}
