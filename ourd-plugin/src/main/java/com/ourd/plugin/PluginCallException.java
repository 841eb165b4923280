package com.ourd.plugin;

import com.ourd.router.ActionError;

import java.util.Objects;

/**
 * The plugin answered a call with an {@code error} message. The process stays healthy.
 */
public class PluginCallException extends PluginException {

    private final ActionError error;

    public PluginCallException(String pluginName, ActionError error) {
        super(pluginName, error.message());
        this.error = Objects.requireNonNull(error, "error");
    }

    public ActionError getError() {
        return error;
    }
}
