package com.ourd.plugin.protocol;

import com.ourd.plugin.PluginException;

import java.time.Duration;

/**
 * Request/response channel to one plugin process. One call is in flight at a time; ids are
 * assigned per session starting at 0.
 */
public interface PluginTransport extends AutoCloseable {

    /**
     * Sends {@code init} and waits for the matching response.
     */
    PluginResponse init(Duration timeout) throws PluginException;

    /**
     * Sends an {@code op} and waits for the matching response.
     */
    PluginResponse call(String name, Object context, Duration timeout) throws PluginException;

    /** False once the channel failed or was closed; a broken transport is never reused. */
    boolean isOpen();

    @Override
    void close();
}
