package com.ourd.plugin.process;

import java.io.InputStream;
import java.io.OutputStream;

/**
 * A started plugin instance as seen by the pool: its protocol streams and its liveness.
 */
public interface LaunchedProcess {

    /** Messages from the plugin (its stdout). */
    InputStream getInputStream();

    /** Messages to the plugin (its stdin). */
    OutputStream getOutputStream();

    boolean isAlive();

    /** Terminates the instance; safe to call more than once. */
    void destroy();
}
