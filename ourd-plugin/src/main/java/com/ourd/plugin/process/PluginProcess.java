package com.ourd.plugin.process;

import com.fasterxml.jackson.databind.JsonNode;
import com.ourd.plugin.PluginCallException;
import com.ourd.plugin.PluginErrors;
import com.ourd.plugin.PluginException;
import com.ourd.plugin.PluginHandshakeException;
import com.ourd.plugin.PluginRegistrationInfo;
import com.ourd.plugin.PluginTransportException;
import com.ourd.plugin.protocol.PluginResponse;
import com.ourd.plugin.protocol.PluginTransport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicReference;

/**
 * One running plugin instance and its transport session.
 * <p>
 * Only a BUSY process accepts calls. A call that ends in a timeout, protocol violation or
 * transport failure kills the process; an {@code error} reply from the plugin does not.
 */
public final class PluginProcess {

    private static final Logger log = LoggerFactory.getLogger(PluginProcess.class);

    private final String pluginName;
    private final int instanceId;
    private final LaunchedProcess process;
    private final PluginTransport transport;
    private final AtomicReference<ProcessState> state = new AtomicReference<>(ProcessState.STARTING);

    public PluginProcess(String pluginName, int instanceId, LaunchedProcess process, PluginTransport transport) {
        this.pluginName = pluginName;
        this.instanceId = instanceId;
        this.process = process;
        this.transport = transport;
    }

    public String getPluginName() {
        return pluginName;
    }

    public int getInstanceId() {
        return instanceId;
    }

    public ProcessState getState() {
        return state.get();
    }

    /**
     * Runs the {@code init} exchange. On success the process is READY; on any failure it is killed.
     */
    public PluginRegistrationInfo handshake(Duration timeout) throws PluginHandshakeException {
        if (state.get() != ProcessState.STARTING) {
            throw new IllegalStateException("handshake on " + this + " in state " + state.get());
        }
        try {
            PluginResponse response = transport.init(timeout);
            if (response.isError()) {
                throw new PluginHandshakeException(pluginName,
                        "init rejected: " + PluginErrors.decodeError(response.data()).message());
            }
            PluginRegistrationInfo info = PluginRegistrationInfo.fromJson(response.data());
            if (!state.compareAndSet(ProcessState.STARTING, ProcessState.READY)) {
                throw new PluginHandshakeException(pluginName, "process was killed during handshake");
            }
            return info;
        } catch (PluginHandshakeException e) {
            kill();
            throw e;
        } catch (PluginException e) {
            kill();
            throw new PluginHandshakeException(pluginName, "init failed: " + e.getMessage(), e);
        } catch (IllegalArgumentException e) {
            kill();
            throw new PluginHandshakeException(pluginName, "malformed init result: " + e.getMessage(), e);
        }
    }

    /** READY to BUSY; false if the process is not READY. */
    boolean checkOut() {
        return state.compareAndSet(ProcessState.READY, ProcessState.BUSY);
    }

    /** BUSY to READY; false if the process died while checked out. */
    boolean checkIn() {
        return state.compareAndSet(ProcessState.BUSY, ProcessState.READY);
    }

    /**
     * Sends one {@code op} and returns the result data.
     *
     * @throws PluginCallException when the plugin answered with an error
     */
    public JsonNode call(String name, Object context, Duration timeout) throws PluginException {
        if (state.get() != ProcessState.BUSY) {
            throw new PluginTransportException(pluginName, "process " + instanceId + " is " + state.get());
        }
        PluginResponse response;
        try {
            response = transport.call(name, context, timeout);
        } catch (PluginException e) {
            log.warn("Plugin {}#{} failed on '{}', killing it: {}", pluginName, instanceId, name, e.getMessage());
            kill();
            throw e;
        }
        if (response.isError()) {
            throw new PluginCallException(pluginName, PluginErrors.decodeError(response.data()));
        }
        return response.data();
    }

    public boolean isAlive() {
        return state.get() != ProcessState.DEAD && transport.isOpen() && process.isAlive();
    }

    /** Marks the process DEAD, closes its transport and terminates it. Idempotent. */
    public void kill() {
        if (state.getAndSet(ProcessState.DEAD) == ProcessState.DEAD) {
            return;
        }
        transport.close();
        process.destroy();
        log.debug("Plugin {}#{} terminated", pluginName, instanceId);
    }

    @Override
    public String toString() {
        return pluginName + "#" + instanceId;
    }
}
