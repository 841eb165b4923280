package com.ourd.plugin.process;

/**
 * Lifecycle of one plugin process. Transitions: STARTING to READY (handshake), READY to BUSY
 * (checkout), BUSY to READY (checkin) and any state to DEAD.
 */
public enum ProcessState {
    STARTING,
    READY,
    BUSY,
    DEAD
}
