package com.ourd.server.http;

import java.time.Duration;

/**
 * Counts in-flight requests so shutdown can stop admitting new ones and wait for the rest.
 */
public final class RequestDrain {

    private int inFlight;
    private boolean draining;

    /** @return false once draining started; the caller must then reject the request */
    public synchronized boolean enter() {
        if (draining) {
            return false;
        }
        inFlight++;
        return true;
    }

    public synchronized void exit() {
        if (inFlight > 0 && --inFlight == 0) {
            notifyAll();
        }
    }

    /**
     * Stops admitting requests and waits for in-flight ones.
     *
     * @return true when every in-flight request finished before the deadline
     */
    public synchronized boolean drain(Duration timeout) throws InterruptedException {
        draining = true;
        long deadline = System.nanoTime() + timeout.toNanos();
        while (inFlight > 0) {
            long remaining = deadline - System.nanoTime();
            if (remaining <= 0) {
                return false;
            }
            wait(Math.max(1, remaining / 1_000_000));
        }
        return true;
    }

    public synchronized boolean isDraining() {
        return draining;
    }

    public synchronized int getInFlight() {
        return inFlight;
    }
}
