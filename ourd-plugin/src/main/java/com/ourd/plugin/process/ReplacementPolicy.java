package com.ourd.plugin.process;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Bounds how fast a pool may replace dead processes: more than {@code maxDeaths} deaths within
 * {@code window} means the plugin should be disabled.
 */
public final class ReplacementPolicy {

    public static final int DEFAULT_MAX_DEATHS = 5;
    public static final Duration DEFAULT_WINDOW = Duration.ofSeconds(60);

    private final int maxDeaths;
    private final Duration window;
    private final Clock clock;
    private final Deque<Instant> deaths = new ArrayDeque<>();

    public ReplacementPolicy(int maxDeaths, Duration window, Clock clock) {
        if (maxDeaths < 0) {
            throw new IllegalArgumentException("maxDeaths must not be negative");
        }
        this.maxDeaths = maxDeaths;
        this.window = window;
        this.clock = clock;
    }

    public static ReplacementPolicy defaults() {
        return new ReplacementPolicy(DEFAULT_MAX_DEATHS, DEFAULT_WINDOW, Clock.systemUTC());
    }

    /**
     * Records one death.
     *
     * @return true when the death rate exceeds the limit and no replacement should be started
     */
    public synchronized boolean recordDeath() {
        Instant now = clock.instant();
        deaths.addLast(now);
        Instant cutoff = now.minus(window);
        while (!deaths.isEmpty() && deaths.peekFirst().isBefore(cutoff)) {
            deaths.removeFirst();
        }
        return deaths.size() > maxDeaths;
    }
}
