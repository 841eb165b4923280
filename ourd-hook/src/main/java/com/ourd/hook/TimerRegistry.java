package com.ourd.hook;

import com.ourd.router.DuplicateRegistrationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Scheduled invocables by name. Timers are collected during startup and handed to a {@link TimerScheduler}
 * by {@link #start(TimerScheduler)} once registration is complete.
 */
public final class TimerRegistry {

    private static final Logger log = LoggerFactory.getLogger(TimerRegistry.class);

    private volatile Map<String, TimerEntry> byName = new LinkedHashMap<>();
    private volatile boolean frozen;

    /** Registered timer: schedule expression, job and owner (plugin name or null). */
    public record TimerEntry(String name, String schedule, Runnable job, String owner) {
        public TimerEntry {
            Objects.requireNonNull(name, "name");
            Objects.requireNonNull(schedule, "schedule");
            Objects.requireNonNull(job, "job");
        }
    }

    public void registerTimer(String schedule, String name, Runnable job) {
        registerTimer(schedule, name, job, null);
    }

    /**
     * @throws DuplicateRegistrationException if a timer with this name exists
     * @throws IllegalStateException          if the registry is frozen
     */
    public synchronized void registerTimer(String schedule, String name, Runnable job, String owner) {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(schedule, "schedule");
        String n = name.trim();
        if (n.isEmpty()) throw new IllegalArgumentException("Timer name must be non-blank");
        if (frozen) {
            throw new IllegalStateException("Timer registry is frozen; timers can only be registered during startup");
        }
        if (byName.putIfAbsent(n, new TimerEntry(n, schedule.trim(), job, owner)) != null) {
            throw new DuplicateRegistrationException("Timer", n);
        }
        log.debug("Registered timer {} at '{}' (owner={})", n, schedule, owner != null ? owner : "native");
    }

    public synchronized void freeze() {
        if (frozen) return;
        byName = Collections.unmodifiableMap(new LinkedHashMap<>(byName));
        frozen = true;
    }

    public List<TimerEntry> getTimers() {
        return List.copyOf(byName.values());
    }

    /**
     * Freezes the registry and schedules every timer. A timer whose schedule the scheduler rejects is
     * logged and skipped; the others are still scheduled. A failing run is logged and does not cancel the schedule.
     *
     * @return number of timers scheduled
     */
    public int start(TimerScheduler scheduler) {
        Objects.requireNonNull(scheduler, "scheduler");
        freeze();
        int scheduled = 0;
        for (TimerEntry entry : byName.values()) {
            try {
                scheduler.schedule(entry.schedule(), entry.name(), guarded(entry));
                scheduled++;
            } catch (IllegalArgumentException e) {
                log.error("Timer {} (owner={}) skipped: {}", entry.name(), entry.owner(), e.getMessage());
            }
        }
        log.info("Scheduled {} of {} timer(s)", scheduled, byName.size());
        return scheduled;
    }

    private static Runnable guarded(TimerEntry entry) {
        return () -> {
            try {
                entry.job().run();
            } catch (RuntimeException e) {
                log.error("Timer {} failed: {}", entry.name(), e.getMessage(), e);
            }
        };
    }
}
