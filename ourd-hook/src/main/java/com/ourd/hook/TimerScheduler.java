package com.ourd.hook;

/**
 * Scheduling capability: fires a job at a cron-like schedule until {@link #close() closed}.
 */
public interface TimerScheduler extends AutoCloseable {

    /**
     * Schedules {@code job} under {@code name}.
     *
     * @throws IllegalArgumentException if the schedule expression is not understood
     */
    void schedule(String schedule, String name, Runnable job);

    /** Stops firing; jobs already running are allowed to finish. */
    @Override
    void close();
}
