package com.ourd.hook;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.ZonedDateTime;
import java.util.Optional;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * {@link TimerScheduler} on a single scheduled executor. Each run is armed as a one-shot task for the next
 * fire time of its {@link Schedule}, computed against the clock's zone, and re-armed once the run finishes.
 */
public final class ExecutorTimerScheduler implements TimerScheduler {

    private static final Logger log = LoggerFactory.getLogger(ExecutorTimerScheduler.class);
    private static final AtomicInteger THREADS = new AtomicInteger();

    private final ScheduledExecutorService executor;
    private final Clock clock;

    public ExecutorTimerScheduler() {
        this(Clock.systemDefaultZone());
    }

    public ExecutorTimerScheduler(Clock clock) {
        this.executor = newExecutor();
        this.clock = clock;
    }

    private static ScheduledExecutorService newExecutor() {
        ScheduledThreadPoolExecutor executor = new ScheduledThreadPoolExecutor(1, r -> {
            Thread t = new Thread(r, "ourd-timer-" + THREADS.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        // pending runs may be days away; close() must not wait for them
        executor.setExecuteExistingDelayedTasksAfterShutdownPolicy(false);
        return executor;
    }

    @Override
    public void schedule(String schedule, String name, Runnable job) {
        Schedule parsed = Schedules.parse(schedule);
        ZonedDateTime first = parsed.next(ZonedDateTime.now(clock))
                .orElseThrow(() -> new IllegalArgumentException("Schedule never fires: " + schedule));
        arm(parsed, name, job, first);
        log.info("Timer {} scheduled ({}), first run at {}", name, schedule, first);
    }

    private void arm(Schedule schedule, String name, Runnable job, ZonedDateTime at) {
        long delay = Math.max(0, Duration.between(ZonedDateTime.now(clock), at).toMillis());
        try {
            executor.schedule(() -> fire(schedule, name, job, at), delay, TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            log.debug("Timer {} not re-armed, scheduler is closed", name);
        }
    }

    private void fire(Schedule schedule, String name, Runnable job, ZonedDateTime firedAt) {
        try {
            job.run();
        } catch (RuntimeException e) {
            log.warn("Timer {} run failed", name, e);
        }
        if (executor.isShutdown()) {
            return;
        }
        ZonedDateTime now = ZonedDateTime.now(clock);
        Optional<ZonedDateTime> next = schedule.next(now.isAfter(firedAt) ? now : firedAt);
        if (next.isEmpty()) {
            log.info("Timer {} has no further runs", name);
            return;
        }
        arm(schedule, name, job, next.get());
    }

    @Override
    public void close() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            executor.shutdownNow();
        }
    }
}
