package com.ourd.plugin;

import com.ourd.plugin.process.PluginProcessPool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Scheduled job declared by a plugin. Failures are logged; the next run happens on schedule.
 */
public final class PluginTimerJob implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(PluginTimerJob.class);

    private final PluginProcessPool pool;
    private final String name;
    private final String schedule;
    private final PluginContextSerializer serializer;

    public PluginTimerJob(PluginProcessPool pool, String name, String schedule, PluginContextSerializer serializer) {
        this.pool = pool;
        this.name = name;
        this.schedule = schedule;
        this.serializer = serializer;
    }

    @Override
    public void run() {
        try {
            pool.call(name, serializer.timer(schedule));
            log.debug("Timer {} of plugin {} completed", name, pool.getName());
        } catch (PluginException e) {
            log.warn("Timer {} of plugin {} failed: {}", name, pool.getName(), e.getMessage());
        }
    }
}
