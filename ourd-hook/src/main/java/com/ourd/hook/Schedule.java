package com.ourd.hook;

import java.time.ZonedDateTime;
import java.util.Optional;

/**
 * A parsed timer schedule. See {@link Schedules#parse(String)}.
 */
public interface Schedule {

    /**
     * Returns the first fire time strictly after {@code after}, or empty when the schedule never fires again.
     */
    Optional<ZonedDateTime> next(ZonedDateTime after);
}
