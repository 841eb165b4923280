package com.ourd.hook;

import java.time.Duration;
import java.time.ZonedDateTime;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses timer schedules: {@code @every <duration>}, the descriptors {@code @yearly}, {@code @annually},
 * {@code @monthly}, {@code @weekly}, {@code @daily}, {@code @midnight} and {@code @hourly}, and
 * {@link CronSchedule cron field expressions}. Durations use the compact unit form of plugin configs,
 * e.g. {@code 1h30m}, {@code 45s}, {@code 250ms}.
 */
public final class Schedules {

    private static final Pattern DURATION_PART = Pattern.compile("(\\d+(?:\\.\\d+)?)(ms|h|m|s)");

    private Schedules() {
    }

    /**
     * Parses a schedule expression.
     *
     * @throws IllegalArgumentException for unknown descriptors, malformed cron fields and non-positive periods
     */
    public static Schedule parse(String schedule) {
        if (schedule == null || schedule.isBlank()) {
            throw new IllegalArgumentException("Schedule must be non-blank");
        }
        String s = schedule.trim().toLowerCase(Locale.ROOT);
        if (s.startsWith("@every ")) {
            return new Every(parseDuration(s.substring("@every ".length()).trim()));
        }
        switch (s) {
            case "@yearly":
            case "@annually":
                return CronSchedule.parse("0 0 0 1 1 *");
            case "@monthly":
                return CronSchedule.parse("0 0 0 1 * *");
            case "@weekly":
                return CronSchedule.parse("0 0 0 * * 0");
            case "@daily":
            case "@midnight":
                return CronSchedule.parse("0 0 0 * * *");
            case "@hourly":
                return CronSchedule.parse("0 0 * * * *");
            default:
                break;
        }
        if (s.startsWith("@")) {
            throw new IllegalArgumentException("Unsupported schedule descriptor: " + schedule);
        }
        return CronSchedule.parse(schedule);
    }

    /**
     * Parses a compact duration such as {@code 1h30m10s} or {@code 500ms}.
     */
    public static Duration parseDuration(String text) {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("Duration must be non-blank");
        }
        Matcher m = DURATION_PART.matcher(text);
        int pos = 0;
        double millis = 0;
        while (m.find()) {
            if (m.start() != pos) break;
            double value = Double.parseDouble(m.group(1));
            switch (m.group(2)) {
                case "h" -> millis += value * 3_600_000d;
                case "m" -> millis += value * 60_000d;
                case "s" -> millis += value * 1_000d;
                default -> millis += value;
            }
            pos = m.end();
        }
        if (pos != text.length()) {
            throw new IllegalArgumentException("Malformed duration: " + text);
        }
        long total = Math.round(millis);
        if (total <= 0) {
            throw new IllegalArgumentException("Duration must be positive: " + text);
        }
        return Duration.ofMillis(total);
    }

    /** Fires every {@code period}, counted from the previous run. */
    public record Every(Duration period) implements Schedule {

        @Override
        public Optional<ZonedDateTime> next(ZonedDateTime after) {
            return Optional.of(after.plus(period));
        }
    }
}
