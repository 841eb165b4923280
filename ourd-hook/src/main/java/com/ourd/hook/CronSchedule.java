package com.ourd.hook;

import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;
import java.util.BitSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Cron field schedule. Accepts five fields ({@code minute hour day-of-month month day-of-week}, seconds fixed
 * at zero) or six fields with a leading seconds field. Each field takes {@code *} or {@code ?}, single values,
 * ranges {@code 1-5}, steps {@code *}{@code /15} or {@code 10-40/10}, and comma separated lists of these.
 * Months and weekdays also accept three letter names ({@code JAN}, {@code MON}); weekday 7 is Sunday.
 *
 * <p>When both day-of-month and day-of-week are restricted a day matching either one fires.
 */
public final class CronSchedule implements Schedule {

    private static final int SEARCH_YEARS = 5;
    private static final List<String> MONTH_NAMES =
            List.of("jan", "feb", "mar", "apr", "may", "jun", "jul", "aug", "sep", "oct", "nov", "dec");
    private static final List<String> DAY_NAMES = List.of("sun", "mon", "tue", "wed", "thu", "fri", "sat");

    private final String expression;
    private final BitSet seconds;
    private final BitSet minutes;
    private final BitSet hours;
    private final BitSet daysOfMonth;
    private final BitSet months;
    private final BitSet daysOfWeek;
    private final boolean anyDayOfMonth;
    private final boolean anyDayOfWeek;

    private CronSchedule(String expression, String[] f) {
        this.expression = expression;
        this.seconds = parseField(f[0], 0, 59, null, "second");
        this.minutes = parseField(f[1], 0, 59, null, "minute");
        this.hours = parseField(f[2], 0, 23, null, "hour");
        this.daysOfMonth = parseField(f[3], 1, 31, null, "day-of-month");
        this.months = parseField(f[4], 1, 12, MONTH_NAMES, "month");
        this.daysOfWeek = parseField(f[5], 0, 7, DAY_NAMES, "day-of-week");
        if (daysOfWeek.get(7)) {
            daysOfWeek.set(0);
            daysOfWeek.clear(7);
        }
        this.anyDayOfMonth = isWildcard(f[3]);
        this.anyDayOfWeek = isWildcard(f[5]);
    }

    /**
     * Parses a five or six field cron expression.
     *
     * @throws IllegalArgumentException on a wrong field count, unknown names or out-of-range values
     */
    public static CronSchedule parse(String expression) {
        if (expression == null || expression.isBlank()) {
            throw new IllegalArgumentException("Cron expression must be non-blank");
        }
        String[] fields = expression.trim().split("\\s+");
        if (fields.length == 5) {
            String[] withSeconds = new String[6];
            withSeconds[0] = "0";
            System.arraycopy(fields, 0, withSeconds, 1, 5);
            fields = withSeconds;
        } else if (fields.length != 6) {
            throw new IllegalArgumentException("Cron expression needs 5 or 6 fields, got " + fields.length + ": " + expression);
        }
        return new CronSchedule(expression.trim(), fields);
    }

    @Override
    public Optional<ZonedDateTime> next(ZonedDateTime after) {
        ZonedDateTime t = after.truncatedTo(ChronoUnit.SECONDS).plusSeconds(1);
        ZonedDateTime limit = t.plusYears(SEARCH_YEARS);
        while (t.isBefore(limit)) {
            if (!months.get(t.getMonthValue())) {
                t = t.withDayOfMonth(1).truncatedTo(ChronoUnit.DAYS).plusMonths(1);
            } else if (!dayMatches(t)) {
                t = t.truncatedTo(ChronoUnit.DAYS).plusDays(1);
            } else if (!hours.get(t.getHour())) {
                t = t.truncatedTo(ChronoUnit.HOURS).plusHours(1);
            } else if (!minutes.get(t.getMinute())) {
                t = t.truncatedTo(ChronoUnit.MINUTES).plusMinutes(1);
            } else if (!seconds.get(t.getSecond())) {
                t = t.plusSeconds(1);
            } else {
                return Optional.of(t);
            }
        }
        return Optional.empty();
    }

    private boolean dayMatches(ZonedDateTime t) {
        boolean dom = daysOfMonth.get(t.getDayOfMonth());
        boolean dow = daysOfWeek.get(t.getDayOfWeek().getValue() % 7);
        if (anyDayOfMonth || anyDayOfWeek) {
            return dom && dow;
        }
        return dom || dow;
    }

    @Override
    public String toString() {
        return expression;
    }

    private static boolean isWildcard(String field) {
        return field.startsWith("*") || field.startsWith("?");
    }

    private static BitSet parseField(String field, int min, int max, List<String> names, String label) {
        BitSet bits = new BitSet(max + 1);
        for (String part : field.split(",", -1)) {
            if (part.isEmpty()) {
                throw new IllegalArgumentException("Empty " + label + " entry in '" + field + "'");
            }
            String range = part;
            int step = 1;
            int slash = part.indexOf('/');
            if (slash >= 0) {
                range = part.substring(0, slash);
                step = number(part.substring(slash + 1), label);
                if (step < 1) {
                    throw new IllegalArgumentException("Step must be positive in " + label + " '" + part + "'");
                }
            }
            int from;
            int to;
            if (range.equals("*") || range.equals("?")) {
                from = min;
                to = max;
            } else {
                int dash = range.indexOf('-');
                if (dash >= 0) {
                    from = value(range.substring(0, dash), names, label);
                    to = value(range.substring(dash + 1), names, label);
                } else {
                    from = value(range, names, label);
                    to = slash >= 0 ? max : from;
                }
            }
            if (from < min || to > max || from > to) {
                throw new IllegalArgumentException(
                        "Invalid " + label + " '" + part + "': allowed range is " + min + "-" + max);
            }
            for (int v = from; v <= to; v += step) {
                bits.set(v);
            }
        }
        return bits;
    }

    private static int value(String text, List<String> names, String label) {
        if (names != null) {
            int idx = names.indexOf(text.toLowerCase(Locale.ROOT));
            if (idx >= 0) {
                return names == MONTH_NAMES ? idx + 1 : idx;
            }
        }
        return number(text, label);
    }

    private static int number(String text, String label) {
        try {
            return Integer.parseInt(text);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid " + label + " value '" + text + "'", e);
        }
    }
}
