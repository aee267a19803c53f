package io.shiftwatch.utils;

import io.shiftwatch.core.CronTrigger;
import org.quartz.CronExpression;

import java.text.ParseException;
import java.time.DayOfWeek;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.temporal.IsoFields;
import java.time.temporal.TemporalAdjusters;
import java.util.ArrayList;
import java.util.Date;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.TimeZone;
import java.util.TreeSet;

/**
 * Evaluates a {@link CronTrigger} through a Quartz {@link CronExpression}.
 *
 * <p>Quartz has no week-of-year field, so the ISO week restriction is applied on top of the
 * Quartz schedule by skipping whole weeks that do not match.
 */
public final class CronSchedule {

    private static final String[] QUARTZ_DAYS = {"MON", "TUE", "WED", "THU", "FRI", "SAT", "SUN"};

    // Two years of weekly skips; a week filter that never matches gives up after this.
    private static final int MAX_WEEK_SKIPS = 110;

    private final String quartzExpression;
    private final Set<Integer> weeks;
    private final ZoneId zone;

    private CronSchedule(String quartzExpression, Set<Integer> weeks, ZoneId zone) {
        this.quartzExpression = quartzExpression;
        this.weeks = weeks;
        this.zone = zone;
    }

    /**
     * Compiles a trigger for the given zone.
     *
     * @throws IllegalArgumentException if the trigger has violations
     */
    public static CronSchedule compile(CronTrigger trigger, ZoneId zone) {
        Objects.requireNonNull(trigger, "trigger must not be null");
        Objects.requireNonNull(zone, "zone must not be null");

        List<String> problems = violations(trigger);
        if (!problems.isEmpty()) {
            throw new IllegalArgumentException("Invalid cron trigger: " + String.join("; ", problems));
        }

        Set<Integer> weeks = isWildcard(trigger.week()) ? null : expand(trigger.week(), 1, 53, false);
        return new CronSchedule(toQuartzCron(trigger), weeks, zone);
    }

    /**
     * Returns every problem found in the trigger fields; empty when valid.
     */
    public static List<String> violations(CronTrigger trigger) {
        List<String> problems = new ArrayList<>();
        check(problems, "second", trigger.second(), 0, 59, false);
        check(problems, "minute", trigger.minute(), 0, 59, false);
        check(problems, "hour", trigger.hour(), 0, 23, false);
        check(problems, "day", trigger.day(), 1, 31, false);
        check(problems, "week", trigger.week(), 1, 53, false);
        check(problems, "day_of_week", trigger.dayOfWeek(), 0, 6, true);

        if (!isWildcard(trigger.day()) && !isWildcard(trigger.dayOfWeek())) {
            problems.add("day and day_of_week cannot both be restricted");
        }

        if (problems.isEmpty()) {
            String cron = toQuartzCron(trigger);
            if (!CronExpression.isValidExpression(cron)) {
                problems.add("unsupported cron expression: " + cron);
            }
        }
        return problems;
    }

    /**
     * Next fire time strictly after {@code after}, or {@code null} if there is none.
     */
    public Instant nextAfter(Instant after) {
        Objects.requireNonNull(after, "after must not be null");

        CronExpression exp;
        try {
            exp = new CronExpression(quartzExpression);
        } catch (ParseException ex) {
            throw new IllegalArgumentException("Invalid cron expression: " + quartzExpression, ex);
        }
        exp.setTimeZone(TimeZone.getTimeZone(zone));

        Instant cursor = after;
        for (int i = 0; i < MAX_WEEK_SKIPS; i++) {
            Date nextDate = exp.getNextValidTimeAfter(Date.from(cursor));
            if (nextDate == null) {
                return null;
            }

            ZonedDateTime next = ZonedDateTime.ofInstant(nextDate.toInstant(), zone);
            if (weeks == null || weeks.contains(next.get(IsoFields.WEEK_OF_WEEK_BASED_YEAR))) {
                return next.toInstant();
            }

            ZonedDateTime nextMonday = next.toLocalDate()
                    .with(TemporalAdjusters.next(DayOfWeek.MONDAY))
                    .atStartOfDay(zone);
            cursor = nextMonday.toInstant().minusSeconds(1);
        }
        return null;
    }

    public String quartzExpression() {
        return quartzExpression;
    }

    /**
     * Builds the Quartz form: {@code sec min hour day-of-month month day-of-week}.
     */
    static String toQuartzCron(CronTrigger trigger) {
        String sec = orWildcard(trigger.second());
        String min = orWildcard(trigger.minute());
        String hour = orWildcard(trigger.hour());
        String dom = orWildcard(trigger.day());
        String dow;

        if (isWildcard(trigger.dayOfWeek())) {
            dow = "?";
        } else {
            List<String> names = new ArrayList<>(7);
            for (int d : expand(trigger.dayOfWeek(), 0, 6, true)) {
                names.add(QUARTZ_DAYS[d]);
            }
            dow = String.join(",", names);
            dom = "?";
        }

        return String.join(" ", sec, min, hour, dom, "*", dow);
    }

    private static void check(List<String> problems, String field, String expr, int min, int max, boolean dayNames) {
        if (isWildcard(expr)) {
            return;
        }
        try {
            if (expand(expr, min, max, dayNames).isEmpty()) {
                problems.add(field + " selects no values: " + expr);
            }
        } catch (IllegalArgumentException ex) {
            problems.add(field + ": " + ex.getMessage());
        }
    }

    /**
     * Expands a field expression into the set of values it selects.
     */
    static Set<Integer> expand(String expr, int min, int max, boolean dayNames) {
        Set<Integer> values = new TreeSet<>();
        for (String part : expr.trim().split(",")) {
            String token = part.trim().toLowerCase(Locale.ROOT);
            if (token.isEmpty()) {
                throw new IllegalArgumentException("empty list element in '" + expr + "'");
            }

            int step = 1;
            int slash = token.indexOf('/');
            if (slash >= 0) {
                step = parseNumber(token.substring(slash + 1), expr);
                if (step <= 0) {
                    throw new IllegalArgumentException("step must be positive in '" + expr + "'");
                }
                token = token.substring(0, slash);
            }

            int from;
            int to;
            if (token.equals("*")) {
                from = min;
                to = max;
            } else if (token.contains("-")) {
                String[] bounds = token.split("-", 2);
                from = parseValue(bounds[0], expr, dayNames);
                to = parseValue(bounds[1], expr, dayNames);
                if (from > to) {
                    throw new IllegalArgumentException("range start after end in '" + expr + "'");
                }
            } else {
                from = parseValue(token, expr, dayNames);
                to = slash >= 0 ? max : from;
            }

            if (from < min || to > max) {
                throw new IllegalArgumentException("value out of range " + min + ".." + max + " in '" + expr + "'");
            }
            for (int v = from; v <= to; v += step) {
                values.add(v);
            }
        }
        return values;
    }

    private static int parseValue(String token, String expr, boolean dayNames) {
        if (dayNames) {
            for (int i = 0; i < QUARTZ_DAYS.length; i++) {
                if (QUARTZ_DAYS[i].equalsIgnoreCase(token)) {
                    return i;
                }
            }
        }
        return parseNumber(token, expr);
    }

    private static int parseNumber(String token, String expr) {
        try {
            return Integer.parseInt(token.trim());
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException("invalid value '" + token + "' in '" + expr + "'");
        }
    }

    private static boolean isWildcard(String expr) {
        return expr == null || expr.isBlank() || expr.trim().equals("*");
    }

    private static String orWildcard(String expr) {
        return isWildcard(expr) ? "*" : expr.trim().replace(" ", "");
    }
}
