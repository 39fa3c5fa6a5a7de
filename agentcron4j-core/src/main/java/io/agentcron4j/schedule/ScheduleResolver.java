package io.agentcron4j.schedule;

import io.agentcron4j.core.InvalidScheduleException;
import io.agentcron4j.core.UnreachableScheduleException;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.temporal.ChronoUnit;
import java.util.Objects;

/**
 * Parses schedule specs and computes fire-times.
 * <p>
 * Supported formats:
 * <ul>
 *   <li>5-field cron strings: "0 9 * * *", "*&#47;15 9-10 * * mon-fri"</li>
 *   <li>Field maps: {hour: 18, minute: 0, day_of_week: "fri"}</li>
 * </ul>
 * <p>
 * Fire-times are whole minutes in the given zone. A schedule with no fire-time within
 * {@value #HORIZON_YEARS} years is reported as unreachable. The longest gap a satisfiable
 * schedule can have is 8 years, Feb 29 across a century that is not a leap year.
 */
public final class ScheduleResolver {

    static final int HORIZON_YEARS = 28;

    private ScheduleResolver() {
    }

    public static CronSchedule parse(ScheduleSpec spec) {
        Objects.requireNonNull(spec, "spec must not be null");
        if (spec instanceof ScheduleSpec.Cron cron) {
            return parseCron(cron.expression());
        }
        if (spec instanceof ScheduleSpec.Fields f) {
            return new CronSchedule(
                    fieldOrEvery(CronFieldType.MINUTE, f.minute()),
                    fieldOrEvery(CronFieldType.HOUR, f.hour()),
                    fieldOrEvery(CronFieldType.DAY_OF_MONTH, f.dayOfMonth()),
                    fieldOrEvery(CronFieldType.MONTH, f.month()),
                    fieldOrEvery(CronFieldType.DAY_OF_WEEK, f.dayOfWeek()));
        }
        throw new InvalidScheduleException("Unsupported schedule type: " + spec.getClass().getName());
    }

    public static CronSchedule parseCron(String expression) {
        if (expression == null || expression.isBlank()) {
            throw new InvalidScheduleException("Cron expression must not be empty");
        }
        String[] parts = expression.trim().split("\\s+");
        if (parts.length != 5) {
            throw new InvalidScheduleException(
                    "Cron expression must have 5 fields, got " + parts.length + ": " + expression);
        }
        return new CronSchedule(
                CronFieldParser.parse(CronFieldType.MINUTE, parts[0]),
                CronFieldParser.parse(CronFieldType.HOUR, parts[1]),
                CronFieldParser.parse(CronFieldType.DAY_OF_MONTH, parts[2]),
                CronFieldParser.parse(CronFieldType.MONTH, parts[3]),
                CronFieldParser.parse(CronFieldType.DAY_OF_WEEK, parts[4]));
    }

    /**
     * Returns true if the string parses as a 5-field cron expression.
     */
    public static boolean isValidCron(String expression) {
        try {
            parseCron(expression);
            return true;
        } catch (InvalidScheduleException ignored) {
            return false;
        }
    }

    /**
     * Earliest instant strictly after {@code from} whose local time in {@code zone} matches the schedule.
     * <p>
     * Local times skipped by a DST gap are shifted forward by the gap length; a repeated local hour
     * fires once.
     */
    public static Instant nextFireAfter(CronSchedule schedule, Instant from, ZoneId zone) {
        Objects.requireNonNull(schedule, "schedule must not be null");
        Objects.requireNonNull(from, "from must not be null");
        Objects.requireNonNull(zone, "zone must not be null");

        LocalDateTime cursor = LocalDateTime.ofInstant(from, zone);
        while (true) {
            LocalDateTime next = nextFireAfter(schedule, cursor);
            Instant candidate = next.atZone(zone).toInstant();
            if (candidate.isAfter(from)) {
                return candidate;
            }
            cursor = next;
        }
    }

    /**
     * Earliest local date-time strictly after {@code from} (seconds = 0) matching the schedule.
     * Searches month, day, hour and minute in turn, carrying into the next unit on overflow.
     */
    public static LocalDateTime nextFireAfter(CronSchedule schedule, LocalDateTime from) {
        Objects.requireNonNull(schedule, "schedule must not be null");
        Objects.requireNonNull(from, "from must not be null");

        LocalDateTime limit = from.plusYears(HORIZON_YEARS);
        LocalDateTime t = from.truncatedTo(ChronoUnit.MINUTES).plusMinutes(1);

        while (!t.isAfter(limit)) {
            int month = schedule.month().nextOrSelf(t.getMonthValue());
            if (month < 0) {
                t = LocalDateTime.of(t.getYear() + 1, schedule.month().first(), 1, 0, 0);
                continue;
            }
            if (month != t.getMonthValue()) {
                t = LocalDateTime.of(t.getYear(), month, 1, 0, 0);
                continue;
            }

            if (!schedule.matchesDay(t.toLocalDate())) {
                t = t.toLocalDate().plusDays(1).atStartOfDay();
                continue;
            }

            int hour = schedule.hour().nextOrSelf(t.getHour());
            if (hour < 0) {
                t = t.toLocalDate().plusDays(1).atStartOfDay();
                continue;
            }
            if (hour != t.getHour()) {
                t = t.withHour(hour).withMinute(0);
                continue;
            }

            int minute = schedule.minute().nextOrSelf(t.getMinute());
            if (minute < 0) {
                t = t.withMinute(0).plusHours(1);
                continue;
            }
            return t.withMinute(minute);
        }

        throw new UnreachableScheduleException(
                "Schedule '" + schedule.expression() + "' has no fire-time within "
                        + HORIZON_YEARS + " years after " + from);
    }

    private static CronField fieldOrEvery(CronFieldType type, String text) {
        return text == null ? CronField.every(type) : CronFieldParser.parse(type, text);
    }
}
