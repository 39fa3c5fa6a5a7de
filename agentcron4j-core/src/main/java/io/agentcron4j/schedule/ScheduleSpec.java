package io.agentcron4j.schedule;

import io.agentcron4j.core.InvalidScheduleException;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Declarative schedule of a job, either a 5-field cron string or a sparse field map.
 *
 * <p>Field map keys: {@code minute}, {@code hour}, {@code day} (or {@code day_of_month}),
 * {@code month}, {@code day_of_week}. Values are integers or cron field text such as
 * {@code "1,15"} or {@code "mon-fri"}. Missing fields mean "every".
 */
public interface ScheduleSpec {

    /**
     * Human readable form, used in logs and job listings.
     */
    String describe();

    static ScheduleSpec cron(String expression) {
        return new Cron(expression);
    }

    static ScheduleSpec fields(Map<String, ?> fields) {
        return Fields.of(fields);
    }

    record Cron(String expression) implements ScheduleSpec {
        public Cron {
            Objects.requireNonNull(expression, "expression must not be null");
            expression = expression.trim();
        }

        @Override
        public String describe() {
            return expression;
        }
    }

    /**
     * Field map form. {@code null} components mean "every".
     */
    record Fields(String minute, String hour, String dayOfMonth, String month, String dayOfWeek)
            implements ScheduleSpec {

        public static Fields of(Map<String, ?> fields) {
            if (fields == null || fields.isEmpty()) {
                throw new InvalidScheduleException("Schedule dict must contain at least one time field");
            }
            Map<String, String> normalized = new LinkedHashMap<>();
            for (var e : fields.entrySet()) {
                String key = e.getKey() == null ? "" : e.getKey().trim();
                String canonical = switch (key) {
                    case "minute" -> "minute";
                    case "hour" -> "hour";
                    case "day", "day_of_month" -> "day";
                    case "month" -> "month";
                    case "day_of_week" -> "day_of_week";
                    default -> throw new InvalidScheduleException("Unsupported schedule field: '" + key + "'");
                };
                if (normalized.containsKey(canonical)) {
                    throw new InvalidScheduleException("Duplicate schedule field: " + canonical);
                }
                String value = toFieldText(canonical, e.getValue());
                if (value != null) {
                    normalized.put(canonical, value);
                }
            }
            if (normalized.isEmpty()) {
                throw new InvalidScheduleException("Schedule dict must contain at least one time field");
            }
            return new Fields(
                    normalized.get("minute"),
                    normalized.get("hour"),
                    normalized.get("day"),
                    normalized.get("month"),
                    normalized.get("day_of_week"));
        }

        private static String toFieldText(String key, Object value) {
            if (value == null) {
                return null;
            }
            if (value instanceof Number n) {
                double asDouble = n.doubleValue();
                if (asDouble % 1 != 0) {
                    throw new InvalidScheduleException("Schedule field '" + key + "' must be an integer: " + value);
                }
                return Long.toString(n.longValue());
            }
            if (value instanceof CharSequence cs) {
                String s = cs.toString().trim();
                if (s.isEmpty()) {
                    throw new InvalidScheduleException("Schedule field '" + key + "' must not be blank");
                }
                return s;
            }
            throw new InvalidScheduleException(
                    "Schedule field '" + key + "' must be a number or string, got " + value.getClass().getSimpleName());
        }

        @Override
        public String describe() {
            StringBuilder sb = new StringBuilder("{");
            append(sb, "minute", minute);
            append(sb, "hour", hour);
            append(sb, "day", dayOfMonth);
            append(sb, "month", month);
            append(sb, "day_of_week", dayOfWeek);
            return sb.append('}').toString();
        }

        private static void append(StringBuilder sb, String key, String value) {
            if (value == null) {
                return;
            }
            if (sb.length() > 1) {
                sb.append(", ");
            }
            sb.append(key).append('=').append(value);
        }
    }
}
