package io.agentcron4j.schedule;

import java.util.List;
import java.util.Locale;

/**
 * The five positions of a standard cron expression with their allowed ranges.
 */
public enum CronFieldType {

    MINUTE("minute", 0, 59, List.of()),
    HOUR("hour", 0, 23, List.of()),
    DAY_OF_MONTH("day-of-month", 1, 31, List.of()),
    MONTH("month", 1, 12, List.of(
            "jan", "feb", "mar", "apr", "may", "jun",
            "jul", "aug", "sep", "oct", "nov", "dec")),
    DAY_OF_WEEK("day-of-week", 0, 6, List.of(
            "sun", "mon", "tue", "wed", "thu", "fri", "sat"));

    private final String label;
    private final int min;
    private final int max;
    // names.get(i) stands for min + i
    private final List<String> names;

    CronFieldType(String label, int min, int max, List<String> names) {
        this.label = label;
        this.min = min;
        this.max = max;
        this.names = names;
    }

    public String label() {
        return label;
    }

    public int min() {
        return min;
    }

    public int max() {
        return max;
    }

    public int size() {
        return max - min + 1;
    }

    /**
     * Resolves a symbolic token such as {@code "mon"} or {@code "Jan"}.
     *
     * @return the numeric value, or {@code -1} if the token is not a name of this field
     */
    int valueOfName(String token) {
        int idx = names.indexOf(token.toLowerCase(Locale.ROOT));
        return idx < 0 ? -1 : min + idx;
    }

    boolean hasNames() {
        return !names.isEmpty();
    }
}
