package io.agentcron4j.schedule;

import java.util.BitSet;
import java.util.Objects;

/**
 * One parsed cron field: the set of calendar values it accepts.
 */
public final class CronField {

    private final CronFieldType type;
    private final BitSet values;
    private final String source;

    CronField(CronFieldType type, BitSet values, String source) {
        this.type = Objects.requireNonNull(type, "type must not be null");
        this.values = (BitSet) values.clone();
        this.source = source;
    }

    static CronField every(CronFieldType type) {
        BitSet all = new BitSet(type.max() + 1);
        all.set(type.min(), type.max() + 1);
        return new CronField(type, all, "*");
    }

    public CronFieldType type() {
        return type;
    }

    /**
     * Text this field was parsed from.
     */
    public String source() {
        return source;
    }

    public boolean matches(int value) {
        return value >= type.min() && value <= type.max() && values.get(value);
    }

    /**
     * Smallest accepted value that is {@code >= from}, or {@code -1} if there is none.
     */
    public int nextOrSelf(int from) {
        if (from > type.max()) {
            return -1;
        }
        int next = values.nextSetBit(Math.max(from, type.min()));
        return next > type.max() ? -1 : next;
    }

    public int first() {
        return values.nextSetBit(type.min());
    }

    /**
     * True when every value of the field's range is accepted ({@code *}, {@code *}/1, {@code 0-59} ...).
     * Used for the day-of-month / day-of-week OR rule.
     */
    public boolean isUnrestricted() {
        return values.cardinality() == type.size();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CronField other)) return false;
        return type == other.type && values.equals(other.values);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, values);
    }

    @Override
    public String toString() {
        return type.label() + "=" + source;
    }
}
