package io.agentcron4j.schedule;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Objects;

/**
 * Normalized form of a {@link ScheduleSpec}: five field predicates over local calendar time.
 *
 * <p>Day-of-month and day-of-week follow POSIX cron: when both are restricted a day matches if
 * either field matches, otherwise both must match.
 */
public final class CronSchedule {

    private final CronField minute;
    private final CronField hour;
    private final CronField dayOfMonth;
    private final CronField month;
    private final CronField dayOfWeek;

    CronSchedule(CronField minute, CronField hour, CronField dayOfMonth, CronField month, CronField dayOfWeek) {
        this.minute = Objects.requireNonNull(minute, "minute must not be null");
        this.hour = Objects.requireNonNull(hour, "hour must not be null");
        this.dayOfMonth = Objects.requireNonNull(dayOfMonth, "dayOfMonth must not be null");
        this.month = Objects.requireNonNull(month, "month must not be null");
        this.dayOfWeek = Objects.requireNonNull(dayOfWeek, "dayOfWeek must not be null");
    }

    public CronField minute() {
        return minute;
    }

    public CronField hour() {
        return hour;
    }

    public CronField dayOfMonth() {
        return dayOfMonth;
    }

    public CronField month() {
        return month;
    }

    public CronField dayOfWeek() {
        return dayOfWeek;
    }

    public boolean matches(LocalDateTime time) {
        return time.getSecond() == 0
                && time.getNano() == 0
                && minute.matches(time.getMinute())
                && hour.matches(time.getHour())
                && month.matches(time.getMonthValue())
                && matchesDay(time.toLocalDate());
    }

    boolean matchesDay(LocalDate date) {
        boolean domMatch = dayOfMonth.matches(date.getDayOfMonth());
        // java.time: MONDAY=1..SUNDAY=7, cron: SUNDAY=0..SATURDAY=6
        boolean dowMatch = dayOfWeek.matches(date.getDayOfWeek().getValue() % 7);
        if (dayOfMonth.isUnrestricted() || dayOfWeek.isUnrestricted()) {
            return domMatch && dowMatch;
        }
        return domMatch || dowMatch;
    }

    /**
     * Canonical five-field text, e.g. {@code "0 9 * * *"}.
     */
    public String expression() {
        return String.join(" ",
                minute.source(), hour.source(), dayOfMonth.source(), month.source(), dayOfWeek.source());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CronSchedule other)) return false;
        return minute.equals(other.minute)
                && hour.equals(other.hour)
                && dayOfMonth.equals(other.dayOfMonth)
                && month.equals(other.month)
                && dayOfWeek.equals(other.dayOfWeek);
    }

    @Override
    public int hashCode() {
        return Objects.hash(minute, hour, dayOfMonth, month, dayOfWeek);
    }

    @Override
    public String toString() {
        return expression();
    }
}
