package opsqueue.jobs.model;

import java.time.DateTimeException;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.Objects;

/**
 * Recurrence rule of a schedule. Fields that do not apply to the
 * cadence type are ignored; missing calendar fields fall back to
 * midnight, Sunday and the first of the month.
 *
 * @param type            cadence family
 * @param intervalMinutes minutes between runs (interval only)
 * @param dayOfWeek       0 = Sunday .. 6 = Saturday (weekly only)
 * @param dayOfMonth      1..31, clamped to the month length (monthly only)
 * @param hour            0..23 (calendar cadences)
 * @param minute          0..59 (calendar cadences)
 * @param zone            zone calendar fields are evaluated in
 */
public record Cadence(
        CadenceType type,
        Integer intervalMinutes,
        Integer dayOfWeek,
        Integer dayOfMonth,
        Integer hour,
        Integer minute,
        ZoneId zone) {

    public static final int MAX_INTERVAL_MINUTES = 10080;

    public Cadence {
        Objects.requireNonNull(type, "cadenceType is required");
        if (zone == null) {
            zone = ZoneOffset.UTC;
        }
    }

    public static Cadence interval(int minutes) {
        return new Cadence(CadenceType.INTERVAL, minutes, null, null, null, null, null);
    }

    public static Cadence daily(int hour, int minute) {
        return new Cadence(CadenceType.DAILY, null, null, null, hour, minute, null);
    }

    public static Cadence weekly(int dayOfWeek, int hour, int minute) {
        return new Cadence(CadenceType.WEEKLY, null, dayOfWeek, null, hour, minute, null);
    }

    public static Cadence monthly(int dayOfMonth, int hour, int minute) {
        return new Cadence(CadenceType.MONTHLY, null, null, dayOfMonth, hour, minute, null);
    }

    public int hourOrDefault() {
        return hour != null ? hour : 0;
    }

    public int minuteOrDefault() {
        return minute != null ? minute : 0;
    }

    public int dayOfWeekOrDefault() {
        return dayOfWeek != null ? dayOfWeek : 0;
    }

    public int dayOfMonthOrDefault() {
        return dayOfMonth != null ? dayOfMonth : 1;
    }

    /**
     * Check field ranges for this cadence type.
     *
     * @throws IllegalArgumentException with a message naming the bad field
     */
    public void validate() {
        if (type == CadenceType.INTERVAL) {
            int m = intervalMinutes != null ? intervalMinutes : 0;
            if (m < 1 || m > MAX_INTERVAL_MINUTES) {
                throw new IllegalArgumentException("intervalMinutes must be 1-" + MAX_INTERVAL_MINUTES);
            }
            return;
        }
        if (hourOrDefault() < 0 || hourOrDefault() > 23) {
            throw new IllegalArgumentException("hour must be 0-23");
        }
        if (minuteOrDefault() < 0 || minuteOrDefault() > 59) {
            throw new IllegalArgumentException("minute must be 0-59");
        }
        if (type == CadenceType.WEEKLY && (dayOfWeekOrDefault() < 0 || dayOfWeekOrDefault() > 6)) {
            throw new IllegalArgumentException("dayOfWeek must be 0-6 (Sun-Sat)");
        }
        if (type == CadenceType.MONTHLY && (dayOfMonthOrDefault() < 1 || dayOfMonthOrDefault() > 31)) {
            throw new IllegalArgumentException("dayOfMonth must be 1-31");
        }
    }

    /**
     * Parse a zone id, treating null/blank as UTC.
     */
    public static ZoneId zoneOf(String timezone) {
        if (timezone == null || timezone.isBlank()) {
            return ZoneOffset.UTC;
        }
        try {
            return ZoneId.of(timezone);
        } catch (DateTimeException e) {
            throw new IllegalArgumentException("Invalid timezone: " + timezone);
        }
    }
}
