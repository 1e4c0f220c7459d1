package opsqueue.jobs.scheduler;

import opsqueue.jobs.model.Cadence;

import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.YearMonth;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;
import java.time.temporal.TemporalAdjusters;
import java.util.Objects;

/**
 * Next due time of a cadence. Pure function of its inputs.
 *
 * <p>
 * Calendar cadences return the first matching wall-clock time strictly after
 * {@code from}, evaluated in the cadence zone. A monthly day past the end of
 * a month lands on that month's last day.
 */
public final class CadenceCalculator {

    private CadenceCalculator() {
    }

    /**
     * @throws IllegalArgumentException if the cadence fails validation
     */
    public static Instant computeNextRunAt(Cadence cadence, Instant from) {
        Objects.requireNonNull(cadence, "cadence");
        Objects.requireNonNull(from, "from");
        cadence.validate();

        return switch (cadence.type()) {
            case INTERVAL -> from.plus(cadence.intervalMinutes(), ChronoUnit.MINUTES);
            case DAILY -> nextDaily(cadence, from);
            case WEEKLY -> nextWeekly(cadence, from);
            case MONTHLY -> nextMonthly(cadence, from);
        };
    }

    private static Instant nextDaily(Cadence cadence, Instant from) {
        ZonedDateTime start = from.atZone(cadence.zone());
        ZonedDateTime candidate = at(start.toLocalDate(), cadence);
        if (!candidate.toInstant().isAfter(from)) {
            candidate = at(start.toLocalDate().plusDays(1), cadence);
        }
        return candidate.toInstant();
    }

    private static Instant nextWeekly(Cadence cadence, Instant from) {
        ZonedDateTime start = from.atZone(cadence.zone());
        DayOfWeek target = toDayOfWeek(cadence.dayOfWeekOrDefault());
        LocalDate day = start.toLocalDate().with(TemporalAdjusters.nextOrSame(target));
        ZonedDateTime candidate = at(day, cadence);
        if (!candidate.toInstant().isAfter(from)) {
            candidate = at(day.plusWeeks(1), cadence);
        }
        return candidate.toInstant();
    }

    private static Instant nextMonthly(Cadence cadence, Instant from) {
        ZonedDateTime start = from.atZone(cadence.zone());
        YearMonth month = YearMonth.from(start);
        // At most two iterations: this month's slot or next month's.
        while (true) {
            int day = Math.min(cadence.dayOfMonthOrDefault(), month.lengthOfMonth());
            ZonedDateTime candidate = at(month.atDay(day), cadence);
            if (candidate.toInstant().isAfter(from)) {
                return candidate.toInstant();
            }
            month = month.plusMonths(1);
        }
    }

    private static ZonedDateTime at(LocalDate date, Cadence cadence) {
        return ZonedDateTime.of(date, LocalTime.of(cadence.hourOrDefault(), cadence.minuteOrDefault()),
                cadence.zone());
    }

    /** 0 = Sunday .. 6 = Saturday */
    static DayOfWeek toDayOfWeek(int dayOfWeek) {
        return dayOfWeek == 0 ? DayOfWeek.SUNDAY : DayOfWeek.of(dayOfWeek);
    }
}
