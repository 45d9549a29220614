package io.nextrun.core.schedule;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.YearMonth;
import java.time.temporal.TemporalAdjusters;
import com.google.common.base.Optional;
import io.nextrun.spi.Ordinal;
import io.nextrun.spi.WeekOption;

/**
 * Calendar lookups shared by the date calculators.
 */
public final class CalendarDays
{
    private CalendarDays()
    { }

    /**
     * Returns the first date on or after {@code date} that falls on {@code dayOfWeek}.
     */
    public static LocalDate nextOrSame(LocalDate date, DayOfWeek dayOfWeek)
    {
        return date.with(TemporalAdjusters.nextOrSame(dayOfWeek));
    }

    /**
     * Returns the day of {@code month} at the given ordinal among the days matching
     * {@code option}, or absent if the month has fewer matching days.
     */
    public static Optional<LocalDate> ordinalDayOf(YearMonth month, WeekOption option, Ordinal ordinal)
    {
        if (ordinal.isLast()) {
            return Optional.of(lastDayOf(month, option));
        }

        int position = ordinal.getPosition();
        if (option.isSingleDay()) {
            DayOfWeek dayOfWeek = option.getDays().iterator().next();
            LocalDate day = nextOrSame(month.atDay(1), dayOfWeek).plusWeeks(position - 1);
            return YearMonth.from(day).equals(month) ? Optional.of(day) : Optional.absent();
        }

        int count = 0;
        for (LocalDate day = month.atDay(1); !day.isAfter(month.atEndOfMonth()); day = day.plusDays(1)) {
            if (option.matches(day.getDayOfWeek())) {
                count++;
                if (count == position) {
                    return Optional.of(day);
                }
            }
        }
        return Optional.absent();
    }

    /**
     * Scans backward from the last day of {@code month} to the first day matching {@code option}.
     */
    public static LocalDate lastDayOf(YearMonth month, WeekOption option)
    {
        LocalDate day = month.atEndOfMonth();
        while (!option.matches(day.getDayOfWeek())) {
            day = day.minusDays(1);
        }
        return day;
    }

    /**
     * Returns the given day of {@code month}, or absent if the month is shorter.
     */
    public static Optional<LocalDate> dayOf(YearMonth month, int dayOfMonth)
    {
        if (dayOfMonth < 1 || dayOfMonth > month.lengthOfMonth()) {
            return Optional.absent();
        }
        return Optional.of(month.atDay(dayOfMonth));
    }
}
