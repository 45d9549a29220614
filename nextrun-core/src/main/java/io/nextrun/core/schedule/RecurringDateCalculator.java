package io.nextrun.core.schedule;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Iterator;
import java.util.List;
import com.google.common.collect.ImmutableList;
import io.nextrun.spi.DateCalculator;
import io.nextrun.spi.HourTimeRange;
import io.nextrun.spi.LimitsInterval;
import io.nextrun.spi.config.RecurringConfiguration;

/**
 * Walks the candidate calendar days of a recurring configuration in order and
 * expands each of them through the hour range until enough instants are collected.
 *
 * The validity interval is applied per calendar day: every candidate day up to the
 * end date is expanded in full, including the part of a midnight-crossing range that
 * falls on the next day. Only instants before the start of the interval are dropped.
 */
public abstract class RecurringDateCalculator<C extends RecurringConfiguration>
        implements DateCalculator<C>
{
    // date walks stop before this day even when the limits are unbounded
    public static final LocalDate SCHEDULE_END = LocalDate.of(9999, 1, 1);

    protected final HourExpander hourExpander;

    protected RecurringDateCalculator(HourExpander hourExpander)
    {
        this.hourExpander = hourExpander;
    }

    @Override
    public List<LocalDateTime> calculate(C config, int maxExecutions)
    {
        LimitsInterval limits = config.getLimits();
        DayExpansion expansion = dayExpansion(config, limits);

        LocalDate anchor = config.getCurrentDate().toLocalDate();
        LocalDate until = SCHEDULE_END.minusDays(1);
        if (limits.getEnd().isPresent() && limits.getEnd().get().toLocalDate().isBefore(until)) {
            until = limits.getEnd().get().toLocalDate();
        }

        ImmutableList.Builder<LocalDateTime> builder = ImmutableList.builder();
        int count = 0;
        Iterator<LocalDate> days = candidateDays(config, anchor, until);
        while (count < maxExecutions && days.hasNext()) {
            LocalDate day = days.next();
            if (!limits.containsDay(day)) {
                continue;
            }
            List<LocalDateTime> instants = expansion.expand(day, maxExecutions - count);
            builder.addAll(instants);
            count += instants.size();
        }
        return builder.build();
    }

    /**
     * Returns the matching days from {@code anchor} to {@code until}, both inclusive, in ascending order.
     */
    protected abstract Iterator<LocalDate> candidateDays(C config, LocalDate anchor, LocalDate until);

    protected DayExpansion dayExpansion(C config, LimitsInterval limits)
    {
        HourTimeRange range = config.requireHourRange();
        return (day, remaining) -> hourExpander.expand(day, range, limits.getStart(), remaining);
    }

    protected interface DayExpansion
    {
        List<LocalDateTime> expand(LocalDate day, int remaining);
    }
}
