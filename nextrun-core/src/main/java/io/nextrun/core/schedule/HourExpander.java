package io.nextrun.core.schedule;

import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import com.google.common.collect.ImmutableList;
import io.nextrun.spi.HourTimeRange;
import io.nextrun.spi.InvalidIntervalException;

/**
 * Expands a calendar date and an hour range into the ordered instants of that date.
 *
 * When the range crosses midnight the expansion continues into the next calendar day
 * with the same stride, so consecutive instants are always exactly one interval apart.
 */
public class HourExpander
{
    public List<LocalDateTime> expand(LocalDate date, HourTimeRange range, int maxCount)
    {
        return expand(date, range, LocalDateTime.MIN, maxCount);
    }

    /**
     * Same as {@link #expand(LocalDate, HourTimeRange, int)} but instants before
     * {@code notBefore} are dropped and do not count toward {@code maxCount}.
     */
    public List<LocalDateTime> expand(LocalDate date, HourTimeRange range, LocalDateTime notBefore, int maxCount)
    {
        if (range.getHourlyInterval() <= 0) {
            throw new InvalidIntervalException("Invalid interval: " + range.getHourlyInterval());
        }

        ImmutableList.Builder<LocalDateTime> builder = ImmutableList.builder();
        if (maxCount <= 0) {
            return builder.build();
        }

        LocalDateTime first = date.atTime(range.getStartHour());
        if (range.isSingleInstant()) {
            if (!first.isBefore(notBefore)) {
                builder.add(first);
            }
            return builder.build();
        }

        LocalDateTime last;
        if (range.crossesMidnight()) {
            last = date.plusDays(1).atTime(range.getEndHour());
        }
        else {
            last = date.atTime(range.getEndHour());
        }

        Duration step = range.getStep();
        int count = 0;
        for (LocalDateTime instant = first; !instant.isAfter(last) && count < maxCount; instant = instant.plus(step)) {
            if (!instant.isBefore(notBefore)) {
                builder.add(instant);
                count++;
            }
        }
        return builder.build();
    }
}
