package io.nextrun.spi.config;

import com.google.common.base.Optional;
import io.nextrun.spi.HourTimeRange;
import io.nextrun.spi.ImmutableHourTimeRange;
import io.nextrun.spi.InvalidArgumentException;

/**
 * Base of the daily, weekly and monthly variants. Every matching calendar day is
 * expanded through the hour range into concrete instants.
 */
public abstract class RecurringConfiguration
        extends SchedulerConfiguration
{
    RecurringConfiguration()
    { }

    public abstract Optional<HourTimeRange> getHourRange();

    /**
     * Overrides the interval carried by the hour range when present.
     */
    public abstract Optional<Integer> getHourlyInterval();

    public HourTimeRange requireHourRange()
    {
        if (!getHourRange().isPresent()) {
            throw new InvalidArgumentException("hourRange is required for " + getClass().getSimpleName());
        }
        HourTimeRange range = getHourRange().get();
        if (getHourlyInterval().isPresent()) {
            // the copy re-runs the interval check of HourTimeRange
            return ImmutableHourTimeRange.copyOf(range).withHourlyInterval(getHourlyInterval().get());
        }
        return range;
    }
}
