package io.nextrun.spi;

import java.time.Duration;
import java.time.LocalTime;
import org.immutables.value.Value;

/**
 * Time-of-day window expanded into concrete instants on each matching calendar day.
 *
 * An end hour earlier than the start hour is valid and means the window continues
 * past midnight into the next calendar day. A zero end hour (the default) means
 * the window is the start hour alone.
 */
@Value.Immutable
public abstract class HourTimeRange
{
    public abstract LocalTime getStartHour();

    @Value.Default
    public LocalTime getEndHour()
    {
        return LocalTime.MIDNIGHT;
    }

    @Value.Default
    public int getHourlyInterval()
    {
        return 1;
    }

    @Value.Default
    public IntervalUnit getIntervalUnit()
    {
        return IntervalUnit.HOURS;
    }

    @Value.Default
    public DailyHourFrequency getFrequency()
    {
        return DailyHourFrequency.RECURRENT;
    }

    /**
     * True when the range yields only its start hour: the frequency is
     * {@link DailyHourFrequency#ONCE} or the end hour is zero.
     */
    public boolean isSingleInstant()
    {
        return getFrequency() == DailyHourFrequency.ONCE || getEndHour().equals(LocalTime.MIDNIGHT);
    }

    public boolean crossesMidnight()
    {
        return !isSingleInstant() && getEndHour().isBefore(getStartHour());
    }

    public Duration getStep()
    {
        return getIntervalUnit().toDuration(getHourlyInterval());
    }

    @Value.Check
    protected void check()
    {
        if (getHourlyInterval() <= 0) {
            throw new InvalidIntervalException("hourlyInterval must be greater than 0: " + getHourlyInterval());
        }
    }

    public static HourTimeRange at(LocalTime startHour)
    {
        return ImmutableHourTimeRange.builder()
            .startHour(startHour)
            .frequency(DailyHourFrequency.ONCE)
            .build();
    }

    public static HourTimeRange of(LocalTime startHour, LocalTime endHour, int hourlyInterval)
    {
        return ImmutableHourTimeRange.builder()
            .startHour(startHour)
            .endHour(endHour)
            .hourlyInterval(hourlyInterval)
            .build();
    }

    public static ImmutableHourTimeRange.Builder builder()
    {
        return ImmutableHourTimeRange.builder();
    }
}
