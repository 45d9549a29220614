package io.nextrun.spi.config;

import io.nextrun.spi.InvalidIntervalException;
import io.nextrun.spi.Ordinal;
import io.nextrun.spi.WeekOption;
import org.immutables.value.Value;

/**
 * Runs on the Nth (or last) day of a month matching a week option, for example
 * "the second Tuesday" or "the last weekday".
 */
@Value.Immutable
public abstract class MonthlyOrdinalConfiguration
        extends RecurringConfiguration
{
    public abstract WeekOption getWeekOption();

    public abstract Ordinal getOrdinal();

    @Value.Default
    public int getMonthInterval()
    {
        return 1;
    }

    @Override
    public <R> R accept(Visitor<R> visitor)
    {
        return visitor.visit(this);
    }

    @Value.Check
    protected void check()
    {
        if (getMonthInterval() < 1) {
            throw new InvalidIntervalException("monthInterval must be greater than 0: " + getMonthInterval());
        }
    }

    public static ImmutableMonthlyOrdinalConfiguration.Builder builder()
    {
        return ImmutableMonthlyOrdinalConfiguration.builder();
    }
}
