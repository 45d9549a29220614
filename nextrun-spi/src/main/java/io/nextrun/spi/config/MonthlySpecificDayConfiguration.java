package io.nextrun.spi.config;

import io.nextrun.spi.InvalidArgumentException;
import io.nextrun.spi.InvalidIntervalException;
import org.immutables.value.Value;

@Value.Immutable
public abstract class MonthlySpecificDayConfiguration
        extends RecurringConfiguration
{
    public abstract int getDayOfMonth();

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
        if (getDayOfMonth() < 1 || getDayOfMonth() > 31) {
            throw new InvalidArgumentException("dayOfMonth must be between 1 and 31: " + getDayOfMonth());
        }
        if (getMonthInterval() < 1) {
            throw new InvalidIntervalException("monthInterval must be greater than 0: " + getMonthInterval());
        }
    }

    public static ImmutableMonthlySpecificDayConfiguration.Builder builder()
    {
        return ImmutableMonthlySpecificDayConfiguration.builder();
    }
}
