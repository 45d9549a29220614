package io.nextrun.spi.config;

import java.time.DayOfWeek;
import java.util.Set;
import io.nextrun.spi.InvalidIntervalException;
import org.immutables.value.Value;

@Value.Immutable
public abstract class WeeklyConfiguration
        extends RecurringConfiguration
{
    // may be empty, in which case nothing is ever scheduled
    public abstract Set<DayOfWeek> getDaysOfWeek();

    @Value.Default
    public int getWeekInterval()
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
        if (getWeekInterval() < 1) {
            throw new InvalidIntervalException("weekInterval must be greater than 0: " + getWeekInterval());
        }
    }

    public static ImmutableWeeklyConfiguration.Builder builder()
    {
        return ImmutableWeeklyConfiguration.builder();
    }
}
