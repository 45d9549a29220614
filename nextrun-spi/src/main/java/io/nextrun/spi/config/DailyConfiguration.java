package io.nextrun.spi.config;

import java.time.LocalTime;
import com.google.common.base.Optional;
import io.nextrun.spi.InvalidArgumentException;
import org.immutables.value.Value;

@Value.Immutable
public abstract class DailyConfiguration
        extends RecurringConfiguration
{
    @Value.Default
    public boolean getOccursOnce()
    {
        return false;
    }

    public abstract Optional<LocalTime> getOnceAt();

    @Override
    public <R> R accept(Visitor<R> visitor)
    {
        return visitor.visit(this);
    }

    @Value.Check
    protected void check()
    {
        if (getOccursOnce() && !getOnceAt().isPresent()) {
            throw new InvalidArgumentException("onceAt is required when occursOnce is set");
        }
    }

    public static ImmutableDailyConfiguration.Builder builder()
    {
        return ImmutableDailyConfiguration.builder();
    }
}
