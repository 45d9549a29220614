package io.nextrun.spi.config;

import java.time.LocalDateTime;
import org.immutables.value.Value;

@Value.Immutable
public abstract class OnceConfiguration
        extends SchedulerConfiguration
{
    public abstract LocalDateTime getTargetDateTime();

    @Override
    public <R> R accept(Visitor<R> visitor)
    {
        return visitor.visit(this);
    }

    public static ImmutableOnceConfiguration.Builder builder()
    {
        return ImmutableOnceConfiguration.builder();
    }
}
