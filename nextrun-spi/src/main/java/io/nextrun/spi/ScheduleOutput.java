package io.nextrun.spi;

import java.time.LocalDateTime;
import org.immutables.value.Value;

@Value.Immutable
public interface ScheduleOutput
{
    String getDescription();

    LocalDateTime getExecutionTime();

    static ScheduleOutput of(String description, LocalDateTime executionTime)
    {
        return ImmutableScheduleOutput.builder()
            .description(description)
            .executionTime(executionTime)
            .build();
    }
}
