package io.nextrun.client.api;

import java.time.LocalDateTime;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import org.immutables.value.Value;

@Value.Immutable
@JsonDeserialize(as = ImmutableRestScheduleOutput.class)
public interface RestScheduleOutput
{
    String getDescription();

    LocalDateTime getExecutionTime();

    static ImmutableRestScheduleOutput.Builder builder()
    {
        return ImmutableRestScheduleOutput.builder();
    }
}
