package io.nextrun.client.api;

import java.time.LocalDateTime;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.google.common.base.Optional;
import org.immutables.value.Value;

@Value.Immutable
@JsonDeserialize(as = ImmutableRestLimits.class)
public interface RestLimits
{
    LocalDateTime getStart();

    Optional<LocalDateTime> getEnd();

    static RestLimits of(LocalDateTime start, Optional<LocalDateTime> end)
    {
        return ImmutableRestLimits.builder()
            .start(start)
            .end(end)
            .build();
    }
}
