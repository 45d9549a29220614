package io.nextrun.client.api;

import java.time.LocalTime;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.google.common.base.Optional;
import io.nextrun.spi.DailyHourFrequency;
import io.nextrun.spi.IntervalUnit;
import org.immutables.value.Value;

@Value.Immutable
@JsonDeserialize(as = ImmutableRestHourTimeRange.class)
public interface RestHourTimeRange
{
    LocalTime getStartHour();

    Optional<LocalTime> getEndHour();

    Optional<Integer> getHourlyInterval();

    Optional<IntervalUnit> getIntervalUnit();

    Optional<DailyHourFrequency> getFrequency();

    static ImmutableRestHourTimeRange.Builder builder()
    {
        return ImmutableRestHourTimeRange.builder();
    }
}
