package io.nextrun.client.api;

import java.time.DayOfWeek;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.List;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.google.common.base.Optional;
import io.nextrun.spi.Ordinal;
import io.nextrun.spi.WeekOption;
import org.immutables.value.Value;

/**
 * Flat JSON shape of a schedule configuration. {@link #getType()} selects the variant
 * and decides which of the optional fields are read.
 */
@Value.Immutable
@JsonDeserialize(as = ImmutableRestScheduleConfiguration.class)
public interface RestScheduleConfiguration
{
    String TYPE_ONCE = "once";
    String TYPE_DAILY = "daily";
    String TYPE_WEEKLY = "weekly";
    String TYPE_MONTHLY_ORDINAL = "monthly_ordinal";
    String TYPE_MONTHLY_DAY = "monthly_day";

    String getType();

    @Value.Default
    default boolean getEnabled()
    {
        return true;
    }

    LocalDateTime getCurrentDate();

    Optional<RestLimits> getLimits();

    // culture tag such as en-GB
    Optional<String> getCulture();

    Optional<LocalDateTime> getTargetDateTime();

    Optional<RestHourTimeRange> getHourRange();

    Optional<Integer> getHourlyInterval();

    Optional<Boolean> getOccursOnce();

    Optional<LocalTime> getOnceAt();

    List<DayOfWeek> getDaysOfWeek();

    Optional<Integer> getWeekInterval();

    Optional<WeekOption> getWeekOption();

    Optional<Ordinal> getOrdinal();

    Optional<Integer> getDayOfMonth();

    Optional<Integer> getMonthInterval();

    static ImmutableRestScheduleConfiguration.Builder builder()
    {
        return ImmutableRestScheduleConfiguration.builder();
    }
}
