package io.nextrun.client.api;

import java.util.List;
import com.google.common.base.Optional;
import com.google.common.collect.ImmutableList;
import io.nextrun.spi.Culture;
import io.nextrun.spi.HourTimeRange;
import io.nextrun.spi.ImmutableHourTimeRange;
import io.nextrun.spi.InvalidArgumentException;
import io.nextrun.spi.LimitsInterval;
import io.nextrun.spi.ScheduleOutput;
import io.nextrun.spi.UnsupportedConfigurationException;
import io.nextrun.spi.config.DailyConfiguration;
import io.nextrun.spi.config.ImmutableDailyConfiguration;
import io.nextrun.spi.config.ImmutableMonthlyOrdinalConfiguration;
import io.nextrun.spi.config.ImmutableMonthlySpecificDayConfiguration;
import io.nextrun.spi.config.ImmutableOnceConfiguration;
import io.nextrun.spi.config.ImmutableWeeklyConfiguration;
import io.nextrun.spi.config.MonthlyOrdinalConfiguration;
import io.nextrun.spi.config.MonthlySpecificDayConfiguration;
import io.nextrun.spi.config.OnceConfiguration;
import io.nextrun.spi.config.SchedulerConfiguration;
import io.nextrun.spi.config.WeeklyConfiguration;

import static java.util.Locale.ENGLISH;

/**
 * Conversions between the JSON shapes and the typed configuration model.
 */
public final class RestModels
{
    private RestModels()
    { }

    public static SchedulerConfiguration configuration(RestScheduleConfiguration rest)
    {
        Optional<LimitsInterval> limits = rest.getLimits()
            .transform(l -> LimitsInterval.of(l.getStart(), l.getEnd()));
        Optional<Culture> culture = rest.getCulture()
            .transform(Culture::fromTag);

        switch (rest.getType().toLowerCase(ENGLISH)) {
        case RestScheduleConfiguration.TYPE_ONCE: {
            ImmutableOnceConfiguration.Builder builder = OnceConfiguration.builder()
                .enabled(rest.getEnabled())
                .currentDate(rest.getCurrentDate())
                .culture(culture)
                .targetDateTime(require(rest.getTargetDateTime(), "targetDateTime", rest));
            if (limits.isPresent()) {
                builder.limits(limits.get());
            }
            return builder.build();
        }

        case RestScheduleConfiguration.TYPE_DAILY: {
            ImmutableDailyConfiguration.Builder builder = DailyConfiguration.builder()
                .enabled(rest.getEnabled())
                .currentDate(rest.getCurrentDate())
                .culture(culture)
                .hourRange(rest.getHourRange().transform(RestModels::hourTimeRange))
                .hourlyInterval(rest.getHourlyInterval())
                .occursOnce(rest.getOccursOnce().or(false))
                .onceAt(rest.getOnceAt());
            if (limits.isPresent()) {
                builder.limits(limits.get());
            }
            return builder.build();
        }

        case RestScheduleConfiguration.TYPE_WEEKLY: {
            ImmutableWeeklyConfiguration.Builder builder = WeeklyConfiguration.builder()
                .enabled(rest.getEnabled())
                .currentDate(rest.getCurrentDate())
                .culture(culture)
                .hourRange(rest.getHourRange().transform(RestModels::hourTimeRange))
                .hourlyInterval(rest.getHourlyInterval())
                .daysOfWeek(rest.getDaysOfWeek());
            if (rest.getWeekInterval().isPresent()) {
                builder.weekInterval(rest.getWeekInterval().get());
            }
            if (limits.isPresent()) {
                builder.limits(limits.get());
            }
            return builder.build();
        }

        case RestScheduleConfiguration.TYPE_MONTHLY_ORDINAL: {
            ImmutableMonthlyOrdinalConfiguration.Builder builder = MonthlyOrdinalConfiguration.builder()
                .enabled(rest.getEnabled())
                .currentDate(rest.getCurrentDate())
                .culture(culture)
                .hourRange(rest.getHourRange().transform(RestModels::hourTimeRange))
                .hourlyInterval(rest.getHourlyInterval())
                .weekOption(require(rest.getWeekOption(), "weekOption", rest))
                .ordinal(require(rest.getOrdinal(), "ordinal", rest));
            if (rest.getMonthInterval().isPresent()) {
                builder.monthInterval(rest.getMonthInterval().get());
            }
            if (limits.isPresent()) {
                builder.limits(limits.get());
            }
            return builder.build();
        }

        case RestScheduleConfiguration.TYPE_MONTHLY_DAY: {
            ImmutableMonthlySpecificDayConfiguration.Builder builder = MonthlySpecificDayConfiguration.builder()
                .enabled(rest.getEnabled())
                .currentDate(rest.getCurrentDate())
                .culture(culture)
                .hourRange(rest.getHourRange().transform(RestModels::hourTimeRange))
                .hourlyInterval(rest.getHourlyInterval())
                .dayOfMonth(require(rest.getDayOfMonth(), "dayOfMonth", rest));
            if (rest.getMonthInterval().isPresent()) {
                builder.monthInterval(rest.getMonthInterval().get());
            }
            if (limits.isPresent()) {
                builder.limits(limits.get());
            }
            return builder.build();
        }

        default:
            throw new UnsupportedConfigurationException("Unsupported configuration type: " + rest.getType());
        }
    }

    public static RestScheduleConfiguration configuration(SchedulerConfiguration config)
    {
        ImmutableRestScheduleConfiguration.Builder builder = RestScheduleConfiguration.builder()
            .enabled(config.getEnabled())
            .currentDate(config.getCurrentDate())
            .limits(RestLimits.of(config.getLimits().getStart(), config.getLimits().getEnd()))
            .culture(config.getCulture().transform(Culture::getTag));

        return config.accept(new SchedulerConfiguration.Visitor<RestScheduleConfiguration>()
        {
            @Override
            public RestScheduleConfiguration visit(OnceConfiguration once)
            {
                return builder
                    .type(RestScheduleConfiguration.TYPE_ONCE)
                    .targetDateTime(once.getTargetDateTime())
                    .build();
            }

            @Override
            public RestScheduleConfiguration visit(DailyConfiguration daily)
            {
                return builder
                    .type(RestScheduleConfiguration.TYPE_DAILY)
                    .hourRange(daily.getHourRange().transform(RestModels::hourTimeRange))
                    .hourlyInterval(daily.getHourlyInterval())
                    .occursOnce(daily.getOccursOnce())
                    .onceAt(daily.getOnceAt())
                    .build();
            }

            @Override
            public RestScheduleConfiguration visit(WeeklyConfiguration weekly)
            {
                return builder
                    .type(RestScheduleConfiguration.TYPE_WEEKLY)
                    .hourRange(weekly.getHourRange().transform(RestModels::hourTimeRange))
                    .hourlyInterval(weekly.getHourlyInterval())
                    .daysOfWeek(weekly.getDaysOfWeek())
                    .weekInterval(weekly.getWeekInterval())
                    .build();
            }

            @Override
            public RestScheduleConfiguration visit(MonthlyOrdinalConfiguration monthly)
            {
                return builder
                    .type(RestScheduleConfiguration.TYPE_MONTHLY_ORDINAL)
                    .hourRange(monthly.getHourRange().transform(RestModels::hourTimeRange))
                    .hourlyInterval(monthly.getHourlyInterval())
                    .weekOption(monthly.getWeekOption())
                    .ordinal(monthly.getOrdinal())
                    .monthInterval(monthly.getMonthInterval())
                    .build();
            }

            @Override
            public RestScheduleConfiguration visit(MonthlySpecificDayConfiguration monthly)
            {
                return builder
                    .type(RestScheduleConfiguration.TYPE_MONTHLY_DAY)
                    .hourRange(monthly.getHourRange().transform(RestModels::hourTimeRange))
                    .hourlyInterval(monthly.getHourlyInterval())
                    .dayOfMonth(monthly.getDayOfMonth())
                    .monthInterval(monthly.getMonthInterval())
                    .build();
            }
        });
    }

    public static HourTimeRange hourTimeRange(RestHourTimeRange rest)
    {
        ImmutableHourTimeRange.Builder builder = HourTimeRange.builder()
            .startHour(rest.getStartHour());
        if (rest.getEndHour().isPresent()) {
            builder.endHour(rest.getEndHour().get());
        }
        if (rest.getHourlyInterval().isPresent()) {
            builder.hourlyInterval(rest.getHourlyInterval().get());
        }
        if (rest.getIntervalUnit().isPresent()) {
            builder.intervalUnit(rest.getIntervalUnit().get());
        }
        if (rest.getFrequency().isPresent()) {
            builder.frequency(rest.getFrequency().get());
        }
        return builder.build();
    }

    public static RestHourTimeRange hourTimeRange(HourTimeRange range)
    {
        return RestHourTimeRange.builder()
            .startHour(range.getStartHour())
            .endHour(range.getEndHour())
            .hourlyInterval(range.getHourlyInterval())
            .intervalUnit(range.getIntervalUnit())
            .frequency(range.getFrequency())
            .build();
    }

    public static RestScheduleOutput output(ScheduleOutput output)
    {
        return RestScheduleOutput.builder()
            .description(output.getDescription())
            .executionTime(output.getExecutionTime())
            .build();
    }

    public static List<RestScheduleOutput> outputs(List<ScheduleOutput> outputs)
    {
        ImmutableList.Builder<RestScheduleOutput> builder = ImmutableList.builder();
        for (ScheduleOutput output : outputs) {
            builder.add(output(output));
        }
        return builder.build();
    }

    private static <T> T require(Optional<T> value, String field, RestScheduleConfiguration rest)
    {
        if (!value.isPresent()) {
            throw new InvalidArgumentException(field + " is required for type " + rest.getType());
        }
        return value.get();
    }
}
