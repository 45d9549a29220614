package io.nextrun.core.description;

import java.time.DayOfWeek;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.List;
import java.util.stream.Collectors;
import com.google.inject.Inject;
import io.nextrun.core.EngineConfig;
import io.nextrun.spi.Culture;
import io.nextrun.spi.HourTimeRange;
import io.nextrun.spi.InvalidArgumentException;
import io.nextrun.spi.Ordinal;
import io.nextrun.spi.WeekOption;
import io.nextrun.spi.config.DailyConfiguration;
import io.nextrun.spi.config.MonthlyOrdinalConfiguration;
import io.nextrun.spi.config.MonthlySpecificDayConfiguration;
import io.nextrun.spi.config.OnceConfiguration;
import io.nextrun.spi.config.SchedulerConfiguration;
import io.nextrun.spi.config.WeeklyConfiguration;

/**
 * Builds the human-readable sentence attached to each execution instant.
 *
 * Every template ends with the date and time of the instant followed by the anchor
 * date of the configuration. The culture is taken from the configuration, or from
 * the engine default when the configuration names none.
 */
public class DescriptionGenerator
{
    private final MessageCatalog catalog;
    private final Culture defaultCulture;

    @Inject
    public DescriptionGenerator(MessageCatalog catalog, EngineConfig engineConfig)
    {
        this.catalog = catalog;
        this.defaultCulture = engineConfig.getDefaultCulture();
    }

    public String describe(SchedulerConfiguration config, LocalDateTime instant)
    {
        Culture culture = config.getCulture().or(defaultCulture);
        String date = catalog.formatDate(culture, instant.toLocalDate());
        String time = catalog.formatTime(culture, instant.toLocalTime());
        String anchorDate = catalog.formatDate(culture, config.getCurrentDate().toLocalDate());

        return config.accept(new SchedulerConfiguration.Visitor<String>()
        {
            @Override
            public String visit(OnceConfiguration once)
            {
                return catalog.format(culture, "description.once", date, time, anchorDate);
            }

            @Override
            public String visit(DailyConfiguration daily)
            {
                if (daily.getOccursOnce()) {
                    return describeSingleTime(daily.getOnceAt().get());
                }
                HourTimeRange range = daily.requireHourRange();
                if (range.isSingleInstant()) {
                    return describeSingleTime(range.getStartHour());
                }
                return catalog.format(culture, "description.daily.range",
                        catalog.formatTime(culture, range.getStartHour()),
                        catalog.formatTime(culture, range.getEndHour()),
                        date, time, anchorDate);
            }

            private String describeSingleTime(LocalTime at)
            {
                return catalog.format(culture, "description.daily.single",
                        catalog.formatTime(culture, at), date, time, anchorDate);
            }

            @Override
            public String visit(WeeklyConfiguration weekly)
            {
                weekly.requireHourRange();
                if (weekly.getDaysOfWeek().isEmpty()) {
                    throw new InvalidArgumentException("daysOfWeek is required for WeeklyConfiguration");
                }
                List<String> names = weekly.getDaysOfWeek().stream()
                    .sorted()
                    .map(day -> dayName(culture, day))
                    .collect(Collectors.toList());
                return catalog.format(culture, "description.weekly",
                        String.valueOf(weekly.getWeekInterval()),
                        String.join(catalog.get(culture, "list.separator"), names),
                        date, time, anchorDate);
            }

            @Override
            public String visit(MonthlyOrdinalConfiguration monthly)
            {
                String monthInterval = String.valueOf(monthly.getMonthInterval());
                if (monthly.getWeekOption() == WeekOption.ANY_DAY) {
                    return catalog.format(culture, "description.monthly.any-day",
                            String.valueOf(instant.getDayOfMonth()), monthInterval,
                            date, time, anchorDate);
                }
                return catalog.format(culture, "description.monthly.day-option",
                        ordinalWord(culture, monthly.getOrdinal()),
                        catalog.get(culture, "week-option." + monthly.getWeekOption().name()),
                        monthInterval, date, time, anchorDate);
            }

            @Override
            public String visit(MonthlySpecificDayConfiguration monthly)
            {
                return catalog.format(culture, "description.monthly.specific-day",
                        String.valueOf(monthly.getDayOfMonth()),
                        String.valueOf(monthly.getMonthInterval()),
                        date, time, anchorDate);
            }
        });
    }

    private String dayName(Culture culture, DayOfWeek day)
    {
        return catalog.get(culture, "week-option." + WeekOption.of(day).name());
    }

    private String ordinalWord(Culture culture, Ordinal ordinal)
    {
        return catalog.get(culture, "ordinal." + ordinal.name());
    }
}
