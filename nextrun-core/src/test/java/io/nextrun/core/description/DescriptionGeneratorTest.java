package io.nextrun.core.description;

import java.time.DayOfWeek;
import java.time.LocalDateTime;
import java.time.LocalTime;
import io.nextrun.core.EngineConfig;
import io.nextrun.spi.Culture;
import io.nextrun.spi.HourTimeRange;
import io.nextrun.spi.InvalidArgumentException;
import io.nextrun.spi.Ordinal;
import io.nextrun.spi.WeekOption;
import io.nextrun.spi.config.DailyConfiguration;
import io.nextrun.spi.config.ImmutableOnceConfiguration;
import io.nextrun.spi.config.ImmutableWeeklyConfiguration;
import io.nextrun.spi.config.MonthlyOrdinalConfiguration;
import io.nextrun.spi.config.MonthlySpecificDayConfiguration;
import io.nextrun.spi.config.OnceConfiguration;
import io.nextrun.spi.config.WeeklyConfiguration;
import org.junit.Test;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;

public class DescriptionGeneratorTest
{
    private static final LocalDateTime ANCHOR = LocalDateTime.of(2024, 1, 1, 0, 0);

    private final DescriptionGenerator generator = new DescriptionGenerator(new MessageCatalog(), EngineConfig.defaults());

    @Test
    public void once()
    {
        ImmutableOnceConfiguration config = OnceConfiguration.builder()
            .enabled(true)
            .currentDate(ANCHOR)
            .targetDateTime(LocalDateTime.of(2024, 6, 1, 14, 30))
            .build();

        assertThat(generator.describe(config, config.getTargetDateTime()),
                is("Occurs once. Schedule will be used on 01/06/2024 at 14:30 starting on 01/01/2024."));
        assertThat(generator.describe(config.withCulture(Culture.EN_US), config.getTargetDateTime()),
                is("Occurs once. Schedule will be used on 06/01/2024 at 14:30 starting on 01/01/2024."));
        assertThat(generator.describe(config.withCulture(Culture.ES_ES), config.getTargetDateTime()),
                is("Ocurre una vez. El horario se utilizará el 01/06/2024 a las 14:30 a partir del 01/01/2024."));
    }

    @Test
    public void dailyRange()
    {
        DailyConfiguration config = DailyConfiguration.builder()
            .enabled(true)
            .currentDate(ANCHOR)
            .hourRange(HourTimeRange.of(LocalTime.of(9, 0), LocalTime.of(17, 0), 2))
            .build();

        assertThat(generator.describe(config, LocalDateTime.of(2024, 1, 2, 11, 0)),
                is("Occurs every day from 09:00 to 17:00. Schedule will be used on 02/01/2024 at 11:00 starting on 01/01/2024."));
    }

    @Test
    public void dailyZeroEndHour()
    {
        DailyConfiguration config = DailyConfiguration.builder()
            .enabled(true)
            .currentDate(ANCHOR)
            .hourRange(HourTimeRange.builder().startHour(LocalTime.of(9, 0)).build())
            .build();

        assertThat(generator.describe(config, LocalDateTime.of(2024, 1, 2, 9, 0)),
                is("Occurs once at 09:00. Schedule will be used on 02/01/2024 at 09:00 starting on 01/01/2024."));

        DailyConfiguration untilMidnight = DailyConfiguration.builder()
            .enabled(true)
            .currentDate(ANCHOR)
            .hourRange(HourTimeRange.of(LocalTime.of(22, 0), LocalTime.MIDNIGHT, 1))
            .build();

        assertThat(generator.describe(untilMidnight, LocalDateTime.of(2024, 1, 1, 22, 0)),
                is("Occurs once at 22:00. Schedule will be used on 01/01/2024 at 22:00 starting on 01/01/2024."));
    }

    @Test
    public void dailySingleTime()
    {
        DailyConfiguration config = DailyConfiguration.builder()
            .enabled(true)
            .currentDate(ANCHOR)
            .hourRange(HourTimeRange.at(LocalTime.of(10, 0)))
            .build();

        assertThat(generator.describe(config, LocalDateTime.of(2024, 1, 3, 10, 0)),
                is("Occurs once at 10:00. Schedule will be used on 03/01/2024 at 10:00 starting on 01/01/2024."));

        DailyConfiguration onceAt = DailyConfiguration.builder()
            .enabled(true)
            .currentDate(ANCHOR)
            .occursOnce(true)
            .onceAt(LocalTime.of(7, 45))
            .culture(Culture.ES_ES)
            .build();

        assertThat(generator.describe(onceAt, LocalDateTime.of(2024, 1, 3, 7, 45)),
                is("Ocurre una vez a las 07:45. El horario se utilizará el 03/01/2024 a las 07:45 a partir del 01/01/2024."));
    }

    @Test(expected = InvalidArgumentException.class)
    public void dailyWithoutRange()
    {
        DailyConfiguration config = DailyConfiguration.builder()
            .enabled(true)
            .currentDate(ANCHOR)
            .build();
        generator.describe(config, ANCHOR);
    }

    @Test
    public void weekly()
    {
        ImmutableWeeklyConfiguration config = WeeklyConfiguration.builder()
            .enabled(true)
            .currentDate(ANCHOR)
            .hourRange(HourTimeRange.of(LocalTime.of(9, 0), LocalTime.of(12, 0), 1))
            .addDaysOfWeek(DayOfWeek.WEDNESDAY, DayOfWeek.MONDAY)
            .weekInterval(2)
            .build();
        LocalDateTime instant = LocalDateTime.of(2024, 1, 15, 9, 0);

        assertThat(generator.describe(config, instant),
                is("Occurs every 2 week(s) on Monday, Wednesday. Schedule will be used on 15/01/2024 at 09:00 starting on 01/01/2024."));
        assertThat(generator.describe(config.withCulture(Culture.ES_ES), instant),
                is("Ocurre cada 2 semana(s) el lunes, miércoles. El horario se utilizará el 15/01/2024 a las 09:00 a partir del 01/01/2024."));
    }

    @Test(expected = InvalidArgumentException.class)
    public void weeklyWithoutDays()
    {
        WeeklyConfiguration config = WeeklyConfiguration.builder()
            .enabled(true)
            .currentDate(ANCHOR)
            .hourRange(HourTimeRange.at(LocalTime.of(9, 0)))
            .build();
        generator.describe(config, ANCHOR);
    }

    @Test
    public void monthlyOrdinal()
    {
        MonthlyOrdinalConfiguration config = MonthlyOrdinalConfiguration.builder()
            .enabled(true)
            .currentDate(ANCHOR)
            .hourRange(HourTimeRange.at(LocalTime.of(10, 0)))
            .weekOption(WeekOption.MONDAY)
            .ordinal(Ordinal.FIRST)
            .build();

        assertThat(generator.describe(config, LocalDateTime.of(2024, 2, 5, 10, 0)),
                is("Occurs on the first Monday of every 1 month(s). Schedule will be used on 05/02/2024 at 10:00 starting on 01/01/2024."));

        MonthlyOrdinalConfiguration lastWeekday = MonthlyOrdinalConfiguration.builder()
            .from(config)
            .weekOption(WeekOption.WEEKDAY)
            .ordinal(Ordinal.LAST)
            .culture(Culture.ES_ES)
            .build();

        assertThat(generator.describe(lastWeekday, LocalDateTime.of(2024, 1, 31, 10, 0)),
                is("Ocurre el último día laborable de cada 1 mes(es). El horario se utilizará el 31/01/2024 a las 10:00 a partir del 01/01/2024."));
    }

    @Test
    public void monthlyAnyDay()
    {
        MonthlyOrdinalConfiguration config = MonthlyOrdinalConfiguration.builder()
            .enabled(true)
            .currentDate(ANCHOR)
            .hourRange(HourTimeRange.at(LocalTime.of(0, 0)))
            .weekOption(WeekOption.ANY_DAY)
            .ordinal(Ordinal.SECOND)
            .monthInterval(6)
            .build();

        assertThat(generator.describe(config, LocalDateTime.of(2024, 7, 2, 0, 0)),
                is("Occurs on day 2 of every 6 month(s). Schedule will be used on 02/07/2024 at 00:00 starting on 01/01/2024."));
    }

    @Test
    public void monthlySpecificDay()
    {
        MonthlySpecificDayConfiguration config = MonthlySpecificDayConfiguration.builder()
            .enabled(true)
            .currentDate(LocalDateTime.of(2024, 1, 15, 0, 0))
            .hourRange(HourTimeRange.at(LocalTime.of(8, 0)))
            .dayOfMonth(31)
            .culture(Culture.EN_US)
            .build();

        assertThat(generator.describe(config, LocalDateTime.of(2024, 3, 31, 8, 0)),
                is("Occurs on day 31 of every 1 month(s). Schedule will be used on 03/31/2024 at 08:00 starting on 01/15/2024."));
    }
}
