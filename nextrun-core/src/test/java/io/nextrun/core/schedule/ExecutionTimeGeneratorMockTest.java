package io.nextrun.core.schedule;

import java.time.LocalTime;
import com.google.common.collect.ImmutableList;
import io.nextrun.core.EngineConfig;
import io.nextrun.spi.HourTimeRange;
import io.nextrun.spi.config.DailyConfiguration;
import io.nextrun.spi.config.ImmutableDailyConfiguration;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.mockito.Mock;
import org.mockito.junit.MockitoJUnitRunner;

import static io.nextrun.core.schedule.ScheduleTestHelper.format;
import static io.nextrun.core.schedule.ScheduleTestHelper.time;
import static java.util.Arrays.asList;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@RunWith(MockitoJUnitRunner.class)
public class ExecutionTimeGeneratorMockTest
{
    @Mock OnceDateCalculator onceCalculator;
    @Mock DailyDateCalculator dailyCalculator;
    @Mock WeeklyDateCalculator weeklyCalculator;
    @Mock MonthlyOrdinalDateCalculator monthlyOrdinalCalculator;
    @Mock MonthlySpecificDayDateCalculator monthlySpecificDayCalculator;

    private ExecutionTimeGenerator generator;

    private final DailyConfiguration config = DailyConfiguration.builder()
        .enabled(true)
        .currentDate(time("2024-01-01 00:00"))
        .hourRange(HourTimeRange.at(LocalTime.of(9, 0)))
        .build();

    @Before
    public void setUp()
    {
        generator = new ExecutionTimeGenerator(EngineConfig.defaults(),
                onceCalculator, dailyCalculator, weeklyCalculator,
                monthlyOrdinalCalculator, monthlySpecificDayCalculator);
    }

    @Test
    public void sortsAndRemovesDuplicates()
    {
        when(dailyCalculator.calculate(config, 12)).thenReturn(ImmutableList.of(
                    time("2024-01-02 09:00"),
                    time("2024-01-01 09:00"),
                    time("2024-01-02 09:00")));

        assertThat(format(generator.generateExecutions(config)), is(asList(
                        "2024-01-01 09:00",
                        "2024-01-02 09:00")));
        verifyNoInteractions(onceCalculator, weeklyCalculator, monthlyOrdinalCalculator, monthlySpecificDayCalculator);
    }

    @Test
    public void disabledConfigurationNeverReachesCalculators()
    {
        generator.generateExecutions(ImmutableDailyConfiguration.copyOf(config).withEnabled(false));
        verifyNoInteractions(onceCalculator, dailyCalculator, weeklyCalculator,
                monthlyOrdinalCalculator, monthlySpecificDayCalculator);
    }
}
