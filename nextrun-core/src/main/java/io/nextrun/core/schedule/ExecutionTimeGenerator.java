package io.nextrun.core.schedule;

import java.time.LocalDateTime;
import java.util.List;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedSet;
import com.google.common.collect.Iterables;
import com.google.inject.Inject;
import io.nextrun.core.EngineConfig;
import io.nextrun.spi.config.DailyConfiguration;
import io.nextrun.spi.config.MonthlyOrdinalConfiguration;
import io.nextrun.spi.config.MonthlySpecificDayConfiguration;
import io.nextrun.spi.config.OnceConfiguration;
import io.nextrun.spi.config.SchedulerConfiguration;
import io.nextrun.spi.config.WeeklyConfiguration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Produces the next execution instants of a configuration in ascending order,
 * without duplicates and never more than the configured maximum.
 */
public class ExecutionTimeGenerator
{
    private static final Logger logger = LoggerFactory.getLogger(ExecutionTimeGenerator.class);

    private final int maxExecutions;
    private final OnceDateCalculator onceCalculator;
    private final DailyDateCalculator dailyCalculator;
    private final WeeklyDateCalculator weeklyCalculator;
    private final MonthlyOrdinalDateCalculator monthlyOrdinalCalculator;
    private final MonthlySpecificDayDateCalculator monthlySpecificDayCalculator;

    @Inject
    public ExecutionTimeGenerator(EngineConfig engineConfig,
            OnceDateCalculator onceCalculator,
            DailyDateCalculator dailyCalculator,
            WeeklyDateCalculator weeklyCalculator,
            MonthlyOrdinalDateCalculator monthlyOrdinalCalculator,
            MonthlySpecificDayDateCalculator monthlySpecificDayCalculator)
    {
        this.maxExecutions = engineConfig.getMaxExecutions();
        this.onceCalculator = onceCalculator;
        this.dailyCalculator = dailyCalculator;
        this.weeklyCalculator = weeklyCalculator;
        this.monthlyOrdinalCalculator = monthlyOrdinalCalculator;
        this.monthlySpecificDayCalculator = monthlySpecificDayCalculator;
    }

    public int getMaxExecutions()
    {
        return maxExecutions;
    }

    public List<LocalDateTime> generateExecutions(SchedulerConfiguration config)
    {
        if (!config.getEnabled()) {
            logger.debug("Configuration is disabled, no execution is generated");
            return ImmutableList.of();
        }

        List<LocalDateTime> instants = config.accept(new SchedulerConfiguration.Visitor<List<LocalDateTime>>()
        {
            @Override
            public List<LocalDateTime> visit(OnceConfiguration once)
            {
                return onceCalculator.calculate(once, maxExecutions);
            }

            @Override
            public List<LocalDateTime> visit(DailyConfiguration daily)
            {
                return dailyCalculator.calculate(daily, maxExecutions);
            }

            @Override
            public List<LocalDateTime> visit(WeeklyConfiguration weekly)
            {
                return weeklyCalculator.calculate(weekly, maxExecutions);
            }

            @Override
            public List<LocalDateTime> visit(MonthlyOrdinalConfiguration monthly)
            {
                return monthlyOrdinalCalculator.calculate(monthly, maxExecutions);
            }

            @Override
            public List<LocalDateTime> visit(MonthlySpecificDayConfiguration monthly)
            {
                return monthlySpecificDayCalculator.calculate(monthly, maxExecutions);
            }
        });

        List<LocalDateTime> executions = ImmutableList.copyOf(
                Iterables.limit(ImmutableSortedSet.copyOf(instants), maxExecutions));
        logger.debug("Generated {} execution(s) for {}", executions.size(), config.getClass().getSimpleName());
        return executions;
    }
}
