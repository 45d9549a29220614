package io.nextrun.core.schedule;

import com.google.inject.Inject;
import io.nextrun.spi.ScheduleType;
import io.nextrun.spi.config.DailyConfiguration;
import io.nextrun.spi.config.MonthlyOrdinalConfiguration;
import io.nextrun.spi.config.MonthlySpecificDayConfiguration;
import io.nextrun.spi.config.OnceConfiguration;
import io.nextrun.spi.config.SchedulerConfiguration;
import io.nextrun.spi.config.WeeklyConfiguration;

public class ScheduleTypeFactory
{
    private final OnceScheduleType onceType;
    private final RecurringScheduleType recurringType;

    @Inject
    public ScheduleTypeFactory(OnceScheduleType onceType, RecurringScheduleType recurringType)
    {
        this.onceType = onceType;
        this.recurringType = recurringType;
    }

    public ScheduleType createScheduleType(SchedulerConfiguration config)
    {
        return config.accept(new SchedulerConfiguration.Visitor<ScheduleType>()
        {
            @Override
            public ScheduleType visit(OnceConfiguration once)
            {
                return onceType;
            }

            @Override
            public ScheduleType visit(DailyConfiguration daily)
            {
                return recurringType;
            }

            @Override
            public ScheduleType visit(WeeklyConfiguration weekly)
            {
                return recurringType;
            }

            @Override
            public ScheduleType visit(MonthlyOrdinalConfiguration monthly)
            {
                return recurringType;
            }

            @Override
            public ScheduleType visit(MonthlySpecificDayConfiguration monthly)
            {
                return recurringType;
            }
        });
    }
}
