package io.nextrun.core.schedule;

import java.time.LocalDate;
import java.time.YearMonth;
import com.google.common.base.Optional;
import com.google.inject.Inject;
import io.nextrun.spi.config.MonthlySpecificDayConfiguration;

/**
 * Resolves a fixed day of the month. A month that does not have that day is skipped.
 */
public class MonthlySpecificDayDateCalculator
        extends MonthlyDateCalculator<MonthlySpecificDayConfiguration>
{
    @Inject
    public MonthlySpecificDayDateCalculator(HourExpander hourExpander)
    {
        super(hourExpander);
    }

    @Override
    protected int monthInterval(MonthlySpecificDayConfiguration config)
    {
        return config.getMonthInterval();
    }

    @Override
    protected Optional<LocalDate> resolveDay(MonthlySpecificDayConfiguration config, YearMonth month)
    {
        return CalendarDays.dayOf(month, config.getDayOfMonth());
    }
}
