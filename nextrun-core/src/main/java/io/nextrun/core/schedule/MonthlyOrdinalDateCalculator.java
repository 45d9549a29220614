package io.nextrun.core.schedule;

import java.time.LocalDate;
import java.time.YearMonth;
import com.google.common.base.Optional;
import com.google.inject.Inject;
import io.nextrun.spi.config.MonthlyOrdinalConfiguration;

/**
 * Resolves "the Nth (or last) day matching a week option" in each visited month.
 */
public class MonthlyOrdinalDateCalculator
        extends MonthlyDateCalculator<MonthlyOrdinalConfiguration>
{
    @Inject
    public MonthlyOrdinalDateCalculator(HourExpander hourExpander)
    {
        super(hourExpander);
    }

    @Override
    protected int monthInterval(MonthlyOrdinalConfiguration config)
    {
        return config.getMonthInterval();
    }

    @Override
    protected Optional<LocalDate> resolveDay(MonthlyOrdinalConfiguration config, YearMonth month)
    {
        return CalendarDays.ordinalDayOf(month, config.getWeekOption(), config.getOrdinal());
    }
}
