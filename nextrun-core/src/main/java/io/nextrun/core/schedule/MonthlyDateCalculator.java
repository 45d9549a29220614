package io.nextrun.core.schedule;

import java.time.LocalDate;
import java.time.YearMonth;
import java.util.Iterator;
import com.google.common.base.Optional;
import com.google.common.collect.AbstractIterator;
import io.nextrun.spi.config.RecurringConfiguration;

/**
 * Steps month by month from the anchor's month and resolves at most one day in each
 * visited month. Months without a resolved day are skipped and days earlier than the
 * anchor are never emitted.
 */
public abstract class MonthlyDateCalculator<C extends RecurringConfiguration>
        extends RecurringDateCalculator<C>
{
    protected MonthlyDateCalculator(HourExpander hourExpander)
    {
        super(hourExpander);
    }

    protected abstract int monthInterval(C config);

    protected abstract Optional<LocalDate> resolveDay(C config, YearMonth month);

    @Override
    protected Iterator<LocalDate> candidateDays(C config, LocalDate anchor, LocalDate until)
    {
        int interval = monthInterval(config);

        return new AbstractIterator<LocalDate>()
        {
            private YearMonth month = YearMonth.from(anchor);

            @Override
            protected LocalDate computeNext()
            {
                while (!month.atDay(1).isAfter(until)) {
                    Optional<LocalDate> day = resolveDay(config, month);
                    month = month.plusMonths(interval);
                    if (day.isPresent() && !day.get().isBefore(anchor) && !day.get().isAfter(until)) {
                        return day.get();
                    }
                }
                return endOfData();
            }
        };
    }
}
