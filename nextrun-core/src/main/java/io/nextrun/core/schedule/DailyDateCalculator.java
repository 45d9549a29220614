package io.nextrun.core.schedule;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Iterator;
import com.google.common.collect.AbstractIterator;
import com.google.common.collect.ImmutableList;
import com.google.inject.Inject;
import io.nextrun.spi.LimitsInterval;
import io.nextrun.spi.config.DailyConfiguration;

public class DailyDateCalculator
        extends RecurringDateCalculator<DailyConfiguration>
{
    @Inject
    public DailyDateCalculator(HourExpander hourExpander)
    {
        super(hourExpander);
    }

    @Override
    protected Iterator<LocalDate> candidateDays(DailyConfiguration config, LocalDate anchor, LocalDate until)
    {
        return new AbstractIterator<LocalDate>()
        {
            private LocalDate next = anchor;

            @Override
            protected LocalDate computeNext()
            {
                if (next.isAfter(until)) {
                    return endOfData();
                }
                LocalDate day = next;
                next = next.plusDays(1);
                return day;
            }
        };
    }

    @Override
    protected DayExpansion dayExpansion(DailyConfiguration config, LimitsInterval limits)
    {
        if (config.getOccursOnce()) {
            return (day, remaining) -> {
                LocalDateTime instant = day.atTime(config.getOnceAt().get());
                if (!instant.isBefore(limits.getStart())) {
                    return ImmutableList.of(instant);
                }
                return ImmutableList.of();
            };
        }
        return super.dayExpansion(config, limits);
    }
}
