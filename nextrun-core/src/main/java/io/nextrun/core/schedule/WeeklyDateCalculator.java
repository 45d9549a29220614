package io.nextrun.core.schedule;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Iterator;
import java.util.List;
import java.util.Set;
import com.google.common.collect.AbstractIterator;
import com.google.common.collect.ImmutableList;
import com.google.inject.Inject;
import io.nextrun.spi.config.WeeklyConfiguration;

/**
 * Walks day by day from the anchor. Every time the walk enters a new week on a
 * Monday, {@code weekInterval - 1} whole weeks are skipped. The anchor day itself
 * never triggers a skip.
 */
public class WeeklyDateCalculator
        extends RecurringDateCalculator<WeeklyConfiguration>
{
    @Inject
    public WeeklyDateCalculator(HourExpander hourExpander)
    {
        super(hourExpander);
    }

    @Override
    public List<LocalDateTime> calculate(WeeklyConfiguration config, int maxExecutions)
    {
        if (config.getDaysOfWeek().isEmpty()) {
            return ImmutableList.of();
        }
        return super.calculate(config, maxExecutions);
    }

    @Override
    protected Iterator<LocalDate> candidateDays(WeeklyConfiguration config, LocalDate anchor, LocalDate until)
    {
        Set<DayOfWeek> days = config.getDaysOfWeek();
        int skipWeeks = config.getWeekInterval() - 1;

        return new AbstractIterator<LocalDate>()
        {
            private LocalDate next = anchor;

            @Override
            protected LocalDate computeNext()
            {
                while (!next.isAfter(until)) {
                    LocalDate day = next;
                    next = next.plusDays(1);
                    if (next.getDayOfWeek() == DayOfWeek.MONDAY) {
                        next = next.plusWeeks(skipWeeks);
                    }
                    if (days.contains(day.getDayOfWeek())) {
                        return day;
                    }
                }
                return endOfData();
            }
        };
    }
}
