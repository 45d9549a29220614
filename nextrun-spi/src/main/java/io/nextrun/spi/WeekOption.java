package io.nextrun.spi;

import java.time.DayOfWeek;
import java.util.EnumSet;
import java.util.Set;

import com.google.common.collect.Sets;

public enum WeekOption
{
    MONDAY(EnumSet.of(DayOfWeek.MONDAY)),
    TUESDAY(EnumSet.of(DayOfWeek.TUESDAY)),
    WEDNESDAY(EnumSet.of(DayOfWeek.WEDNESDAY)),
    THURSDAY(EnumSet.of(DayOfWeek.THURSDAY)),
    FRIDAY(EnumSet.of(DayOfWeek.FRIDAY)),
    SATURDAY(EnumSet.of(DayOfWeek.SATURDAY)),
    SUNDAY(EnumSet.of(DayOfWeek.SUNDAY)),
    WEEKDAY(EnumSet.range(DayOfWeek.MONDAY, DayOfWeek.FRIDAY)),
    WEEKEND_DAY(EnumSet.of(DayOfWeek.SATURDAY, DayOfWeek.SUNDAY)),
    ANY_DAY(EnumSet.allOf(DayOfWeek.class));

    private final Set<DayOfWeek> days;

    WeekOption(EnumSet<DayOfWeek> days)
    {
        this.days = Sets.immutableEnumSet(days);
    }

    public Set<DayOfWeek> getDays()
    {
        return days;
    }

    public boolean matches(DayOfWeek dayOfWeek)
    {
        return days.contains(dayOfWeek);
    }

    public boolean isSingleDay()
    {
        return days.size() == 1;
    }

    public static WeekOption of(DayOfWeek dayOfWeek)
    {
        return valueOf(dayOfWeek.name());
    }
}
