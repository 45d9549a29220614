package io.nextrun.spi;

import java.time.LocalDate;
import java.time.LocalDateTime;
import org.junit.Test;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;
import static org.junit.Assert.fail;

public class LimitsIntervalTest
{
    private static final LocalDateTime START = LocalDateTime.of(2024, 1, 1, 0, 0);
    private static final LocalDateTime END = LocalDateTime.of(2024, 1, 31, 12, 0);

    @Test
    public void containsIsInclusive()
    {
        LimitsInterval limits = LimitsInterval.of(START, END);
        assertThat(limits.contains(START), is(true));
        assertThat(limits.contains(END), is(true));
        assertThat(limits.contains(START.minusSeconds(1)), is(false));
        assertThat(limits.contains(END.plusSeconds(1)), is(false));
    }

    @Test
    public void absentEndIsUnbounded()
    {
        LimitsInterval limits = LimitsInterval.of(START);
        assertThat(limits.contains(LocalDateTime.of(9000, 1, 1, 0, 0)), is(true));
        assertThat(limits.containsDay(LocalDate.of(9000, 1, 1)), is(true));
    }

    @Test
    public void containsDayIgnoresTimeOfDay()
    {
        LimitsInterval limits = LimitsInterval.of(START.withHour(10), END);
        assertThat(limits.containsDay(LocalDate.of(2024, 1, 1)), is(true));
        assertThat(limits.containsDay(LocalDate.of(2024, 1, 31)), is(true));
        assertThat(limits.containsDay(LocalDate.of(2023, 12, 31)), is(false));
        assertThat(limits.containsDay(LocalDate.of(2024, 2, 1)), is(false));
    }

    @Test
    public void rejectEndBeforeStart()
    {
        try {
            LimitsInterval.of(END, START);
            fail();
        }
        catch (InvalidRangeException ex) {
            assertThat(ex.getKind(), is(ErrorKind.INVALID_RANGE));
        }
    }

    @Test
    public void endEqualToStartIsValid()
    {
        LimitsInterval limits = LimitsInterval.of(START, START);
        assertThat(limits.contains(START), is(true));
    }
}
