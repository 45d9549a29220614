package io.nextrun.spi;

import java.time.LocalDate;
import java.time.LocalDateTime;
import com.google.common.base.Optional;
import org.immutables.value.Value;

/**
 * Inclusive validity window of a configuration. An absent end means an unbounded future.
 */
@Value.Immutable
public abstract class LimitsInterval
{
    public abstract LocalDateTime getStart();

    public abstract Optional<LocalDateTime> getEnd();

    public boolean contains(LocalDateTime instant)
    {
        if (instant.isBefore(getStart())) {
            return false;
        }
        return !getEnd().isPresent() || !instant.isAfter(getEnd().get());
    }

    /**
     * Day-granular variant of {@link #contains(LocalDateTime)}: true if any part of
     * {@code day} lies between the start date and the end date.
     */
    public boolean containsDay(LocalDate day)
    {
        if (day.isBefore(getStart().toLocalDate())) {
            return false;
        }
        return !getEnd().isPresent() || !day.isAfter(getEnd().get().toLocalDate());
    }

    @Value.Check
    protected void check()
    {
        if (getEnd().isPresent() && getEnd().get().isBefore(getStart())) {
            throw new InvalidRangeException("End date must be greater than or equal to start date: " + getStart() + " - " + getEnd().get());
        }
    }

    public static LimitsInterval of(LocalDateTime start)
    {
        return ImmutableLimitsInterval.builder()
            .start(start)
            .build();
    }

    public static LimitsInterval of(LocalDateTime start, LocalDateTime end)
    {
        return ImmutableLimitsInterval.builder()
            .start(start)
            .end(end)
            .build();
    }

    public static LimitsInterval of(LocalDateTime start, Optional<LocalDateTime> end)
    {
        return ImmutableLimitsInterval.builder()
            .start(start)
            .end(end)
            .build();
    }
}
