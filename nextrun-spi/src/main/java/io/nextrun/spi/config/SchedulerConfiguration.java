package io.nextrun.spi.config;

import java.time.LocalDateTime;
import com.google.common.base.Optional;
import io.nextrun.spi.Culture;
import io.nextrun.spi.LimitsInterval;
import org.immutables.value.Value;

/**
 * Configuration of a schedule. The set of variants is closed: callers dispatch on
 * the variant through {@link #accept(Visitor)} so that adding a variant breaks every
 * place that has to handle it at compile time.
 */
public abstract class SchedulerConfiguration
{
    SchedulerConfiguration()
    { }

    public abstract boolean getEnabled();

    /**
     * Anchor date from which generation begins.
     */
    public abstract LocalDateTime getCurrentDate();

    @Value.Default
    public LimitsInterval getLimits()
    {
        return LimitsInterval.of(getCurrentDate());
    }

    /**
     * Culture of the descriptions. The engine default applies when absent.
     */
    public abstract Optional<Culture> getCulture();

    public abstract <R> R accept(Visitor<R> visitor);

    public interface Visitor<R>
    {
        R visit(OnceConfiguration config);

        R visit(DailyConfiguration config);

        R visit(WeeklyConfiguration config);

        R visit(MonthlyOrdinalConfiguration config);

        R visit(MonthlySpecificDayConfiguration config);
    }
}
