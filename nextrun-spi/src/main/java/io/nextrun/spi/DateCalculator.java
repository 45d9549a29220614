package io.nextrun.spi;

import java.time.LocalDateTime;
import java.util.List;
import io.nextrun.spi.config.SchedulerConfiguration;

public interface DateCalculator<C extends SchedulerConfiguration>
{
    /**
     * Returns the instants of the configuration in ascending order, at most
     * {@code maxExecutions} of them.
     */
    List<LocalDateTime> calculate(C config, int maxExecutions);
}
