package io.nextrun.core.schedule;

import java.time.LocalDateTime;
import java.util.List;
import com.google.common.collect.ImmutableList;
import io.nextrun.spi.ConfigurationInPastException;
import io.nextrun.spi.DateCalculator;
import io.nextrun.spi.config.OnceConfiguration;

/**
 * A one-shot configuration always yields its target instant, regardless of the limits.
 */
public class OnceDateCalculator
        implements DateCalculator<OnceConfiguration>
{
    @Override
    public List<LocalDateTime> calculate(OnceConfiguration config, int maxExecutions)
    {
        LocalDateTime target = config.getTargetDateTime();
        if (target.isBefore(config.getCurrentDate())) {
            throw new ConfigurationInPastException(
                    "Configuration date time cannot be in the past: " + target + " < " + config.getCurrentDate());
        }
        return ImmutableList.of(target);
    }
}
