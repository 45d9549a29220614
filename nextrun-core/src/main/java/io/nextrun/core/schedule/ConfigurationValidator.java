package io.nextrun.core.schedule;

import io.nextrun.spi.ConfigurationDisabledException;
import io.nextrun.spi.config.SchedulerConfiguration;

public class ConfigurationValidator
{
    public void validate(SchedulerConfiguration config)
    {
        if (!config.getEnabled()) {
            throw new ConfigurationDisabledException("Configuration must be enabled.");
        }
    }
}
