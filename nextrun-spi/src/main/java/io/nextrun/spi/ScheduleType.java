package io.nextrun.spi;

import java.util.List;
import io.nextrun.spi.config.SchedulerConfiguration;

/**
 * Pairs the execution time calculation of a configuration family with its descriptions.
 */
public interface ScheduleType
{
    /**
     * Validates the configuration, computes its next execution times and labels each of them.
     *
     * @throws ConfigurationDisabledException if the configuration is not enabled
     * @throws UnsupportedConfigurationException if this type does not handle the given variant
     */
    List<ScheduleOutput> getNextExecutionTimes(SchedulerConfiguration config);
}
