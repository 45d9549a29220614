package io.nextrun.core.schedule;

import com.google.inject.Inject;
import io.nextrun.core.description.DescriptionGenerator;
import io.nextrun.spi.config.RecurringConfiguration;
import io.nextrun.spi.config.SchedulerConfiguration;

/**
 * Handles the daily, weekly and monthly variants.
 */
public class RecurringScheduleType
        extends AbstractScheduleType
{
    @Inject
    public RecurringScheduleType(ConfigurationValidator validator,
            ExecutionTimeGenerator generator,
            DescriptionGenerator describer)
    {
        super(validator, generator, describer);
    }

    @Override
    protected boolean supports(SchedulerConfiguration config)
    {
        return config instanceof RecurringConfiguration;
    }
}
