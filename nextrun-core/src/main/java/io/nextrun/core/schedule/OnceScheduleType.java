package io.nextrun.core.schedule;

import com.google.inject.Inject;
import io.nextrun.core.description.DescriptionGenerator;
import io.nextrun.spi.config.OnceConfiguration;
import io.nextrun.spi.config.SchedulerConfiguration;

public class OnceScheduleType
        extends AbstractScheduleType
{
    @Inject
    public OnceScheduleType(ConfigurationValidator validator,
            ExecutionTimeGenerator generator,
            DescriptionGenerator describer)
    {
        super(validator, generator, describer);
    }

    @Override
    protected boolean supports(SchedulerConfiguration config)
    {
        return config instanceof OnceConfiguration;
    }
}
