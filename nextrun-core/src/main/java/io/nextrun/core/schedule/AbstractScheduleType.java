package io.nextrun.core.schedule;

import java.time.LocalDateTime;
import java.util.List;
import com.google.common.collect.ImmutableList;
import io.nextrun.core.description.DescriptionGenerator;
import io.nextrun.spi.ScheduleOutput;
import io.nextrun.spi.ScheduleType;
import io.nextrun.spi.UnsupportedConfigurationException;
import io.nextrun.spi.config.SchedulerConfiguration;

public abstract class AbstractScheduleType
        implements ScheduleType
{
    private final ConfigurationValidator validator;
    private final ExecutionTimeGenerator generator;
    private final DescriptionGenerator describer;

    protected AbstractScheduleType(ConfigurationValidator validator,
            ExecutionTimeGenerator generator,
            DescriptionGenerator describer)
    {
        this.validator = validator;
        this.generator = generator;
        this.describer = describer;
    }

    protected abstract boolean supports(SchedulerConfiguration config);

    @Override
    public List<ScheduleOutput> getNextExecutionTimes(SchedulerConfiguration config)
    {
        validator.validate(config);
        if (!supports(config)) {
            throw new UnsupportedConfigurationException(
                    "Unsupported configuration type for " + getClass().getSimpleName() + ": " + config.getClass().getSimpleName());
        }

        ImmutableList.Builder<ScheduleOutput> builder = ImmutableList.builder();
        for (LocalDateTime instant : generator.generateExecutions(config)) {
            builder.add(ScheduleOutput.of(describer.describe(config, instant), instant));
        }
        return builder.build();
    }
}
