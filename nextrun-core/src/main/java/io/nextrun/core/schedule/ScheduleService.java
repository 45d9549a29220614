package io.nextrun.core.schedule;

import java.util.List;
import com.google.inject.Inject;
import io.nextrun.spi.ScheduleException;
import io.nextrun.spi.ScheduleOutput;
import io.nextrun.spi.config.SchedulerConfiguration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point of the engine: computes the next executions of a configuration
 * together with their descriptions.
 */
public class ScheduleService
{
    private static final Logger logger = LoggerFactory.getLogger(ScheduleService.class);

    private final ScheduleTypeFactory factory;

    @Inject
    public ScheduleService(ScheduleTypeFactory factory)
    {
        this.factory = factory;
    }

    public List<ScheduleOutput> createSchedule(SchedulerConfiguration config)
    {
        try {
            return factory.createScheduleType(config).getNextExecutionTimes(config);
        }
        catch (ScheduleException ex) {
            logger.debug("Failed to create schedule ({}): {}", ex.getKind(), ex.getMessage());
            throw ex;
        }
    }
}
