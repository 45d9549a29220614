package io.nextrun.core;

import java.util.Properties;
import io.nextrun.spi.Culture;
import io.nextrun.spi.InvalidArgumentException;
import org.immutables.value.Value;

/**
 * Engine-wide settings shared by every calculation.
 */
@Value.Immutable
public abstract class EngineConfig
{
    static final int DEFAULT_MAX_EXECUTIONS = 12;

    public static final String MAX_EXECUTIONS_KEY = "schedule.max-executions";
    public static final String DEFAULT_CULTURE_KEY = "schedule.default-culture";

    /**
     * Upper bound of the instants any single generation call returns.
     */
    @Value.Default
    public int getMaxExecutions()
    {
        return DEFAULT_MAX_EXECUTIONS;
    }

    @Value.Default
    public Culture getDefaultCulture()
    {
        return Culture.getDefault();
    }

    @Value.Check
    protected void check()
    {
        if (getMaxExecutions() <= 0) {
            throw new ConfigException(MAX_EXECUTIONS_KEY + " must be greater than 0: " + getMaxExecutions());
        }
    }

    public static EngineConfig defaults()
    {
        return ImmutableEngineConfig.builder().build();
    }

    public static EngineConfig fromProperties(Properties props)
    {
        ImmutableEngineConfig.Builder builder = ImmutableEngineConfig.builder();

        String maxExecutions = props.getProperty(MAX_EXECUTIONS_KEY);
        if (maxExecutions != null) {
            try {
                builder.maxExecutions(Integer.parseInt(maxExecutions.trim()));
            }
            catch (NumberFormatException ex) {
                throw new ConfigException(MAX_EXECUTIONS_KEY + " must be an integer: " + maxExecutions, ex);
            }
        }

        String culture = props.getProperty(DEFAULT_CULTURE_KEY);
        if (culture != null) {
            try {
                builder.defaultCulture(Culture.fromTag(culture));
            }
            catch (InvalidArgumentException ex) {
                throw new ConfigException(DEFAULT_CULTURE_KEY + " is not a supported culture: " + culture, ex);
            }
        }

        return builder.build();
    }
}
