package io.nextrun.core.schedule;

import io.nextrun.spi.ConfigurationDisabledException;
import io.nextrun.spi.ErrorKind;
import io.nextrun.spi.config.OnceConfiguration;
import org.junit.Test;

import static io.nextrun.core.schedule.ScheduleTestHelper.time;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;
import static org.junit.Assert.fail;

public class ConfigurationValidatorTest
{
    private final ConfigurationValidator validator = new ConfigurationValidator();

    @Test
    public void enabledConfigurationPasses()
    {
        validator.validate(OnceConfiguration.builder()
                .enabled(true)
                .currentDate(time("2024-01-01 00:00"))
                .targetDateTime(time("2024-01-02 00:00"))
                .build());
    }

    @Test
    public void disabledConfigurationFails()
    {
        try {
            validator.validate(OnceConfiguration.builder()
                    .enabled(false)
                    .currentDate(time("2024-01-01 00:00"))
                    .targetDateTime(time("2024-01-02 00:00"))
                    .build());
            fail();
        }
        catch (ConfigurationDisabledException ex) {
            assertThat(ex.getKind(), is(ErrorKind.CONFIGURATION_DISABLED));
            assertThat(ex.getMessage(), is("Configuration must be enabled."));
        }
    }
}
