package io.nextrun.spi;

public class ConfigurationDisabledException
        extends ScheduleException
{
    public ConfigurationDisabledException(String message)
    {
        super(message);
    }

    @Override
    public ErrorKind getKind()
    {
        return ErrorKind.CONFIGURATION_DISABLED;
    }
}
