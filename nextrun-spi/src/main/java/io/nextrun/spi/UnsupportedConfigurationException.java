package io.nextrun.spi;

public class UnsupportedConfigurationException
        extends ScheduleException
{
    public UnsupportedConfigurationException(String message)
    {
        super(message);
    }

    @Override
    public ErrorKind getKind()
    {
        return ErrorKind.UNSUPPORTED_CONFIGURATION;
    }
}
