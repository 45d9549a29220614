package io.nextrun.spi;

/**
 * A one-time target instant precedes the anchor date of its configuration.
 */
public class ConfigurationInPastException
        extends ScheduleException
{
    public ConfigurationInPastException(String message)
    {
        super(message);
    }

    @Override
    public ErrorKind getKind()
    {
        return ErrorKind.CONFIGURATION_IN_PAST;
    }
}
