package io.nextrun.spi;

public class InvalidIntervalException
        extends ScheduleException
{
    public InvalidIntervalException(String message)
    {
        super(message);
    }

    @Override
    public ErrorKind getKind()
    {
        return ErrorKind.INVALID_INTERVAL;
    }
}
