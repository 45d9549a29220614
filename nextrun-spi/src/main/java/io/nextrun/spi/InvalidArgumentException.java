package io.nextrun.spi;

/**
 * A field that is mandatory for a configuration variant is missing or empty.
 */
public class InvalidArgumentException
        extends ScheduleException
{
    public InvalidArgumentException(String message)
    {
        super(message);
    }

    @Override
    public ErrorKind getKind()
    {
        return ErrorKind.INVALID_ARGUMENT;
    }
}
