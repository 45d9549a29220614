package io.nextrun.spi;

/**
 * The end of an hour range or of a validity interval precedes its start.
 */
public class InvalidRangeException
        extends ScheduleException
{
    public InvalidRangeException(String message)
    {
        super(message);
    }

    @Override
    public ErrorKind getKind()
    {
        return ErrorKind.INVALID_RANGE;
    }
}
