package io.nextrun.spi;

/**
 * Base class of all errors raised while computing execution times.
 *
 * The engine never recovers from these. They propagate unchanged to the caller.
 */
public abstract class ScheduleException
        extends RuntimeException
{
    protected ScheduleException(String message)
    {
        super(message);
    }

    public abstract ErrorKind getKind();
}
