package io.nextrun.cli;

/**
 * Thrown by commands to end the process with an exit code instead of calling
 * {@link System#exit(int)} directly.
 */
public class SystemExitException
        extends Exception
{
    public static final int EXIT_OK = 0;
    public static final int EXIT_ERROR = 1;

    private final int code;

    public SystemExitException(int code, String message)
    {
        super(message);
        this.code = code;
    }

    // null message means a clean exit, for example after printing usage for --help
    public static SystemExitException systemExit(String errorMessage)
    {
        return new SystemExitException(errorMessage == null ? EXIT_OK : EXIT_ERROR, errorMessage);
    }

    public int getCode()
    {
        return code;
    }
}
