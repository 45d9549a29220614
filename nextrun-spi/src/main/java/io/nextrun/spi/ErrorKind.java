package io.nextrun.spi;

public enum ErrorKind
{
    CONFIGURATION_DISABLED,
    CONFIGURATION_IN_PAST,
    UNSUPPORTED_CONFIGURATION,
    INVALID_INTERVAL,
    INVALID_RANGE,
    INVALID_ARGUMENT;
}
