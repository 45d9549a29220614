package io.nextrun.spi;

import java.time.Duration;

public enum IntervalUnit
{
    HOURS,
    MINUTES,
    SECONDS;

    public Duration toDuration(long amount)
    {
        switch (this) {
        case HOURS:
            return Duration.ofHours(amount);
        case MINUTES:
            return Duration.ofMinutes(amount);
        case SECONDS:
            return Duration.ofSeconds(amount);
        default:
            throw new UnsupportedConfigurationException("Unsupported interval unit: " + this);
        }
    }
}
