package io.nextrun.spi;

public enum DailyHourFrequency
{
    // a single instant at the start hour
    ONCE,
    // every interval from the start hour through the end hour
    RECURRENT;
}
