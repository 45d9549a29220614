package io.nextrun.spi;

/**
 * Position of a matching day inside a calendar month.
 */
public enum Ordinal
{
    FIRST(1),
    SECOND(2),
    THIRD(3),
    FOURTH(4),
    LAST(-1);

    private final int position;

    Ordinal(int position)
    {
        this.position = position;
    }

    /**
     * 1-based position counted from the first day of the month, or -1 for {@link #LAST}.
     */
    public int getPosition()
    {
        return position;
    }

    public boolean isLast()
    {
        return this == LAST;
    }
}
