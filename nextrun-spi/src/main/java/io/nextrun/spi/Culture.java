package io.nextrun.spi;

import java.util.Locale;

public enum Culture
{
    EN_GB("en-GB"),
    EN_US("en-US"),
    ES_ES("es-ES");

    private final String tag;

    Culture(String tag)
    {
        this.tag = tag;
    }

    public String getTag()
    {
        return tag;
    }

    public Locale getLocale()
    {
        return Locale.forLanguageTag(tag);
    }

    public static Culture fromTag(String tag)
    {
        String normalized = tag.trim().replace('_', '-');
        for (Culture culture : values()) {
            if (culture.tag.equalsIgnoreCase(normalized)) {
                return culture;
            }
        }
        throw new InvalidArgumentException("Unknown culture: " + tag);
    }

    public static Culture getDefault()
    {
        return EN_GB;
    }
}
