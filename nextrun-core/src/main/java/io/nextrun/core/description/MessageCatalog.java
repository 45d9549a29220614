package io.nextrun.core.description;

import java.text.MessageFormat;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.format.DateTimeFormatter;
import java.util.ResourceBundle;
import io.nextrun.spi.Culture;

/**
 * Localization table of the descriptions, backed by the {@code messages} resource bundles
 * of this package. Keys missing from a culture's bundle fall back to the default bundle.
 */
public class MessageCatalog
{
    private static final String BUNDLE_NAME = "io.nextrun.core.description.messages";

    private static final ResourceBundle.Control CONTROL =
        ResourceBundle.Control.getNoFallbackControl(ResourceBundle.Control.FORMAT_PROPERTIES);

    public String get(Culture culture, String key)
    {
        return bundle(culture).getString(key);
    }

    public String format(Culture culture, String key, Object... args)
    {
        return new MessageFormat(get(culture, key), culture.getLocale()).format(args);
    }

    public String formatDate(Culture culture, LocalDate date)
    {
        return DateTimeFormatter.ofPattern(get(culture, "format.date"), culture.getLocale()).format(date);
    }

    public String formatTime(Culture culture, LocalTime time)
    {
        return DateTimeFormatter.ofPattern(get(culture, "format.time"), culture.getLocale()).format(time);
    }

    private static ResourceBundle bundle(Culture culture)
    {
        return ResourceBundle.getBundle(BUNDLE_NAME, culture.getLocale(), CONTROL);
    }
}
