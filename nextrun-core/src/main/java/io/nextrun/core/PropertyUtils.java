package io.nextrun.core;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Properties;

public class PropertyUtils
{
    private PropertyUtils()
    { }

    public static Properties loadFile(Path file)
        throws IOException
    {
        Properties props = new Properties();
        try (InputStream in = Files.newInputStream(file)) {
            props.load(in);
        }
        return props;
    }

    public static Properties merge(Properties base, Map<String, String> overrides)
    {
        Properties props = new Properties();
        props.putAll(base);
        props.putAll(overrides);
        return props;
    }
}
