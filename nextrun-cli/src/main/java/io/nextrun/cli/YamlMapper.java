package io.nextrun.cli;

import java.io.IOException;
import java.io.InputStream;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.dataformat.yaml.YAMLGenerator;
import com.fasterxml.jackson.dataformat.yaml.YAMLParser;
import com.google.inject.Inject;

/**
 * Reads and writes values as YAML with the modules of the shared {@link ObjectMapper}.
 * JSON documents are valid YAML, so configuration files may use either syntax.
 */
public class YamlMapper
{
    private final YAMLFactory yaml;
    private final ObjectMapper mapper;

    @Inject
    public YamlMapper(ObjectMapper mapper)
    {
        this.yaml = new YAMLFactory()
            .configure(YAMLGenerator.Feature.WRITE_DOC_START_MARKER, false);
        this.mapper = mapper;
    }

    public <T> T readFile(Path file, Class<T> type)
        throws IOException
    {
        try (InputStream in = Files.newInputStream(file);
                YAMLParser parser = yaml.createParser(in)) {
            return mapper.readValue(parser, type);
        }
    }

    public String toYaml(Object value)
        throws IOException
    {
        StringWriter writer = new StringWriter();
        try (YAMLGenerator out = yaml.createGenerator(writer)) {
            mapper.writeValue(out, value);
        }
        return writer.toString();
    }
}
