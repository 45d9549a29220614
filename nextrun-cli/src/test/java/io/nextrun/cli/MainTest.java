package io.nextrun.cli;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import com.fasterxml.jackson.core.type.TypeReference;
import io.nextrun.client.ScheduleJson;
import io.nextrun.client.api.RestScheduleOutput;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.startsWith;

public class MainTest
{
    private static final String DAILY_YAML = ""
        + "type: daily\n"
        + "currentDate: \"2024-01-01T00:00:00\"\n"
        + "hourRange:\n"
        + "  startHour: \"09:00\"\n"
        + "  endHour: \"11:00\"\n"
        + "  hourlyInterval: 1\n";

    @Rule
    public TemporaryFolder folder = new TemporaryFolder();

    private ByteArrayOutputStream outBuffer;
    private ByteArrayOutputStream errBuffer;
    private Main main;

    @Before
    public void setUp()
    {
        outBuffer = new ByteArrayOutputStream();
        errBuffer = new ByteArrayOutputStream();
        main = new Main(
                new PrintStream(outBuffer, true),
                new PrintStream(errBuffer, true));
    }

    private String out()
    {
        return new String(outBuffer.toByteArray(), StandardCharsets.UTF_8);
    }

    private String err()
    {
        return new String(errBuffer.toByteArray(), StandardCharsets.UTF_8);
    }

    private String write(String name, String content)
            throws IOException
    {
        Path file = folder.getRoot().toPath().resolve(name);
        Files.write(file, content.getBytes(StandardCharsets.UTF_8));
        return file.toString();
    }

    @Test
    public void noArgumentsShowsUsage()
    {
        assertThat(main.cli(), is(0));
        assertThat(err(), startsWith("Usage: nextrun <command>"));
    }

    @Test
    public void unknownCommand()
    {
        assertThat(main.cli("forecast"), is(1));
        assertThat(err(), containsString("error: available commands are"));
    }

    @Test
    public void previewTable()
            throws Exception
    {
        String path = write("daily.yml", DAILY_YAML);

        assertThat(main.cli("preview", path), is(0));

        String[] lines = out().split("\\R");
        assertThat(lines.length, is(13));
        assertThat(lines[0], startsWith("EXECUTION TIME"));
        assertThat(lines[1], startsWith("2024-01-01 09:00:00  Occurs every day from 09:00 to 11:00."));
        assertThat(lines[12], startsWith("2024-01-04 11:00:00"));
        assertThat(err(), containsString("12 execution(s)"));
    }

    @Test
    public void previewJson()
            throws Exception
    {
        String path = write("daily.json", "{"
                + "\"type\": \"daily\","
                + "\"currentDate\": \"2024-01-01T00:00:00\","
                + "\"culture\": \"es-ES\","
                + "\"hourRange\": {\"startHour\": \"09:00\", \"endHour\": \"11:00\", \"hourlyInterval\": 1}"
                + "}");

        assertThat(main.cli("p", path, "--format", "json"), is(0));

        List<RestScheduleOutput> outputs = ScheduleJson.objectMapper()
            .readValue(out(), new TypeReference<List<RestScheduleOutput>>() {});
        assertThat(outputs, hasSize(12));
        assertThat(outputs.get(0).getExecutionTime().toString(), is("2024-01-01T09:00"));
        assertThat(outputs.get(0).getDescription(), startsWith("Ocurre todos los días"));
    }

    @Test
    public void previewYaml()
            throws Exception
    {
        String path = write("daily.yml", DAILY_YAML);

        assertThat(main.cli("preview", path, "--format", "yaml"), is(0));
        assertThat(out(), startsWith("- description: \"Occurs every day from 09:00 to 11:00."));
        assertThat(out(), containsString("executionTime: \"2024-01-01T10:00:00\""));
    }

    @Test
    public void overrideMaxExecutions()
            throws Exception
    {
        String path = write("daily.yml", DAILY_YAML);

        assertThat(main.cli("preview", path, "-X", "schedule.max-executions=2"), is(0));
        assertThat(out().split("\\R").length, is(3));
        assertThat(err(), containsString("2 execution(s)"));
    }

    @Test
    public void engineConfigFile()
            throws Exception
    {
        String path = write("daily.yml", DAILY_YAML);
        String config = write("engine.properties", "schedule.max-executions = 1\n");

        assertThat(main.cli("preview", path, "-c", config), is(0));
        assertThat(err(), containsString("1 execution(s)"));
    }

    @Test
    public void disabledConfiguration()
            throws Exception
    {
        String path = write("disabled.yml", DAILY_YAML + "enabled: false\n");

        assertThat(main.cli("preview", path), is(1));
        assertThat(err(), containsString("error: Configuration must be enabled."));
    }

    @Test
    public void unknownFormat()
            throws Exception
    {
        String path = write("daily.yml", DAILY_YAML);

        assertThat(main.cli("preview", path, "--format", "xml"), is(1));
        assertThat(err(), containsString("error: Unknown output format 'xml'"));
    }

    @Test
    public void unknownLogLevel()
            throws Exception
    {
        String path = write("daily.yml", DAILY_YAML);

        assertThat(main.cli("preview", path, "-l", "loud"), is(1));
        assertThat(err(), containsString("error: Unknown log level 'loud'"));
    }

    @Test
    public void formatNestedMessages()
    {
        Exception ex = new RuntimeException("outer", new IllegalStateException("inner"));
        assertThat(Main.formatExceptionMessage(ex), is("outer: inner"));
    }
}
