package io.nextrun.cli;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Properties;
import com.beust.jcommander.DynamicParameter;
import com.beust.jcommander.Parameter;
import com.google.inject.Inject;
import io.nextrun.core.PropertyUtils;

public abstract class Command
{
    @Inject @ProgramName protected String programName;
    @Inject @StdOut protected PrintStream out;
    @Inject @StdErr protected PrintStream err;

    @Parameter()
    protected List<String> args = new ArrayList<>();

    @Parameter(names = {"-c", "--config"})
    protected String configPath = null;

    @Parameter(names = {"-L", "--log"})
    protected String logPath = "-";

    @Parameter(names = {"-l", "--log-level"})
    protected String logLevel = "info";

    @Parameter(names = {"--logback-config"})
    protected String logbackConfigPath = null;

    @DynamicParameter(names = "-X")
    protected Map<String, String> systemProperties = new HashMap<>();

    @Parameter(names = {"-help", "--help"}, help = true, hidden = true)
    protected boolean help;

    public abstract void main() throws Exception;

    public abstract SystemExitException usage(String error);

    /**
     * Engine properties. Later sources take precedence:
     * JVM system properties, then the --config file, then -X options.
     */
    protected Properties loadSystemProperties()
        throws IOException
    {
        Properties props = new Properties();
        props.putAll(System.getProperties());

        if (configPath != null) {
            props.putAll(PropertyUtils.loadFile(Paths.get(configPath)));
        }

        return PropertyUtils.merge(props, systemProperties);
    }
}
