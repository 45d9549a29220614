package io.nextrun.cli;

import java.io.PrintStream;
import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.joran.JoranConfigurator;
import ch.qos.logback.core.joran.spi.JoranException;
import com.beust.jcommander.JCommander;
import com.beust.jcommander.MissingCommandException;
import com.beust.jcommander.Parameter;
import com.beust.jcommander.ParameterException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.inject.AbstractModule;
import com.google.inject.Guice;
import com.google.inject.Injector;
import com.google.inject.Scopes;
import io.nextrun.client.ScheduleJson;
import org.slf4j.LoggerFactory;

import static io.nextrun.cli.SystemExitException.systemExit;

public class Main
{
    private static final String DEFAULT_PROGRAM_NAME = "nextrun";

    private final PrintStream out;
    private final PrintStream err;
    private final String programName;

    public Main(PrintStream out, PrintStream err)
    {
        this.out = out;
        this.err = err;
        this.programName = System.getProperty("io.nextrun.cli.programName", DEFAULT_PROGRAM_NAME);
    }

    public static class MainOptions
    {
        @Parameter(names = {"-c", "--config"})
        protected String configPath = null;

        @Parameter(names = {"-help", "--help"}, help = true, hidden = true)
        boolean help;
    }

    public static void main(String... args)
    {
        int code = new Main(System.out, System.err).cli(args);
        if (code != 0) {
            System.exit(code);
        }
    }

    protected void addCommands(JCommander jc, Injector injector)
    {
        jc.addCommand("preview", injector.getInstance(Preview.class), "p");
    }

    public int cli(String... args)
    {
        if (args.length == 0) {
            usage(null);
            return 0;
        }

        boolean verbose = false;

        MainOptions mainOpts = new MainOptions();
        JCommander jc = new JCommander(mainOpts);
        jc.setProgramName(programName);

        Injector injector = Guice.createInjector(new AbstractModule()
        {
            @Override
            protected void configure()
            {
                bind(String.class).annotatedWith(ProgramName.class).toInstance(programName);
                bind(PrintStream.class).annotatedWith(StdOut.class).toInstance(out);
                bind(PrintStream.class).annotatedWith(StdErr.class).toInstance(err);
                bind(ObjectMapper.class).toInstance(ScheduleJson.objectMapper());
                bind(YamlMapper.class).in(Scopes.SINGLETON);
            }
        });

        addCommands(jc, injector);

        // Disable @ expansion
        jc.setExpandAtSign(false);
        jc.getCommands().values().forEach(c -> c.setExpandAtSign(false));

        try {
            try {
                jc.parse(args);
            }
            catch (MissingCommandException ex) {
                throw usage("available commands are: " + jc.getCommands().keySet());
            }

            if (mainOpts.help) {
                throw usage(null);
            }

            Command command = getParsedCommand(jc);
            if (command == null) {
                throw usage(null);
            }

            verbose = processCommonOptions(mainOpts, command);

            command.main();
            return 0;
        }
        catch (ParameterException ex) {
            err.println("error: " + ex.getMessage());
            return 1;
        }
        catch (SystemExitException ex) {
            if (ex.getMessage() != null) {
                err.println("error: " + ex.getMessage());
            }
            return ex.getCode();
        }
        catch (Exception ex) {
            String message = formatExceptionMessage(ex);
            if (message.trim().isEmpty()) {
                // prevent silent crash
                ex.printStackTrace(err);
            }
            else {
                err.println("error: " + message);
                if (verbose) {
                    ex.printStackTrace(err);
                }
            }
            return 1;
        }
    }

    private static Command getParsedCommand(JCommander jc)
    {
        String commandName = jc.getParsedCommand();
        if (commandName == null) {
            return null;
        }

        return (Command) jc.getCommands().get(commandName).getObjects().get(0);
    }

    private boolean processCommonOptions(MainOptions mainOpts, Command command)
            throws SystemExitException
    {
        if (command.help) {
            throw command.usage(null);
        }

        boolean verbose;

        switch (command.logLevel) {
        case "error":
        case "warn":
        case "info":
            verbose = false;
            break;
        case "debug":
        case "trace":
            verbose = true;
            break;
        default:
            throw usage("Unknown log level '" + command.logLevel + "'");
        }

        if (command.configPath == null) {
            command.configPath = mainOpts.configPath;
        }

        configureLogging(command.logLevel, command.logPath, command.logbackConfigPath);

        return verbose;
    }

    private static void configureLogging(String level, String logPath, String logbackConfigPath)
    {
        LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
        JoranConfigurator configurator = new JoranConfigurator();
        configurator.setContext(context);
        context.reset();

        // logback uses system property to embed variables in XML file
        Level lv = Level.toLevel(level.toUpperCase(), Level.DEBUG);
        System.setProperty("nextrun.log.level", lv.toString());

        try {
            if (logbackConfigPath != null) {
                configurator.doConfigure(logbackConfigPath);
                return;
            }

            String name;
            if (logPath.equals("-")) {
                name = "/io/nextrun/cli/logback-console.xml";
            }
            else {
                System.setProperty("nextrun.log.path", logPath);
                name = "/io/nextrun/cli/logback-file.xml";
            }
            configurator.doConfigure(Main.class.getResource(name));
        }
        catch (JoranException ex) {
            throw new RuntimeException(ex);
        }
    }

    static String formatExceptionMessage(Throwable ex)
    {
        StringBuilder sb = new StringBuilder();
        for (Throwable t = ex; t != null; t = t.getCause()) {
            String message = t.getMessage();
            if (message == null || sb.indexOf(message) >= 0) {
                continue;
            }
            if (sb.length() > 0) {
                sb.append(": ");
            }
            sb.append(message);
        }
        if (sb.length() == 0) {
            return ex.toString();
        }
        return sb.toString();
    }

    private SystemExitException usage(String error)
    {
        err.println("Usage: " + programName + " <command> [options...]");
        err.println("  Commands:");
        err.println("    p[review] <config.yml>             show the next execution times of a schedule");
        err.println("");
        err.println("  Options:");
        showCommonOptions(err);
        if (error == null) {
            err.println("Use `<command> --help` to see detailed usage of a command.");
        }
        return systemExit(error);
    }

    public static void showCommonOptions(PrintStream err)
    {
        err.println("    -L, --log PATH                   output log messages to a file (default: -)");
        err.println("    -l, --log-level LEVEL            log level (error, warn, info, debug or trace)");
        err.println("    -X KEY=VALUE                     override an engine property");
        err.println("    -c, --config PATH.properties     engine configuration file");
        err.println("");
    }
}
