package io.nextrun.cli;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.format.DateTimeFormatter;
import java.util.List;
import com.beust.jcommander.Parameter;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.inject.Guice;
import com.google.inject.Inject;
import io.nextrun.client.api.RestModels;
import io.nextrun.client.api.RestScheduleConfiguration;
import io.nextrun.client.api.RestScheduleOutput;
import io.nextrun.core.EngineConfig;
import io.nextrun.core.schedule.ScheduleModule;
import io.nextrun.core.schedule.ScheduleService;
import io.nextrun.spi.ScheduleOutput;
import io.nextrun.spi.config.SchedulerConfiguration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static io.nextrun.cli.SystemExitException.systemExit;

public class Preview
    extends Command
{
    private static final Logger logger = LoggerFactory.getLogger(Preview.class);

    private static final DateTimeFormatter TIME_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    @Inject YamlMapper yamlMapper;
    @Inject ObjectMapper mapper;

    @Parameter(names = {"--format"})
    String format = "table";

    @Override
    public void main()
            throws Exception
    {
        if (args.size() != 1) {
            throw usage(null);
        }
        switch (format) {
        case "table":
        case "json":
        case "yaml":
            break;
        default:
            throw usage("Unknown output format '" + format + "'");
        }
        preview(Paths.get(args.get(0)));
    }

    @Override
    public SystemExitException usage(String error)
    {
        err.println("Usage: " + programName + " preview <config.yml|config.json> [options...]");
        err.println("  Options:");
        err.println("        --format FORMAT              output format (table, json or yaml; default: table)");
        Main.showCommonOptions(err);
        return systemExit(error);
    }

    private void preview(Path file)
            throws Exception
    {
        EngineConfig engineConfig = EngineConfig.fromProperties(loadSystemProperties());
        ScheduleService service = Guice.createInjector(new ScheduleModule(engineConfig))
            .getInstance(ScheduleService.class);

        RestScheduleConfiguration rest = yamlMapper.readFile(file, RestScheduleConfiguration.class);
        SchedulerConfiguration config = RestModels.configuration(rest);
        logger.debug("Loaded {} configuration from {}", rest.getType(), file);

        List<ScheduleOutput> outputs = service.createSchedule(config);
        List<RestScheduleOutput> restOutputs = RestModels.outputs(outputs);

        switch (format) {
        case "json":
            out.println(mapper.writerWithDefaultPrettyPrinter().writeValueAsString(restOutputs));
            break;
        case "yaml":
            out.print(yamlMapper.toYaml(restOutputs));
            break;
        default:
            TablePrinter table = new TablePrinter(out);
            table.row("EXECUTION TIME", "DESCRIPTION");
            for (ScheduleOutput output : outputs) {
                table.row(TIME_FORMAT.format(output.getExecutionTime()), output.getDescription());
            }
            table.print();
            err.println(outputs.size() + " execution(s)");
        }
    }
}
