package work.lcod.envbase.cli;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import picocli.CommandLine;
import work.lcod.envbase.api.EnvironmentBase;
import work.lcod.envbase.api.HandlerLoader;
import work.lcod.envbase.monitor.LoggingStackEventHandler;
import work.lcod.envbase.monitor.MonitorSettings;
import work.lcod.envbase.shared.DurationParser;

@CommandLine.Command(name = "deploy", description = "Update the environment stack, or create it when it does not exist.")
final class DeployCommand extends EnvironmentCommand {
    @CommandLine.Option(
        names = "--parameter",
        paramLabel = "KEY=VALUE",
        description = "Stack parameter value (repeatable)."
    )
    Map<String, String> parameters = new LinkedHashMap<>();

    @CommandLine.Option(
        names = "--watch",
        description = "Log stack events until the stack reaches a terminal status."
    )
    boolean watch;

    @CommandLine.Option(
        names = "--event-handler",
        paramLabel = "CLASS",
        description = "Stack event handler class (repeatable)."
    )
    List<String> eventHandlers = new ArrayList<>();

    @CommandLine.Option(
        names = "--timeout",
        description = "Stop monitoring after this long (e.g. 30s, 2m, 1h; default 1h).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    String timeoutRaw;

    @Override
    MonitorSettings monitorSettings() {
        var defaults = MonitorSettings.defaults();
        try {
            return DurationParser.parse(timeoutRaw).map(defaults::withTimeout).orElse(defaults);
        } catch (IllegalArgumentException ex) {
            throw new CommandLine.ParameterException(spec.commandLine(), ex.getMessage());
        }
    }

    @Override
    void execute(EnvironmentBase environment, Map<String, Object> metadata) {
        parameters.forEach(environment::addDeployParameter);
        if (watch) {
            environment.addStackEventHandler(new LoggingStackEventHandler(environment.environmentName()));
        }
        for (String className : eventHandlers) {
            environment.addStackEventHandler(HandlerLoader.instantiate(className));
        }
        var report = environment.deployAction();
        metadata.put("stack", report.stackName());
        metadata.put("outcome", report.outcome().name().toLowerCase());
        report.monitor().ifPresent(result -> {
            metadata.put("monitor", result.state().name().toLowerCase());
            metadata.put("eventsProcessed", result.eventsProcessed());
            result.stackStatus().ifPresent(status -> metadata.put("stackStatus", status));
        });
    }
}
