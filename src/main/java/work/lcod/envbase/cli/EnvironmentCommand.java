package work.lcod.envbase.cli;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.Callable;
import picocli.CommandLine;
import work.lcod.envbase.api.ActionResult;
import work.lcod.envbase.api.EnvironmentBase;
import work.lcod.envbase.api.HandlerLoader;
import work.lcod.envbase.monitor.MonitorSettings;
import work.lcod.envbase.monitor.StackMonitorInterruptedException;
import work.lcod.envbase.shared.EnvBaseException;

/**
 * Builds the environment from the shared options, runs one action and prints its {@link ActionResult}. Coded
 * failures are reported on stderr and as a {@code failure} result.
 */
abstract class EnvironmentCommand implements Callable<Integer> {
    @CommandLine.ParentCommand
    EnvBaseCommand parent;

    @CommandLine.Mixin
    EnvironmentArguments arguments = new EnvironmentArguments();

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @Override
    public Integer call() {
        Instant started = Instant.now();
        String action = spec.name();
        try (EnvironmentBase environment = parent.newEnvironment(arguments.toOptions(monitorSettings()))) {
            for (String className : arguments.configHandlers) {
                environment.addConfigHandler(HandlerLoader.instantiate(className));
            }
            var metadata = new LinkedHashMap<String, Object>();
            execute(environment, metadata);
            return print(ActionResult.success(action, metadata, started));
        } catch (StackMonitorInterruptedException ex) {
            return print(ActionResult.interrupted(action, Map.of("stack", ex.stackName()), started));
        } catch (EnvBaseException ex) {
            ShortErrorHandler.report(ex, spec.commandLine());
            return print(ActionResult.failure(action, ex, started));
        }
    }

    MonitorSettings monitorSettings() {
        return MonitorSettings.defaults();
    }

    abstract void execute(EnvironmentBase environment, Map<String, Object> metadata);

    private int print(ActionResult result) {
        spec.commandLine().getOut().println(result.toPrettyJson());
        return result.status().exitCode();
    }
}
