package work.lcod.envbase.cli;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import picocli.CommandLine;
import work.lcod.envbase.api.EnvironmentOptions;
import work.lcod.envbase.config.ConfigLoader;
import work.lcod.envbase.monitor.MonitorSettings;

/** Options shared by every subcommand. */
final class EnvironmentArguments {
    @CommandLine.Option(
        names = "--config-file",
        paramLabel = "PATH",
        description = "Configuration file, JSON or YAML (default: " + ConfigLoader.DEFAULT_CONFIG_FILENAME + ")."
    )
    Path configFile = Path.of(ConfigLoader.DEFAULT_CONFIG_FILENAME);

    @CommandLine.Option(
        names = "--project-dir",
        paramLabel = "DIR",
        description = "Directory holding the config file, ami_cache.json and templates/ (default: current directory)."
    )
    Path projectDirectory = Path.of("");

    @CommandLine.Option(
        names = "--no-create-missing",
        description = "Fail instead of writing defaults for a missing config file or AMI table."
    )
    boolean noCreateMissing;

    @CommandLine.Option(
        names = "--config-handler",
        paramLabel = "CLASS",
        description = "Config handler class adding its own schema and defaults (repeatable)."
    )
    List<String> configHandlers = new ArrayList<>();

    EnvironmentOptions toOptions(MonitorSettings monitorSettings) {
        return EnvironmentOptions.builder()
            .projectDirectory(projectDirectory)
            .configFile(configFile)
            .createMissingFiles(!noCreateMissing)
            .monitorSettings(monitorSettings)
            .build();
    }
}
