package work.lcod.envbase.cli;

import java.util.Objects;
import java.util.function.Function;
import picocli.CommandLine;
import work.lcod.envbase.api.EnvironmentBase;
import work.lcod.envbase.api.EnvironmentOptions;

@CommandLine.Command(
    name = "envbase",
    description = "Generate, deploy and follow CloudFormation environments.",
    mixinStandardHelpOptions = true,
    versionProvider = VersionProvider.class,
    subcommands = {
        InitCommand.class,
        CreateCommand.class,
        DeployCommand.class,
        DeleteCommand.class
    }
)
final class EnvBaseCommand implements Runnable {
    private final Function<EnvironmentOptions, ? extends EnvironmentBase> environmentFactory;

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    EnvBaseCommand(Function<EnvironmentOptions, ? extends EnvironmentBase> environmentFactory) {
        this.environmentFactory = Objects.requireNonNull(environmentFactory, "environmentFactory");
    }

    EnvironmentBase newEnvironment(EnvironmentOptions options) {
        return environmentFactory.apply(options);
    }

    @Override
    public void run() {
        throw new CommandLine.ParameterException(spec.commandLine(), "Missing subcommand: init, create, deploy or delete");
    }
}
