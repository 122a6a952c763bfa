package work.lcod.envbase.cli;

import java.util.Map;
import picocli.CommandLine;
import work.lcod.envbase.api.EnvironmentBase;

@CommandLine.Command(name = "init", description = "Write the default configuration file.")
final class InitCommand extends EnvironmentCommand {
    @Override
    void execute(EnvironmentBase environment, Map<String, Object> metadata) {
        metadata.put("configFile", environment.initAction().toString());
    }
}
