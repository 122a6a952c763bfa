package work.lcod.envbase.cli;

import java.util.Map;
import picocli.CommandLine;
import work.lcod.envbase.api.EnvironmentBase;

@CommandLine.Command(name = "delete", description = "Delete the environment stack.")
final class DeleteCommand extends EnvironmentCommand {
    @Override
    void execute(EnvironmentBase environment, Map<String, Object> metadata) {
        metadata.put("stack", environment.deleteAction());
    }
}
