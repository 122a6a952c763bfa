package work.lcod.envbase.cli;

import java.util.LinkedHashMap;
import java.util.Map;
import picocli.CommandLine;
import work.lcod.envbase.api.EnvironmentBase;

@CommandLine.Command(name = "create", description = "Generate the root template under templates/.")
final class CreateCommand extends EnvironmentCommand {
    @CommandLine.Option(
        names = "--bind",
        paramLabel = "NAME=VALUE",
        description = "Manual binding for child template parameters (repeatable)."
    )
    Map<String, String> bindings = new LinkedHashMap<>();

    @Override
    void execute(EnvironmentBase environment, Map<String, Object> metadata) {
        bindings.forEach(environment::addManualParameterBinding);
        metadata.put("template", environment.createAction().toString());
    }
}
