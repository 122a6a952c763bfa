package work.lcod.envbase.template;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Output names recorded per attached child template, in attachment order.
 */
public final class StackOutputRegistry {
    /** Generated on every render, never bound to a sibling parameter. */
    public static final Set<String> IGNORED_OUTPUTS = Set.of(
        TemplateRenderer.VALIDATION_HASH,
        TemplateRenderer.DATE_GENERATED
    );

    private final Map<String, List<String>> outputsByTemplate = new LinkedHashMap<>();

    public void record(String templateName, Collection<String> outputNames) {
        var names = outputsByTemplate.computeIfAbsent(templateName, key -> new ArrayList<>());
        for (var output : outputNames) {
            if (!IGNORED_OUTPUTS.contains(output) && !names.contains(output)) {
                names.add(output);
            }
        }
    }

    public List<String> outputsOf(String templateName) {
        return Collections.unmodifiableList(outputsByTemplate.getOrDefault(templateName, List.of()));
    }

    /** First template other than {@code excludedTemplate} that recorded {@code outputName}. */
    public Optional<String> producerOf(String outputName, String excludedTemplate) {
        for (var entry : outputsByTemplate.entrySet()) {
            if (!entry.getKey().equals(excludedTemplate) && entry.getValue().contains(outputName)) {
                return Optional.of(entry.getKey());
            }
        }
        return Optional.empty();
    }
}
