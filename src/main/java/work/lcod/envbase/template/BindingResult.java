package work.lcod.envbase.template;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Resolved child stack parameters, in child declaration order, and the sibling stacks they read outputs from.
 */
public record BindingResult(Map<String, ValueRef> bindings, Set<String> dependsOn) {
    public BindingResult {
        bindings = Collections.unmodifiableMap(new LinkedHashMap<>(bindings));
        dependsOn = Collections.unmodifiableSet(new LinkedHashSet<>(dependsOn));
    }
}
