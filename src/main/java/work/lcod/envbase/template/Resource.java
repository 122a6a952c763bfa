package work.lcod.envbase.template;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Resource declaration: logical name, CloudFormation type, properties and explicit dependencies.
 */
public record Resource(String name, String type, Map<String, Object> properties, Set<String> dependsOn) {
    public static final String STACK_TYPE = "AWS::CloudFormation::Stack";

    public Resource {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(type, "type");
        properties = Collections.unmodifiableMap(new LinkedHashMap<>(properties == null ? Map.of() : properties));
        dependsOn = Collections.unmodifiableSet(new LinkedHashSet<>(dependsOn == null ? Set.of() : dependsOn));
    }

    public static Resource of(String name, String type, Map<String, Object> properties) {
        return new Resource(name, type, properties, Set.of());
    }

    public Resource dependingOn(String... names) {
        var next = new LinkedHashSet<>(dependsOn);
        next.addAll(List.of(names));
        return new Resource(name, type, properties, next);
    }

    Map<String, Object> toJson() {
        var json = new LinkedHashMap<String, Object>();
        json.put("Type", type);
        if (!properties.isEmpty()) {
            json.put("Properties", ValueRef.expand(properties));
        }
        if (!dependsOn.isEmpty()) {
            json.put("DependsOn", List.copyOf(dependsOn));
        }
        return json;
    }
}
