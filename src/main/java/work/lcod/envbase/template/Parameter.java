package work.lcod.envbase.template;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Template parameter declaration. {@code attributes} holds the optional CloudFormation keys
 * ({@code Default}, {@code Description}, {@code AllowedPattern}, ...).
 */
public record Parameter(String name, String type, Map<String, Object> attributes) {
    public Parameter {
        Objects.requireNonNull(name, "name");
        attributes = Collections.unmodifiableMap(new LinkedHashMap<>(attributes == null ? Map.of() : attributes));
    }

    public static Parameter of(String name, String type) {
        return new Parameter(name, type, Map.of());
    }

    public Parameter with(String attribute, Object value) {
        var next = new LinkedHashMap<>(attributes);
        next.put(attribute, value);
        return new Parameter(name, type, next);
    }

    public Parameter withDefault(Object value) {
        return with("Default", value);
    }

    public Parameter withDescription(String description) {
        return with("Description", description);
    }

    /** Copy suitable for declaring on another template; rejects declarations that cannot be rendered. */
    public Parameter copy() {
        if (type == null || type.isBlank()) {
            throw new BindingResolutionException("Parameter '" + name + "' has no type and cannot be copied");
        }
        return new Parameter(name, type, attributes);
    }

    Map<String, Object> toJson() {
        var json = new LinkedHashMap<String, Object>();
        json.put("Type", type);
        for (var entry : attributes.entrySet()) {
            json.put(entry.getKey(), ValueRef.expand(entry.getValue()));
        }
        return json;
    }
}
