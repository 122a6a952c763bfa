package work.lcod.envbase.config;

import java.util.Map;

/**
 * Checks a configuration tree against a required-shape schema.
 *
 * <p>Every schema key is a {@link GlobPattern}; it must match at least one key at the same level of the
 * configuration. Leaf requirements name a {@link SchemaType}, compound requirements are nested schemas and are
 * applied to every matching subsection independently. Validation stops at the first violation.
 */
public final class ConfigValidator {
    private ConfigValidator() {}

    public static void validate(Map<String, Object> schema, Map<String, Object> config) {
        validate(schema, config, "");
    }

    @SuppressWarnings("unchecked")
    public static void validate(Map<String, Object> schema, Map<String, Object> config, String path) {
        for (var requirement : schema.entrySet()) {
            var pattern = GlobPattern.compile(requirement.getKey());
            var matches = pattern.filter(config.keySet());
            if (matches.isEmpty()) {
                throw new ConfigValidationException(join(path, requirement.getKey()), "Config file missing section");
            }
            Object expected = requirement.getValue();
            for (var key : matches) {
                String childPath = join(path, key);
                Object actual = config.get(key);
                if (expected instanceof String typeName) {
                    var type = SchemaType.from(typeName);
                    if (!type.accepts(actual)) {
                        throw new ConfigValidationException(
                            childPath,
                            "Type mismatch in config, expected " + typeName + " but found " + SchemaType.describe(actual)
                        );
                    }
                } else if (expected instanceof Map<?, ?> nested) {
                    if (!(actual instanceof Map<?, ?> section)) {
                        throw new ConfigValidationException(
                            childPath,
                            "Type mismatch in config, expected dict but found " + SchemaType.describe(actual)
                        );
                    }
                    validate((Map<String, Object>) nested, (Map<String, Object>) section, childPath);
                } else {
                    throw new IllegalArgumentException("Malformed schema entry at " + childPath + ": " + expected);
                }
            }
        }
    }

    static String join(String path, String key) {
        return path == null || path.isEmpty() ? key : path + "." + key;
    }
}
