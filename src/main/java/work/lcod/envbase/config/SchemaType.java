package work.lcod.envbase.config;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Leaf type names accepted in a config schema, with the Java runtime types produced by Jackson for each.
 */
public enum SchemaType {
    STRING("str", "string"),
    INTEGER("int", "integer"),
    NUMBER("float", "number"),
    BOOLEAN("bool", "boolean"),
    LIST("list", "array"),
    MAPPING("dict", "mapping");

    private final String shortName;
    private final String longName;

    SchemaType(String shortName, String longName) {
        this.shortName = shortName;
        this.longName = longName;
    }

    public static SchemaType from(String name) {
        if (name != null) {
            String normalized = name.trim().toLowerCase(Locale.ROOT);
            for (var type : values()) {
                if (type.shortName.equals(normalized) || type.longName.equals(normalized)) {
                    return type;
                }
            }
        }
        throw new IllegalArgumentException("Unsupported schema type: " + name);
    }

    public boolean accepts(Object value) {
        return switch (this) {
            case STRING -> value instanceof String;
            case INTEGER -> value instanceof Integer || value instanceof Long
                || value instanceof Short || value instanceof BigInteger;
            case NUMBER -> value instanceof Number;
            case BOOLEAN -> value instanceof Boolean;
            case LIST -> value instanceof List<?>;
            case MAPPING -> value instanceof Map<?, ?>;
        };
    }

    /** Schema-style name of a runtime value, used in mismatch messages. */
    static String describe(Object value) {
        if (value == null) {
            return "null";
        }
        if (value instanceof BigDecimal || value instanceof Double || value instanceof Float) {
            return NUMBER.shortName;
        }
        for (var type : values()) {
            if (type.accepts(value)) {
                return type.shortName;
            }
        }
        return value.getClass().getSimpleName();
    }
}
