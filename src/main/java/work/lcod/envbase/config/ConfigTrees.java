package work.lcod.envbase.config;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Helpers for the nested map/list trees produced by Jackson.
 */
public final class ConfigTrees {
    private ConfigTrees() {}

    public static Map<String, Object> deepCopy(Map<String, ?> source) {
        var copy = new LinkedHashMap<String, Object>();
        if (source != null) {
            for (var entry : source.entrySet()) {
                copy.put(entry.getKey(), copyValue(entry.getValue()));
            }
        }
        return copy;
    }

    /** Copies {@code base} and overlays every fragment by top-level key; later fragments win. */
    public static Map<String, Object> mergeTopLevel(Map<String, Object> base, List<Map<String, Object>> fragments) {
        var merged = deepCopy(base);
        for (var fragment : fragments) {
            if (fragment != null) {
                merged.putAll(deepCopy(fragment));
            }
        }
        return merged;
    }

    @SuppressWarnings("unchecked")
    public static Map<String, Object> section(Map<String, Object> config, String name) {
        Object value = config.get(name);
        if (value instanceof Map<?, ?> map) {
            return (Map<String, Object>) map;
        }
        return Map.of();
    }

    public static String string(Map<String, Object> section, String key, String fallback) {
        Object value = section.get(key);
        return value == null ? fallback : String.valueOf(value);
    }

    /** Reads {@code <sectionName>.<key>} as an int; failures report the dotted path. */
    public static int integer(Map<String, Object> config, String sectionName, String key, int fallback) {
        String path = sectionName + "." + key;
        Object value = section(config, sectionName).get(key);
        try {
            if (value instanceof BigInteger big) {
                return big.intValueExact();
            }
            if (value instanceof Integer || value instanceof Long || value instanceof Short) {
                return Math.toIntExact(((Number) value).longValue());
            }
        } catch (ArithmeticException ex) {
            throw new ConfigValidationException(path, "Integer " + value + " is out of range");
        }
        if (value instanceof Number) {
            throw new ConfigValidationException(path, "Expected an integer but found " + value);
        }
        if (value instanceof String str && !str.isBlank()) {
            try {
                return Integer.parseInt(str.trim());
            } catch (NumberFormatException ex) {
                throw new ConfigValidationException(path, "Expected an integer but found '" + str + "'");
            }
        }
        return fallback;
    }

    public static boolean flag(Map<String, Object> section, String key) {
        return Boolean.TRUE.equals(section.get(key));
    }

    @SuppressWarnings("unchecked")
    private static Object copyValue(Object value) {
        if (value instanceof Map<?, ?> map) {
            return deepCopy((Map<String, ?>) map);
        }
        if (value instanceof List<?> list) {
            var copy = new ArrayList<Object>(list.size());
            for (var item : list) {
                copy.add(copyValue(item));
            }
            return copy;
        }
        return value;
    }
}
