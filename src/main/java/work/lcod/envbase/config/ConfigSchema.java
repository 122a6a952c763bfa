package work.lcod.envbase.config;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Map;

/**
 * Factory schema and default values bundled with envbase, plus their extension by registered handlers.
 */
public final class ConfigSchema {
    static final String SCHEMA_RESOURCE = "/envbase/config_schema.json";
    static final String DEFAULTS_RESOURCE = "/envbase/factory_defaults.json";

    private static final ObjectMapper JSON = new ObjectMapper();
    private static final TypeReference<Map<String, Object>> MAP_REF = new TypeReference<>() {};

    private ConfigSchema() {}

    /** A fresh copy of the bundled schema; callers may mutate it. */
    public static Map<String, Object> base() {
        return readResource(SCHEMA_RESOURCE);
    }

    public static Map<String, Object> baseDefaults() {
        return readResource(DEFAULTS_RESOURCE);
    }

    public static Map<String, Object> extend(Map<String, Object> schema, Collection<? extends ConfigHandler> handlers) {
        var fragments = new ArrayList<Map<String, Object>>();
        for (var handler : handlers) {
            fragments.add(handler.configSchema());
        }
        return ConfigTrees.mergeTopLevel(schema, fragments);
    }

    public static Map<String, Object> extendDefaults(
        Map<String, Object> defaults,
        Collection<? extends ConfigHandler> handlers
    ) {
        var fragments = new ArrayList<Map<String, Object>>();
        for (var handler : handlers) {
            fragments.add(handler.factoryDefaults());
        }
        return ConfigTrees.mergeTopLevel(defaults, fragments);
    }

    static Map<String, Object> readResource(String resource) {
        try (var in = ConfigSchema.class.getResourceAsStream(resource)) {
            if (in == null) {
                throw new ConfigLoadException("Missing bundled resource " + resource);
            }
            return ConfigTrees.deepCopy(JSON.readValue(in, MAP_REF));
        } catch (IOException ex) {
            throw new ConfigLoadException("Unable to read bundled resource " + resource, ex);
        }
    }
}
