package work.lcod.envbase.config;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.envbase.shared.HandlerRegistrationException;

/**
 * Loads the environment configuration file, creating it from factory defaults when allowed, and validates it
 * against the bundled schema extended by the registered {@link ConfigHandler}s.
 */
public final class ConfigLoader {
    public static final String DEFAULT_CONFIG_FILENAME = "config.json";

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);
    private static final ObjectMapper JSON = new ObjectMapper()
        .enable(JsonParser.Feature.ALLOW_COMMENTS)
        .enable(SerializationFeature.INDENT_OUTPUT)
        .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS);
    private static final ObjectMapper YAML = new ObjectMapper(new YAMLFactory());
    private static final TypeReference<Map<String, Object>> MAP_REF = new TypeReference<>() {};

    private final List<ConfigHandler> handlers = new ArrayList<>();
    private final boolean createMissingFiles;

    public ConfigLoader(boolean createMissingFiles) {
        this.createMissingFiles = createMissingFiles;
    }

    /**
     * Accepts any object but only keeps it if it implements {@link ConfigHandler}; anything else fails immediately.
     */
    public ConfigLoader registerHandler(Object candidate) {
        if (candidate == null) {
            throw new HandlerRegistrationException("Config handler must not be null");
        }
        if (!(candidate instanceof ConfigHandler handler)) {
            throw new HandlerRegistrationException(
                "Class " + candidate.getClass().getName()
                    + " cannot be a config handler, it must implement configSchema() and factoryDefaults()"
            );
        }
        handlers.add(handler);
        return this;
    }

    public List<ConfigHandler> handlers() {
        return Collections.unmodifiableList(handlers);
    }

    public Map<String, Object> schema() {
        return ConfigSchema.extend(ConfigSchema.base(), handlers);
    }

    public Map<String, Object> factoryDefaults() {
        return ConfigSchema.extendDefaults(ConfigSchema.baseDefaults(), handlers);
    }

    public Map<String, Object> load(Path configFile) {
        Map<String, Object> config;
        if (Files.isRegularFile(configFile)) {
            config = read(configFile);
        } else if (createMissingFiles && DEFAULT_CONFIG_FILENAME.equals(String.valueOf(configFile.getFileName()))) {
            config = factoryDefaults();
            writeDefaults(configFile, config);
            log.info("Created {} from factory defaults", configFile);
        } else {
            throw new ConfigLoadException(configFile + " could not be found");
        }
        return validate(config);
    }

    /** Validates a tree supplied directly (no file involved) and returns it. */
    public Map<String, Object> validate(Map<String, Object> config) {
        ConfigValidator.validate(schema(), config);
        return config;
    }

    public void writeDefaults(Path configFile, Map<String, Object> defaults) {
        try {
            var parent = configFile.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(configFile, JSON.writeValueAsString(defaults) + "\n", StandardCharsets.UTF_8);
        } catch (IOException ex) {
            throw new ConfigLoadException("Unable to write " + configFile, ex);
        }
    }

    private static Map<String, Object> read(Path configFile) {
        String name = String.valueOf(configFile.getFileName()).toLowerCase(Locale.ROOT);
        var mapper = name.endsWith(".yaml") || name.endsWith(".yml") ? YAML : JSON;
        try {
            Map<String, Object> parsed = mapper.readValue(configFile.toFile(), MAP_REF);
            if (parsed == null) {
                throw new ConfigLoadException(configFile + " is empty");
            }
            return ConfigTrees.deepCopy(parsed);
        } catch (IOException ex) {
            throw new ConfigLoadException(configFile + " could not be parsed: " + ex.getMessage(), ex);
        }
    }
}
