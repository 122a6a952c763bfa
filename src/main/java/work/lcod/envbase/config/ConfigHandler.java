package work.lcod.envbase.config;

import java.util.Map;

/**
 * Contributes configuration sections: a schema fragment merged into the validation schema and the factory default
 * values written when a fresh config file is created. Fragments are merged by top-level key and override the base.
 */
public interface ConfigHandler {
    Map<String, Object> configSchema();

    Map<String, Object> factoryDefaults();
}
