package work.lcod.envbase.config;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Adds the {@code db} section: any number of labelled database subsections, each with engine, instance class and
 * master credentials. Passwords are meant to be supplied through {@code <LABEL>_PASSWORD} environment variables.
 */
public final class DatabaseConfigHandler implements ConfigHandler {
    public static final String SECTION = "db";

    @Override
    public Map<String, Object> configSchema() {
        var database = new LinkedHashMap<String, Object>();
        database.put("engine", "str");
        database.put("instance_class", "str");
        database.put("username", "str");
        database.put("password", "str");
        return Map.of(SECTION, Map.of("*", database));
    }

    @Override
    public Map<String, Object> factoryDefaults() {
        var database = new LinkedHashMap<String, Object>();
        database.put("engine", "postgres");
        database.put("instance_class", "db.t3.micro");
        database.put("username", "envbase");
        database.put("password", "changeme");
        return Map.of(SECTION, Map.of("primarydb", database));
    }
}
