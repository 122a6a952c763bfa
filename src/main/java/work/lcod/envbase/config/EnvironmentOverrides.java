package work.lcod.envbase.config;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Replaces a key in every subsection of a config section with the value of {@code <SUBSECTION>_<KEY>} from the
 * environment, when that variable is set. Used for credentials that should not live in the config file.
 *
 * <p>For {@code apply(config, "db", "password", env)} and a config with {@code db.proddb.password},
 * {@code PRODDB_PASSWORD} wins over the file value.
 */
public final class EnvironmentOverrides {
    private static final Logger log = LoggerFactory.getLogger(EnvironmentOverrides.class);

    private EnvironmentOverrides() {}

    @SuppressWarnings("unchecked")
    public static void apply(
        Map<String, Object> config,
        String section,
        String key,
        Function<String, String> env,
        boolean verbose
    ) {
        Object raw = config.get(section);
        if (!(raw instanceof Map<?, ?> sectionMap)) {
            throw new ConfigValidationException(section, "No config section found");
        }
        var updates = new LinkedHashMap<String, Object>();
        for (var entry : ((Map<String, Object>) sectionMap).entrySet()) {
            if (!(entry.getValue() instanceof Map<?, ?> subsection)) {
                continue;
            }
            String envName = (entry.getKey() + "_" + key).toUpperCase(Locale.ROOT);
            String envValue = env.apply(envName);
            if (envValue != null && !envValue.isEmpty()) {
                updates.put(entry.getKey(), envValue);
                logOverride(verbose, "{}.{}.{} updated from {}", section, entry.getKey(), key, envName);
            } else {
                logOverride(verbose, "{}.{}.{} kept, {} not set", section, entry.getKey(), key, envName);
            }
        }
        for (var update : updates.entrySet()) {
            ((Map<String, Object>) ((Map<String, Object>) sectionMap).get(update.getKey())).put(key, update.getValue());
        }
    }

    private static void logOverride(boolean verbose, String format, Object... args) {
        if (verbose) {
            log.info(format, args);
        } else {
            log.debug(format, args);
        }
    }
}
