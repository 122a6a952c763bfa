package work.lcod.envbase.template;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.envbase.config.ConfigLoadException;

/**
 * Region to AMI id table attached to every template as the {@code RegionMap} mapping. A project-local
 * {@code ami_cache.json} wins; otherwise the bundled table is written there when file creation is enabled.
 */
public final class AmiCatalog {
    public static final String DEFAULT_FILENAME = "ami_cache.json";
    static final String BUNDLED_RESOURCE = "/envbase/ami_cache.json";

    private static final Logger log = LoggerFactory.getLogger(AmiCatalog.class);
    private static final ObjectMapper JSON = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
    private static final TypeReference<LinkedHashMap<String, Object>> MAP_REF = new TypeReference<>() {};

    private AmiCatalog() {}

    public static Map<String, Object> load(Path projectDirectory, boolean createMissingFiles) {
        Path local = projectDirectory.resolve(DEFAULT_FILENAME);
        if (Files.isRegularFile(local)) {
            try {
                return JSON.readValue(local.toFile(), MAP_REF);
            } catch (IOException ex) {
                throw new ConfigLoadException(local + " could not be parsed: " + ex.getMessage(), ex);
            }
        }
        if (!createMissingFiles) {
            throw new ConfigLoadException(local + " could not be found");
        }
        var bundled = bundled();
        try {
            Files.writeString(local, JSON.writeValueAsString(bundled));
        } catch (IOException ex) {
            throw new ConfigLoadException("Unable to write " + local, ex);
        }
        log.info("Created {} from the bundled AMI table", local);
        return bundled;
    }

    public static Map<String, Object> bundled() {
        try (InputStream in = AmiCatalog.class.getResourceAsStream(BUNDLED_RESOURCE)) {
            if (in == null) {
                throw new ConfigLoadException("Missing bundled resource " + BUNDLED_RESOURCE);
            }
            return JSON.readValue(in, MAP_REF);
        } catch (IOException ex) {
            throw new ConfigLoadException("Unable to read bundled resource " + BUNDLED_RESOURCE, ex);
        }
    }
}
