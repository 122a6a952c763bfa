package work.lcod.envbase.template;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import work.lcod.envbase.config.ConfigTrees;

/**
 * Values from the {@code template} and {@code network} config sections that drive child composition.
 */
public record ComposerSettings(
    int azCount,
    List<String> subnetTypes,
    String ec2KeyDefault,
    String templateBucket,
    String templatePrefix,
    String templateUploadAcl,
    int timeoutInMinutes,
    Map<String, Object> amiMap
) {
    public static final int DEFAULT_TIMEOUT_MINUTES = 60;

    public ComposerSettings {
        subnetTypes = List.copyOf(subnetTypes);
        amiMap = Collections.unmodifiableMap(new LinkedHashMap<>(amiMap == null ? Map.of() : amiMap));
    }

    public static ComposerSettings fromConfig(Map<String, Object> config, Map<String, Object> amiMap) {
        var network = ConfigTrees.section(config, "network");
        var template = ConfigTrees.section(config, "template");
        var subnetTypes = new ArrayList<String>();
        if (network.get("subnet_types") instanceof List<?> types) {
            for (var type : types) {
                subnetTypes.add(String.valueOf(type));
            }
        }
        return new ComposerSettings(
            ConfigTrees.integer(config, "network", "az_count", 0),
            subnetTypes,
            ConfigTrees.string(template, "ec2_key_default", "default-key"),
            ConfigTrees.string(template, "template_bucket", null),
            ConfigTrees.string(template, "s3_template_prefix", ""),
            ConfigTrees.string(template, "template_upload_acl", "private"),
            ConfigTrees.integer(config, "template", "timeout_in_minutes", DEFAULT_TIMEOUT_MINUTES),
            amiMap
        );
    }
}
