package work.lcod.envbase.template;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.util.DefaultIndenter;
import com.fasterxml.jackson.core.util.DefaultPrettyPrinter;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.time.Instant;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Serializes a {@link Template} to CloudFormation JSON. Every rendered document gets two generated outputs:
 * {@code dateGenerated} and {@code templateValidationHash} (SHA-256 of the document rendered without them).
 */
public final class TemplateRenderer {
    public static final String FORMAT_VERSION = "2010-09-09";
    public static final String DATE_GENERATED = "dateGenerated";
    public static final String VALIDATION_HASH = "templateValidationHash";

    private static final ObjectMapper JSON = new ObjectMapper();
    private static final ObjectWriter PRETTY = JSON.writer(new DefaultPrettyPrinter()
        .withObjectIndenter(new DefaultIndenter("    ", "\n"))
        .withArrayIndenter(new DefaultIndenter("    ", "\n")));

    private final Clock clock;

    public TemplateRenderer() {
        this(Clock.systemUTC());
    }

    public TemplateRenderer(Clock clock) {
        this.clock = clock;
    }

    public String render(Template template) {
        var document = toDocument(template);
        try {
            String unstamped = JSON.writeValueAsString(document);
            @SuppressWarnings("unchecked")
            var outputs = (Map<String, Object>) document.computeIfAbsent("Outputs", key -> new LinkedHashMap<>());
            outputs.put(DATE_GENERATED, Map.of("Value", Instant.now(clock).toString()));
            outputs.put(VALIDATION_HASH, Map.of("Value", sha256(unstamped)));
            return JSON.writeValueAsString(document);
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Unable to render template " + template.name(), ex);
        }
    }

    /** Re-parses a rendered document and writes it back with stable 4-space indentation. */
    public String normalize(String rendered) {
        try {
            return PRETTY.writeValueAsString(JSON.readTree(rendered));
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Rendered template is not valid JSON", ex);
        }
    }

    private static Map<String, Object> toDocument(Template template) {
        var document = new LinkedHashMap<String, Object>();
        document.put("AWSTemplateFormatVersion", FORMAT_VERSION);
        if (template.description() != null) {
            document.put("Description", template.description());
        }
        if (!template.mappings().isEmpty()) {
            document.put("Mappings", new LinkedHashMap<>(template.mappings()));
        }
        if (!template.parameters().isEmpty()) {
            var parameters = new LinkedHashMap<String, Object>();
            template.parameters().forEach((name, parameter) -> parameters.put(name, parameter.toJson()));
            document.put("Parameters", parameters);
        }
        var resources = new LinkedHashMap<String, Object>();
        template.resources().forEach((name, resource) -> resources.put(name, resource.toJson()));
        document.put("Resources", resources);
        if (!template.outputs().isEmpty()) {
            var outputs = new LinkedHashMap<String, Object>();
            template.outputs().forEach((name, output) -> outputs.put(name, output.toJson()));
            document.put("Outputs", outputs);
        }
        return document;
    }

    private static String sha256(String body) {
        try {
            var digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(body.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException ex) {
            throw new IllegalStateException("SHA-256 not available", ex);
        }
    }
}
