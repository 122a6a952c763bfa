package work.lcod.envbase.monitor;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Turns a queued notification body into a {@link StackEvent}.
 *
 * <p>Bodies are SNS envelopes whose {@code Message} holds newline separated {@code Key='value'} pairs. A body
 * that is not an envelope is parsed as the message itself. Unknown or malformed pairs are ignored and never fail
 * the parse.
 */
public final class StackEventParser {
    private static final ObjectMapper JSON = new ObjectMapper();
    private static final TypeReference<Object> ANY = new TypeReference<>() {};
    private static final Pattern PAIR = Pattern.compile("(\\S+)=('.*?'|\\S+)");

    private StackEventParser() {}

    public static StackEvent parse(String body) {
        var fields = parseFields(unwrapEnvelope(body));
        return new StackEvent(
            fields.get("ResourceStatus"),
            fields.get("ResourceType"),
            fields.get("LogicalResourceId"),
            fields.get("ResourceStatusReason"),
            parseProperties(fields.get("ResourceProperties")),
            fields
        );
    }

    static String unwrapEnvelope(String body) {
        if (body == null) {
            return "";
        }
        String trimmed = body.trim();
        if (!trimmed.startsWith("{")) {
            return body;
        }
        try {
            JsonNode envelope = JSON.readTree(trimmed);
            JsonNode message = envelope == null ? null : envelope.get("Message");
            return message != null && message.isTextual() ? message.asText() : body;
        } catch (JsonProcessingException ex) {
            return body;
        }
    }

    static Map<String, String> parseFields(String message) {
        var fields = new LinkedHashMap<String, String>();
        var matcher = PAIR.matcher(message);
        while (matcher.find()) {
            fields.put(matcher.group(1), stripQuotes(matcher.group(2)));
        }
        return fields;
    }

    static Object parseProperties(String raw) {
        if (raw == null || raw.isBlank()) {
            return raw;
        }
        try {
            return JSON.readValue(raw, ANY);
        } catch (JsonProcessingException ex) {
            return raw;
        }
    }

    private static String stripQuotes(String value) {
        int start = 0;
        int end = value.length();
        while (start < end && value.charAt(start) == '\'') {
            start++;
        }
        while (end > start && value.charAt(end - 1) == '\'') {
            end--;
        }
        return value.substring(start, end);
    }
}
