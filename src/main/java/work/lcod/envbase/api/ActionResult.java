package work.lcod.envbase.api;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import java.io.UncheckedIOException;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import work.lcod.envbase.shared.EnvBaseException;

/**
 * Outcome of one CLI action, printed as JSON on stdout.
 */
public record ActionResult(String action, Status status, Map<String, Object> metadata, Instant startedAt, Instant finishedAt) {
    private static final ObjectWriter WRITER = new ObjectMapper().writerWithDefaultPrettyPrinter();

    public ActionResult {
        metadata = Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    public static ActionResult success(String action, Map<String, Object> metadata, Instant startedAt) {
        return new ActionResult(action, Status.SUCCESS, metadata, startedAt, Instant.now());
    }

    /** Failed action; the metadata carries the error code and message of {@code error}. */
    public static ActionResult failure(String action, EnvBaseException error, Instant startedAt) {
        Map<String, Object> meta = new LinkedHashMap<>();
        meta.put("code", error.code());
        meta.put("error", error.getMessage() == null ? error.getClass().getSimpleName() : error.getMessage());
        return new ActionResult(action, Status.FAILURE, meta, startedAt, Instant.now());
    }

    public static ActionResult interrupted(String action, Map<String, Object> metadata, Instant startedAt) {
        return new ActionResult(action, Status.INTERRUPTED, metadata, startedAt, Instant.now());
    }

    public Map<String, Object> toSerializableMap() {
        Map<String, Object> serializable = new LinkedHashMap<>();
        serializable.put("action", action);
        serializable.put("status", status.name().toLowerCase());
        serializable.put("metadata", metadata);
        serializable.put("startedAt", startedAt.toString());
        serializable.put("finishedAt", finishedAt.toString());
        return serializable;
    }

    public String toPrettyJson() {
        try {
            return WRITER.writeValueAsString(toSerializableMap());
        } catch (JsonProcessingException ex) {
            throw new UncheckedIOException("Cannot serialize result of " + action, ex);
        }
    }

    public enum Status {
        SUCCESS(0),
        FAILURE(1),
        INTERRUPTED(130);

        private final int exitCode;

        Status(int exitCode) {
            this.exitCode = exitCode;
        }

        public int exitCode() {
            return exitCode;
        }
    }
}
