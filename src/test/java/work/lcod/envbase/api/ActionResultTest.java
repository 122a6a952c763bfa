package work.lcod.envbase.api;

import static org.junit.jupiter.api.Assertions.assertEquals;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Instant;
import org.junit.jupiter.api.Test;
import work.lcod.envbase.shared.EnvBaseException;

class ActionResultTest {
    @Test
    void statusesMapToExitCodes() {
        assertEquals(0, ActionResult.Status.SUCCESS.exitCode());
        assertEquals(1, ActionResult.Status.FAILURE.exitCode());
        assertEquals(130, ActionResult.Status.INTERRUPTED.exitCode());
    }

    @Test
    void serializesActionStatusAndMetadata() throws Exception {
        var error = new EnvBaseException("deploy_failed", "Stack \"demo\" rejected the update");
        var result = ActionResult.failure("deploy", error, Instant.parse("2024-05-01T10:15:30Z"));

        var json = new ObjectMapper().readTree(result.toPrettyJson());

        assertEquals("deploy", json.get("action").asText());
        assertEquals("failure", json.get("status").asText());
        assertEquals("deploy_failed", json.at("/metadata/code").asText());
        assertEquals("Stack \"demo\" rejected the update", json.at("/metadata/error").asText());
        assertEquals("2024-05-01T10:15:30Z", json.get("startedAt").asText());
    }
}
