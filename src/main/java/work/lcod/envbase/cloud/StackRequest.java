package work.lcod.envbase.cloud;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Arguments of a create or update stack call.
 */
public record StackRequest(
    String stackName,
    String templateBody,
    Map<String, String> parameters,
    List<String> notificationTopics,
    List<String> capabilities,
    boolean disableRollback,
    Optional<Integer> timeoutInMinutes
) {
    public StackRequest {
        Objects.requireNonNull(stackName, "stackName");
        Objects.requireNonNull(templateBody, "templateBody");
        parameters = Collections.unmodifiableMap(new LinkedHashMap<>(parameters == null ? Map.of() : parameters));
        notificationTopics = notificationTopics == null ? List.of() : List.copyOf(notificationTopics);
        capabilities = capabilities == null ? List.of() : List.copyOf(capabilities);
        timeoutInMinutes = timeoutInMinutes == null ? Optional.empty() : timeoutInMinutes;
    }

    /** Same request with rollback disabled and a creation timeout, as used for the create fallback. */
    public StackRequest forCreate(int timeoutMinutes) {
        return new StackRequest(
            stackName,
            templateBody,
            parameters,
            notificationTopics,
            capabilities,
            true,
            Optional.of(timeoutMinutes)
        );
    }
}
