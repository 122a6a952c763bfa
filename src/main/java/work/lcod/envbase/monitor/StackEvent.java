package work.lcod.envbase.monitor;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Stack lifecycle event extracted from a notification. {@code properties} is the parsed JSON of
 * {@code ResourceProperties} when it parses, the raw text otherwise, or {@code null} when absent.
 */
public record StackEvent(
    String status,
    String resourceType,
    String logicalResourceId,
    String statusReason,
    Object properties,
    Map<String, String> fields
) {
    public StackEvent {
        fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields == null ? Map.of() : fields));
    }

    public String stackName() {
        return fields.get("StackName");
    }

    public boolean isStackResource() {
        return StackStatuses.STACK_RESOURCE_TYPE.equals(resourceType);
    }
}
