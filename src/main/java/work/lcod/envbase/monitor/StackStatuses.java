package work.lcod.envbase.monitor;

import java.util.Set;

public final class StackStatuses {
    public static final String STACK_RESOURCE_TYPE = "AWS::CloudFormation::Stack";

    /** Statuses after which the stack does not change without a new request. */
    public static final Set<String> TERMINAL = Set.of(
        "CREATE_COMPLETE",
        "UPDATE_COMPLETE",
        "UPDATE_ROLLBACK_COMPLETE",
        "CREATE_FAILED",
        "UPDATE_FAILED",
        "UPDATE_ROLLBACK_FAILED"
    );

    private StackStatuses() {}

    public static boolean isTerminal(String status) {
        return status != null && TERMINAL.contains(status);
    }

    /** Event reports that {@code stackName} itself reached a terminal status. */
    public static boolean isStackTerminal(StackEvent event, String stackName) {
        return event.isStackResource()
            && stackName != null
            && stackName.equals(event.logicalResourceId())
            && isTerminal(event.status());
    }
}
