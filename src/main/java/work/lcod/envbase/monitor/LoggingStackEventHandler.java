package work.lcod.envbase.monitor;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Prints the progress of a deployment and is satisfied once the watched stack reaches a terminal status.
 */
public final class LoggingStackEventHandler implements StackEventHandler {
    private static final Logger log = LoggerFactory.getLogger(LoggingStackEventHandler.class);

    private final String stackName;

    public LoggingStackEventHandler(String stackName) {
        this.stackName = stackName;
    }

    @Override
    public boolean handle(StackEvent event) {
        String reason = event.statusReason() == null || event.statusReason().isBlank()
            ? ""
            : " (" + event.statusReason() + ")";
        log.info("{} {} {}{}", event.logicalResourceId(), event.resourceType(), event.status(), reason);
        return StackStatuses.isStackTerminal(event, stackName);
    }
}
