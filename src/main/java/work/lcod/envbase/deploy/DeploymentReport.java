package work.lcod.envbase.deploy;

import java.util.Optional;
import work.lcod.envbase.monitor.MonitorResult;

/**
 * Result of a deploy action. {@code monitor} is empty when no stack event handler was registered or when the
 * stack was already up to date.
 */
public record DeploymentReport(String stackName, DeployOutcome outcome, Optional<MonitorResult> monitor) {}
