package work.lcod.envbase.monitor;

import java.time.Duration;
import java.util.Optional;

/**
 * How a monitor run ended. {@code stackStatus} is the terminal status of the target stack when one was seen.
 */
public record MonitorResult(MonitorState state, int eventsProcessed, Duration elapsed, Optional<String> stackStatus) {}
