package work.lcod.envbase.monitor;

import java.time.Duration;
import java.util.Objects;

/**
 * Polling limits of a {@link StackEventMonitor}.
 *
 * @param timeout ceiling on the whole observation
 * @param waitSeconds longest blocking wait of a single receive
 * @param maxMessages largest batch fetched per receive
 * @param verbose log every event at INFO instead of DEBUG
 */
public record MonitorSettings(Duration timeout, int waitSeconds, int maxMessages, boolean verbose) {
    public static final Duration DEFAULT_TIMEOUT = Duration.ofHours(1);
    public static final int DEFAULT_WAIT_SECONDS = 5;
    public static final int DEFAULT_MAX_MESSAGES = 10;

    public MonitorSettings {
        Objects.requireNonNull(timeout, "timeout");
        if (timeout.isNegative()) {
            throw new IllegalArgumentException("timeout must not be negative");
        }
        if (waitSeconds < 0 || maxMessages < 1) {
            throw new IllegalArgumentException("waitSeconds must be >= 0 and maxMessages >= 1");
        }
    }

    public static MonitorSettings defaults() {
        return new MonitorSettings(DEFAULT_TIMEOUT, DEFAULT_WAIT_SECONDS, DEFAULT_MAX_MESSAGES, false);
    }

    public MonitorSettings withTimeout(Duration newTimeout) {
        return new MonitorSettings(newTimeout, waitSeconds, maxMessages, verbose);
    }

    public MonitorSettings withVerbose(boolean newVerbose) {
        return new MonitorSettings(timeout, waitSeconds, maxMessages, newVerbose);
    }
}
