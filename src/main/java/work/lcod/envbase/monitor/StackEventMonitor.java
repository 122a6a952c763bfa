package work.lcod.envbase.monitor;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.envbase.cloud.NotificationChannelProvider;
import work.lcod.envbase.cloud.NotificationChannelProvider.NotificationMessage;
import work.lcod.envbase.cloud.NotificationChannelProvider.QueueRef;

/**
 * Polls a notification queue for stack events and feeds them to a handler chain.
 *
 * <p>Every iteration first checks, in order: interruption ({@link MonitorState#ABORTED}, rethrown as
 * {@link StackMonitorInterruptedException}), a terminal status of the target stack ({@link MonitorState#TERMINATED}),
 * the time ceiling ({@link MonitorState#TIMED_OUT}) and an empty chain ({@link MonitorState#EXHAUSTED}). It then
 * receives one batch. Each message is deleted from the queue as soon as it is parsed, before any handler runs.
 * Handlers that report satisfaction leave the chain after the event has been offered to the whole chain.
 */
public final class StackEventMonitor {
    private static final Logger log = LoggerFactory.getLogger(StackEventMonitor.class);

    private final NotificationChannelProvider provider;
    private final QueueRef queue;
    private final String stackName;
    private final List<StackEventHandler> handlers;
    private final MonitorSettings settings;
    private final Clock clock;
    private MonitorState state = MonitorState.POLLING;

    public StackEventMonitor(
        NotificationChannelProvider provider,
        QueueRef queue,
        String stackName,
        Collection<? extends StackEventHandler> handlers,
        MonitorSettings settings,
        Clock clock
    ) {
        this.provider = Objects.requireNonNull(provider, "provider");
        this.queue = Objects.requireNonNull(queue, "queue");
        this.stackName = Objects.requireNonNull(stackName, "stackName");
        this.handlers = new ArrayList<>(handlers);
        this.settings = settings == null ? MonitorSettings.defaults() : settings;
        this.clock = clock == null ? Clock.systemUTC() : clock;
    }

    public MonitorResult run() {
        Instant started = clock.instant();
        int processed = 0;
        String terminalStatus = null;
        while (true) {
            Duration elapsed = Duration.between(started, clock.instant());
            if (Thread.currentThread().isInterrupted()) {
                state = MonitorState.ABORTED;
                log.warn("Interrupted after {}s, stopping observation of '{}' (the deployment continues)",
                    elapsed.toSeconds(), stackName);
                throw new StackMonitorInterruptedException(stackName);
            }
            if (terminalStatus != null) {
                state = MonitorState.TERMINATED;
            } else if (elapsed.compareTo(settings.timeout()) > 0) {
                state = MonitorState.TIMED_OUT;
                log.warn("Stopped waiting for '{}' after {}", stackName, settings.timeout());
            } else if (handlers.isEmpty()) {
                state = MonitorState.EXHAUSTED;
            }
            if (state.isExit()) {
                return new MonitorResult(state, processed, elapsed, Optional.ofNullable(terminalStatus));
            }

            var batch = provider.receiveMessages(queue, settings.waitSeconds(), settings.maxMessages());
            for (NotificationMessage message : batch) {
                var event = StackEventParser.parse(message.body());
                provider.deleteMessage(queue, message);
                processed++;
                logEvent(event);
                dispatch(event);
                if (StackStatuses.isStackTerminal(event, stackName)) {
                    terminalStatus = event.status();
                }
            }
        }
    }

    private void dispatch(StackEvent event) {
        var satisfied = new ArrayList<StackEventHandler>();
        for (var handler : handlers) {
            if (handler.handle(event)) {
                satisfied.add(handler);
            }
        }
        if (!satisfied.isEmpty()) {
            handlers.removeAll(satisfied);
            state = MonitorState.DRAINING;
        }
    }

    private void logEvent(StackEvent event) {
        if (settings.verbose()) {
            log.info("Stack event {} {} {} {}", event.status(), event.resourceType(), event.logicalResourceId(),
                event.statusReason() == null ? "" : event.statusReason());
        } else {
            log.debug("Stack event {} {} {}", event.status(), event.resourceType(), event.logicalResourceId());
        }
    }

    public MonitorState state() {
        return state;
    }

    public List<StackEventHandler> remainingHandlers() {
        return List.copyOf(handlers);
    }
}
