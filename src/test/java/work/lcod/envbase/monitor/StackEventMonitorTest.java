package work.lcod.envbase.monitor;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import work.lcod.envbase.cloud.NotificationChannelProvider.QueueRef;
import work.lcod.envbase.support.FakeCloud;
import work.lcod.envbase.support.MutableClock;

class StackEventMonitorTest {
    private static final QueueRef QUEUE = new QueueRef("https://sqs.local/demo", "arn:aws:sqs:us-east-1:0:demo");
    private static final String STACK = StackStatuses.STACK_RESOURCE_TYPE;

    private final MutableClock clock = new MutableClock(Instant.parse("2024-05-01T10:00:00Z"));

    @AfterEach
    void clearInterrupt() {
        Thread.interrupted();
    }

    @Test
    void terminalStackEventEndsMonitoringWhateverHandlersRemain() {
        var cloud = new FakeCloud()
            .enqueue(FakeCloud.event("demo", "web", "AWS::EC2::Instance", "CREATE_IN_PROGRESS"))
            .enqueue(FakeCloud.event("demo", "demo", STACK, "CREATE_COMPLETE"));
        var neverSatisfied = new RecordingHandler(-1);

        var result = monitor(cloud, List.of(neverSatisfied, new RecordingHandler(-1))).run();

        assertEquals(MonitorState.TERMINATED, result.state());
        assertEquals(Optional.of("CREATE_COMPLETE"), result.stackStatus());
        assertEquals(2, result.eventsProcessed());
        assertEquals(2, neverSatisfied.seen.size());
        assertEquals(2, cloud.receiveRounds());
    }

    @Test
    void terminalStatusOfAnotherStackDoesNotStop() {
        var cloud = new FakeCloud()
            .enqueue(FakeCloud.event("demo", "webStack", STACK, "CREATE_COMPLETE"))
            .enqueue(FakeCloud.event("demo", "demo", STACK, "UPDATE_ROLLBACK_COMPLETE"));

        var result = monitor(cloud, List.of(new RecordingHandler(-1))).run();

        assertEquals(MonitorState.TERMINATED, result.state());
        assertEquals(Optional.of("UPDATE_ROLLBACK_COMPLETE"), result.stackStatus());
    }

    @Test
    void satisfiedHandlerSeesItsEventButNotTheNextOne() {
        var cloud = new FakeCloud().enqueue(
            FakeCloud.event("demo", "a", "AWS::S3::Bucket", "CREATE_IN_PROGRESS"),
            FakeCloud.event("demo", "b", "AWS::S3::Bucket", "CREATE_IN_PROGRESS"),
            FakeCloud.event("demo", "c", "AWS::S3::Bucket", "CREATE_IN_PROGRESS")
        );
        var satisfiedOnFirst = new RecordingHandler(1);
        var satisfiedOnThird = new RecordingHandler(3);

        var monitor = monitor(cloud, List.of(satisfiedOnFirst, satisfiedOnThird));
        var result = monitor.run();

        assertEquals(List.of("a"), satisfiedOnFirst.seen);
        assertEquals(List.of("a", "b", "c"), satisfiedOnThird.seen);
        assertEquals(MonitorState.EXHAUSTED, result.state());
        assertTrue(monitor.remainingHandlers().isEmpty());
    }

    @Test
    void everyMessageIsDeletedBeforeDispatch() {
        var cloud = new FakeCloud().enqueue(
            FakeCloud.event("demo", "a", "AWS::S3::Bucket", "CREATE_IN_PROGRESS"),
            "not an event at all"
        );
        var calls = cloud.calls;
        StackEventHandler handler = event -> {
            assertEquals("deleteMessage", calls.get(calls.size() - 1));
            return false;
        };
        cloud.onReceive = round -> {
            if (round > 1) {
                clock.advance(Duration.ofHours(2));
            }
        };

        var result = monitor(cloud, List.of(handler)).run();

        assertEquals(List.of("receipt-1", "receipt-2"), cloud.deletedReceipts);
        assertEquals(2, result.eventsProcessed());
    }

    @Test
    void stopsAtTimeoutCeiling() {
        var cloud = new FakeCloud();
        cloud.onReceive = round -> clock.advance(Duration.ofSeconds(5));
        var settings = MonitorSettings.defaults().withTimeout(Duration.ofSeconds(20));

        var result = new StackEventMonitor(cloud, QUEUE, "demo", List.of(new RecordingHandler(-1)), settings, clock).run();

        assertEquals(MonitorState.TIMED_OUT, result.state());
        assertEquals(5, cloud.receiveRounds());
        assertTrue(result.elapsed().compareTo(Duration.ofSeconds(20)) > 0);
        assertTrue(result.stackStatus().isEmpty());
    }

    @Test
    void emptyChainReturnsWithoutPolling() {
        var cloud = new FakeCloud();

        var result = monitor(cloud, List.of()).run();

        assertEquals(MonitorState.EXHAUSTED, result.state());
        assertEquals(0, cloud.receiveRounds());
    }

    @Test
    void interruptAbortsAndKeepsTheFlag() {
        var cloud = new FakeCloud().enqueue(FakeCloud.event("demo", "a", "AWS::S3::Bucket", "CREATE_IN_PROGRESS"));
        StackEventHandler interrupting = event -> {
            Thread.currentThread().interrupt();
            return false;
        };
        var monitor = monitor(cloud, List.of(interrupting));

        var error = assertThrows(StackMonitorInterruptedException.class, monitor::run);

        assertEquals("monitor_interrupted", error.code());
        assertEquals("demo", error.stackName());
        assertEquals(MonitorState.ABORTED, monitor.state());
        assertTrue(Thread.currentThread().isInterrupted());
        assertEquals(1, cloud.receiveRounds());
    }

    @Test
    void callerListIsNotModified() {
        var handlers = new ArrayList<StackEventHandler>(List.of(new RecordingHandler(1)));
        var cloud = new FakeCloud().enqueue(FakeCloud.event("demo", "a", "AWS::S3::Bucket", "CREATE_IN_PROGRESS"));

        monitor(cloud, handlers).run();

        assertEquals(1, handlers.size());
    }

    @Test
    void loggingHandlerIsSatisfiedByTerminalStatusOfItsStack() {
        var handler = new LoggingStackEventHandler("demo");

        assertFalse(handler.handle(StackEventParser.parse(FakeCloud.event("demo", "demo", STACK, "CREATE_IN_PROGRESS"))));
        assertFalse(handler.handle(StackEventParser.parse(FakeCloud.event("demo", "web", STACK, "CREATE_COMPLETE"))));
        assertTrue(handler.handle(StackEventParser.parse(FakeCloud.event("demo", "demo", STACK, "CREATE_FAILED"))));
    }

    private StackEventMonitor monitor(FakeCloud cloud, List<? extends StackEventHandler> handlers) {
        return new StackEventMonitor(cloud, QUEUE, "demo", handlers, MonitorSettings.defaults(), clock);
    }

    /** Records logical ids and reports satisfaction on the n-th event (never when negative). */
    private static final class RecordingHandler implements StackEventHandler {
        private final int satisfiedAt;
        private final List<String> seen = new ArrayList<>();

        RecordingHandler(int satisfiedAt) {
            this.satisfiedAt = satisfiedAt;
        }

        @Override
        public boolean handle(StackEvent event) {
            seen.add(event.logicalResourceId());
            return seen.size() == satisfiedAt;
        }
    }
}
