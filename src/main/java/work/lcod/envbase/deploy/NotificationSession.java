package work.lcod.envbase.deploy;

import java.security.SecureRandom;
import java.time.Clock;
import java.time.format.DateTimeFormatter;
import java.util.Objects;
import java.util.Random;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.envbase.cloud.NotificationChannelProvider;
import work.lcod.envbase.cloud.NotificationChannelProvider.QueueRef;

/**
 * Topic, queue and subscription receiving the lifecycle events of one deploy invocation. Open it with
 * try-with-resources: {@link #close()} removes topic and queue on every exit path.
 */
public final class NotificationSession implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(NotificationSession.class);
    private static final DateTimeFormatter STAMP = DateTimeFormatter.ofPattern("yyyyMMdd-HHmmss");
    private static final String SUFFIX_ALPHABET = "abcdefghijklmnopqrstuvwxyz0123456789";
    private static final int SUFFIX_LENGTH = 5;

    private final NotificationChannelProvider provider;
    private final String name;
    private String topicId;
    private QueueRef queue;
    private boolean closed;
    private boolean removed;

    private NotificationSession(NotificationChannelProvider provider, String name) {
        this.provider = provider;
        this.name = name;
    }

    public static NotificationSession open(NotificationChannelProvider provider, String environmentName) {
        return open(provider, environmentName, Clock.systemDefaultZone(), new SecureRandom());
    }

    /**
     * Creates the channel. If any step fails, whatever was already created is removed before the error propagates.
     */
    public static NotificationSession open(
        NotificationChannelProvider provider,
        String environmentName,
        Clock clock,
        Random random
    ) {
        Objects.requireNonNull(provider, "provider");
        var session = new NotificationSession(provider, channelName(environmentName, clock, random));
        try {
            session.topicId = provider.createTopic(session.name);
            session.queue = provider.createQueue(session.name);
            provider.subscribe(session.topicId, session.queue);
            provider.allowPublish(session.topicId, session.queue);
        } catch (RuntimeException ex) {
            session.close();
            throw ex;
        }
        log.info("Listening for stack events on {}", session.name);
        return session;
    }

    static String channelName(String environmentName, Clock clock, Random random) {
        var suffix = new StringBuilder(SUFFIX_LENGTH);
        for (int i = 0; i < SUFFIX_LENGTH; i++) {
            suffix.append(SUFFIX_ALPHABET.charAt(random.nextInt(SUFFIX_ALPHABET.length())));
        }
        var now = clock.instant().atZone(clock.getZone());
        return environmentName + "_" + STAMP.format(now) + "_" + suffix;
    }

    public String name() {
        return name;
    }

    public String topicId() {
        return topicId;
    }

    public QueueRef queue() {
        return queue;
    }

    public NotificationChannelProvider provider() {
        return provider;
    }

    /** Best-effort teardown; failures are logged so that the original error, if any, keeps propagating. */
    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        boolean complete = true;
        if (topicId != null) {
            try {
                provider.deleteTopic(topicId);
            } catch (RuntimeException ex) {
                complete = false;
                log.warn("Unable to delete topic {}: {}", topicId, ex.getMessage());
            }
        }
        if (queue != null) {
            try {
                provider.deleteQueue(queue);
            } catch (RuntimeException ex) {
                complete = false;
                log.warn("Unable to delete queue {}: {}", queue.url(), ex.getMessage());
            }
        }
        removed = complete;
        if (complete) {
            log.info("Removed notification channel {}", name);
        } else {
            log.warn("Notification channel {} was only partially removed", name);
        }
    }

    /** Whether {@link #close()} deleted every part of the channel that had been created. */
    public boolean removed() {
        return removed;
    }
}
