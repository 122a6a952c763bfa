package work.lcod.envbase.cloud;

import java.util.List;

/**
 * Topic and queue operations backing a notification channel. Identifiers are provider specific
 * (ARNs and queue URLs on AWS).
 */
public interface NotificationChannelProvider {
    String createTopic(String name);

    QueueRef createQueue(String name);

    /** Subscribes the queue to the topic unless it already is. */
    void subscribe(String topicId, QueueRef queue);

    /** Lets the topic publish into the queue. Must be idempotent. */
    void allowPublish(String topicId, QueueRef queue);

    List<NotificationMessage> receiveMessages(QueueRef queue, int waitSeconds, int maxCount);

    void deleteMessage(QueueRef queue, NotificationMessage message);

    void deleteTopic(String topicId);

    void deleteQueue(QueueRef queue);

    record QueueRef(String url, String arn) {}

    record NotificationMessage(String receiptHandle, String body) {}
}
