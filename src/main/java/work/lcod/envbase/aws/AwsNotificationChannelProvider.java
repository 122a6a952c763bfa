package work.lcod.envbase.aws;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import software.amazon.awssdk.core.exception.AbortedException;
import software.amazon.awssdk.services.sns.SnsClient;
import software.amazon.awssdk.services.sns.model.CreateTopicRequest;
import software.amazon.awssdk.services.sns.model.DeleteTopicRequest;
import software.amazon.awssdk.services.sns.model.ListSubscriptionsByTopicRequest;
import software.amazon.awssdk.services.sns.model.SubscribeRequest;
import software.amazon.awssdk.services.sqs.SqsClient;
import software.amazon.awssdk.services.sqs.model.CreateQueueRequest;
import software.amazon.awssdk.services.sqs.model.DeleteMessageRequest;
import software.amazon.awssdk.services.sqs.model.DeleteQueueRequest;
import software.amazon.awssdk.services.sqs.model.GetQueueAttributesRequest;
import software.amazon.awssdk.services.sqs.model.QueueAttributeName;
import software.amazon.awssdk.services.sqs.model.ReceiveMessageRequest;
import software.amazon.awssdk.services.sqs.model.SetQueueAttributesRequest;
import work.lcod.envbase.cloud.NotificationChannelProvider;

/**
 * Notification channel on SNS (topic) and SQS (queue). Topic and queue creation are idempotent on AWS.
 */
public final class AwsNotificationChannelProvider implements NotificationChannelProvider {
    private static final ObjectMapper JSON = new ObjectMapper();

    private final SnsClient sns;
    private final SqsClient sqs;

    public AwsNotificationChannelProvider(SnsClient sns, SqsClient sqs) {
        this.sns = sns;
        this.sqs = sqs;
    }

    @Override
    public String createTopic(String name) {
        return sns.createTopic(CreateTopicRequest.builder().name(name).build()).topicArn();
    }

    @Override
    public QueueRef createQueue(String name) {
        String url = sqs.createQueue(CreateQueueRequest.builder().queueName(name).build()).queueUrl();
        String arn = queueAttributes(url).get(QueueAttributeName.QUEUE_ARN);
        return new QueueRef(url, arn);
    }

    @Override
    public void subscribe(String topicId, QueueRef queue) {
        var request = ListSubscriptionsByTopicRequest.builder().topicArn(topicId).build();
        boolean subscribed = sns.listSubscriptionsByTopicPaginator(request).subscriptions().stream()
            .anyMatch(subscription -> queue.arn().equals(subscription.endpoint()));
        if (!subscribed) {
            sns.subscribe(SubscribeRequest.builder().topicArn(topicId).protocol("sqs").endpoint(queue.arn()).build());
        }
    }

    @Override
    public void allowPublish(String topicId, QueueRef queue) {
        String existing = queueAttributes(queue.url()).get(QueueAttributeName.POLICY);
        queuePolicy(existing, topicId, queue.arn()).ifPresent(policy ->
            sqs.setQueueAttributes(SetQueueAttributesRequest.builder()
                .queueUrl(queue.url())
                .attributes(Map.of(QueueAttributeName.POLICY, policy))
                .build()));
    }

    /** Policy letting {@code topicId} send to the queue, or empty when the queue already carries statements. */
    static Optional<String> queuePolicy(String existing, String topicId, String queueArn) {
        try {
            ObjectNode policy = existing == null || existing.isBlank()
                ? JSON.createObjectNode().put("Version", "2008-10-17")
                : (ObjectNode) JSON.readTree(existing);
            if (policy.has("Statement")) {
                return Optional.empty();
            }
            ObjectNode statement = policy.putArray("Statement").addObject();
            statement.put("Sid", "sqs-access");
            statement.put("Effect", "Allow");
            statement.putObject("Principal").put("AWS", "*");
            statement.put("Action", "SQS:SendMessage");
            statement.put("Resource", queueArn);
            statement.putObject("Condition").putObject("StringLike").put("aws:SourceArn", topicId);
            return Optional.of(JSON.writeValueAsString(policy));
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Queue policy of " + queueArn + " is not valid JSON", ex);
        }
    }

    @Override
    public List<NotificationMessage> receiveMessages(QueueRef queue, int waitSeconds, int maxCount) {
        var request = ReceiveMessageRequest.builder()
            .queueUrl(queue.url())
            .waitTimeSeconds(waitSeconds)
            .maxNumberOfMessages(maxCount)
            .build();
        try {
            return sqs.receiveMessage(request).messages().stream()
                .map(message -> new NotificationMessage(message.receiptHandle(), message.body()))
                .toList();
        } catch (AbortedException ex) {
            // the SDK clears the flag when it aborts on interrupt; restore it for the monitor loop
            Thread.currentThread().interrupt();
            return List.of();
        }
    }

    @Override
    public void deleteMessage(QueueRef queue, NotificationMessage message) {
        sqs.deleteMessage(DeleteMessageRequest.builder()
            .queueUrl(queue.url())
            .receiptHandle(message.receiptHandle())
            .build());
    }

    @Override
    public void deleteTopic(String topicId) {
        sns.deleteTopic(DeleteTopicRequest.builder().topicArn(topicId).build());
    }

    @Override
    public void deleteQueue(QueueRef queue) {
        sqs.deleteQueue(DeleteQueueRequest.builder().queueUrl(queue.url()).build());
    }

    private Map<QueueAttributeName, String> queueAttributes(String url) {
        return sqs.getQueueAttributes(GetQueueAttributesRequest.builder()
            .queueUrl(url)
            .attributeNames(QueueAttributeName.QUEUE_ARN, QueueAttributeName.POLICY)
            .build()).attributes();
    }
}
