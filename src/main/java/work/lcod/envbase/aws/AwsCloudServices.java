package work.lcod.envbase.aws;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.cloudformation.CloudFormationClient;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.sns.SnsClient;
import software.amazon.awssdk.services.sqs.SqsClient;
import software.amazon.awssdk.utils.SdkAutoCloseable;
import work.lcod.envbase.cloud.CloudServices;
import work.lcod.envbase.cloud.NotificationChannelProvider;
import work.lcod.envbase.cloud.ObjectStorage;
import work.lcod.envbase.cloud.StackGateway;
import work.lcod.envbase.config.ConfigTrees;

/**
 * AWS clients for one region, taken from {@code aws.region_name}. Credentials come from the SDK default chain.
 */
public final class AwsCloudServices implements CloudServices {
    private final List<SdkAutoCloseable> clients;
    private final StackGateway stacks;
    private final NotificationChannelProvider notifications;
    private final ObjectStorage storage;

    AwsCloudServices(CloudFormationClient cloudFormation, SnsClient sns, SqsClient sqs, S3Client s3) {
        this.clients = List.of(cloudFormation, sns, sqs, s3);
        this.stacks = new AwsStackGateway(cloudFormation);
        this.notifications = new AwsNotificationChannelProvider(sns, sqs);
        this.storage = new AwsObjectStorage(s3);
    }

    public static CloudServices fromConfig(Map<String, Object> config) {
        String region = ConfigTrees.string(ConfigTrees.section(config, "aws"), "region_name", "us-east-1");
        return forRegion(Region.of(region));
    }

    /** Builds the four clients; if one cannot be built, those already built are closed. */
    public static AwsCloudServices forRegion(Region region) {
        var built = new ArrayList<SdkAutoCloseable>();
        try {
            var cloudFormation = track(built, CloudFormationClient.builder().region(region).build());
            var sns = track(built, SnsClient.builder().region(region).build());
            var sqs = track(built, SqsClient.builder().region(region).build());
            var s3 = track(built, S3Client.builder().region(region).build());
            return new AwsCloudServices(cloudFormation, sns, sqs, s3);
        } catch (RuntimeException ex) {
            RuntimeException cleanup = closeAll(built);
            if (cleanup != null) {
                ex.addSuppressed(cleanup);
            }
            throw ex;
        }
    }

    @Override
    public StackGateway stacks() {
        return stacks;
    }

    @Override
    public NotificationChannelProvider notifications() {
        return notifications;
    }

    @Override
    public ObjectStorage storage() {
        return storage;
    }

    /** Closes every client; the first failure is rethrown once all of them were attempted. */
    @Override
    public void close() {
        RuntimeException failure = closeAll(clients);
        if (failure != null) {
            throw failure;
        }
    }

    private static <T extends SdkAutoCloseable> T track(List<SdkAutoCloseable> built, T client) {
        built.add(client);
        return client;
    }

    static RuntimeException closeAll(List<SdkAutoCloseable> clients) {
        RuntimeException failure = null;
        for (var client : clients) {
            try {
                client.close();
            } catch (RuntimeException ex) {
                if (failure == null) {
                    failure = ex;
                } else {
                    failure.addSuppressed(ex);
                }
            }
        }
        return failure;
    }
}
