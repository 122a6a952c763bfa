package work.lcod.envbase.cloud;

/**
 * The cloud collaborators one environment works with.
 */
public interface CloudServices extends AutoCloseable {
    StackGateway stacks();

    NotificationChannelProvider notifications();

    ObjectStorage storage();

    @Override
    default void close() {}
}
