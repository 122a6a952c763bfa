package work.lcod.envbase.deploy;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.envbase.cloud.NoStackUpdatesException;
import work.lcod.envbase.cloud.StackGateway;
import work.lcod.envbase.cloud.StackNotFoundException;
import work.lcod.envbase.cloud.StackRequest;

/**
 * Create-or-update of the root stack. An update is attempted first; only a stack-not-found answer falls back to a
 * create, issued with rollback disabled and a bounded timeout. Nothing is retried: any other update failure and
 * every create failure reach the caller as a {@link work.lcod.envbase.cloud.DeploymentApiException}.
 */
public final class DeploymentOrchestrator {
    public static final int CREATE_TIMEOUT_MINUTES = 60;
    public static final List<String> CAPABILITIES = List.of("CAPABILITY_IAM");

    private static final Logger log = LoggerFactory.getLogger(DeploymentOrchestrator.class);

    private final StackGateway gateway;
    private final TemplateStore templateStore;

    public DeploymentOrchestrator(StackGateway gateway, TemplateStore templateStore) {
        this.gateway = Objects.requireNonNull(gateway, "gateway");
        this.templateStore = Objects.requireNonNull(templateStore, "templateStore");
    }

    public DeployOutcome ensureDeployed(
        String stackName,
        Map<String, String> parameters,
        Optional<NotificationSession> channel
    ) {
        var topics = channel.map(session -> List.of(session.topicId())).orElse(List.of());
        var request = new StackRequest(
            stackName,
            templateStore.readBody(),
            parameters,
            topics,
            CAPABILITIES,
            false,
            Optional.empty()
        );
        try {
            log.info("Updating stack '{}' ...", stackName);
            gateway.updateStack(request);
            log.info("Update of '{}' accepted", stackName);
            return DeployOutcome.UPDATED;
        } catch (NoStackUpdatesException ex) {
            log.info("Stack '{}' is already up to date", stackName);
            return DeployOutcome.UNCHANGED;
        } catch (StackNotFoundException ex) {
            log.info("Stack '{}' does not exist yet, creating it", stackName);
        }
        gateway.createStack(request.forCreate(CREATE_TIMEOUT_MINUTES));
        log.info("Created stack '{}'", stackName);
        return DeployOutcome.CREATED;
    }

    public void delete(String stackName) {
        log.info("Deleting stack '{}' ...", stackName);
        gateway.deleteStack(stackName);
        log.info("Delete of '{}' requested", stackName);
    }
}
