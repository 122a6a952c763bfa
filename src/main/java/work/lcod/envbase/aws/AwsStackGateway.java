package work.lcod.envbase.aws;

import java.util.ArrayList;
import java.util.Locale;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.cloudformation.CloudFormationClient;
import software.amazon.awssdk.services.cloudformation.model.CloudFormationException;
import software.amazon.awssdk.services.cloudformation.model.CreateStackRequest;
import software.amazon.awssdk.services.cloudformation.model.DeleteStackRequest;
import software.amazon.awssdk.services.cloudformation.model.Parameter;
import software.amazon.awssdk.services.cloudformation.model.UpdateStackRequest;
import work.lcod.envbase.cloud.DeploymentApiException;
import work.lcod.envbase.cloud.NoStackUpdatesException;
import work.lcod.envbase.cloud.StackGateway;
import work.lcod.envbase.cloud.StackNotFoundException;
import work.lcod.envbase.cloud.StackRequest;

/**
 * {@link StackGateway} on the CloudFormation API. CloudFormation reports a missing stack on update as a
 * {@code ValidationError} whose message says the stack "does not exist"; that is the only failure translated to
 * {@link StackNotFoundException}.
 */
public final class AwsStackGateway implements StackGateway {
    private static final String VALIDATION_ERROR = "ValidationError";

    private final CloudFormationClient client;

    public AwsStackGateway(CloudFormationClient client) {
        this.client = client;
    }

    @Override
    public void createStack(StackRequest request) {
        var builder = CreateStackRequest.builder()
            .stackName(request.stackName())
            .templateBody(request.templateBody())
            .parameters(parameters(request))
            .notificationARNs(request.notificationTopics())
            .capabilitiesWithStrings(request.capabilities())
            .disableRollback(request.disableRollback());
        request.timeoutInMinutes().ifPresent(builder::timeoutInMinutes);
        try {
            client.createStack(builder.build());
        } catch (SdkException ex) {
            throw new DeploymentApiException(request.stackName(), "create", ex.getMessage(), ex);
        }
    }

    @Override
    public void updateStack(StackRequest request) {
        var update = UpdateStackRequest.builder()
            .stackName(request.stackName())
            .templateBody(request.templateBody())
            .parameters(parameters(request))
            .notificationARNs(request.notificationTopics())
            .capabilitiesWithStrings(request.capabilities())
            .build();
        try {
            client.updateStack(update);
        } catch (CloudFormationException ex) {
            if (isStackMissing(ex)) {
                throw new StackNotFoundException(request.stackName(), "update", errorMessage(ex), ex);
            }
            if (isNoUpdate(ex)) {
                throw new NoStackUpdatesException(request.stackName(), errorMessage(ex), ex);
            }
            throw new DeploymentApiException(request.stackName(), "update", errorMessage(ex), ex);
        } catch (SdkException ex) {
            throw new DeploymentApiException(request.stackName(), "update", ex.getMessage(), ex);
        }
    }

    @Override
    public void deleteStack(String stackName) {
        try {
            client.deleteStack(DeleteStackRequest.builder().stackName(stackName).build());
        } catch (SdkException ex) {
            throw new DeploymentApiException(stackName, "delete", ex.getMessage(), ex);
        }
    }

    static boolean isStackMissing(CloudFormationException ex) {
        return VALIDATION_ERROR.equals(errorCode(ex)) && errorMessage(ex).toLowerCase(Locale.ROOT).contains("does not exist");
    }

    static boolean isNoUpdate(CloudFormationException ex) {
        return VALIDATION_ERROR.equals(errorCode(ex))
            && errorMessage(ex).toLowerCase(Locale.ROOT).contains("no updates are to be performed");
    }

    private static String errorCode(CloudFormationException ex) {
        return ex.awsErrorDetails() == null ? null : ex.awsErrorDetails().errorCode();
    }

    private static String errorMessage(CloudFormationException ex) {
        if (ex.awsErrorDetails() != null && ex.awsErrorDetails().errorMessage() != null) {
            return ex.awsErrorDetails().errorMessage();
        }
        return ex.getMessage() == null ? "" : ex.getMessage();
    }

    private static ArrayList<Parameter> parameters(StackRequest request) {
        var parameters = new ArrayList<Parameter>();
        request.parameters().forEach((key, value) ->
            parameters.add(Parameter.builder().parameterKey(key).parameterValue(value).build()));
        return parameters;
    }
}
