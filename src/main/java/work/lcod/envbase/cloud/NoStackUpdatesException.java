package work.lcod.envbase.cloud;

/**
 * Update rejected because template and parameters are identical to the deployed stack.
 */
public final class NoStackUpdatesException extends DeploymentApiException {
    public NoStackUpdatesException(String stackName, String message, Throwable cause) {
        super("stack_unchanged", stackName, "update", message, cause);
    }
}
