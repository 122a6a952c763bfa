package work.lcod.envbase.cloud;

/**
 * The orchestration API does not know the stack. The only update failure that falls back to a create.
 */
public final class StackNotFoundException extends DeploymentApiException {
    public StackNotFoundException(String stackName, String phase, String message, Throwable cause) {
        super("stack_not_found", stackName, phase, message, cause);
    }
}
