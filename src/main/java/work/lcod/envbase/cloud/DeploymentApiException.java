package work.lcod.envbase.cloud;

import work.lcod.envbase.shared.EnvBaseException;

/**
 * Failure reported by the orchestration API, tagged with the stack and the phase that failed.
 */
public class DeploymentApiException extends EnvBaseException {
    private final String stackName;
    private final String phase;

    public DeploymentApiException(String stackName, String phase, String message, Throwable cause) {
        this("deployment_failed", stackName, phase, message, cause);
    }

    protected DeploymentApiException(String code, String stackName, String phase, String message, Throwable cause) {
        super(code, "[" + phase + "] stack '" + stackName + "': " + message, cause);
        this.stackName = stackName;
        this.phase = phase;
    }

    public String stackName() {
        return stackName;
    }

    public String phase() {
        return phase;
    }
}
