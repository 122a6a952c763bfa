package work.lcod.envbase.cloud;

/**
 * Orchestration API calls used by envbase.
 */
public interface StackGateway {
    void createStack(StackRequest request);

    /**
     * @throws StackNotFoundException when the stack does not exist yet
     * @throws NoStackUpdatesException when the stack already matches the request
     * @throws DeploymentApiException for any other failure
     */
    void updateStack(StackRequest request);

    void deleteStack(String stackName);
}
