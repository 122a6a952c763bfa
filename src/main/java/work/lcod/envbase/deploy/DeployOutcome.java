package work.lcod.envbase.deploy;

public enum DeployOutcome {
    UPDATED,
    CREATED,
    /** The stack already matched; the API will publish no events. */
    UNCHANGED
}
