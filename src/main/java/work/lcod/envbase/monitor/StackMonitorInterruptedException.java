package work.lcod.envbase.monitor;

import work.lcod.envbase.shared.EnvBaseException;

public final class StackMonitorInterruptedException extends EnvBaseException {
    private final String stackName;

    public StackMonitorInterruptedException(String stackName) {
        super("monitor_interrupted", "Interrupted while watching stack '" + stackName + "'");
        this.stackName = stackName;
    }

    public String stackName() {
        return stackName;
    }
}
