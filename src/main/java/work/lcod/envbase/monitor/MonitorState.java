package work.lcod.envbase.monitor;

public enum MonitorState {
    POLLING(false),
    /** At least one handler has been satisfied and left the chain. */
    DRAINING(false),
    /** Every handler was satisfied before the stack finished; a normal exit. */
    EXHAUSTED(true),
    TERMINATED(true),
    TIMED_OUT(true),
    ABORTED(true);

    private final boolean exit;

    MonitorState(boolean exit) {
        this.exit = exit;
    }

    public boolean isExit() {
        return exit;
    }
}
