package work.lcod.envbase.cli;

import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Function;
import picocli.CommandLine;
import work.lcod.envbase.api.EnvironmentBase;
import work.lcod.envbase.api.EnvironmentOptions;

/**
 * Entry point for the {@code java -jar} distribution. Projects with their own {@link EnvironmentBase} subclass call
 * {@link #run(String[], Function)} from their own {@code main}.
 */
public final class Main {
    static final long SHUTDOWN_GRACE_MILLIS = 30_000L;

    private static final AtomicBoolean SHUTTING_DOWN = new AtomicBoolean();

    private Main() {}

    public static void main(String[] args) {
        int exitCode = run(args, EnvironmentBase::new);
        if (!SHUTTING_DOWN.get()) {
            System.exit(exitCode);
        }
    }

    public static int run(String[] args, Function<EnvironmentOptions, ? extends EnvironmentBase> environmentFactory) {
        // Ctrl-C interrupts the action thread and waits for it so notification channels get torn down
        Thread control = Thread.currentThread();
        var finished = new AtomicBoolean();
        Thread hook = new Thread(() -> {
            SHUTTING_DOWN.set(true);
            if (finished.get()) {
                return;
            }
            control.interrupt();
            try {
                control.join(SHUTDOWN_GRACE_MILLIS);
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
            }
        }, "envbase-shutdown");
        Runtime.getRuntime().addShutdownHook(hook);
        try {
            return commandLine(environmentFactory).execute(args);
        } finally {
            finished.set(true);
            if (!SHUTTING_DOWN.get()) {
                Runtime.getRuntime().removeShutdownHook(hook);
            }
        }
    }

    static CommandLine commandLine(Function<EnvironmentOptions, ? extends EnvironmentBase> environmentFactory) {
        return new CommandLine(new EnvBaseCommand(environmentFactory))
            .setExecutionExceptionHandler(new ShortErrorHandler());
    }
}
