package work.lcod.envbase.cli;

import picocli.CommandLine;
import work.lcod.envbase.shared.EnvBaseException;

/**
 * Keeps CLI failures short and focused on the root cause. {@code -Denvbase.debug=true} adds the stack trace.
 */
final class ShortErrorHandler implements CommandLine.IExecutionExceptionHandler {
    static final String DEBUG_PROPERTY = "envbase.debug";

    @Override
    public int handleExecutionException(
        Exception ex,
        CommandLine commandLine,
        CommandLine.ParseResult parseResult
    ) {
        report(ex, commandLine);
        return commandLine.getCommandSpec().exitCodeOnExecutionException();
    }

    static void report(Exception ex, CommandLine commandLine) {
        commandLine.getErr().println(commandLine.getColorScheme().errorText(describe(ex)));
        if (Boolean.getBoolean(DEBUG_PROPERTY)) {
            ex.printStackTrace(commandLine.getErr());
        }
    }

    static String describe(Exception ex) {
        String message = ex.getMessage();
        if (message == null || message.isBlank()) {
            message = ex.getClass().getSimpleName();
        }
        if (ex instanceof EnvBaseException coded) {
            return "[" + coded.code() + "] " + message;
        }
        return message;
    }
}
