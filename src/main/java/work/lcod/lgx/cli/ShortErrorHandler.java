package work.lcod.lgx.cli;

import java.io.PrintWriter;
import picocli.CommandLine;
import work.lcod.lgx.shared.LgxException;

/**
 * Prints {@code Error: <message>} for package failures. Anything else is reported
 * with its root cause and a hint to rerun with {@code -Dlgx.debug=true}.
 */
final class ShortErrorHandler implements CommandLine.IExecutionExceptionHandler {
    static final String DEBUG_PROPERTY = "lgx.debug";

    @Override
    public int handleExecutionException(
        Exception ex,
        CommandLine commandLine,
        CommandLine.ParseResult parseResult
    ) {
        PrintWriter err = commandLine.getErr();
        boolean debug = Boolean.getBoolean(DEBUG_PROPERTY);
        if (ex instanceof LgxException) {
            err.println(commandLine.getColorScheme().errorText("Error: " + ex.getMessage()));
        } else {
            Throwable cause = rootCause(ex);
            String detail = cause.getMessage() == null || cause.getMessage().isBlank()
                ? cause.getClass().getSimpleName()
                : cause.getClass().getSimpleName() + ": " + cause.getMessage();
            err.println(commandLine.getColorScheme().errorText("Error: unexpected failure (" + detail + ")"));
            if (!debug) {
                err.println("Run with -D" + DEBUG_PROPERTY + "=true for the stack trace.");
            }
        }
        if (debug) {
            ex.printStackTrace(err);
        }
        err.flush();
        return commandLine.getCommandSpec().exitCodeOnExecutionException();
    }

    static Throwable rootCause(Throwable error) {
        Throwable current = error;
        while (current.getCause() != null && current.getCause() != current) {
            current = current.getCause();
        }
        return current;
    }
}
