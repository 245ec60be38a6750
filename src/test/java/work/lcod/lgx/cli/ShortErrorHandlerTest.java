package work.lcod.lgx.cli;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import org.junit.jupiter.api.Test;
import picocli.CommandLine;
import work.lcod.lgx.shared.LgxException;

class ShortErrorHandlerTest {
    @Test
    void packageFailuresPrintOnlyTheMessage() {
        StringWriter err = new StringWriter();
        int code = handle(LgxException.usage("Variant not found: ios"), err);

        assertEquals(1, code);
        assertEquals("Error: Variant not found: ios", err.toString().strip());
    }

    @Test
    void unexpectedFailuresNameTheRootCause() {
        StringWriter err = new StringWriter();
        handle(new UncheckedIOException("write failed", new IOException("No space left on device")), err);

        String text = err.toString();
        assertTrue(text.contains("Error: unexpected failure (IOException: No space left on device)"));
        assertTrue(text.contains("-Dlgx.debug=true"));
        assertFalse(text.contains("\tat "));
    }

    @Test
    void rootCauseStopsAtTheInnermostError() {
        IOException inner = new IOException("inner");
        assertSame(inner, ShortErrorHandler.rootCause(new IllegalStateException(new RuntimeException(inner))));
    }

    private static int handle(Exception ex, StringWriter err) {
        CommandLine commandLine = new CommandLine(new LgxCommand((question, out) -> false));
        commandLine.setErr(new PrintWriter(err, true));
        commandLine.setColorScheme(CommandLine.Help.defaultColorScheme(CommandLine.Help.Ansi.OFF));
        return new ShortErrorHandler().handleExecutionException(ex, commandLine, null);
    }
}
