package work.lcod.lgx.cli;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.util.Locale;
import work.lcod.lgx.shared.LgxException;

/**
 * Yes/no question asked before destructive changes. The answer defaults to no.
 */
@FunctionalInterface
interface ConfirmationPrompt {
    boolean confirm(String question, PrintWriter out);

    static ConfirmationPrompt console(InputStream in) {
        BufferedReader reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8));
        return (question, out) -> {
            out.print(question + " [y/N]: ");
            out.flush();
            try {
                return isYes(reader.readLine());
            } catch (IOException ex) {
                throw LgxException.io("Cannot read confirmation", ex);
            }
        };
    }

    /**
     * End of input and blank answers count as no.
     */
    static boolean isYes(String answer) {
        if (answer == null) {
            return false;
        }
        String trimmed = answer.trim().toLowerCase(Locale.ROOT);
        return !trimmed.isEmpty() && trimmed.charAt(0) == 'y';
    }
}
