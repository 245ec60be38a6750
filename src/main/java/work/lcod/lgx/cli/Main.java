package work.lcod.lgx.cli;

import picocli.CommandLine;

/**
 * Entry point for the {@code java -jar} distribution.
 */
public final class Main {
    private Main() {}

    public static void main(String[] args) {
        int exitCode = commandLine(ConfirmationPrompt.console(System.in)).execute(args);
        System.exit(exitCode);
    }

    static CommandLine commandLine(ConfirmationPrompt prompt) {
        return new CommandLine(new LgxCommand(prompt))
            .setExecutionExceptionHandler(new ShortErrorHandler());
    }
}
