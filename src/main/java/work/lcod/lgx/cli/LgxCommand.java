package work.lcod.lgx.cli;

import java.nio.file.Path;
import java.util.concurrent.Callable;
import picocli.CommandLine;
import work.lcod.lgx.api.LgxSettings;
import work.lcod.lgx.api.LogLevel;

@CommandLine.Command(
    name = "lgx",
    description = "Create, inspect and unpack deterministic .lgx packages.",
    mixinStandardHelpOptions = true,
    versionProvider = VersionProvider.class,
    subcommands = {
        CreateCommand.class,
        AddCommand.class,
        RemoveCommand.class,
        ExtractCommand.class,
        VerifyCommand.class,
        SignCommand.class,
        PublishCommand.class
    }
)
final class LgxCommand implements Callable<Integer> {
    static final String LOG_LEVEL_PROPERTY = "org.slf4j.simpleLogger.defaultLogLevel";

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @CommandLine.Option(
        names = "--config",
        paramLabel = "FILE",
        description = "Settings file (default: $LGX_CONFIG, then ~/.lgx/config.toml).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private Path configFile;

    @CommandLine.Option(
        names = "--log-level",
        description = "Diagnostic threshold on stderr (trace|debug|info|warn|error|off).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private String logLevelRaw;

    private final ConfirmationPrompt prompt;
    private LgxSettings settings;

    LgxCommand(ConfirmationPrompt prompt) {
        this.prompt = prompt;
    }

    @Override
    public Integer call() {
        throw new CommandLine.ParameterException(spec.commandLine(), "Missing required subcommand");
    }

    /**
     * Settings for this invocation; the first call also fixes the log level, which
     * must happen before any logger is created.
     */
    LgxSettings settings() {
        if (settings == null) {
            settings = LgxSettings.load(configFile);
            applyLogLevel(settings);
        }
        return settings;
    }

    ConfirmationPrompt prompt() {
        return prompt;
    }

    private void applyLogLevel(LgxSettings loaded) {
        if (logLevelRaw != null && !logLevelRaw.isBlank()) {
            System.setProperty(LOG_LEVEL_PROPERTY, LogLevel.from(logLevelRaw).simpleLoggerName());
        } else if (System.getProperty(LOG_LEVEL_PROPERTY) == null) {
            System.setProperty(LOG_LEVEL_PROPERTY, loaded.logLevel().simpleLoggerName());
        }
    }
}
