package work.lcod.lgx.api;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;
import org.tomlj.Toml;
import org.tomlj.TomlInvalidTypeException;
import org.tomlj.TomlParseError;
import org.tomlj.TomlParseResult;
import work.lcod.lgx.shared.LgxException;

/**
 * User defaults read from a TOML file ({@code [prompt] assume_yes}, {@code [extract] output},
 * {@code [log] level}). Command-line options always win over these values.
 */
public record LgxSettings(boolean assumeYes, Path extractOutput, LogLevel logLevel, Optional<Path> source) {
    public static final String ENV_VARIABLE = "LGX_CONFIG";
    static final String DEFAULT_FILE = ".lgx/config.toml";

    public LgxSettings {
        Objects.requireNonNull(extractOutput, "extractOutput");
        Objects.requireNonNull(logLevel, "logLevel");
        Objects.requireNonNull(source, "source");
    }

    public static LgxSettings defaults() {
        return builder().build();
    }

    /**
     * Looks for settings in {@code explicit}, then {@code $LGX_CONFIG}, then
     * {@code ~/.lgx/config.toml}. Only the home file may be absent.
     */
    public static LgxSettings load(Path explicit) {
        return resolve(explicit, System.getenv(ENV_VARIABLE), Path.of(System.getProperty("user.home")));
    }

    static LgxSettings resolve(Path explicit, String environmentValue, Path home) {
        if (explicit != null) {
            return fromFile(requireFile(explicit));
        }
        if (environmentValue != null && !environmentValue.isBlank()) {
            return fromFile(requireFile(Path.of(environmentValue)));
        }
        Path fallback = home.resolve(DEFAULT_FILE);
        return Files.isRegularFile(fallback) ? fromFile(fallback) : defaults();
    }

    public static LgxSettings fromFile(Path file) {
        TomlParseResult toml;
        try {
            toml = Toml.parse(file);
        } catch (IOException ex) {
            throw LgxException.io("Cannot read config file: " + file, ex);
        }
        if (toml.hasErrors()) {
            TomlParseError first = toml.errors().get(0);
            throw LgxException.usage("Invalid config file " + file + ": " + first.toString());
        }

        Builder builder = builder().source(file);
        try {
            Boolean assumeYes = toml.getBoolean("prompt.assume_yes");
            if (assumeYes != null) {
                builder.assumeYes(assumeYes);
            }
            String output = toml.getString("extract.output");
            if (output != null && !output.isBlank()) {
                builder.extractOutput(Path.of(output));
            }
            String level = toml.getString("log.level");
            if (level != null) {
                builder.logLevel(LogLevel.from(level));
            }
        } catch (TomlInvalidTypeException | IllegalArgumentException ex) {
            throw LgxException.usage("Invalid config file " + file + ": " + ex.getMessage());
        }
        return builder.build();
    }

    private static Path requireFile(Path file) {
        if (!Files.isRegularFile(file)) {
            throw LgxException.usage("Config file not found: " + file);
        }
        return file;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private boolean assumeYes;
        private Path extractOutput = Path.of(".");
        private LogLevel logLevel = LogLevel.WARN;
        private Optional<Path> source = Optional.empty();

        public Builder assumeYes(boolean assumeYes) {
            this.assumeYes = assumeYes;
            return this;
        }

        public Builder extractOutput(Path extractOutput) {
            this.extractOutput = extractOutput;
            return this;
        }

        public Builder logLevel(LogLevel logLevel) {
            this.logLevel = logLevel;
            return this;
        }

        public Builder source(Path source) {
            this.source = Optional.ofNullable(source);
            return this;
        }

        public LgxSettings build() {
            return new LgxSettings(assumeYes, extractOutput, logLevel, source);
        }
    }
}
