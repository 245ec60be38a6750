package work.lcod.lgx.cli;

import java.nio.file.Files;
import java.nio.file.Path;
import picocli.CommandLine;
import work.lcod.lgx.api.LgxSettings;
import work.lcod.lgx.core.LgxPackage;
import work.lcod.lgx.shared.LgxException;
import work.lcod.lgx.shared.PathNormalizer;

@CommandLine.Command(
    name = "create",
    description = "Create an empty package named <name>.lgx.",
    mixinStandardHelpOptions = true
)
final class CreateCommand extends PackageCommand {
    @CommandLine.Parameters(index = "0", paramLabel = "NAME", description = "Package name (stored lowercased).")
    private String name;

    @CommandLine.Option(
        names = {"-o", "--output"},
        paramLabel = "DIR",
        description = "Directory to write the package to (default: current directory).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private Path outputDir;

    @Override
    protected int run(LgxSettings settings) {
        if (name.isBlank() || name.indexOf('/') >= 0 || name.indexOf('\\') >= 0) {
            throw LgxException.usage("Invalid package name: " + name);
        }
        Path directory = outputDir != null ? outputDir : Path.of(".");
        Path file = directory.resolve(PathNormalizer.toLowercase(name) + ".lgx");
        if (Files.exists(file)) {
            throw LgxException.usage("File already exists: " + file);
        }
        LgxPackage.create(file, name);
        out().println("Created package: " + file);
        return 0;
    }
}
