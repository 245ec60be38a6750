package work.lcod.lgx.cli;

import java.nio.file.Path;
import picocli.CommandLine;
import work.lcod.lgx.api.LgxSettings;

@CommandLine.Command(name = "publish", description = "Publish a package (currently does nothing).", mixinStandardHelpOptions = true)
final class PublishCommand extends PackageCommand {
    @CommandLine.Parameters(index = "0", paramLabel = "PACKAGE")
    private Path packagePath;

    @Override
    protected int run(LgxSettings settings) {
        out().println("Publish: no-op");
        return 0;
    }
}
