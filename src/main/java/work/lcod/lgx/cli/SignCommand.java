package work.lcod.lgx.cli;

import java.nio.file.Path;
import picocli.CommandLine;
import work.lcod.lgx.api.LgxSettings;
import work.lcod.lgx.shared.LgxException;

@CommandLine.Command(name = "sign", description = "Sign a package (not available yet).", mixinStandardHelpOptions = true)
final class SignCommand extends PackageCommand {
    @CommandLine.Parameters(index = "0", paramLabel = "PACKAGE")
    private Path packagePath;

    @Override
    protected int run(LgxSettings settings) {
        throw LgxException.usage("Sign command not implemented");
    }
}
