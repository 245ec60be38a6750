package work.lcod.lgx.cli;

import java.nio.file.Files;
import java.nio.file.Path;
import picocli.CommandLine;
import work.lcod.lgx.api.LgxSettings;
import work.lcod.lgx.core.LgxPackage;
import work.lcod.lgx.shared.LgxException;
import work.lcod.lgx.shared.ValidationResult;

@CommandLine.Command(name = "verify", description = "Check a package for structural problems.", mixinStandardHelpOptions = true)
final class VerifyCommand extends PackageCommand {
    @CommandLine.Parameters(index = "0", paramLabel = "PACKAGE")
    private Path packagePath;

    @Override
    protected int run(LgxSettings settings) {
        if (!Files.exists(packagePath)) {
            throw LgxException.usage("Package not found: " + packagePath);
        }
        ValidationResult result = LgxPackage.verify(packagePath);
        for (String warning : result.warnings()) {
            out().println("Warning: " + warning);
        }
        if (!result.valid()) {
            err().println("Package validation failed:");
            for (String error : result.errors()) {
                err().println("  - " + error);
            }
            return 1;
        }
        out().println("Package is valid: " + packagePath);
        return 0;
    }
}
