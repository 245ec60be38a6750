package work.lcod.lgx.cli;

import java.nio.file.Path;
import picocli.CommandLine;
import work.lcod.lgx.api.LgxSettings;
import work.lcod.lgx.core.LgxPackage;
import work.lcod.lgx.shared.LgxException;
import work.lcod.lgx.shared.PathNormalizer;

@CommandLine.Command(name = "remove", description = "Remove a variant from a package.", mixinStandardHelpOptions = true)
final class RemoveCommand extends PackageCommand {
    @CommandLine.Parameters(index = "0", paramLabel = "PACKAGE")
    private Path packagePath;

    @CommandLine.Option(names = {"-v", "--variant"}, required = true)
    private String variant;

    @CommandLine.Option(names = {"-y", "--yes"}, description = "Do not ask for confirmation.")
    private boolean yes;

    @Override
    protected int run(LgxSettings settings) {
        LgxPackage pkg = loadPackage(packagePath);
        String lowered = PathNormalizer.toLowercase(variant);
        if (!pkg.hasVariant(lowered)) {
            throw LgxException.usage("Variant not found: " + lowered);
        }
        if (!yes && !settings.assumeYes() && !confirm("Remove variant '" + lowered + "'?")) {
            out().println("Aborted.");
            return 1;
        }
        pkg.removeVariant(lowered);
        pkg.save(packagePath);
        out().println("Removed variant '" + lowered + "' from " + packagePath);
        return 0;
    }
}
