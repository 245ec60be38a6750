package work.lcod.lgx.cli;

import java.nio.file.Files;
import java.nio.file.Path;
import picocli.CommandLine;
import work.lcod.lgx.api.LgxSettings;
import work.lcod.lgx.core.LgxPackage;
import work.lcod.lgx.core.VariantName;
import work.lcod.lgx.shared.LgxException;

@CommandLine.Command(
    name = "add",
    description = {
        "Add a variant to a package.",
        "An existing variant is replaced completely; its old files are not kept."
    },
    mixinStandardHelpOptions = true
)
final class AddCommand extends PackageCommand {
    @CommandLine.Parameters(index = "0", paramLabel = "PACKAGE")
    private Path packagePath;

    @CommandLine.Option(names = {"-v", "--variant"}, required = true, description = "Variant name (stored lowercased).")
    private String variant;

    @CommandLine.Option(names = {"-f", "--files"}, required = true, paramLabel = "PATH", description = "File or directory to add.")
    private Path files;

    @CommandLine.Option(
        names = {"-m", "--main"},
        paramLabel = "PATH",
        description = "Entry point inside the variant; required for directories.",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private String main;

    @CommandLine.Option(names = {"-y", "--yes"}, description = "Do not ask for confirmation.")
    private boolean yes;

    @Override
    protected int run(LgxSettings settings) {
        LgxPackage pkg = loadPackage(packagePath);
        if (!Files.exists(files)) {
            throw LgxException.usage("Path not found: " + files);
        }
        VariantName name = VariantName.of(variant);

        String effectiveMain = main;
        if (effectiveMain == null) {
            if (Files.isDirectory(files)) {
                throw LgxException.usage("--main is required when --files is a directory");
            }
            effectiveMain = files.getFileName().toString();
        }

        boolean exists = pkg.hasVariant(name.value());
        boolean mainChanges = pkg.wouldMainChange(name.value(), effectiveMain);
        if (!yes && !settings.assumeYes() && (exists || mainChanges)) {
            String question;
            if (exists && mainChanges) {
                question = "Variant '" + name + "' exists and main would change. Replace?";
            } else if (exists) {
                question = "Variant '" + name + "' exists and will be replaced. Continue?";
            } else {
                question = "main[" + name + "] would change. Continue?";
            }
            if (!confirm(question)) {
                out().println("Aborted.");
                return 1;
            }
        }

        pkg.addVariant(name.value(), files, main);
        pkg.save(packagePath);
        if (exists) {
            out().println("Replaced variant '" + name + "' in " + packagePath);
        } else {
            out().println("Added variant '" + name + "' to " + packagePath);
        }
        return 0;
    }
}
