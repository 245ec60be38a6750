package work.lcod.lgx.cli;

import java.nio.file.Path;
import java.util.SortedSet;
import picocli.CommandLine;
import work.lcod.lgx.api.LgxSettings;
import work.lcod.lgx.core.LgxPackage;
import work.lcod.lgx.shared.LgxException;
import work.lcod.lgx.shared.PathNormalizer;

@CommandLine.Command(
    name = "extract",
    description = "Extract one variant, or all of them, to <output>/<variant>/.",
    mixinStandardHelpOptions = true
)
final class ExtractCommand extends PackageCommand {
    @CommandLine.Parameters(index = "0", paramLabel = "PACKAGE")
    private Path packagePath;

    @CommandLine.Option(names = {"-v", "--variant"}, defaultValue = CommandLine.Option.NULL_VALUE)
    private String variant;

    @CommandLine.Option(
        names = {"-o", "--output"},
        paramLabel = "DIR",
        description = "Output directory (default: current directory).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private Path outputDir;

    @Override
    protected int run(LgxSettings settings) {
        LgxPackage pkg = loadPackage(packagePath);
        Path target = outputDir != null ? outputDir : settings.extractOutput();

        if (variant == null) {
            SortedSet<String> variants = pkg.variants();
            if (variants.isEmpty()) {
                out().println("No variants to extract");
                return 0;
            }
            pkg.extractAll(target);
            out().println("Extracted " + variants.size() + " variant(s) to " + target);
            return 0;
        }

        String lowered = PathNormalizer.toLowercase(variant);
        if (!pkg.hasVariant(lowered)) {
            throw LgxException.usage("Variant not found: " + variant);
        }
        pkg.extractVariant(lowered, target);
        out().println("Extracted variant '" + lowered + "' to " + target);
        return 0;
    }
}
