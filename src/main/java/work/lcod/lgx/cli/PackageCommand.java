package work.lcod.lgx.cli;

import java.io.PrintWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;
import picocli.CommandLine;
import work.lcod.lgx.api.LgxSettings;
import work.lcod.lgx.core.LgxPackage;
import work.lcod.lgx.shared.LgxException;

/**
 * Shared plumbing for subcommands: settings, output streams and package loading.
 */
abstract class PackageCommand implements Callable<Integer> {
    @CommandLine.ParentCommand
    private LgxCommand root;

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @Override
    public final Integer call() {
        return run(root.settings());
    }

    protected abstract int run(LgxSettings settings);

    protected PrintWriter out() {
        return spec.commandLine().getOut();
    }

    protected PrintWriter err() {
        return spec.commandLine().getErr();
    }

    protected boolean confirm(String question) {
        return root.prompt().confirm(question, out());
    }

    protected static LgxPackage loadPackage(Path path) {
        if (!Files.exists(path)) {
            throw LgxException.usage("Package not found: " + path);
        }
        try {
            return LgxPackage.load(path);
        } catch (LgxException ex) {
            throw new LgxException(ex.kind(), "Failed to load package: " + ex.getMessage(), ex);
        }
    }
}
