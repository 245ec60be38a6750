package work.lcod.lgx.api;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;
import work.lcod.lgx.core.LgxPackage;
import work.lcod.lgx.shared.ErrorKind;
import work.lcod.lgx.shared.LgxException;
import work.lcod.lgx.shared.ValidationResult;

/**
 * Embedding entry point. Mutating calls report through {@link OperationResult}
 * instead of throwing; value getters throw {@link IllegalStateException} when the
 * handle is {@code null} or closed.
 */
public final class LgxLibrary {
    private static final String DEVELOPMENT_VERSION = "development";

    /**
     * Loaded handle, or the reason loading failed.
     */
    public record LoadResult(Optional<PackageHandle> handle, OperationResult result) {}

    public static String version() {
        String implementationVersion = LgxLibrary.class.getPackage().getImplementationVersion();
        return implementationVersion != null ? implementationVersion : DEVELOPMENT_VERSION;
    }

    public OperationResult create(Path path, String name) {
        try {
            LgxPackage.create(path, name);
            return OperationResult.success("Created package: " + path);
        } catch (LgxException ex) {
            return OperationResult.failure(ex);
        }
    }

    public Optional<PackageHandle> load(Path path) {
        return loadResult(path).handle();
    }

    public LoadResult loadResult(Path path) {
        try {
            PackageHandle handle = new PackageHandle(path, LgxPackage.load(path));
            return new LoadResult(Optional.of(handle), OperationResult.success());
        } catch (LgxException ex) {
            return new LoadResult(Optional.empty(), OperationResult.failure(ex));
        }
    }

    public OperationResult save(PackageHandle handle, Path path) {
        return apply(handle, pkg -> pkg.save(path));
    }

    /**
     * @param main path of the entry point inside the variant, or {@code null} to use the
     *             file name of a single-file source
     */
    public OperationResult addVariant(PackageHandle handle, String variant, Path files, String main) {
        return apply(handle, pkg -> pkg.addVariant(variant, files, main));
    }

    public OperationResult removeVariant(PackageHandle handle, String variant) {
        return apply(handle, pkg -> pkg.removeVariant(variant));
    }

    /**
     * Extracts {@code variant}, or every variant when it is {@code null}.
     */
    public OperationResult extract(PackageHandle handle, String variant, Path outputDir) {
        return apply(handle, pkg -> {
            if (variant == null) {
                pkg.extractAll(outputDir);
            } else {
                pkg.extractVariant(variant, outputDir);
            }
        });
    }

    public ValidationResult verify(Path path) {
        return LgxPackage.verify(path);
    }

    public boolean hasVariant(PackageHandle handle, String variant) {
        return open(handle).hasVariant(variant);
    }

    public List<String> variants(PackageHandle handle) {
        return List.copyOf(open(handle).variants());
    }

    public String name(PackageHandle handle) {
        return open(handle).manifest().name();
    }

    public String version(PackageHandle handle) {
        return open(handle).manifest().version();
    }

    public OperationResult setVersion(PackageHandle handle, String version) {
        if (version == null || version.isEmpty()) {
            return OperationResult.failure(ErrorKind.USAGE, "Version cannot be empty");
        }
        return apply(handle, pkg -> pkg.manifest().setVersion(version));
    }

    public String description(PackageHandle handle) {
        return open(handle).manifest().description();
    }

    public OperationResult setDescription(PackageHandle handle, String description) {
        if (description == null) {
            return OperationResult.failure(ErrorKind.USAGE, "Description cannot be null");
        }
        return apply(handle, pkg -> pkg.manifest().setDescription(description));
    }

    public String icon(PackageHandle handle) {
        return open(handle).manifest().icon();
    }

    public OperationResult setIcon(PackageHandle handle, String icon) {
        if (icon == null) {
            return OperationResult.failure(ErrorKind.USAGE, "Icon cannot be null");
        }
        return apply(handle, pkg -> pkg.manifest().setIcon(icon));
    }

    public String manifestJson(PackageHandle handle) {
        return open(handle).manifest().toJson();
    }

    private static OperationResult apply(PackageHandle handle, Consumer<LgxPackage> action) {
        if (handle == null) {
            return OperationResult.failure(ErrorKind.STATE, "No package handle");
        }
        try {
            action.accept(handle.require());
            return OperationResult.success();
        } catch (LgxException ex) {
            return OperationResult.failure(ex);
        }
    }

    private static LgxPackage open(PackageHandle handle) {
        if (handle == null) {
            throw new IllegalStateException("No package handle");
        }
        if (handle.isClosed()) {
            throw new IllegalStateException("Package handle is closed");
        }
        return handle.require();
    }
}
