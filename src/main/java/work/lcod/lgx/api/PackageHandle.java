package work.lcod.lgx.api;

import java.nio.file.Path;
import work.lcod.lgx.core.LgxPackage;
import work.lcod.lgx.shared.ErrorKind;
import work.lcod.lgx.shared.LgxException;

/**
 * Owns one loaded {@link LgxPackage}. Closing releases it; every later use fails
 * with a {@link ErrorKind#STATE} error.
 */
public final class PackageHandle implements AutoCloseable {
    private final Path source;
    private LgxPackage pkg;

    PackageHandle(Path source, LgxPackage pkg) {
        this.source = source;
        this.pkg = pkg;
    }

    public Path source() {
        return source;
    }

    public boolean isClosed() {
        return pkg == null;
    }

    LgxPackage require() {
        if (pkg == null) {
            throw new LgxException(ErrorKind.STATE, "Package handle is closed");
        }
        return pkg;
    }

    @Override
    public void close() {
        pkg = null;
    }
}
