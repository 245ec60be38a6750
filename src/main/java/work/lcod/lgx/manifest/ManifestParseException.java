package work.lcod.lgx.manifest;

import java.util.Optional;
import work.lcod.lgx.shared.ErrorKind;
import work.lcod.lgx.shared.LgxException;

/**
 * {@code manifest.json} could not be turned into a {@link Manifest}.
 */
public final class ManifestParseException extends LgxException {
    private final String field;

    public ManifestParseException(String message) {
        this(message, null, null);
    }

    public ManifestParseException(String message, String field) {
        this(message, field, null);
    }

    public ManifestParseException(String message, String field, Throwable cause) {
        super(ErrorKind.FORMAT, message, cause);
        this.field = field;
    }

    /**
     * Name of the offending top-level field, when the failure is field-specific.
     */
    public Optional<String> field() {
        return Optional.ofNullable(field);
    }
}
