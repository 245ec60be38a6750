package work.lcod.lgx.archive;

import java.util.OptionalLong;
import work.lcod.lgx.shared.ErrorKind;
import work.lcod.lgx.shared.LgxException;

/**
 * Malformed or unencodable tar/gzip data.
 */
public final class ArchiveFormatException extends LgxException {
    private final long offset;

    public ArchiveFormatException(String message) {
        super(ErrorKind.FORMAT, message);
        this.offset = -1;
    }

    public ArchiveFormatException(String message, Throwable cause) {
        super(ErrorKind.FORMAT, message, cause);
        this.offset = -1;
    }

    public ArchiveFormatException(String message, long offset) {
        super(ErrorKind.FORMAT, message + " at offset " + offset);
        this.offset = offset;
    }

    /**
     * Byte offset into the tar stream where decoding failed, when known.
     */
    public OptionalLong offset() {
        return offset < 0 ? OptionalLong.empty() : OptionalLong.of(offset);
    }
}
