package work.lcod.lgx.shared;

import java.util.Objects;

/**
 * Unchecked failure carrying an {@link ErrorKind} alongside the message.
 */
public class LgxException extends RuntimeException {
    private final ErrorKind kind;

    public LgxException(ErrorKind kind, String message) {
        super(message);
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    public LgxException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    public ErrorKind kind() {
        return kind;
    }

    public static LgxException usage(String message) {
        return new LgxException(ErrorKind.USAGE, message);
    }

    public static LgxException validation(String message) {
        return new LgxException(ErrorKind.VALIDATION, message);
    }

    public static LgxException io(String message, Throwable cause) {
        return new LgxException(ErrorKind.IO, message, cause);
    }
}
