package work.lcod.lgx.api;

import java.util.Objects;
import java.util.Optional;
import work.lcod.lgx.shared.ErrorKind;
import work.lcod.lgx.shared.LgxException;

/**
 * Outcome of an {@link LgxLibrary} call, for hosts that prefer values over exceptions.
 */
public record OperationResult(Status status, String message, Optional<ErrorKind> errorKind) {
    public OperationResult {
        Objects.requireNonNull(status, "status");
        message = message == null ? "" : message;
        Objects.requireNonNull(errorKind, "errorKind");
    }

    public static OperationResult success() {
        return new OperationResult(Status.SUCCESS, "", Optional.empty());
    }

    public static OperationResult success(String message) {
        return new OperationResult(Status.SUCCESS, message, Optional.empty());
    }

    public static OperationResult failure(ErrorKind kind, String message) {
        return new OperationResult(Status.FAILURE, message, Optional.of(kind));
    }

    public static OperationResult failure(LgxException ex) {
        return failure(ex.kind(), ex.getMessage());
    }

    public boolean isSuccess() {
        return status == Status.SUCCESS;
    }

    public enum Status {
        SUCCESS(0),
        FAILURE(1);

        private final int exitCode;

        Status(int exitCode) {
            this.exitCode = exitCode;
        }

        public int exitCode() {
            return exitCode;
        }
    }
}
