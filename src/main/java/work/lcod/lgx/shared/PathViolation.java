package work.lcod.lgx.shared;

/**
 * Reasons an archive path is refused, in the order they are checked.
 */
public enum PathViolation {
    EMPTY("Path is empty"),
    BACKSLASH("Path contains backslashes"),
    ABSOLUTE("Path is absolute"),
    PARENT_SEGMENT("Path contains '..' segment"),
    NOT_NFC("Path is not NFC-normalized");

    private final String message;

    PathViolation(String message) {
        this.message = message;
    }

    public String message() {
        return message;
    }
}
