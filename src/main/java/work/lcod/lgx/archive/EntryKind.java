package work.lcod.lgx.archive;

/**
 * Entry types recognised in a tar stream. Only {@link #FILE} and {@link #DIRECTORY}
 * can be written; the rest are decoded so verification can name them.
 */
public enum EntryKind {
    FILE("file"),
    DIRECTORY("directory"),
    HARDLINK("hardlink"),
    SYMLINK("symlink"),
    CHAR_DEVICE("character device"),
    BLOCK_DEVICE("block device"),
    FIFO("fifo"),
    OTHER("unknown");

    private final String label;

    EntryKind(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public boolean isWritable() {
        return this == FILE || this == DIRECTORY;
    }

    static EntryKind fromTypeFlag(byte flag) {
        return switch (flag) {
            case '0', 0 -> FILE;
            case '1' -> HARDLINK;
            case '2' -> SYMLINK;
            case '3' -> CHAR_DEVICE;
            case '4' -> BLOCK_DEVICE;
            case '5' -> DIRECTORY;
            case '6' -> FIFO;
            default -> OTHER;
        };
    }
}
