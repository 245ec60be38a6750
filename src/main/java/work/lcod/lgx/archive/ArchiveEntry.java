package work.lcod.lgx.archive;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Objects;

/**
 * One unit inside an archive. {@code data} is empty for everything but files and
 * {@code linkTarget} is empty for everything but links. The byte array is shared,
 * not copied.
 */
public record ArchiveEntry(String path, EntryKind kind, byte[] data, String linkTarget) {
    private static final byte[] EMPTY = new byte[0];

    public ArchiveEntry {
        Objects.requireNonNull(path, "path");
        Objects.requireNonNull(kind, "kind");
        data = data == null ? EMPTY : data;
        linkTarget = linkTarget == null ? "" : linkTarget;
    }

    public static ArchiveEntry file(String path, byte[] data) {
        return new ArchiveEntry(path, EntryKind.FILE, data, "");
    }

    public static ArchiveEntry file(String path, String content) {
        return file(path, content.getBytes(StandardCharsets.UTF_8));
    }

    public static ArchiveEntry directory(String path) {
        return new ArchiveEntry(path, EntryKind.DIRECTORY, EMPTY, "");
    }

    public boolean isDirectory() {
        return kind == EntryKind.DIRECTORY;
    }

    public boolean isFile() {
        return kind == EntryKind.FILE;
    }

    /**
     * Path with leading and trailing slashes removed; the identity used for
     * duplicate detection and lookups.
     */
    public String normalizedPath() {
        return stripSlashes(path);
    }

    static String stripSlashes(String path) {
        int start = 0;
        int end = path.length();
        while (start < end && path.charAt(start) == '/') {
            start++;
        }
        while (end > start && path.charAt(end - 1) == '/') {
            end--;
        }
        return path.substring(start, end);
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof ArchiveEntry entry)) {
            return false;
        }
        return path.equals(entry.path)
            && kind == entry.kind
            && Arrays.equals(data, entry.data)
            && linkTarget.equals(entry.linkTarget);
    }

    @Override
    public int hashCode() {
        return Objects.hash(path, kind, Arrays.hashCode(data), linkTarget);
    }

    @Override
    public String toString() {
        return "ArchiveEntry[" + kind.label() + " " + path + ", " + data.length + " bytes]";
    }
}
