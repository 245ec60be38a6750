package work.lcod.lgx.archive;

/**
 * Header metadata of one tar entry, without its payload.
 */
public record TarEntryInfo(
    String path,
    EntryKind kind,
    char typeFlag,
    long mode,
    long uid,
    long gid,
    long size,
    long mtime,
    String linkTarget,
    long headerOffset
) {
    public boolean isDirectory() {
        return kind == EntryKind.DIRECTORY;
    }

    public boolean isRegularFile() {
        return kind == EntryKind.FILE;
    }
}
