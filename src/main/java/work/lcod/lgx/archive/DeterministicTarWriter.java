package work.lcod.lgx.archive;

import static work.lcod.lgx.archive.TarFormat.BLOCK_SIZE;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;

/**
 * Builds a canonical USTAR stream. The output depends only on the set of
 * (path, kind, bytes) added: entries are sorted by the UTF-8 bytes of their tar
 * path and every header carries fixed ownership, mode and timestamp fields.
 */
public final class DeterministicTarWriter {
    private final List<ArchiveEntry> entries = new ArrayList<>();

    public DeterministicTarWriter addFile(String path, byte[] data) {
        return addEntry(ArchiveEntry.file(path, data));
    }

    public DeterministicTarWriter addFile(String path, String content) {
        return addEntry(ArchiveEntry.file(path, content));
    }

    public DeterministicTarWriter addDirectory(String path) {
        return addEntry(ArchiveEntry.directory(path));
    }

    public DeterministicTarWriter addEntry(ArchiveEntry entry) {
        if (!entry.kind().isWritable()) {
            throw new ArchiveFormatException("Cannot write " + entry.kind().label() + " entry: " + entry.path());
        }
        entries.add(entry);
        return this;
    }

    public void clear() {
        entries.clear();
    }

    public int entryCount() {
        return entries.size();
    }

    /**
     * Encodes all entries followed by the two-block end-of-archive marker.
     */
    public byte[] finish() {
        var out = new ByteArrayOutputStream();
        try {
            writeTo(out);
        } catch (IOException ex) {
            throw new UncheckedIOException(ex);
        }
        return out.toByteArray();
    }

    public void writeTo(OutputStream out) throws IOException {
        for (Staged staged : sortedEntries()) {
            out.write(createHeader(staged));
            if (staged.entry().isFile()) {
                byte[] data = staged.entry().data();
                out.write(data);
                int padding = (int) (TarFormat.paddedSize(data.length) - data.length);
                if (padding > 0) {
                    out.write(new byte[padding]);
                }
            }
        }
        out.write(new byte[BLOCK_SIZE * 2]);
    }

    private List<Staged> sortedEntries() {
        List<Staged> staged = new ArrayList<>(entries.size());
        for (ArchiveEntry entry : entries) {
            String tarPath = TarFormat.tarPath(entry.path(), entry.isDirectory());
            if (tarPath.isEmpty()) {
                throw new ArchiveFormatException("Empty archive path");
            }
            staged.add(new Staged(entry, tarPath.getBytes(StandardCharsets.UTF_8)));
        }
        staged.sort(Comparator.comparing(Staged::pathBytes, Arrays::compareUnsigned));

        List<Staged> unique = new ArrayList<>(staged.size());
        for (Staged candidate : staged) {
            if (!unique.isEmpty()) {
                Staged previous = unique.get(unique.size() - 1);
                if (Arrays.equals(previous.pathBytes(), candidate.pathBytes())) {
                    if (!Arrays.equals(previous.entry().data(), candidate.entry().data())) {
                        throw new ArchiveFormatException(
                            "Conflicting entries for path: " + new String(candidate.pathBytes(), StandardCharsets.UTF_8)
                        );
                    }
                    continue;
                }
            }
            unique.add(candidate);
        }
        return unique;
    }

    private static byte[] createHeader(Staged staged) {
        ArchiveEntry entry = staged.entry();
        boolean directory = entry.isDirectory();
        byte[] path = staged.pathBytes();
        int split = findSplit(path);

        byte[] header = new byte[BLOCK_SIZE];
        if (split < 0) {
            System.arraycopy(path, 0, header, TarFormat.NAME_OFFSET, path.length);
        } else {
            System.arraycopy(path, split + 1, header, TarFormat.NAME_OFFSET, path.length - split - 1);
            System.arraycopy(path, 0, header, TarFormat.PREFIX_OFFSET, split);
        }

        TarFormat.writeOctal(header, TarFormat.MODE_OFFSET, TarFormat.ID_FIELD_SIZE,
            directory ? TarFormat.DIR_MODE : TarFormat.FILE_MODE);
        TarFormat.writeOctal(header, TarFormat.UID_OFFSET, TarFormat.ID_FIELD_SIZE, 0);
        TarFormat.writeOctal(header, TarFormat.GID_OFFSET, TarFormat.ID_FIELD_SIZE, 0);
        TarFormat.writeOctal(header, TarFormat.SIZE_OFFSET, TarFormat.NUMERIC_FIELD_SIZE,
            directory ? 0 : entry.data().length);
        TarFormat.writeOctal(header, TarFormat.MTIME_OFFSET, TarFormat.NUMERIC_FIELD_SIZE, 0);
        header[TarFormat.TYPEFLAG_OFFSET] = directory ? TarFormat.TYPE_DIRECTORY : TarFormat.TYPE_FILE;
        System.arraycopy(TarFormat.USTAR_MAGIC, 0, header, TarFormat.MAGIC_OFFSET, TarFormat.USTAR_MAGIC.length);
        header[TarFormat.VERSION_OFFSET] = '0';
        header[TarFormat.VERSION_OFFSET + 1] = '0';
        // uname/gname stay empty
        TarFormat.writeOctal(header, TarFormat.DEVMAJOR_OFFSET, TarFormat.ID_FIELD_SIZE, 0);
        TarFormat.writeOctal(header, TarFormat.DEVMINOR_OFFSET, TarFormat.ID_FIELD_SIZE, 0);

        long checksum = TarFormat.checksum(header, 0);
        TarFormat.writeOctal(header, TarFormat.CHECKSUM_OFFSET, 7, checksum);
        header[TarFormat.CHECKSUM_OFFSET + 7] = ' ';
        return header;
    }

    /**
     * Index of the '/' separating prefix and name, or -1 when the path fits the
     * name field as is.
     */
    static int findSplit(byte[] path) {
        if (path.length <= TarFormat.NAME_SIZE) {
            return -1;
        }
        int first = Math.max(1, path.length - TarFormat.NAME_SIZE - 1);
        int last = Math.min(TarFormat.PREFIX_SIZE, path.length - 2);
        for (int i = first; i <= last; i++) {
            if (path[i] == '/') {
                return i;
            }
        }
        throw new ArchiveFormatException(
            "Path too long for USTAR format: " + new String(path, StandardCharsets.UTF_8)
        );
    }

    private record Staged(ArchiveEntry entry, byte[] pathBytes) {}
}
