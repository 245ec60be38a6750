package work.lcod.lgx.archive;

import static work.lcod.lgx.archive.TarFormat.BLOCK_SIZE;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * Parses USTAR streams produced by {@link DeterministicTarWriter} and by ordinary tar tools.
 *
 * <p>Every header checksum is verified. Two consecutive zero blocks, or the end of
 * the buffer, terminate the archive. Link, device and FIFO entries are decoded
 * rather than rejected so that callers can report them.
 */
public final class TarReader {
    private TarReader() {}

    /**
     * Receives entries during {@link #iterate}; return {@code false} to stop.
     */
    @FunctionalInterface
    public interface EntryVisitor {
        boolean visit(ArchiveEntry entry);
    }

    public static List<ArchiveEntry> read(byte[] tar) {
        List<ArchiveEntry> entries = new ArrayList<>();
        traverse(tar, true, (info, data) -> {
            entries.add(toEntry(info, data));
            return true;
        });
        return entries;
    }

    public static List<TarEntryInfo> readInfo(byte[] tar) {
        List<TarEntryInfo> infos = new ArrayList<>();
        traverse(tar, false, (info, data) -> {
            infos.add(info);
            return true;
        });
        return infos;
    }

    /**
     * Finds a regular file by path; leading and trailing slashes are ignored on both sides.
     */
    public static Optional<byte[]> readFile(byte[] tar, String path) {
        String wanted = ArchiveEntry.stripSlashes(path);
        byte[][] found = new byte[1][];
        traverse(tar, true, (info, data) -> {
            if (info.isRegularFile() && ArchiveEntry.stripSlashes(info.path()).equals(wanted)) {
                found[0] = data;
                return false;
            }
            return true;
        });
        return Optional.ofNullable(found[0]);
    }

    /**
     * Streams entries to {@code visitor}. Returns {@code true} when the whole archive
     * was visited and {@code false} when the visitor asked to stop.
     */
    public static boolean iterate(byte[] tar, EntryVisitor visitor) {
        return traverse(tar, true, (info, data) -> visitor.visit(toEntry(info, data)));
    }

    /**
     * True when the buffer starts with one complete header whose checksum verifies.
     * The USTAR magic is not required.
     */
    public static boolean isValidTar(byte[] tar) {
        if (tar == null || tar.length < BLOCK_SIZE || TarFormat.isZeroBlock(tar, 0)) {
            return false;
        }
        return verifyChecksum(tar, 0);
    }

    private static boolean traverse(byte[] tar, boolean loadData, HeaderVisitor visitor) {
        int offset = 0;
        int zeroBlocks = 0;
        while (offset < tar.length) {
            if (offset + BLOCK_SIZE > tar.length) {
                throw new ArchiveFormatException("Incomplete header", offset);
            }
            if (TarFormat.isZeroBlock(tar, offset)) {
                offset += BLOCK_SIZE;
                if (++zeroBlocks >= 2) {
                    break;
                }
                continue;
            }
            zeroBlocks = 0;
            if (!verifyChecksum(tar, offset)) {
                throw new ArchiveFormatException("Invalid header checksum", offset);
            }

            TarEntryInfo info = parseHeader(tar, offset);
            offset += BLOCK_SIZE;

            long payload = hasPayload(info.kind()) ? info.size() : 0;
            if (payload > tar.length - (long) offset) {
                throw new ArchiveFormatException("Incomplete file data for " + info.path(), offset);
            }
            byte[] data = null;
            if (loadData && info.isRegularFile()) {
                data = Arrays.copyOfRange(tar, offset, offset + (int) payload);
            }
            offset += (int) Math.min(TarFormat.paddedSize(payload), tar.length - (long) offset);

            if (!visitor.visit(info, data)) {
                return false;
            }
        }
        return true;
    }

    private static TarEntryInfo parseHeader(byte[] tar, int offset) {
        String name = decodeField(tar, offset + TarFormat.NAME_OFFSET, TarFormat.NAME_SIZE, offset);
        String prefix = decodeField(tar, offset + TarFormat.PREFIX_OFFSET, TarFormat.PREFIX_SIZE, offset);
        String path = prefix.isEmpty() ? name : prefix + "/" + name;

        byte flag = tar[offset + TarFormat.TYPEFLAG_OFFSET];
        EntryKind kind = EntryKind.fromTypeFlag(flag);
        String linkTarget = "";
        if (kind == EntryKind.SYMLINK || kind == EntryKind.HARDLINK) {
            linkTarget = decodeField(tar, offset + TarFormat.LINKNAME_OFFSET, TarFormat.LINKNAME_SIZE, offset);
        }

        return new TarEntryInfo(
            path,
            kind,
            (char) (flag & 0xFF),
            TarFormat.readOctal(tar, offset + TarFormat.MODE_OFFSET, TarFormat.ID_FIELD_SIZE),
            TarFormat.readOctal(tar, offset + TarFormat.UID_OFFSET, TarFormat.ID_FIELD_SIZE),
            TarFormat.readOctal(tar, offset + TarFormat.GID_OFFSET, TarFormat.ID_FIELD_SIZE),
            TarFormat.readOctal(tar, offset + TarFormat.SIZE_OFFSET, TarFormat.NUMERIC_FIELD_SIZE),
            TarFormat.readOctal(tar, offset + TarFormat.MTIME_OFFSET, TarFormat.NUMERIC_FIELD_SIZE),
            linkTarget,
            offset
        );
    }

    private static boolean verifyChecksum(byte[] tar, int offset) {
        long stored = TarFormat.readOctal(tar, offset + TarFormat.CHECKSUM_OFFSET, TarFormat.CHECKSUM_SIZE);
        return stored == TarFormat.checksum(tar, offset);
    }

    private static boolean hasPayload(EntryKind kind) {
        return kind == EntryKind.FILE || kind == EntryKind.OTHER;
    }

    private static String decodeField(byte[] tar, int fieldOffset, int length, int headerOffset) {
        int end = fieldOffset;
        while (end < fieldOffset + length && tar[end] != 0) {
            end++;
        }
        try {
            return StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT)
                .decode(ByteBuffer.wrap(tar, fieldOffset, end - fieldOffset))
                .toString();
        } catch (CharacterCodingException ex) {
            throw new ArchiveFormatException("Header field is not valid UTF-8", headerOffset);
        }
    }

    private static ArchiveEntry toEntry(TarEntryInfo info, byte[] data) {
        return new ArchiveEntry(info.path(), info.kind(), data, info.linkTarget());
    }

    @FunctionalInterface
    private interface HeaderVisitor {
        boolean visit(TarEntryInfo info, byte[] data);
    }
}
