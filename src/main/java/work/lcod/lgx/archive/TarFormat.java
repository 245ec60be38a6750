package work.lcod.lgx.archive;

import java.nio.charset.StandardCharsets;

/**
 * USTAR header layout shared by the writer and the reader.
 */
final class TarFormat {
    static final int BLOCK_SIZE = 512;

    static final int NAME_OFFSET = 0;
    static final int NAME_SIZE = 100;
    static final int MODE_OFFSET = 100;
    static final int UID_OFFSET = 108;
    static final int GID_OFFSET = 116;
    static final int ID_FIELD_SIZE = 8;
    static final int SIZE_OFFSET = 124;
    static final int MTIME_OFFSET = 136;
    static final int NUMERIC_FIELD_SIZE = 12;
    static final int CHECKSUM_OFFSET = 148;
    static final int CHECKSUM_SIZE = 8;
    static final int TYPEFLAG_OFFSET = 156;
    static final int LINKNAME_OFFSET = 157;
    static final int LINKNAME_SIZE = 100;
    static final int MAGIC_OFFSET = 257;
    static final int VERSION_OFFSET = 263;
    static final int DEVMAJOR_OFFSET = 329;
    static final int DEVMINOR_OFFSET = 337;
    static final int PREFIX_OFFSET = 345;
    static final int PREFIX_SIZE = 155;

    static final int FILE_MODE = 0644;
    static final int DIR_MODE = 0755;

    static final byte TYPE_FILE = '0';
    static final byte TYPE_DIRECTORY = '5';

    static final byte[] USTAR_MAGIC = {'u', 's', 't', 'a', 'r', 0};

    private TarFormat() {}

    /**
     * Header checksum with the checksum field itself counted as eight spaces.
     */
    static long checksum(byte[] block, int offset) {
        long sum = 0;
        for (int i = 0; i < BLOCK_SIZE; i++) {
            if (i >= CHECKSUM_OFFSET && i < CHECKSUM_OFFSET + CHECKSUM_SIZE) {
                sum += ' ';
            } else {
                sum += block[offset + i] & 0xFF;
            }
        }
        return sum;
    }

    /**
     * Parses an octal field, skipping leading spaces/NULs and stopping at the first non-digit.
     */
    static long readOctal(byte[] buf, int offset, int length) {
        int end = offset + length;
        int i = offset;
        while (i < end && (buf[i] == ' ' || buf[i] == 0)) {
            i++;
        }
        long value = 0;
        while (i < end && buf[i] >= '0' && buf[i] <= '7') {
            value = (value << 3) + (buf[i] - '0');
            i++;
        }
        return value;
    }

    /**
     * Writes {@code length - 1} zero-padded octal digits followed by a NUL.
     */
    static void writeOctal(byte[] buf, int offset, int length, long value) {
        String digits = Long.toOctalString(value);
        int width = length - 1;
        if (digits.length() > width) {
            throw new ArchiveFormatException("Value " + value + " does not fit a " + length + "-byte octal field");
        }
        int pad = width - digits.length();
        for (int i = 0; i < pad; i++) {
            buf[offset + i] = '0';
        }
        byte[] ascii = digits.getBytes(StandardCharsets.US_ASCII);
        System.arraycopy(ascii, 0, buf, offset + pad, ascii.length);
        buf[offset + width] = 0;
    }

    static boolean isZeroBlock(byte[] buf, int offset) {
        for (int i = 0; i < BLOCK_SIZE; i++) {
            if (buf[offset + i] != 0) {
                return false;
            }
        }
        return true;
    }

    static long paddedSize(long size) {
        return (size + BLOCK_SIZE - 1) / BLOCK_SIZE * BLOCK_SIZE;
    }

    /**
     * Strips leading and trailing slashes; directories get exactly one trailing slash.
     */
    static String tarPath(String path, boolean directory) {
        String stripped = ArchiveEntry.stripSlashes(path);
        return directory && !stripped.isEmpty() ? stripped + "/" : stripped;
    }
}
