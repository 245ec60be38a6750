package work.lcod.lgx.archive;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.util.zip.CRC32;
import java.util.zip.Deflater;
import java.util.zip.GZIPInputStream;
import java.util.zip.ZipException;

/**
 * Gzip envelope with no variable metadata, so equal input always compresses to equal bytes.
 *
 * <p>The header is written by hand (FLG=0, MTIME=0, XFL=0, OS=0xFF) around a raw
 * DEFLATE payload; {@link java.util.zip.GZIPOutputStream} is avoided because it
 * stamps its own OS byte. Decompression is ordinary RFC 1952 decoding.
 */
public final class GzipCodec {
    static final byte[] GZIP_MAGIC = new byte[]{0x1f, (byte) 0x8b};
    private static final byte METHOD_DEFLATE = 8;
    private static final byte OS_UNKNOWN = (byte) 0xFF;
    private static final int BUFFER_SIZE = 32 * 1024;

    private GzipCodec() {}

    /**
     * Receives decompressed chunks; return {@code false} to stop early.
     */
    @FunctionalInterface
    public interface ChunkSink {
        boolean accept(byte[] buffer, int length);
    }

    public static boolean isGzip(byte[] data) {
        return data != null && data.length >= 2 && data[0] == GZIP_MAGIC[0] && data[1] == GZIP_MAGIC[1];
    }

    public static byte[] compress(byte[] data) {
        var out = new ByteArrayOutputStream(Math.max(data.length / 3, 64));
        writeHeader(out);

        Deflater deflater = new Deflater(Deflater.DEFAULT_COMPRESSION, true);
        try {
            deflater.setInput(data);
            deflater.finish();
            byte[] buffer = new byte[BUFFER_SIZE];
            while (!deflater.finished()) {
                int count = deflater.deflate(buffer);
                out.write(buffer, 0, count);
            }
        } finally {
            deflater.end();
        }

        CRC32 crc = new CRC32();
        crc.update(data);
        writeIntLe(out, crc.getValue());
        writeIntLe(out, data.length & 0xFFFFFFFFL);
        return out.toByteArray();
    }

    /**
     * Drains {@code in} and compresses it; the trailer needs the full CRC, so the
     * input is buffered first.
     */
    public static byte[] compress(InputStream in) throws IOException {
        return compress(in.readAllBytes());
    }

    public static byte[] decompress(byte[] data) {
        var out = new ByteArrayOutputStream(Math.max(data.length * 3, 4096));
        decompress(data, (buffer, length) -> {
            out.write(buffer, 0, length);
            return true;
        });
        return out.toByteArray();
    }

    /**
     * Streams decompressed bytes to {@code sink}. Returns {@code false} when the sink
     * stopped early; truncated or corrupt input throws.
     */
    public static boolean decompress(byte[] data, ChunkSink sink) {
        if (!isGzip(data)) {
            throw new ArchiveFormatException("Not valid gzip data");
        }
        try (GZIPInputStream gzip = new GZIPInputStream(new ByteArrayInputStream(data), BUFFER_SIZE)) {
            byte[] buffer = new byte[BUFFER_SIZE];
            int read;
            while ((read = gzip.read(buffer)) != -1) {
                if (read > 0 && !sink.accept(buffer, read)) {
                    return false;
                }
            }
            return true;
        } catch (EOFException ex) {
            throw new ArchiveFormatException("Truncated gzip data", ex);
        } catch (ZipException ex) {
            throw new ArchiveFormatException("Corrupt gzip data: " + ex.getMessage(), ex);
        } catch (IOException ex) {
            throw new ArchiveFormatException("Failed to decompress gzip data: " + ex.getMessage(), ex);
        }
    }

    private static void writeHeader(ByteArrayOutputStream out) {
        out.write(GZIP_MAGIC[0]);
        out.write(GZIP_MAGIC[1]);
        out.write(METHOD_DEFLATE);
        out.write(0); // FLG
        writeIntLe(out, 0); // MTIME
        out.write(0); // XFL
        out.write(OS_UNKNOWN);
    }

    private static void writeIntLe(ByteArrayOutputStream out, long value) {
        out.write((int) (value & 0xFF));
        out.write((int) ((value >>> 8) & 0xFF));
        out.write((int) ((value >>> 16) & 0xFF));
        out.write((int) ((value >>> 24) & 0xFF));
    }
}
