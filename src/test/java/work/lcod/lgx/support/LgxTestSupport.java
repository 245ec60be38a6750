package work.lcod.lgx.support;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import work.lcod.lgx.archive.GzipCodec;

/**
 * Builders for hand-made archives and source trees. Raw headers allow entry types
 * and paths that the deterministic writer refuses to produce.
 */
public final class LgxTestSupport {
    public static final int BLOCK = 512;

    private LgxTestSupport() {}

    /**
     * USTAR header with a valid checksum; {@code name} must fit the 100-byte name field.
     */
    public static byte[] rawHeader(String name, char typeFlag, int size, String linkName) {
        byte[] header = new byte[BLOCK];
        byte[] nameBytes = name.getBytes(StandardCharsets.UTF_8);
        System.arraycopy(nameBytes, 0, header, 0, nameBytes.length);
        writeOctal(header, 100, 8, typeFlag == '5' ? 0755 : 0644);
        writeOctal(header, 108, 8, 0);
        writeOctal(header, 116, 8, 0);
        writeOctal(header, 124, 12, size);
        writeOctal(header, 136, 12, 0);
        header[156] = (byte) typeFlag;
        if (linkName != null) {
            byte[] link = linkName.getBytes(StandardCharsets.UTF_8);
            System.arraycopy(link, 0, header, 157, link.length);
        }
        byte[] magic = "ustar\u000000".getBytes(StandardCharsets.US_ASCII);
        System.arraycopy(magic, 0, header, 257, magic.length);
        sealChecksum(header);
        return header;
    }

    public static byte[] rawFile(String name, String content) {
        byte[] data = content.getBytes(StandardCharsets.UTF_8);
        byte[] block = new byte[BLOCK + padded(data.length)];
        System.arraycopy(rawHeader(name, '0', data.length, null), 0, block, 0, BLOCK);
        System.arraycopy(data, 0, block, BLOCK, data.length);
        return block;
    }

    public static byte[] rawDirectory(String name) {
        return rawHeader(name, '5', 0, null);
    }

    /**
     * Concatenates the parts and appends the two zero blocks that end an archive.
     */
    public static byte[] tarOf(byte[]... parts) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        for (byte[] part : parts) {
            out.writeBytes(part);
        }
        out.writeBytes(new byte[BLOCK * 2]);
        return out.toByteArray();
    }

    public static Path writePackage(Path file, byte[] tar) throws IOException {
        Files.write(file, GzipCodec.compress(tar));
        return file;
    }

    public static String manifestJson(String name, Map<String, String> main) {
        StringBuilder mainJson = new StringBuilder();
        main.forEach((key, value) -> {
            if (mainJson.length() > 0) {
                mainJson.append(',');
            }
            mainJson.append('"').append(key).append("\":\"").append(value).append('"');
        });
        return "{\"manifestVersion\":\"0.1.0\",\"name\":\"" + name + "\",\"version\":\"1.0.0\","
            + "\"description\":\"\",\"author\":\"\",\"type\":\"\",\"category\":\"\","
            + "\"dependencies\":[],\"main\":{" + mainJson + "}}";
    }

    /**
     * Creates {@code files} (relative path to UTF-8 content) below {@code root}.
     */
    public static Path sourceTree(Path root, Map<String, String> files) throws IOException {
        for (Map.Entry<String, String> file : files.entrySet()) {
            Path target = root.resolve(file.getKey());
            Files.createDirectories(target.getParent());
            Files.writeString(target, file.getValue());
        }
        return root;
    }

    public static void sealChecksum(byte[] header) {
        for (int i = 148; i < 156; i++) {
            header[i] = ' ';
        }
        long sum = 0;
        for (byte b : header) {
            sum += b & 0xFF;
        }
        writeOctal(header, 148, 7, sum);
        header[155] = ' ';
    }

    private static void writeOctal(byte[] buf, int offset, int length, long value) {
        String digits = String.format("%0" + (length - 1) + "o", value);
        byte[] ascii = digits.getBytes(StandardCharsets.US_ASCII);
        System.arraycopy(ascii, 0, buf, offset, ascii.length);
        buf[offset + length - 1] = 0;
    }

    private static int padded(int size) {
        return (size + BLOCK - 1) / BLOCK * BLOCK;
    }
}
