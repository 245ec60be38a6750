package work.lcod.lgx.shared;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.text.Normalizer;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Unicode and separator handling for archive paths.
 *
 * <p>Archive paths are always forward-slash separated and relative. Every path
 * that reaches the filesystem during extraction must first pass
 * {@link #validateArchivePath(String)}.
 */
public final class PathNormalizer {
    private PathNormalizer() {}

    /**
     * NFC-normalizes {@code text}. Empty when the text holds an unpaired surrogate,
     * which has no UTF-8 encoding and therefore no normal form on disk.
     */
    public static Optional<String> toNfc(String text) {
        if (text == null || !isWellFormed(text)) {
            return Optional.empty();
        }
        return Optional.of(Normalizer.normalize(text, Normalizer.Form.NFC));
    }

    /**
     * Decodes strict UTF-8 and NFC-normalizes the result; empty on malformed input.
     */
    public static Optional<String> toNfc(byte[] utf8) {
        if (utf8 == null) {
            return Optional.empty();
        }
        try {
            String decoded = StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT)
                .decode(ByteBuffer.wrap(utf8))
                .toString();
            return toNfc(decoded);
        } catch (CharacterCodingException ex) {
            return Optional.empty();
        }
    }

    public static boolean isNfc(String text) {
        return text != null && isWellFormed(text) && Normalizer.isNormalized(text, Normalizer.Form.NFC);
    }

    public static String toLowercase(String text) {
        return text.toLowerCase(Locale.ROOT);
    }

    /**
     * Returns the first rule {@code path} breaks, or empty when it is safe to
     * resolve under an extraction directory.
     */
    public static Optional<PathViolation> validateArchivePath(String path) {
        if (path == null || path.isEmpty()) {
            return Optional.of(PathViolation.EMPTY);
        }
        if (path.indexOf('\\') >= 0) {
            return Optional.of(PathViolation.BACKSLASH);
        }
        if (isAbsolute(path)) {
            return Optional.of(PathViolation.ABSOLUTE);
        }
        for (String segment : splitPath(path)) {
            if ("..".equals(segment)) {
                return Optional.of(PathViolation.PARENT_SEGMENT);
            }
        }
        if (!isNfc(path)) {
            return Optional.of(PathViolation.NOT_NFC);
        }
        return Optional.empty();
    }

    /**
     * Converts backslashes to slashes, collapses repeated separators and drops
     * trailing separators (a lone "/" is kept).
     */
    public static String normalizeSeparators(String path) {
        StringBuilder result = new StringBuilder(path.length());
        boolean lastWasSeparator = false;
        for (int i = 0; i < path.length(); i++) {
            char c = path.charAt(i);
            if (c == '/' || c == '\\') {
                if (!lastWasSeparator) {
                    result.append('/');
                    lastWasSeparator = true;
                }
            } else {
                result.append(c);
                lastWasSeparator = false;
            }
        }
        while (result.length() > 1 && result.charAt(result.length() - 1) == '/') {
            result.setLength(result.length() - 1);
        }
        return result.toString();
    }

    public static String joinPath(List<String> components) {
        return String.join("/", components);
    }

    public static String joinPath(String base, String relative) {
        if (base.isEmpty()) {
            return relative;
        }
        if (relative.isEmpty()) {
            return base;
        }
        StringBuilder result = new StringBuilder(base);
        if (base.charAt(base.length() - 1) != '/') {
            result.append('/');
        }
        result.append(relative.charAt(0) == '/' ? relative.substring(1) : relative);
        return result.toString();
    }

    public static String joinPath(String base, String... more) {
        String result = base;
        for (String part : more) {
            result = joinPath(result, part);
        }
        return result;
    }

    public static String basename(String path) {
        String normalized = normalizeSeparators(path);
        int slash = normalized.lastIndexOf('/');
        return slash < 0 ? normalized : normalized.substring(slash + 1);
    }

    public static String dirname(String path) {
        String normalized = normalizeSeparators(path);
        int slash = normalized.lastIndexOf('/');
        if (slash < 0) {
            return "";
        }
        if (slash == 0) {
            return "/";
        }
        return normalized.substring(0, slash);
    }

    /**
     * True for POSIX absolute paths and drive-letter paths such as {@code C:\} or {@code c:/}.
     */
    public static boolean isAbsolute(String path) {
        if (path == null || path.isEmpty()) {
            return false;
        }
        if (path.charAt(0) == '/') {
            return true;
        }
        return path.length() >= 3
            && isAsciiLetter(path.charAt(0))
            && path.charAt(1) == ':'
            && (path.charAt(2) == '\\' || path.charAt(2) == '/');
    }

    /**
     * Splits on either separator, dropping empty and {@code "."} segments.
     */
    public static List<String> splitPath(String path) {
        List<String> components = new ArrayList<>();
        for (String component : normalizeSeparators(path).split("/")) {
            if (!component.isEmpty() && !".".equals(component)) {
                components.add(component);
            }
        }
        return components;
    }

    public static String getRootComponent(String path) {
        List<String> components = splitPath(path);
        return components.isEmpty() ? "" : components.get(0);
    }

    private static boolean isAsciiLetter(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z');
    }

    private static boolean isWellFormed(String text) {
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (Character.isHighSurrogate(c)) {
                if (i + 1 >= text.length() || !Character.isLowSurrogate(text.charAt(i + 1))) {
                    return false;
                }
                i++;
            } else if (Character.isLowSurrogate(c)) {
                return false;
            }
        }
        return true;
    }
}
