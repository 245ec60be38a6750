package work.lcod.lgx.shared;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class PathNormalizerTest {
    private static final String E_ACUTE_NFC = "\u00e9";
    private static final String E_ACUTE_NFD = "e\u0301";

    @Test
    void composesDecomposedText() {
        assertEquals(Optional.of("caf" + E_ACUTE_NFC), PathNormalizer.toNfc("caf" + E_ACUTE_NFD));
        assertTrue(PathNormalizer.isNfc("caf" + E_ACUTE_NFC));
        assertFalse(PathNormalizer.isNfc("caf" + E_ACUTE_NFD));
    }

    @Test
    void rejectsUnpairedSurrogates() {
        assertTrue(PathNormalizer.toNfc("bad\uD800").isEmpty());
        assertFalse(PathNormalizer.isNfc("\uDC00"));
    }

    @Test
    void decodesStrictUtf8() {
        byte[] decomposed = ("caf" + E_ACUTE_NFD).getBytes(StandardCharsets.UTF_8);
        assertEquals(Optional.of("caf" + E_ACUTE_NFC), PathNormalizer.toNfc(decomposed));
        assertTrue(PathNormalizer.toNfc(new byte[] {(byte) 0xC3, (byte) 0x28}).isEmpty());
    }

    @Test
    void lowercasesWithoutLocale() {
        assertEquals("web-ios", PathNormalizer.toLowercase("WEB-iOS"));
        assertEquals("title", PathNormalizer.toLowercase("TITLE"));
    }

    @Test
    void flagsUnsafeArchivePaths() {
        assertEquals(Optional.of(PathViolation.EMPTY), PathNormalizer.validateArchivePath(""));
        assertEquals(Optional.of(PathViolation.BACKSLASH), PathNormalizer.validateArchivePath("dist\\index.js"));
        assertEquals(Optional.of(PathViolation.ABSOLUTE), PathNormalizer.validateArchivePath("/etc/passwd"));
        assertEquals(Optional.of(PathViolation.ABSOLUTE), PathNormalizer.validateArchivePath("C:/Windows"));
        assertEquals(Optional.of(PathViolation.PARENT_SEGMENT), PathNormalizer.validateArchivePath("a/../b"));
        assertEquals(Optional.of(PathViolation.PARENT_SEGMENT), PathNormalizer.validateArchivePath(".."));
        assertEquals(Optional.of(PathViolation.NOT_NFC), PathNormalizer.validateArchivePath("docs/" + E_ACUTE_NFD));
    }

    @Test
    void backslashIsReportedBeforeAbsolute() {
        assertEquals(Optional.of(PathViolation.BACKSLASH), PathNormalizer.validateArchivePath("C:\\Windows"));
    }

    @Test
    void acceptsSafeArchivePaths() {
        assertTrue(PathNormalizer.validateArchivePath("variants/web/dist/index.js").isEmpty());
        assertTrue(PathNormalizer.validateArchivePath("variants/web/").isEmpty());
        assertTrue(PathNormalizer.validateArchivePath("a/..b/c").isEmpty());
        assertTrue(PathNormalizer.validateArchivePath("docs/" + E_ACUTE_NFC).isEmpty());
        assertEquals("Path contains '..' segment", PathViolation.PARENT_SEGMENT.message());
    }

    @Test
    void normalizesSeparators() {
        assertEquals("a/b/c", PathNormalizer.normalizeSeparators("a\\\\b//c/"));
        assertEquals("/", PathNormalizer.normalizeSeparators("///"));
        assertEquals("", PathNormalizer.normalizeSeparators(""));
    }

    @Test
    void joinsPaths() {
        assertEquals("a/b", PathNormalizer.joinPath("a/", "/b"));
        assertEquals("b", PathNormalizer.joinPath("", "b"));
        assertEquals("a", PathNormalizer.joinPath("a", ""));
        assertEquals("variants/web/index.js", PathNormalizer.joinPath("variants", "web", "index.js"));
        assertEquals("x/y", PathNormalizer.joinPath(List.of("x", "y")));
    }

    @Test
    void splitsIntoComponents() {
        assertEquals(List.of("a", "b", "c"), PathNormalizer.splitPath("./a//b/./c/"));
        assertEquals(List.of(), PathNormalizer.splitPath("/"));
        assertEquals("variants", PathNormalizer.getRootComponent("/variants/web/"));
        assertEquals("", PathNormalizer.getRootComponent(""));
    }

    @Test
    void extractsBasenameAndDirname() {
        assertEquals("c", PathNormalizer.basename("a/b/c"));
        assertEquals("b", PathNormalizer.basename("a/b/"));
        assertEquals("a/b", PathNormalizer.dirname("a/b/c"));
        assertEquals("", PathNormalizer.dirname("file"));
        assertEquals("/", PathNormalizer.dirname("/top"));
    }

    @Test
    void detectsAbsolutePaths() {
        assertTrue(PathNormalizer.isAbsolute("/x"));
        assertTrue(PathNormalizer.isAbsolute("c:\\x"));
        assertTrue(PathNormalizer.isAbsolute("D:/x"));
        assertFalse(PathNormalizer.isAbsolute("c:x"));
        assertFalse(PathNormalizer.isAbsolute("1:/x"));
        assertFalse(PathNormalizer.isAbsolute("relative/x"));
    }
}
