package work.lcod.lgx.archive;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.stream.Collectors;
import org.junit.jupiter.api.Test;

class DeterministicTarWriterTest {
    @Test
    void outputDoesNotDependOnInsertionOrder() {
        byte[] first = new DeterministicTarWriter()
            .addFile("b.txt", "bee")
            .addDirectory("a")
            .addFile("a/x.txt", "ex")
            .finish();
        byte[] second = new DeterministicTarWriter()
            .addFile("a/x.txt", "ex")
            .addFile("b.txt", "bee")
            .addDirectory("a/")
            .finish();
        assertArrayEquals(first, second);
    }

    @Test
    void entriesAreSortedByPathBytes() {
        byte[] tar = new DeterministicTarWriter()
            .addFile("b.txt", "b")
            .addFile("a/x", "x")
            .addDirectory("a")
            .addFile("B.txt", "B")
            .finish();
        List<String> paths = TarReader.readInfo(tar).stream().map(TarEntryInfo::path).collect(Collectors.toList());
        assertEquals(List.of("B.txt", "a/", "a/x", "b.txt"), paths);
    }

    @Test
    void headersCarryNoHostMetadata() {
        byte[] tar = new DeterministicTarWriter()
            .addDirectory("variants")
            .addFile("manifest.json", "{}")
            .finish();
        List<TarEntryInfo> infos = TarReader.readInfo(tar);

        TarEntryInfo file = infos.get(0);
        assertEquals("manifest.json", file.path());
        assertEquals(0644, file.mode());
        assertEquals(0, file.uid());
        assertEquals(0, file.gid());
        assertEquals(0, file.mtime());
        assertEquals('0', file.typeFlag());
        assertEquals(2, file.size());

        TarEntryInfo directory = infos.get(1);
        assertEquals("variants/", directory.path());
        assertEquals(0755, directory.mode());
        assertEquals(0, directory.size());
        assertTrue(directory.isDirectory());

        assertEquals('u', (char) tar[257]);
        assertEquals(0, tar[257 + 5]);
        assertEquals('0', (char) tar[263]);
        assertEquals('0', (char) tar[264]);
    }

    @Test
    void checksumFieldIsSixDigitsNulSpace() {
        byte[] tar = new DeterministicTarWriter().addFile("a", "x").finish();
        for (int i = 148; i < 154; i++) {
            assertTrue(tar[i] >= '0' && tar[i] <= '7', "octal digit at " + i);
        }
        assertEquals(0, tar[154]);
        assertEquals(' ', tar[155]);
    }

    @Test
    void padsDataAndEndsWithTwoZeroBlocks() {
        byte[] tar = new DeterministicTarWriter().addFile("hello.txt", "hello").finish();
        assertEquals(512 * 4, tar.length);
        for (int i = 512 + 5; i < tar.length; i++) {
            assertEquals(0, tar[i], "byte " + i);
        }
    }

    @Test
    void emptyArchiveIsTwoZeroBlocks() {
        assertArrayEquals(new byte[1024], new DeterministicTarWriter().finish());
    }

    @Test
    void identicalDuplicatesCollapse() {
        DeterministicTarWriter writer = new DeterministicTarWriter()
            .addFile("same.txt", "data")
            .addFile("/same.txt", "data");
        assertEquals(2, writer.entryCount());
        assertEquals(1, TarReader.read(writer.finish()).size());
    }

    @Test
    void conflictingDuplicatesFail() {
        DeterministicTarWriter writer = new DeterministicTarWriter()
            .addFile("same.txt", "one")
            .addFile("same.txt", "two");
        ArchiveFormatException ex = assertThrows(ArchiveFormatException.class, writer::finish);
        assertTrue(ex.getMessage().contains("Conflicting entries"));
    }

    @Test
    void longPathsUseThePrefixField() {
        String path = "d".repeat(60) + "/" + "f".repeat(80);
        byte[] tar = new DeterministicTarWriter().addFile(path, "long").finish();

        assertEquals('d', (char) tar[345]);
        assertEquals('f', (char) tar[0]);
        List<ArchiveEntry> entries = TarReader.read(tar);
        assertEquals(path, entries.get(0).path());
        assertEquals("long", new String(entries.get(0).data(), StandardCharsets.UTF_8));
    }

    @Test
    void splitPicksTheEarliestSlashThatFits() {
        byte[] shortPath = "a/b".getBytes(StandardCharsets.UTF_8);
        assertEquals(-1, DeterministicTarWriter.findSplit(shortPath));

        String path = "p".repeat(20) + "/" + "q".repeat(30) + "/" + "r".repeat(90);
        assertEquals(51, DeterministicTarWriter.findSplit(path.getBytes(StandardCharsets.UTF_8)));
    }

    @Test
    void unsplittablePathsFail() {
        DeterministicTarWriter single = new DeterministicTarWriter().addFile("x".repeat(120), "");
        ArchiveFormatException ex = assertThrows(ArchiveFormatException.class, single::finish);
        assertTrue(ex.getMessage().startsWith("Path too long for USTAR format"));

        DeterministicTarWriter longName = new DeterministicTarWriter().addFile("a/" + "b".repeat(150), "");
        assertThrows(ArchiveFormatException.class, longName::finish);
    }

    @Test
    void refusesLinkEntries() {
        DeterministicTarWriter writer = new DeterministicTarWriter();
        ArchiveEntry link = new ArchiveEntry("variants/web/link", EntryKind.SYMLINK, null, "index.js");
        ArchiveFormatException ex = assertThrows(ArchiveFormatException.class, () -> writer.addEntry(link));
        assertEquals("Cannot write symlink entry: variants/web/link", ex.getMessage());
    }

    @Test
    void writeToMatchesFinish() throws IOException {
        DeterministicTarWriter writer = new DeterministicTarWriter().addFile("a", "1").addDirectory("d");
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        writer.writeTo(out);
        assertArrayEquals(writer.finish(), out.toByteArray());
    }

    @Test
    void clearDropsStagedEntries() {
        DeterministicTarWriter writer = new DeterministicTarWriter().addFile("a", "1");
        writer.clear();
        assertEquals(0, writer.entryCount());
        assertArrayEquals(new byte[1024], writer.finish());
    }
}
