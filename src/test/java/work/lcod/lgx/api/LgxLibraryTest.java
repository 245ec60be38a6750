package work.lcod.lgx.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import work.lcod.lgx.shared.ErrorKind;

class LgxLibraryTest {
    private final LgxLibrary library = new LgxLibrary();

    @TempDir
    Path tmp;

    @Test
    void fullLifecycleThroughHandles() throws IOException {
        Path file = tmp.resolve("demo.lgx");
        Path app = Files.writeString(tmp.resolve("app.js"), "app");
        assertTrue(library.create(file, "Demo").isSuccess());

        try (PackageHandle handle = library.load(file).orElseThrow()) {
            assertEquals("demo", library.name(handle));
            assertEquals("0.0.1", library.version(handle));
            assertTrue(library.addVariant(handle, "Web", app, null).isSuccess());
            assertTrue(library.setVersion(handle, "1.0.0").isSuccess());
            assertTrue(library.setDescription(handle, "A demo").isSuccess());
            assertTrue(library.setIcon(handle, "icon.png").isSuccess());
            assertTrue(library.save(handle, file).isSuccess());
        }

        assertTrue(library.verify(file).valid());
        try (PackageHandle handle = library.load(file).orElseThrow()) {
            assertEquals(List.of("web"), library.variants(handle));
            assertTrue(library.hasVariant(handle, "WEB"));
            assertEquals("1.0.0", library.version(handle));
            assertEquals("A demo", library.description(handle));
            assertEquals("icon.png", library.icon(handle));
            assertTrue(library.manifestJson(handle).contains("\"web\": \"app.js\""));

            assertTrue(library.extract(handle, null, tmp.resolve("out")).isSuccess());
            assertEquals("app", Files.readString(tmp.resolve("out/web/app.js")));
            assertTrue(library.removeVariant(handle, "web").isSuccess());
            assertEquals(List.of(), library.variants(handle));
        }
    }

    @Test
    void failuresCarryKindAndMessage() {
        LgxLibrary.LoadResult missing = library.loadResult(tmp.resolve("missing.lgx"));
        assertTrue(missing.handle().isEmpty());
        assertEquals(Optional.of(ErrorKind.IO), missing.result().errorKind());
        assertTrue(missing.result().message().startsWith("Cannot open file"));
        assertEquals(1, missing.result().status().exitCode());

        Path file = tmp.resolve("p.lgx");
        library.create(file, "p");
        OperationResult again = library.create(file, "p");
        assertFalse(again.isSuccess());
        assertEquals(Optional.of(ErrorKind.USAGE), again.errorKind());
    }

    @Test
    void emptyVersionIsRejected() {
        Path file = tmp.resolve("p.lgx");
        library.create(file, "p");
        try (PackageHandle handle = library.load(file).orElseThrow()) {
            OperationResult result = library.setVersion(handle, "");
            assertEquals(Optional.of(ErrorKind.USAGE), result.errorKind());
            assertEquals("0.0.1", library.version(handle));
        }
    }

    @Test
    void closedAndMissingHandlesAreStateErrors() {
        Path file = tmp.resolve("p.lgx");
        library.create(file, "p");
        PackageHandle handle = library.load(file).orElseThrow();
        handle.close();

        assertTrue(handle.isClosed());
        assertEquals(Optional.of(ErrorKind.STATE), library.save(handle, file).errorKind());
        assertEquals(Optional.of(ErrorKind.STATE), library.removeVariant(handle, "web").errorKind());
        assertEquals(Optional.of(ErrorKind.STATE), library.addVariant(null, "web", file, null).errorKind());
        assertThrows(IllegalStateException.class, () -> library.name(handle));
        assertThrows(IllegalStateException.class, () -> library.variants(null));
    }

    @Test
    void reportsALibraryVersion() {
        assertFalse(LgxLibrary.version().isBlank());
    }
}
