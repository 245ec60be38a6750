package work.lcod.lgx.core;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;
import work.lcod.lgx.shared.ErrorKind;
import work.lcod.lgx.shared.LgxException;

class VariantNameTest {
    @Test
    void foldsCaseAndComposes() {
        assertEquals("web", VariantName.of("WEB").value());
        assertEquals("caf\u00e9", VariantName.of("CAF\u00c9").value());
        assertEquals("caf\u00e9", VariantName.of("CAFE\u0301").value());
        assertEquals("variants/web/", VariantName.of("Web").prefix());
    }

    @Test
    void rejectsNamesThatAreNotASingleSegment() {
        for (String raw : new String[] {"", ".", "..", "a/b", "a\\b"}) {
            LgxException ex = assertThrows(LgxException.class, () -> VariantName.of(raw), raw);
            assertEquals(ErrorKind.USAGE, ex.kind());
        }
        assertTrue(VariantName.parse(null).isEmpty());
        assertTrue(VariantName.parse("x/y").isEmpty());
    }

    @Test
    void constructorRequiresCanonicalForm() {
        assertThrows(IllegalArgumentException.class, () -> new VariantName("Web"));
        assertEquals(new VariantName("web"), VariantName.of("wEb"));
    }
}
