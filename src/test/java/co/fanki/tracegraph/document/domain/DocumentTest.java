package co.fanki.tracegraph.document.domain;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Unit tests for Document.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class DocumentTest {

    private static final Path DIR = Path.of("/reqs/srs");

    @Test
    void whenFormatUid_givenDefaultDigits_shouldZeroPad() {
        final Document document = Document.of("SRS", DIR, List.of("SYS"), 3,
                "");

        assertEquals("SRS004", document.formatUid(4));
        assertEquals("SRS1234", document.formatUid(1234));
    }

    @Test
    void whenFormatUid_givenSeparator_shouldInsertIt() {
        final Document document = Document.of("REQ", DIR, List.of(), 4, "-");

        assertEquals("REQ-0012", document.formatUid(12));
    }

    @Test
    void whenOwns_givenMatchingAndForeignUids_shouldMatchOnlyOwn() {
        final Document document = Document.of("SRS", DIR, List.of(), 3, "");

        assertTrue(document.owns("SRS001"));
        assertTrue(document.owns("srs001"));
        assertFalse(document.owns("SRSX001"));
        assertFalse(document.owns("SYS001"));
        assertFalse(document.owns(null));
    }

    @Test
    void whenIsRoot_givenNoParents_shouldBeRoot() {
        assertTrue(Document.root("SYS", DIR).isRoot());
        assertFalse(Document.of("SRS", DIR, List.of("SYS"), 3, "").isRoot());
    }

    @Test
    void whenOf_givenInvalidPrefix_shouldThrowException() {
        assertThrows(IllegalArgumentException.class,
                () -> Document.root("S", DIR));
        assertThrows(IllegalArgumentException.class,
                () -> Document.root("srs", DIR));
        assertThrows(IllegalArgumentException.class,
                () -> Document.root("1SRS", DIR));
    }

    @Test
    void whenOf_givenDigitsOutOfRange_shouldThrowException() {
        assertThrows(IllegalArgumentException.class,
                () -> Document.of("SRS", DIR, List.of(), 0, ""));
        assertThrows(IllegalArgumentException.class,
                () -> Document.of("SRS", DIR, List.of(), 11, ""));
    }

    @Test
    void whenOf_givenAlphanumericSeparator_shouldThrowException() {
        assertThrows(IllegalArgumentException.class,
                () -> Document.of("SRS", DIR, List.of(), 3, "x"));
    }

    @Test
    void whenConfigFile_givenDocument_shouldResolveInsideDirectory() {
        assertEquals(DIR.resolve(Document.CONFIG_FILE),
                Document.root("SRS", DIR).configFile());
    }

    @Test
    void whenWithParents_givenNewParents_shouldKeepEverythingElse() {
        final Document document = Document.of("SRS", DIR, List.of("SYS"), 4,
                "-");

        final Document moved = document.withParents(List.of("HAZ"));

        assertEquals(List.of("HAZ"), moved.parents());
        assertEquals(4, moved.digits());
        assertEquals("-", moved.sep());
        assertEquals(List.of("SYS"), document.parents());
    }

}
