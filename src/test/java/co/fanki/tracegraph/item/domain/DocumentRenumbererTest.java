package co.fanki.tracegraph.item.domain;

import co.fanki.tracegraph.ProjectFixture;
import co.fanki.tracegraph.document.domain.Document;
import co.fanki.tracegraph.document.domain.DocumentDiscovery;
import co.fanki.tracegraph.document.domain.DocumentTree;
import co.fanki.tracegraph.shared.DomainException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Unit tests for DocumentRenumberer.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class DocumentRenumbererTest {

    @TempDir
    Path root;

    private ProjectFixture fixture;
    private ItemStore store;
    private DocumentRenumberer renumberer;
    private Document sys;
    private Document srs;

    @BeforeEach
    void setUp() throws IOException {
        fixture = new ProjectFixture(root);
        store = fixture.store();
        renumberer = new DocumentRenumberer(store);
        sys = fixture.document("sys", "SYS");
        srs = fixture.document("srs", "SRS", "SYS");
    }

    private DocumentTree tree() throws IOException {
        return new DocumentDiscovery().discover(root);
    }

    @Test
    void whenRenumber_givenGaps_shouldCompactAndRelinkChildren()
            throws IOException {
        fixture.requirement(sys, "SYS002", "Stop the pump");
        fixture.requirement(sys, "SYS005", "Alarm on occlusion");
        fixture.requirement(srs, "SRS001", "Stop within 2s", "SYS005");

        final DocumentRenumberer.RenumberResult result =
                renumberer.renumber(sys, tree());

        assertEquals(2, result.renamed());
        assertEquals(0, result.unchanged());
        assertEquals(Map.of("SYS002", "SYS001", "SYS005", "SYS002"),
                result.renameMap());
        assertEquals(List.of("SYS001", "SYS002"), store.uids(sys));
        assertEquals("Alarm on occlusion", store.read(sys, "SYS002").text());
        assertEquals(List.of("SYS002"),
                store.read(srs, "SRS001").parentUids());
    }

    @Test
    void whenRenumber_givenContiguousItems_shouldChangeNothing()
            throws IOException {
        fixture.requirement(sys, "SYS001", "One");
        fixture.requirement(sys, "SYS002", "Two");

        final DocumentRenumberer.RenumberResult result =
                renumberer.renumber(sys, tree());

        assertEquals(0, result.renamed());
        assertEquals(2, result.unchanged());
    }

    @Test
    void whenRenumber_givenBrokenLink_shouldRefuseWithoutMoving()
            throws IOException {
        fixture.requirement(srs, "SRS003", "Orphan", "SYS404");

        final DomainException e = assertThrows(DomainException.class,
                () -> renumberer.renumber(srs, tree()));

        assertEquals(DocumentRenumberer.BROKEN_LINKS, e.getErrorCode());
        assertEquals(List.of("SRS003"), store.uids(srs));
    }

    @Test
    void whenRenumber_givenUnreadableItem_shouldRefuse() throws IOException {
        fixture.requirement(sys, "SYS003", "One");
        Files.writeString(sys.path().resolve("SYS004.yml"), "active: maybe\n");

        final DomainException e = assertThrows(DomainException.class,
                () -> renumberer.renumber(sys, tree()));

        assertEquals(ItemParseException.CODE, e.getErrorCode());
        assertTrue(Files.exists(store.itemPath(sys, "SYS003")));
    }

    @Test
    void whenRenumber_givenRelinkedChild_shouldClearItsReview()
            throws IOException {
        fixture.requirement(sys, "SYS004", "Stop the pump");
        fixture.item(srs, Item.builder("SRS001", "SRS").text("Stop")
                .link("SYS004").build().markReviewed());

        renumberer.renumber(sys, tree());

        assertFalse(store.read(srs, "SRS001").isReviewed());
    }

    @Test
    void whenInsertSlots_givenMiddlePosition_shouldShiftLaterItems()
            throws IOException {
        fixture.requirement(sys, "SYS001", "One");
        fixture.requirement(sys, "SYS002", "Two");
        fixture.requirement(sys, "SYS003", "Three");
        fixture.requirement(srs, "SRS001", "Child", "SYS003");

        final List<String> freed = renumberer.insertSlots(sys, tree(), 2, 1);

        assertEquals(List.of("SYS002"), freed);
        assertEquals(List.of("SYS001", "SYS003", "SYS004"), store.uids(sys));
        assertEquals("Two", store.read(sys, "SYS003").text());
        assertEquals(List.of("SYS004"),
                store.read(srs, "SRS001").parentUids());
    }

    @Test
    void whenInsertSlots_givenPositionPastEnd_shouldAppend()
            throws IOException {
        fixture.requirement(sys, "SYS001", "One");

        final List<String> freed = renumberer.insertSlots(sys, tree(), 9, 2);

        assertEquals(List.of("SYS002", "SYS003"), freed);
        assertEquals(List.of("SYS001"), store.uids(sys));
    }

}
