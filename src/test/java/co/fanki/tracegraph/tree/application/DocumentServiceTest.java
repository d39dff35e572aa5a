package co.fanki.tracegraph.tree.application;

import co.fanki.tracegraph.ProjectFixture;
import co.fanki.tracegraph.document.domain.DiscoveryException;
import co.fanki.tracegraph.document.domain.Document;
import co.fanki.tracegraph.document.domain.DocumentConfigReader;
import co.fanki.tracegraph.document.domain.DocumentDiscovery;
import co.fanki.tracegraph.shared.DomainException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Unit tests for DocumentService.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class DocumentServiceTest {

    @TempDir
    Path root;

    private ProjectFixture fixture;
    private DocumentService service;

    @BeforeEach
    void setUp() {
        fixture = new ProjectFixture(root);
        service = new DocumentService(new DocumentDiscovery(),
                fixture.store(), root.toString());
    }

    @Test
    void whenCreate_givenRelativePath_shouldWriteConfigUnderRoot()
            throws IOException {
        fixture.document("sys", "SYS");

        final Document created = service.create("SRS", Path.of("reqs/srs"),
                List.of("SYS"), 4, "-");

        final Path config = root.resolve("reqs/srs")
                .resolve(Document.CONFIG_FILE);
        assertTrue(Files.isRegularFile(config));
        assertEquals(List.of("SYS"), DocumentConfigReader.read(config)
                .parents());
        assertEquals("SRS-0001", created.formatUid(1));
    }

    @Test
    void whenCreate_givenExistingPrefix_shouldRefuse() throws IOException {
        fixture.document("sys", "SYS");

        final DomainException e = assertThrows(DomainException.class,
                () -> service.create("SYS", Path.of("other"), List.of(), 3,
                        ""));

        assertEquals(DocumentService.DOCUMENT_EXISTS, e.getErrorCode());
    }

    @Test
    void whenCreate_givenUnknownParent_shouldRefuse() {
        final DomainException e = assertThrows(DomainException.class,
                () -> service.create("SRS", Path.of("srs"), List.of("SYS"), 3,
                        ""));

        assertEquals(DocumentService.DOCUMENT_NOT_FOUND, e.getErrorCode());
        assertFalse(Files.exists(root.resolve("srs")));
    }

    @Test
    void whenDelete_givenIncomingLinksWithoutCascade_shouldRefuse()
            throws IOException {
        final Document sys = fixture.document("sys", "SYS");
        final Document srs = fixture.document("srs", "SRS", "SYS");
        fixture.requirement(sys, "SYS001", "Stop the pump");
        fixture.requirement(srs, "SRS001", "Stop within 2s", "SYS001");

        final DomainException e = assertThrows(DomainException.class,
                () -> service.delete("SYS", false));

        assertEquals(DocumentService.DANGLING_LINKS, e.getErrorCode());
        assertTrue(Files.exists(fixture.store().itemPath(sys, "SYS001")));
    }

    @Test
    void whenDelete_givenCascade_shouldUnlinkAndReparentChildren()
            throws IOException {
        final Document sys = fixture.document("sys", "SYS");
        final Document srs = fixture.document("srs", "SRS", "SYS");
        fixture.requirement(sys, "SYS001", "Stop the pump");
        fixture.requirement(srs, "SRS001", "Stop within 2s", "SYS001");

        final DocumentService.DeleteResult result = service.delete("SYS",
                true);

        assertEquals(List.of("SRS001"), result.unlinkedItems());
        assertEquals(List.of("SRS"), result.reparentedDocuments());
        assertFalse(fixture.store().read(srs, "SRS001").hasLinks());
        assertTrue(DocumentConfigReader.read(srs.configFile()).isRoot());
        assertFalse(Files.exists(sys.path()));
    }

    @Test
    void whenDelete_givenForeignFileInDirectory_shouldKeepDirectory()
            throws IOException {
        final Document sys = fixture.document("sys", "SYS");
        fixture.requirement(sys, "SYS001", "Stop the pump");
        Files.writeString(sys.path().resolve("README.md"), "notes");

        service.delete("SYS", false);

        assertTrue(Files.exists(sys.path().resolve("README.md")));
        assertFalse(Files.exists(sys.configFile()));
        assertFalse(Files.exists(fixture.store().itemPath(sys, "SYS001")));
    }

    @Test
    void whenReconfigure_givenCycle_shouldRefuseAndKeepConfig()
            throws IOException {
        final Document sys = fixture.document("sys", "SYS");
        fixture.document("srs", "SRS", "SYS");

        assertThrows(DiscoveryException.class,
                () -> service.reconfigure("SYS", List.of("SRS")));

        assertTrue(DocumentConfigReader.read(sys.configFile()).isRoot());
    }

    @Test
    void whenReconfigure_givenNewParent_shouldWriteIt() throws IOException {
        fixture.document("sys", "SYS");
        fixture.document("haz", "HAZ");
        final Document srs = fixture.document("srs", "SRS", "SYS");

        service.reconfigure("SRS", List.of("SYS", "HAZ"));

        assertEquals(List.of("SYS", "HAZ"),
                DocumentConfigReader.read(srs.configFile()).parents());
    }

    @Test
    void whenList_givenHierarchy_shouldReturnParentsFirst()
            throws IOException {
        fixture.document("tst", "TST", "SRS");
        fixture.document("srs", "SRS", "SYS");
        fixture.document("sys", "SYS");

        final List<String> prefixes = service.list().stream()
                .map(Document::prefix).toList();

        assertEquals(List.of("SYS", "SRS", "TST"), prefixes);
    }

    @Test
    void whenFind_givenUnknownPrefix_shouldThrowNotFound() {
        final DomainException e = assertThrows(DomainException.class,
                () -> service.find("NOPE"));

        assertEquals(DocumentService.DOCUMENT_NOT_FOUND, e.getErrorCode());
    }

}
