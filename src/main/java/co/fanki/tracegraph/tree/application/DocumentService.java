package co.fanki.tracegraph.tree.application;

import co.fanki.tracegraph.document.domain.DiscoveryException;
import co.fanki.tracegraph.document.domain.Document;
import co.fanki.tracegraph.document.domain.DocumentConfigReader;
import co.fanki.tracegraph.document.domain.DocumentDiscovery;
import co.fanki.tracegraph.document.domain.DocumentTree;
import co.fanki.tracegraph.item.domain.Item;
import co.fanki.tracegraph.item.domain.ItemStore;
import co.fanki.tracegraph.shared.DomainException;
import co.fanki.tracegraph.shared.Preconditions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

/**
 * Application service for document operations: creating, deleting,
 * re-parenting and listing the documents of the configured project.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Service
public class DocumentService {

    private static final Logger LOG = LoggerFactory.getLogger(
            DocumentService.class);

    /** Error code when the prefix is already taken. */
    public static final String DOCUMENT_EXISTS = "DOCUMENT_EXISTS";

    /** Error code when no document has the prefix. */
    public static final String DOCUMENT_NOT_FOUND = "DOCUMENT_NOT_FOUND";

    /** Error code when other items still link into a deleted document. */
    public static final String DANGLING_LINKS = "DANGLING_LINKS";

    /**
     * The outcome of a delete.
     *
     * @param document the deleted document
     * @param unlinkedItems uids of items whose links into it were removed
     * @param reparentedDocuments prefixes of documents that lost it as a
     *        parent
     */
    public record DeleteResult(Document document, List<String> unlinkedItems,
            List<String> reparentedDocuments) {}

    private final DocumentDiscovery discovery;
    private final ItemStore store;
    private final Path root;

    /**
     * Creates a new DocumentService.
     *
     * @param theDiscovery finds the project's documents
     * @param theStore reads and writes item files
     * @param theRoot the configured project root
     */
    public DocumentService(final DocumentDiscovery theDiscovery,
            final ItemStore theStore,
            @Value("${tracegraph.root:.}") final String theRoot) {
        this.discovery = theDiscovery;
        this.store = theStore;
        this.root = Path.of(Preconditions.requireNonBlank(theRoot,
                "Project root is required"));
    }

    /**
     * Creates a document and writes its configuration file.
     *
     * @param prefix the new prefix
     * @param path the directory, relative paths resolve against the root
     * @param parents the parent prefixes, empty for a root document
     * @param digits the zero-padding width of item numbers
     * @param sep the separator between prefix and number
     * @return the created document
     * @throws IOException if the configuration cannot be written
     * @throws DomainException with {@link #DOCUMENT_EXISTS} or
     *         {@link #DOCUMENT_NOT_FOUND} for an unknown parent
     */
    public Document create(final String prefix, final Path path,
            final List<String> parents, final int digits, final String sep)
            throws IOException {

        LOG.info("Creating document {} at {}", prefix, path);

        final Path directory = path.isAbsolute() ? path : root.resolve(path);
        final Document document = Document.of(prefix, directory, parents,
                digits, sep);

        final DocumentTree tree = discovery.discover(root);
        Preconditions.requireDomain(!tree.contains(prefix),
                "Document already exists: " + prefix, DOCUMENT_EXISTS);
        for (final String parent : document.parents()) {
            Preconditions.requireDomain(tree.contains(parent),
                    "Parent document not found: " + parent,
                    DOCUMENT_NOT_FOUND);
        }
        Preconditions.requireDomain(!Files.exists(document.configFile()),
                "A document configuration already exists at "
                        + document.configFile(), DOCUMENT_EXISTS);

        Files.createDirectories(directory);
        DocumentConfigReader.write(document);

        LOG.info("Created document {}", document);
        return document;
    }

    /**
     * Deletes a document with its items.
     *
     * <p>Without cascade the delete is refused while items of other
     * documents link into it. With cascade those links are removed first
     * and child documents stop naming it as a parent. The directory itself
     * is removed only when nothing else is left in it.</p>
     *
     * @param prefix the document to delete
     * @param cascade whether to remove incoming links
     * @return what was changed
     * @throws IOException if a file cannot be read, written or deleted
     * @throws DomainException with {@link #DOCUMENT_NOT_FOUND} or
     *         {@link #DANGLING_LINKS}
     */
    public DeleteResult delete(final String prefix, final boolean cascade)
            throws IOException {

        LOG.info("Deleting document {} (cascade: {})", prefix, cascade);

        final DocumentTree tree = discovery.discover(root);
        final Document document = require(tree, prefix);

        final List<Item> linking = new ArrayList<>();
        for (final Document other : tree.documents()) {
            if (other.prefix().equals(prefix)) {
                continue;
            }
            for (final Item item : store.readDocument(other).items()) {
                if (linksInto(item, document)) {
                    linking.add(item);
                }
            }
        }

        if (!linking.isEmpty() && !cascade) {
            throw new DomainException("Items still link into " + prefix + ": "
                    + linking.stream().map(Item::uid).toList(),
                    DANGLING_LINKS);
        }

        final List<String> unlinked = new ArrayList<>();
        for (final Item item : linking) {
            Item changed = item;
            for (final String parentUid : item.parentUids()) {
                if (document.owns(parentUid)) {
                    changed = changed.withoutLink(parentUid);
                }
            }
            store.write(tree.documentFor(item.uid()), changed);
            unlinked.add(item.uid());
        }

        final List<String> reparented = new ArrayList<>();
        for (final Document other : tree.documents()) {
            if (other.parents().contains(prefix)) {
                final List<String> remaining = new ArrayList<>(other.parents());
                remaining.remove(prefix);
                DocumentConfigReader.write(other.withParents(remaining));
                reparented.add(other.prefix());
            }
        }

        for (final String uid : store.uids(document)) {
            store.delete(document, uid);
        }
        Files.deleteIfExists(document.configFile());
        removeIfEmpty(document.path());

        if (!unlinked.isEmpty()) {
            LOG.warn("Removed links into {} from {}", prefix, unlinked);
        }
        LOG.info("Deleted document {}", prefix);
        return new DeleteResult(document, List.copyOf(unlinked),
                List.copyOf(reparented));
    }

    /**
     * Replaces the parents of a document.
     *
     * @param prefix the document
     * @param parents the new parent prefixes
     * @return the updated document
     * @throws IOException if the configuration cannot be written
     * @throws DomainException with {@link #DOCUMENT_NOT_FOUND}
     * @throws DiscoveryException if the change would close a cycle
     */
    public Document reconfigure(final String prefix,
            final List<String> parents) throws IOException {

        LOG.info("Setting parents of {} to {}", prefix, parents);

        final DocumentTree tree = discovery.discover(root);
        final Document document = require(tree, prefix);
        final Document updated = document.withParents(parents);

        for (final String parent : updated.parents()) {
            require(tree, parent);
        }

        tree.replace(updated);
        tree.hierarchy().topologicalOrder();

        DocumentConfigReader.write(updated);
        return updated;
    }

    /**
     * Lists the documents, parents before children.
     *
     * @return the documents in load order
     * @throws IOException if the project cannot be read
     * @throws DiscoveryException on a document cycle
     */
    public List<Document> list() throws IOException {
        final DocumentTree tree = discovery.discover(root);
        final List<Document> result = new ArrayList<>();
        for (final String prefix : tree.hierarchy().topologicalOrder()) {
            result.add(tree.document(prefix));
        }
        return result;
    }

    /**
     * Finds a document by prefix.
     *
     * @param prefix the prefix
     * @return the document
     * @throws IOException if the project cannot be read
     * @throws DomainException with {@link #DOCUMENT_NOT_FOUND}
     */
    public Document find(final String prefix) throws IOException {
        return require(discovery.discover(root), prefix);
    }

    private static Document require(final DocumentTree tree,
            final String prefix) {
        final Document document = tree.document(prefix);
        if (document == null) {
            throw new DomainException("Document not found: " + prefix,
                    DOCUMENT_NOT_FOUND);
        }
        return document;
    }

    private static boolean linksInto(final Item item,
            final Document document) {
        for (final String parentUid : item.parentUids()) {
            if (document.owns(parentUid)) {
                return true;
            }
        }
        return false;
    }

    private static void removeIfEmpty(final Path directory)
            throws IOException {
        if (!Files.isDirectory(directory)) {
            return;
        }
        try (Stream<Path> entries = Files.list(directory)) {
            if (entries.findAny().isPresent()) {
                LOG.info("Keeping non-empty directory {}", directory);
                return;
            }
        }
        Files.delete(directory);
    }

}
