package co.fanki.tracegraph.tree.application;

import co.fanki.tracegraph.document.domain.Document;
import co.fanki.tracegraph.document.domain.DocumentTree;
import co.fanki.tracegraph.graph.domain.GraphBuilder;
import co.fanki.tracegraph.graph.domain.TraceabilityGraph;
import co.fanki.tracegraph.item.domain.DocumentRenumberer;
import co.fanki.tracegraph.item.domain.Item;
import co.fanki.tracegraph.item.domain.ItemStore;
import co.fanki.tracegraph.item.domain.ItemType;
import co.fanki.tracegraph.item.domain.Link;
import co.fanki.tracegraph.shared.DomainException;
import co.fanki.tracegraph.shared.Preconditions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Application service for item operations of the configured project.
 *
 * <p>Operations that take a label accept {@code all}, a document prefix
 * or a single item uid.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Service
public class ItemService {

    private static final Logger LOG = LoggerFactory.getLogger(
            ItemService.class);

    /** Label selecting every item of the project. */
    public static final String ALL = "all";

    /** Error code when the child already links to the parent. */
    public static final String LINK_EXISTS = "LINK_EXISTS";

    /** Error code when the child does not link to the parent. */
    public static final String LINK_NOT_FOUND = "LINK_NOT_FOUND";

    private final GraphBuilder graphBuilder;
    private final ItemStore store;
    private final DocumentRenumberer renumberer;
    private final Path root;

    /**
     * Creates a new ItemService.
     *
     * @param theGraphBuilder loads the project
     * @param theStore reads and writes item files
     * @param theRenumberer renames item files
     * @param theRoot the configured project root
     */
    public ItemService(final GraphBuilder theGraphBuilder,
            final ItemStore theStore,
            final DocumentRenumberer theRenumberer,
            @Value("${tracegraph.root:.}") final String theRoot) {
        this.graphBuilder = theGraphBuilder;
        this.store = theStore;
        this.renumberer = theRenumberer;
        this.root = Path.of(Preconditions.requireNonBlank(theRoot,
                "Project root is required"));
    }

    // -- single items -----------------------------------------------------

    /**
     * Reads an item.
     *
     * @param uid the item uid
     * @return the item
     * @throws IOException if the project cannot be read
     * @throws DomainException if no such item exists
     */
    public Item item(final String uid) throws IOException {
        final DocumentTree tree = graphBuilder.discover(root);
        return store.read(documentOf(tree, uid), uid);
    }

    /**
     * Appends a new item to a document.
     *
     * @param prefix the document
     * @param text the text, null for empty
     * @param header the header, may be null
     * @param type the type, null for a requirement
     * @return the written item
     * @throws IOException if the item cannot be written
     */
    public Item add(final String prefix, final String text,
            final String header, final ItemType type) throws IOException {

        final DocumentTree tree = graphBuilder.discover(root);
        final Document document = requireDocument(tree, prefix);

        final Item item = newItem(store.nextUid(document), prefix, text,
                header, type);
        store.write(document, item);

        LOG.info("Added item {}", item.uid());
        return item;
    }

    /**
     * Inserts a new item at a position, shifting later items up by one and
     * rewriting links to them.
     *
     * @param prefix the document
     * @param position the 1 based number the new item takes
     * @param text the text, null for empty
     * @param header the header, may be null
     * @param type the type, null for a requirement
     * @return the written item
     * @throws IOException if a file cannot be moved or written
     */
    public Item insert(final String prefix, final int position,
            final String text, final String header, final ItemType type)
            throws IOException {

        final DocumentTree tree = graphBuilder.discover(root);
        final Document document = requireDocument(tree, prefix);

        final String uid = renumberer.insertSlots(document, tree, position, 1)
                .get(0);
        final Item item = newItem(uid, prefix, text, header, type);
        store.write(document, item);

        LOG.info("Inserted item {}", uid);
        return item;
    }

    /**
     * Changes an item's content. Null arguments keep the current value.
     *
     * @param uid the item
     * @param text the new text, or null
     * @param header the new header, or null
     * @param type the new type, or null
     * @return the written item
     * @throws IOException if the item cannot be read or written
     */
    public Item edit(final String uid, final String text,
            final String header, final ItemType type) throws IOException {

        final DocumentTree tree = graphBuilder.discover(root);
        final Document document = documentOf(tree, uid);

        Item item = store.read(document, uid);
        if (text != null) {
            item = item.withText(text);
        }
        if (header != null) {
            item = item.withHeader(header);
        }
        if (type != null) {
            item = item.withType(type);
        }
        store.write(document, item);

        LOG.info("Edited item {}", uid);
        return item;
    }

    /**
     * Deletes an item file. Links from other items are left in place and
     * reported.
     *
     * @param uid the item
     * @return the uids of items that still link to the removed item
     * @throws IOException if the project cannot be read or the file deleted
     * @throws DomainException if no such item exists
     */
    public List<String> remove(final String uid) throws IOException {

        final GraphBuilder.BuildResult result = graphBuilder.build(root);
        final Document document = documentOf(result.tree(), uid);

        Preconditions.requireDomain(store.delete(document, uid),
                "Item not found: " + uid, ItemStore.ITEM_NOT_FOUND);

        final List<String> children = new ArrayList<>(
                result.graph().childrenOf(uid));
        if (!children.isEmpty()) {
            LOG.warn("Removed item {} is still linked from {}", uid, children);
        }
        LOG.info("Removed item {}", uid);
        return children;
    }

    // -- links ------------------------------------------------------------

    /**
     * Links a child to a parent, storing the parent's current hash.
     *
     * @param childUid the child
     * @param parentUid the parent
     * @return the written child
     * @throws IOException if an item cannot be read or written
     * @throws DomainException with {@link #LINK_EXISTS}, or when either
     *         item does not exist
     */
    public Item link(final String childUid, final String parentUid)
            throws IOException {

        final DocumentTree tree = graphBuilder.discover(root);
        final Document childDocument = documentOf(tree, childUid);
        final Item child = store.read(childDocument, childUid);
        final Item parent = store.read(documentOf(tree, parentUid), parentUid);

        Preconditions.requireDomain(!child.linksTo(parentUid),
                childUid + " already links to " + parentUid, LINK_EXISTS);

        final Item linked = child.withLink(
                Link.verified(parentUid, parent.contentHash()));
        store.write(childDocument, linked);

        LOG.info("Linked {} -> {}", childUid, parentUid);
        return linked;
    }

    /**
     * Removes a link.
     *
     * @param childUid the child
     * @param parentUid the parent
     * @return the written child
     * @throws IOException if the child cannot be read or written
     * @throws DomainException with {@link #LINK_NOT_FOUND}
     */
    public Item unlink(final String childUid, final String parentUid)
            throws IOException {

        final DocumentTree tree = graphBuilder.discover(root);
        final Document childDocument = documentOf(tree, childUid);
        final Item child = store.read(childDocument, childUid);

        Preconditions.requireDomain(child.linksTo(parentUid),
                childUid + " does not link to " + parentUid, LINK_NOT_FOUND);

        final Item unlinked = child.withoutLink(parentUid);
        store.write(childDocument, unlinked);

        LOG.info("Unlinked {} -> {}", childUid, parentUid);
        return unlinked;
    }

    // -- review -----------------------------------------------------------

    /**
     * Marks items as reviewed with their current content hash.
     *
     * @param label {@code all}, a prefix or a uid
     * @return the number of items written
     * @throws IOException if the project cannot be read or written
     */
    public int markReviewed(final String label) throws IOException {
        final GraphBuilder.BuildResult result = graphBuilder.build(root);
        int written = 0;
        for (final Item item : select(result, label)) {
            if (item.isReviewCurrent()) {
                continue;
            }
            store.write(result.tree().document(item.documentPrefix()),
                    item.markReviewed());
            written++;
        }
        LOG.info("Marked {} items reviewed ({})", written, label);
        return written;
    }

    /**
     * Refreshes the stored parent hashes on items' links.
     *
     * @param label {@code all}, a prefix or a uid
     * @param parents the parent uids to refresh, or null for every link
     * @return the number of items written
     * @throws IOException if the project cannot be read or written
     */
    public int clearSuspect(final String label,
            final Collection<String> parents) throws IOException {

        final GraphBuilder.BuildResult result = graphBuilder.build(root);
        final TraceabilityGraph graph = result.graph();
        int written = 0;

        for (final Item item : select(result, label)) {
            Item updated = item;
            for (final String parentUid : item.parentUids()) {
                if (parents != null && !parents.contains(parentUid)) {
                    continue;
                }
                final Item parent = graph.item(parentUid);
                if (parent == null) {
                    LOG.warn("Cannot verify link {} -> {}: parent not found",
                            item.uid(), parentUid);
                    continue;
                }
                updated = updated.withLinkVerified(parentUid,
                        parent.contentHash());
            }
            if (!updated.equals(item)) {
                store.write(result.tree().document(item.documentPrefix()),
                        updated);
                written++;
            }
        }
        LOG.info("Cleared suspect links on {} items ({})", written, label);
        return written;
    }

    /**
     * Forgets reviews: clears the review mark and every stored link hash.
     *
     * @param label {@code all}, a prefix or a uid
     * @return the number of items written
     * @throws IOException if the project cannot be read or written
     */
    public int resetReview(final String label) throws IOException {
        final GraphBuilder.BuildResult result = graphBuilder.build(root);
        int written = 0;
        for (final Item item : select(result, label)) {
            final Item reset = item.withReviewCleared()
                    .withLinkHashesStripped();
            if (!reset.equals(item)) {
                store.write(result.tree().document(item.documentPrefix()),
                        reset);
                written++;
            }
        }
        LOG.info("Reset review of {} items ({})", written, label);
        return written;
    }

    // -- documents --------------------------------------------------------

    /**
     * Renumbers a document's items 1..n, rewriting links project-wide.
     *
     * @param prefix the document
     * @return the renames performed
     * @throws IOException if a file cannot be read, moved or written
     */
    public DocumentRenumberer.RenumberResult renumber(final String prefix)
            throws IOException {
        final DocumentTree tree = graphBuilder.discover(root);
        return renumberer.renumber(requireDocument(tree, prefix), tree);
    }

    // -- helpers ----------------------------------------------------------

    private List<Item> select(final GraphBuilder.BuildResult result,
            final String label) {

        Preconditions.requireNonBlank(label, "Label is required");
        final TraceabilityGraph graph = result.graph();

        if (ALL.equalsIgnoreCase(label)) {
            return new ArrayList<>(graph.items());
        }
        if (result.tree().contains(label)) {
            return new ArrayList<>(graph.itemsInDocument(label));
        }
        final Item item = graph.item(label);
        if (item == null) {
            throw new DomainException("No document or item named " + label,
                    ItemStore.ITEM_NOT_FOUND);
        }
        return List.of(item);
    }

    private static Item newItem(final String uid, final String prefix,
            final String text, final String header, final ItemType type) {
        return Item.builder(uid, prefix)
                .text(text == null ? "" : text)
                .header(header)
                .type(type == null ? ItemType.REQUIREMENT : type)
                .build();
    }

    private static Document requireDocument(final DocumentTree tree,
            final String prefix) {
        final Document document = tree.document(prefix);
        if (document == null) {
            throw new DomainException("Document not found: " + prefix,
                    DocumentService.DOCUMENT_NOT_FOUND);
        }
        return document;
    }

    private static Document documentOf(final DocumentTree tree,
            final String uid) {
        final Document document = tree.documentFor(uid);
        if (document == null) {
            throw new DomainException("Item not found: " + uid,
                    ItemStore.ITEM_NOT_FOUND);
        }
        return document;
    }

}
