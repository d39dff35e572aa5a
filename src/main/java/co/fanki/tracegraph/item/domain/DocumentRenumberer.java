package co.fanki.tracegraph.item.domain;

import co.fanki.tracegraph.document.domain.Document;
import co.fanki.tracegraph.document.domain.DocumentTree;
import co.fanki.tracegraph.shared.AtomicFiles;
import co.fanki.tracegraph.shared.DomainException;
import co.fanki.tracegraph.shared.Preconditions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Changes the uids of a document's items and rewrites every link that
 * refers to them, in any document.
 *
 * <p>Files are first moved to temporary names and then to their new
 * names, so a new uid can take the place of an old one. If a move fails
 * the files already moved are put back. Link rewriting happens after all
 * moves and is not transactional across files.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class DocumentRenumberer {

    private static final Logger LOG =
            LoggerFactory.getLogger(DocumentRenumberer.class);

    /** Raised when the document links to uids that do not exist. */
    public static final String BROKEN_LINKS = "BROKEN_LINKS";

    /**
     * Outcome of renumbering a document.
     *
     * @param renamed how many items got a new uid
     * @param unchanged how many items kept their uid
     * @param renameMap old uid to new uid, in old uid order
     */
    public record RenumberResult(int renamed, int unchanged,
            Map<String, String> renameMap) {}

    private final ItemStore store;

    /**
     * Creates a renumberer.
     *
     * @param theStore the store holding the item files
     */
    public DocumentRenumberer(final ItemStore theStore) {
        this.store = Preconditions.requireNonNull(theStore,
                "Item store is required");
    }

    /**
     * Renumbers a document's items 1..n in their current numeric order.
     *
     * @param document the document to renumber
     * @param tree every document whose links may need rewriting
     * @return the renames performed
     * @throws IOException if a file cannot be read, moved or written
     * @throws DomainException with {@link #BROKEN_LINKS} when an item of
     *         the document links to an unknown uid
     */
    public RenumberResult renumber(final Document document,
            final DocumentTree tree) throws IOException {

        final Map<String, List<Item>> itemsByDocument = loadAll(tree);
        final List<Item> items = sortedByNumber(document,
                itemsByDocument.getOrDefault(document.prefix(), List.of()));

        if (items.isEmpty()) {
            return new RenumberResult(0, 0, Map.of());
        }
        checkBrokenLinks(items, itemsByDocument);

        final Map<String, String> renameMap = new LinkedHashMap<>();
        int position = 1;
        for (final Item item : items) {
            final String newUid = document.formatUid(position++);
            if (!newUid.equals(item.uid())) {
                renameMap.put(item.uid(), newUid);
            }
        }

        apply(document, renameMap, itemsByDocument, tree);

        LOG.info("Renumbered document {}: {} renamed, {} unchanged",
                document.prefix(), renameMap.size(),
                items.size() - renameMap.size());

        return new RenumberResult(renameMap.size(),
                items.size() - renameMap.size(),
                Collections.unmodifiableMap(renameMap));
    }

    /**
     * Frees a run of uids by shifting the items at or after a position.
     *
     * @param document the document
     * @param tree every document whose links may need rewriting
     * @param position the first number to free, 1 based; positions past
     *        the end are clamped to the end
     * @param count how many numbers to free
     * @return the freed uids, in order
     * @throws IOException if a file cannot be read, moved or written
     */
    public List<String> insertSlots(final Document document,
            final DocumentTree tree, final int position, final int count)
            throws IOException {

        Preconditions.requirePositive(position, "Position must be >= 1");
        Preconditions.requirePositive(count, "Count must be >= 1");

        final Map<String, List<Item>> itemsByDocument = loadAll(tree);
        final List<Item> items = sortedByNumber(document,
                itemsByDocument.getOrDefault(document.prefix(), List.of()));

        int start = position;
        if (start > items.size() + 1) {
            LOG.warn("Insert position {} exceeds item count {} of {},"
                    + " appending", position, items.size(), document.prefix());
            start = items.size() + 1;
        }
        checkBrokenLinks(items, itemsByDocument);

        final Map<String, String> renameMap = new LinkedHashMap<>();
        for (final Item item : items) {
            final long number = UidAllocator.number(document, item.uid());
            if (number >= start) {
                renameMap.put(item.uid(), document.formatUid(number + count));
            }
        }

        apply(document, renameMap, itemsByDocument, tree);

        final List<String> freed = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            freed.add(document.formatUid(start + i));
        }
        return freed;
    }

    private void apply(final Document document,
            final Map<String, String> renameMap,
            final Map<String, List<Item>> itemsByDocument,
            final DocumentTree tree) throws IOException {

        if (renameMap.isEmpty()) {
            return;
        }
        renameFiles(document, renameMap);

        for (final Map.Entry<String, List<Item>> entry
                : itemsByDocument.entrySet()) {
            final Document owner = tree.document(entry.getKey());
            for (final Item item : entry.getValue()) {
                final Item relinked = item.withLinksRenamed(renameMap);
                if (relinked == item) {
                    continue;
                }
                final String newUid = owner.prefix().equals(document.prefix())
                        ? renameMap.getOrDefault(item.uid(), item.uid())
                        : item.uid();
                store.write(owner, relinked.withUid(newUid));
            }
        }
    }

    private void renameFiles(final Document document,
            final Map<String, String> renameMap) throws IOException {

        final Map<String, Path> temps = new LinkedHashMap<>();
        final Set<String> finished = new HashSet<>();
        try {
            for (final String oldUid : renameMap.keySet()) {
                final Path temp = document.path().resolve(
                        AtomicFiles.TEMP_PREFIX + oldUid + ItemStore.EXTENSION);
                Files.move(store.itemPath(document, oldUid), temp,
                        StandardCopyOption.REPLACE_EXISTING);
                temps.put(oldUid, temp);
            }
            for (final Map.Entry<String, String> rename : renameMap.entrySet()) {
                Files.move(temps.get(rename.getKey()),
                        store.itemPath(document, rename.getValue()));
                finished.add(rename.getKey());
            }
        } catch (final IOException e) {
            restore(document, renameMap, temps, finished, e);
            throw e;
        }
    }

    /** Moves every already-moved file back to its old name. */
    private void restore(final Document document,
            final Map<String, String> renameMap, final Map<String, Path> temps,
            final Set<String> finished, final IOException failure) {
        for (final Map.Entry<String, Path> temp : temps.entrySet()) {
            final String oldUid = temp.getKey();
            final Path current = finished.contains(oldUid)
                    ? store.itemPath(document, renameMap.get(oldUid))
                    : temp.getValue();
            try {
                Files.move(current, store.itemPath(document, oldUid),
                        StandardCopyOption.REPLACE_EXISTING);
            } catch (final IOException e) {
                failure.addSuppressed(e);
            }
        }
    }

    private Map<String, List<Item>> loadAll(final DocumentTree tree)
            throws IOException {
        final Map<String, List<Item>> result = new LinkedHashMap<>();
        final List<String> unreadable = new ArrayList<>();
        for (final Document document : tree.documents()) {
            final ItemStore.DocumentItems loaded = store.readDocument(document);
            loaded.failures().forEach(f -> unreadable.add(f.file().toString()));
            result.put(document.prefix(), loaded.items());
        }
        if (!unreadable.isEmpty()) {
            throw new DomainException("Cannot renumber while item files are"
                    + " unreadable: " + String.join(", ", unreadable),
                    ItemParseException.CODE);
        }
        return result;
    }

    private static List<Item> sortedByNumber(final Document document,
            final List<Item> items) {
        final List<Item> sorted = new ArrayList<>(items);
        sorted.sort(Comparator
                .comparingLong((Item item) ->
                        UidAllocator.number(document, item.uid()))
                .thenComparing(Item::uid));
        return sorted;
    }

    private static void checkBrokenLinks(final List<Item> items,
            final Map<String, List<Item>> itemsByDocument) {
        final Set<String> known = new HashSet<>();
        itemsByDocument.values().forEach(list ->
                list.forEach(item -> known.add(item.uid())));

        final List<String> broken = new ArrayList<>();
        for (final Item item : items) {
            for (final String parent : item.parentUids()) {
                if (!known.contains(parent)) {
                    broken.add(item.uid() + " -> " + parent);
                }
            }
        }
        if (!broken.isEmpty()) {
            throw new DomainException("Broken links found: "
                    + String.join(", ", broken), BROKEN_LINKS);
        }
    }

}
