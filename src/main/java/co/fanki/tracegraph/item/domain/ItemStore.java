package co.fanki.tracegraph.item.domain;

import co.fanki.tracegraph.document.domain.Document;
import co.fanki.tracegraph.shared.AtomicFiles;
import co.fanki.tracegraph.shared.DomainException;
import co.fanki.tracegraph.shared.Preconditions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Reads and writes the item files of a document, one
 * {@code <UID>.yml} file per item in the document directory.
 *
 * <p>Writes are atomic per file. An item file that cannot be parsed does
 * not stop a document from loading; it is reported as an
 * {@link ItemLoadFailure} next to the items that did load.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class ItemStore {

    private static final Logger LOG = LoggerFactory.getLogger(ItemStore.class);

    /** Extension of item files. */
    public static final String EXTENSION = ".yml";

    /** Raised when a requested item file does not exist. */
    public static final String ITEM_NOT_FOUND = "ITEM_NOT_FOUND";

    /**
     * An item file that could not be parsed.
     *
     * @param uid the uid taken from the file name
     * @param file the item file
     * @param message why parsing failed
     */
    public record ItemLoadFailure(String uid, Path file, String message) {}

    /**
     * The outcome of loading one document.
     *
     * @param items the items that loaded, sorted by file name
     * @param failures the files that could not be parsed
     */
    public record DocumentItems(List<Item> items,
            List<ItemLoadFailure> failures) {}

    /**
     * Loads every item of a document, active or not.
     *
     * @param document the document
     * @return the loaded items and the per-file failures
     * @throws IOException if the directory or a file cannot be read
     */
    public DocumentItems readDocument(final Document document)
            throws IOException {
        Preconditions.requireNonNull(document, "Document is required");

        final List<Item> items = new ArrayList<>();
        final List<ItemLoadFailure> failures = new ArrayList<>();

        for (final Path file : itemFiles(document)) {
            final String uid = uidOf(file);
            try {
                items.add(ItemCodec.decode(uid, document.prefix(),
                        Files.readAllBytes(file)));
            } catch (final ItemParseException e) {
                LOG.warn("Could not parse item file {}: {}", file,
                        e.getMessage());
                failures.add(new ItemLoadFailure(uid, file, e.reason()));
            }
        }

        LOG.debug("Loaded {} items from document {} ({} failures)",
                items.size(), document.prefix(), failures.size());

        return new DocumentItems(Collections.unmodifiableList(items),
                Collections.unmodifiableList(failures));
    }

    /**
     * Lists the item files of a document, sorted by name.
     *
     * @param document the document
     * @return the files whose names match the document's uid pattern
     * @throws IOException if the directory cannot be listed
     */
    public List<Path> itemFiles(final Document document) throws IOException {
        if (!Files.isDirectory(document.path())) {
            return List.of();
        }
        final Pattern pattern = document.uidPattern();
        try (Stream<Path> files = Files.list(document.path())) {
            return files
                    .filter(Files::isRegularFile)
                    .filter(f -> f.getFileName().toString().endsWith(EXTENSION))
                    .filter(f -> pattern.matcher(uidOf(f)).matches())
                    .sorted()
                    .collect(Collectors.toList());
        }
    }

    /**
     * Lists the uids present in a document directory.
     *
     * @param document the document
     * @return the uids, sorted
     * @throws IOException if the directory cannot be listed
     */
    public List<String> uids(final Document document) throws IOException {
        final List<String> result = new ArrayList<>();
        for (final Path file : itemFiles(document)) {
            result.add(uidOf(file));
        }
        return result;
    }

    /**
     * Reads a single item.
     *
     * @param document the owning document
     * @param uid the item uid
     * @return the item
     * @throws IOException if the file cannot be read
     * @throws DomainException if the item does not exist
     * @throws ItemParseException if the file is not a valid item
     */
    public Item read(final Document document, final String uid)
            throws IOException {
        final Path file = itemPath(document, uid);
        if (!Files.isRegularFile(file)) {
            throw new DomainException("Item not found: " + uid,
                    ITEM_NOT_FOUND);
        }
        return ItemCodec.decode(uid, document.prefix(),
                Files.readAllBytes(file));
    }

    /**
     * Writes an item with stored link hashes.
     *
     * @param document the owning document
     * @param item the item
     * @throws IOException if the file cannot be written
     */
    public void write(final Document document, final Item item)
            throws IOException {
        write(document, item, LinkEncoding.WITH_HASHES);
    }

    /**
     * Writes an item atomically.
     *
     * @param document the owning document
     * @param item the item
     * @param encoding how links are written
     * @throws IOException if the file cannot be written
     */
    public void write(final Document document, final Item item,
            final LinkEncoding encoding) throws IOException {
        Preconditions.requireNonNull(item, "Item is required");
        Preconditions.require(document.prefix().equals(item.documentPrefix()),
                "Item " + item.uid() + " does not belong to document "
                        + document.prefix());
        AtomicFiles.write(itemPath(document, item.uid()),
                ItemCodec.encode(item, encoding));
        LOG.debug("Wrote item {}", item.uid());
    }

    /**
     * Deletes an item file.
     *
     * @param document the owning document
     * @param uid the item uid
     * @return true if the file existed
     * @throws IOException if the file cannot be deleted
     */
    public boolean delete(final Document document, final String uid)
            throws IOException {
        return Files.deleteIfExists(itemPath(document, uid));
    }

    /**
     * Allocates the next uid of a document from the files on disk.
     *
     * @param document the document
     * @return the new uid
     * @throws IOException if the directory cannot be listed
     */
    public String nextUid(final Document document) throws IOException {
        return UidAllocator.next(document, uids(document));
    }

    /**
     * Resolves the file of an item.
     *
     * @param document the owning document
     * @param uid the item uid
     * @return the item file path
     */
    public Path itemPath(final Document document, final String uid) {
        Preconditions.requireNonNull(document, "Document is required");
        Preconditions.requireNonBlank(uid, "Item uid is required");
        return document.path().resolve(uid + EXTENSION);
    }

    private static String uidOf(final Path file) {
        final String name = file.getFileName().toString();
        return name.substring(0, name.length() - EXTENSION.length()).trim();
    }

}
