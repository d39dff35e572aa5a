package co.fanki.tracegraph.document.domain;

import co.fanki.tracegraph.shared.Preconditions;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The documents found under one project root, their hierarchy, and the
 * configuration files that could not be read.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class DocumentTree {

    /**
     * A configuration file that was skipped.
     *
     * @param configFile the offending file
     * @param message why it was rejected
     */
    public record ConfigProblem(Path configFile, String message) {}

    private final Path root;
    private final Map<String, Document> documents = new LinkedHashMap<>();
    private final DocumentHierarchy hierarchy = new DocumentHierarchy();
    private final List<ConfigProblem> problems = new ArrayList<>();

    /**
     * Creates an empty tree.
     *
     * @param theRoot the project root directory
     */
    public DocumentTree(final Path theRoot) {
        this.root = Preconditions.requireNonNull(theRoot, "Root is required");
    }

    /**
     * Registers a document.
     *
     * @param document the document
     * @throws DiscoveryException if another document has the same prefix
     */
    public void add(final Document document) {
        Preconditions.requireNonNull(document, "Document is required");
        final Document existing = documents.get(document.prefix());
        if (existing != null) {
            throw DiscoveryException.duplicatePrefix(document.prefix(),
                    existing.configFile(), document.configFile());
        }
        hierarchy.add(document.prefix(), document.parents());
        documents.put(document.prefix(), document);
    }

    /**
     * Replaces a registered document, e.g. after reconfiguring its parents.
     *
     * @param document the new version of the document
     */
    public void replace(final Document document) {
        Preconditions.require(documents.containsKey(document.prefix()),
                "Unknown document " + document.prefix());
        hierarchy.put(document.prefix(), document.parents());
        documents.put(document.prefix(), document);
    }

    /**
     * Removes a document from the tree.
     *
     * @param prefix the document prefix
     * @return the removed document, or null if not found
     */
    public Document remove(final String prefix) {
        hierarchy.remove(prefix);
        return documents.remove(prefix);
    }

    /**
     * Records a configuration file that could not be read.
     *
     * @param configFile the file
     * @param message the reason
     */
    public void addProblem(final Path configFile, final String message) {
        problems.add(new ConfigProblem(configFile, message));
    }

    public Path root() {
        return root;
    }

    /**
     * Finds a document by prefix.
     *
     * @param prefix the document prefix
     * @return the document, or null if not found
     */
    public Document document(final String prefix) {
        return documents.get(prefix);
    }

    public boolean contains(final String prefix) {
        return documents.containsKey(prefix);
    }

    /**
     * Finds the document owning a uid.
     *
     * @param uid the item uid
     * @return the owning document, or null if no document matches
     */
    public Document documentFor(final String uid) {
        for (final Document document : documents.values()) {
            if (document.owns(uid)) {
                return document;
            }
        }
        return null;
    }

    public Collection<Document> documents() {
        return Collections.unmodifiableCollection(documents.values());
    }

    public DocumentHierarchy hierarchy() {
        return hierarchy;
    }

    public List<ConfigProblem> problems() {
        return Collections.unmodifiableList(problems);
    }

    public int size() {
        return documents.size();
    }

}
