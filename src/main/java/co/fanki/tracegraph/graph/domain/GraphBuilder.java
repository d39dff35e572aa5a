package co.fanki.tracegraph.graph.domain;

import co.fanki.tracegraph.document.domain.DiscoveryException;
import co.fanki.tracegraph.document.domain.Document;
import co.fanki.tracegraph.document.domain.DocumentDiscovery;
import co.fanki.tracegraph.document.domain.DocumentTree;
import co.fanki.tracegraph.issue.domain.IssueCode;
import co.fanki.tracegraph.issue.domain.ValidationIssue;
import co.fanki.tracegraph.item.domain.Item;
import co.fanki.tracegraph.item.domain.ItemStore;
import co.fanki.tracegraph.shared.Preconditions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;

/**
 * Loads a project into a {@link TraceabilityGraph}.
 *
 * <p>Documents are loaded parents first, in the order given by their
 * hierarchy. A cyclic hierarchy stops the build before any item is read.
 * Unreadable configuration files and item files do not: each becomes an
 * error issue on the result and the build carries on.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class GraphBuilder {

    private static final Logger LOG = LoggerFactory.getLogger(GraphBuilder.class);

    /**
     * The outcome of a build.
     *
     * @param graph the assembled graph
     * @param tree the discovered documents
     * @param issues problems met while loading
     */
    public record BuildResult(TraceabilityGraph graph, DocumentTree tree,
            List<ValidationIssue> issues) {}

    private final DocumentDiscovery discovery;
    private final ItemStore store;

    /**
     * Creates a builder.
     *
     * @param theDiscovery finds the documents under a root
     * @param theStore reads the item files
     */
    public GraphBuilder(final DocumentDiscovery theDiscovery,
            final ItemStore theStore) {
        this.discovery = Preconditions.requireNonNull(theDiscovery,
                "Document discovery is required");
        this.store = Preconditions.requireNonNull(theStore,
                "Item store is required");
    }

    /**
     * Discovers the documents under a root without loading items.
     *
     * @param root the project root
     * @return the discovered documents
     * @throws IOException if the file system cannot be read
     * @throws DiscoveryException on a duplicate prefix
     */
    public DocumentTree discover(final Path root) throws IOException {
        return discovery.discover(root);
    }

    /**
     * Discovers and loads every document under a root.
     *
     * @param root the project root
     * @return the build result
     * @throws IOException if the file system cannot be read
     * @throws DiscoveryException on a duplicate prefix or document cycle
     */
    public BuildResult build(final Path root) throws IOException {
        return build(discovery.discover(root));
    }

    /**
     * Loads every document of a tree.
     *
     * @param tree the discovered documents
     * @return the build result
     * @throws IOException if the file system cannot be read
     * @throws DiscoveryException on a document cycle
     */
    public BuildResult build(final DocumentTree tree) throws IOException {
        return build(tree, null);
    }

    /**
     * Loads some documents of a tree. The graph's document hierarchy
     * always holds every document.
     *
     * @param tree the discovered documents
     * @param prefixFilter the prefixes whose items are loaded, or null
     *        for all
     * @return the build result
     * @throws IOException if the file system cannot be read
     * @throws DiscoveryException on a document cycle
     */
    public BuildResult build(final DocumentTree tree,
            final Set<String> prefixFilter) throws IOException {

        Preconditions.requireNonNull(tree, "Document tree is required");

        final List<String> order = tree.hierarchy().topologicalOrder();
        LOG.debug("Document load order: {}", order);

        final TraceabilityGraph graph = new TraceabilityGraph();
        final List<ValidationIssue> issues = new ArrayList<>();

        for (final DocumentTree.ConfigProblem problem : tree.problems()) {
            issues.add(ValidationIssue.error(problem.configFile().toString(),
                    IssueCode.DOCUMENT_CONFIG_INVALID, problem.message()));
        }

        for (final String prefix : order) {
            final Document document = tree.document(prefix);
            graph.setDocumentParents(prefix, document.parents());

            if (prefixFilter != null && !prefixFilter.contains(prefix)) {
                continue;
            }

            final ItemStore.DocumentItems loaded = store.readDocument(document);
            for (final Item item : loaded.items()) {
                graph.addItem(item);
            }
            for (final ItemStore.ItemLoadFailure failure : loaded.failures()) {
                issues.add(ValidationIssue.error(failure.uid(),
                        IssueCode.ITEM_PARSE_FAILED, failure.message()));
            }
        }

        LOG.info("Built traceability graph: {} documents, {} items,"
                + " {} load issues", order.size(), graph.itemCount(),
                issues.size());

        return new BuildResult(graph, tree,
                Collections.unmodifiableList(issues));
    }

}
