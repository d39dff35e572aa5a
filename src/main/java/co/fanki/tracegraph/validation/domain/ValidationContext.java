package co.fanki.tracegraph.validation.domain;

import co.fanki.tracegraph.document.domain.DocumentHierarchy;
import co.fanki.tracegraph.graph.domain.TraceabilityGraph;
import co.fanki.tracegraph.item.domain.Item;
import co.fanki.tracegraph.shared.Preconditions;

import java.util.ArrayList;
import java.util.List;

/**
 * What a validation check looks at: the graph and the options in force.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class ValidationContext {

    private final TraceabilityGraph graph;
    private final ValidationOptions options;

    /**
     * Creates a context.
     *
     * @param theGraph the graph under validation, never mutated
     * @param theOptions the options in force
     */
    public ValidationContext(final TraceabilityGraph theGraph,
            final ValidationOptions theOptions) {
        this.graph = Preconditions.requireNonNull(theGraph, "Graph is required");
        this.options = Preconditions.requireNonNull(theOptions,
                "Options are required");
    }

    public TraceabilityGraph graph() {
        return graph;
    }

    public ValidationOptions options() {
        return options;
    }

    public DocumentHierarchy hierarchy() {
        return graph.documentHierarchy();
    }

    /**
     * Returns the items subject to item checks: every item outside the
     * skipped documents, active or not.
     *
     * @return the items in graph order
     */
    public List<Item> items() {
        final List<Item> result = new ArrayList<>();
        for (final Item item : graph.items()) {
            if (!options.isSkipped(item.documentPrefix())) {
                result.add(item);
            }
        }
        return result;
    }

    /**
     * Returns the active items subject to item checks.
     *
     * @return the active items in graph order
     */
    public List<Item> activeItems() {
        final List<Item> result = new ArrayList<>();
        for (final Item item : items()) {
            if (item.isActive()) {
                result.add(item);
            }
        }
        return result;
    }

    /**
     * Returns the active requirements subject to item checks.
     *
     * @return the active normative items in graph order
     */
    public List<Item> activeRequirements() {
        final List<Item> result = new ArrayList<>();
        for (final Item item : activeItems()) {
            if (item.isNormative()) {
                result.add(item);
            }
        }
        return result;
    }

    /**
     * Returns the documents subject to document checks.
     *
     * @return the prefixes not skipped, in hierarchy order
     */
    public List<String> documents() {
        final List<String> result = new ArrayList<>();
        for (final String prefix : hierarchy().prefixes()) {
            if (!options.isSkipped(prefix)) {
                result.add(prefix);
            }
        }
        return result;
    }

}
