package co.fanki.tracegraph.document.domain;

import java.util.List;
import java.util.SortedSet;

/**
 * Outcome of ordering a document hierarchy.
 *
 * @param order the prefixes that could be ordered, parents first
 * @param cyclicPrefixes the prefixes lying on at least one cycle
 * @param blockedPrefixes prefixes not on a cycle that could not be
 *        ordered because they descend from one
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record TopologicalSort(
        List<String> order,
        SortedSet<String> cyclicPrefixes,
        SortedSet<String> blockedPrefixes) {

    /** Checks if every document was ordered. */
    public boolean isAcyclic() {
        return cyclicPrefixes.isEmpty();
    }
}
