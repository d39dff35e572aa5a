package co.fanki.tracegraph.document.domain;

import co.fanki.tracegraph.shared.Preconditions;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * The directed graph of parent relations between documents.
 *
 * <p>Nodes are document prefixes; each node lists its parent prefixes in
 * declaration order. Parents that are not themselves registered are kept
 * as declared and reported by {@link #unknownParents()}, but they never
 * count as ordering dependencies.</p>
 *
 * <p>All traversals use explicit worklists, so a cyclic relation cannot
 * cause unbounded recursion.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class DocumentHierarchy {

    /** Maps prefix to its declared parent prefixes. */
    private final Map<String, List<String>> parents = new LinkedHashMap<>();

    /**
     * Registers a new document.
     *
     * @param prefix the document prefix
     * @param parentPrefixes the parent prefixes, empty for a root
     * @throws DiscoveryException if the prefix is already registered
     */
    public void add(final String prefix, final List<String> parentPrefixes) {
        Preconditions.requireNonBlank(prefix, "Document prefix is required");
        if (parents.containsKey(prefix)) {
            throw DiscoveryException.duplicatePrefix(prefix,
                    "an earlier document", "a later document");
        }
        put(prefix, parentPrefixes);
    }

    /**
     * Registers a document, replacing any parents it already had.
     *
     * @param prefix the document prefix
     * @param parentPrefixes the parent prefixes, empty for a root
     */
    public void put(final String prefix, final List<String> parentPrefixes) {
        Preconditions.requireNonBlank(prefix, "Document prefix is required");
        final Set<String> unique = new LinkedHashSet<>();
        if (parentPrefixes != null) {
            unique.addAll(parentPrefixes);
        }
        parents.put(prefix, List.copyOf(unique));
    }

    /**
     * Removes a document. Documents that declared it as a parent keep the
     * declaration, which then shows up in {@link #unknownParents()}.
     *
     * @param prefix the document prefix
     * @return true if the document was registered
     */
    public boolean remove(final String prefix) {
        return parents.remove(prefix) != null;
    }

    public boolean contains(final String prefix) {
        return prefix != null && parents.containsKey(prefix);
    }

    public int size() {
        return parents.size();
    }

    /**
     * Returns all registered prefixes in registration order.
     *
     * @return unmodifiable set of prefixes
     */
    public Set<String> prefixes() {
        return Collections.unmodifiableSet(parents.keySet());
    }

    /**
     * Returns the declared parents of a document.
     *
     * @param prefix the document prefix
     * @return the parent prefixes, empty if unknown or root
     */
    public List<String> parents(final String prefix) {
        return parents.getOrDefault(prefix, List.of());
    }

    /**
     * Returns the documents that declare the given one as a parent.
     *
     * @param prefix the document prefix
     * @return the child prefixes in registration order
     */
    public List<String> children(final String prefix) {
        final List<String> result = new ArrayList<>();
        for (final Map.Entry<String, List<String>> entry : parents.entrySet()) {
            if (entry.getValue().contains(prefix)) {
                result.add(entry.getKey());
            }
        }
        return Collections.unmodifiableList(result);
    }

    /**
     * Returns the documents that declare no parents.
     *
     * @return root prefixes in registration order
     */
    public List<String> roots() {
        final List<String> result = new ArrayList<>();
        for (final Map.Entry<String, List<String>> entry : parents.entrySet()) {
            if (entry.getValue().isEmpty()) {
                result.add(entry.getKey());
            }
        }
        return Collections.unmodifiableList(result);
    }

    /**
     * Returns the documents that no other document declares as a parent.
     *
     * @return leaf prefixes in registration order
     */
    public List<String> leaves() {
        final Set<String> referenced = new HashSet<>();
        for (final List<String> declared : parents.values()) {
            referenced.addAll(declared);
        }
        final List<String> result = new ArrayList<>();
        for (final String prefix : parents.keySet()) {
            if (!referenced.contains(prefix)) {
                result.add(prefix);
            }
        }
        return Collections.unmodifiableList(result);
    }

    /**
     * Checks if no other document declares the given one as a parent.
     *
     * @param prefix the document prefix
     * @return true if the document has no children
     */
    public boolean isLeaf(final String prefix) {
        for (final List<String> declared : parents.values()) {
            if (declared.contains(prefix)) {
                return false;
            }
        }
        return true;
    }

    /**
     * Returns every registered document reachable by following parent
     * declarations upward, nearest first.
     *
     * @param prefix the document prefix
     * @return the ancestor prefixes, excluding the document itself unless
     *         it lies on a cycle
     */
    public Set<String> ancestors(final String prefix) {
        final Set<String> visited = new LinkedHashSet<>();
        final Deque<String> worklist = new ArrayDeque<>(parents(prefix));

        while (!worklist.isEmpty()) {
            final String current = worklist.poll();
            if (!parents.containsKey(current) || !visited.add(current)) {
                continue;
            }
            worklist.addAll(parents(current));
        }
        return Collections.unmodifiableSet(visited);
    }

    /**
     * Returns every registered document that reaches the given one by
     * following parent declarations, nearest first.
     *
     * @param prefix the document prefix
     * @return the descendant prefixes
     */
    public Set<String> descendants(final String prefix) {
        final Map<String, List<String>> childIndex = childIndex();
        final Set<String> visited = new LinkedHashSet<>();
        final Deque<String> worklist = new ArrayDeque<>(
                childIndex.getOrDefault(prefix, List.of()));

        while (!worklist.isEmpty()) {
            final String current = worklist.poll();
            if (!visited.add(current)) {
                continue;
            }
            worklist.addAll(childIndex.getOrDefault(current, List.of()));
        }
        return Collections.unmodifiableSet(visited);
    }

    /**
     * Checks if one document is an ancestor of another.
     *
     * @param candidate the possible ancestor prefix
     * @param prefix the descendant prefix
     * @return true if candidate is reachable upward from prefix
     */
    public boolean isAncestor(final String candidate, final String prefix) {
        return ancestors(prefix).contains(candidate);
    }

    /**
     * Returns declared parents that are not registered documents.
     *
     * @return map of prefix to its unknown parents, only for documents
     *         that have any
     */
    public Map<String, List<String>> unknownParents() {
        final Map<String, List<String>> result = new LinkedHashMap<>();
        for (final Map.Entry<String, List<String>> entry : parents.entrySet()) {
            final List<String> missing = new ArrayList<>();
            for (final String parent : entry.getValue()) {
                if (!parents.containsKey(parent)) {
                    missing.add(parent);
                }
            }
            if (!missing.isEmpty()) {
                result.put(entry.getKey(), List.copyOf(missing));
            }
        }
        return Collections.unmodifiableMap(result);
    }

    /**
     * Orders the documents parents-first with Kahn's algorithm.
     *
     * <p>Documents whose parents are all processed become eligible;
     * eligible documents are taken in ascending prefix order, so the
     * result is deterministic. Whatever remains unprocessed is split into
     * the prefixes lying on a cycle and those merely downstream of one.</p>
     *
     * @return the sort outcome
     */
    public TopologicalSort sort() {
        final Map<String, Integer> inDegree = new HashMap<>();
        final Map<String, List<String>> childIndex = childIndex();

        for (final Map.Entry<String, List<String>> entry : parents.entrySet()) {
            int degree = 0;
            for (final String parent : entry.getValue()) {
                if (parents.containsKey(parent)) {
                    degree++;
                }
            }
            inDegree.put(entry.getKey(), degree);
        }

        final TreeSet<String> ready = new TreeSet<>();
        for (final Map.Entry<String, Integer> entry : inDegree.entrySet()) {
            if (entry.getValue() == 0) {
                ready.add(entry.getKey());
            }
        }

        final List<String> order = new ArrayList<>();
        while (!ready.isEmpty()) {
            final String node = ready.pollFirst();
            order.add(node);
            for (final String child : childIndex.getOrDefault(node, List.of())) {
                final int remaining = inDegree.merge(child, -1, Integer::sum);
                if (remaining == 0) {
                    ready.add(child);
                }
            }
        }

        final Set<String> unprocessed = new HashSet<>(parents.keySet());
        order.forEach(unprocessed::remove);

        final SortedSet<String> cyclic = new TreeSet<>();
        final SortedSet<String> blocked = new TreeSet<>();
        for (final String prefix : unprocessed) {
            if (reachesItself(prefix, unprocessed)) {
                cyclic.add(prefix);
            } else {
                blocked.add(prefix);
            }
        }

        return new TopologicalSort(List.copyOf(order),
                Collections.unmodifiableSortedSet(cyclic),
                Collections.unmodifiableSortedSet(blocked));
    }

    /**
     * Returns the parents-first order of all documents.
     *
     * @return every prefix, parents strictly before children
     * @throws DiscoveryException if the relation contains a cycle
     */
    public List<String> topologicalOrder() {
        final TopologicalSort result = sort();
        if (!result.isAcyclic()) {
            throw DiscoveryException.cycle(result.cyclicPrefixes());
        }
        return result.order();
    }

    /** Maps each registered prefix to its registered children. */
    private Map<String, List<String>> childIndex() {
        final Map<String, List<String>> index = new HashMap<>();
        for (final Map.Entry<String, List<String>> entry : parents.entrySet()) {
            for (final String parent : entry.getValue()) {
                if (parents.containsKey(parent)) {
                    index.computeIfAbsent(parent, k -> new ArrayList<>())
                            .add(entry.getKey());
                }
            }
        }
        return index;
    }

    private boolean reachesItself(final String start, final Set<String> scope) {
        final Set<String> visited = new HashSet<>();
        final Deque<String> worklist = new ArrayDeque<>(parents(start));

        while (!worklist.isEmpty()) {
            final String current = worklist.poll();
            if (current.equals(start)) {
                return true;
            }
            if (!scope.contains(current) || !visited.add(current)) {
                continue;
            }
            worklist.addAll(parents(current));
        }
        return false;
    }

}
