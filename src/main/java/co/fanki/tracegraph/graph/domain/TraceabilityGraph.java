package co.fanki.tracegraph.graph.domain;

import co.fanki.tracegraph.document.domain.DocumentHierarchy;
import co.fanki.tracegraph.item.domain.Item;
import co.fanki.tracegraph.shared.Preconditions;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Queue;
import java.util.Set;

/**
 * In-memory traceability graph of all items of a project.
 *
 * <p>Edges run from a child item to the parent items it links to.
 * {@link #parentsOf(String)} and {@link #childrenOf(String)} are kept
 * consistent with each other: adding an item again replaces its previous
 * edges. Links to uids that are not in the graph are kept as dangling
 * edges so validation can report them.</p>
 *
 * <p>The graph also mirrors the document hierarchy, which the validation
 * rules use to decide which links conform.</p>
 *
 * <p>Not thread-safe. Build it once, then treat it as read-only.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class TraceabilityGraph {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    /** Maps uid to item, in insertion order. */
    private final Map<String, Item> items = new LinkedHashMap<>();

    /** Maps child uid to the parent uids it links to. */
    private final Map<String, Set<String>> itemParents = new HashMap<>();

    /** Maps parent uid to the child uids linking to it. */
    private final Map<String, Set<String>> itemChildren = new HashMap<>();

    private final DocumentHierarchy documents = new DocumentHierarchy();

    // -- items -------------------------------------------------------------

    /**
     * Adds an item, replacing any item with the same uid and its edges.
     *
     * @param item the item to add
     */
    public void addItem(final Item item) {
        Preconditions.requireNonNull(item, "Item is required");
        dropOutgoingEdges(item.uid());

        items.put(item.uid(), item);
        final Set<String> parents = new LinkedHashSet<>(item.parentUids());
        itemParents.put(item.uid(), parents);
        for (final String parent : parents) {
            itemChildren.computeIfAbsent(parent, k -> new LinkedHashSet<>())
                    .add(item.uid());
        }
    }

    /**
     * Removes an item and its outgoing edges. Links from other items to
     * it remain, now dangling.
     *
     * @param uid the item uid
     * @return the removed item, or null if not found
     */
    public Item removeItem(final String uid) {
        final Item removed = items.remove(uid);
        if (removed != null) {
            dropOutgoingEdges(uid);
        }
        return removed;
    }

    /**
     * Finds an item by uid.
     *
     * @param uid the item uid
     * @return the item, or null if not found
     */
    public Item item(final String uid) {
        return items.get(uid);
    }

    public boolean contains(final String uid) {
        return uid != null && items.containsKey(uid);
    }

    /** Returns all items in insertion order. */
    public Collection<Item> items() {
        return Collections.unmodifiableCollection(items.values());
    }

    public Set<String> uids() {
        return Collections.unmodifiableSet(items.keySet());
    }

    public int itemCount() {
        return items.size();
    }

    // -- edges -------------------------------------------------------------

    /**
     * Returns the uids an item links to, including ones not in the graph.
     *
     * @param uid the child uid
     * @return unmodifiable set of parent uids, empty if unknown
     */
    public Set<String> parentsOf(final String uid) {
        return Collections.unmodifiableSet(
                itemParents.getOrDefault(uid, Set.of()));
    }

    /**
     * Returns the uids of the items linking to a uid. The uid itself
     * need not be in the graph.
     *
     * @param uid the parent uid
     * @return unmodifiable set of child uids
     */
    public Set<String> childrenOf(final String uid) {
        return Collections.unmodifiableSet(
                itemChildren.getOrDefault(uid, Set.of()));
    }

    /**
     * Returns the parent items present in the graph.
     *
     * @param uid the child uid
     * @return the parent items in link order
     */
    public List<Item> parentItems(final String uid) {
        return resolve(parentsOf(uid));
    }

    /**
     * Returns the items linking to a uid.
     *
     * @param uid the parent uid
     * @return the child items
     */
    public List<Item> childItems(final String uid) {
        return resolve(childrenOf(uid));
    }

    /**
     * Returns the items of a document that link to a uid.
     *
     * @param uid the parent uid
     * @param prefix the document prefix of the children
     * @return the child items in that document
     */
    public List<Item> childrenInDocument(final String uid,
            final String prefix) {
        final List<Item> result = new ArrayList<>();
        for (final Item child : childItems(uid)) {
            if (child.documentPrefix().equals(prefix)) {
                result.add(child);
            }
        }
        return result;
    }

    /**
     * Returns the items of a document that a uid links to.
     *
     * @param uid the child uid
     * @param prefix the document prefix of the parents
     * @return the parent items in that document
     */
    public List<Item> parentsInDocument(final String uid,
            final String prefix) {
        final List<Item> result = new ArrayList<>();
        for (final Item parent : parentItems(uid)) {
            if (parent.documentPrefix().equals(prefix)) {
                result.add(parent);
            }
        }
        return result;
    }

    /**
     * Returns every uid reachable upward from an item, nearest first.
     *
     * @param uid the starting uid
     * @return the ancestor uids, including dangling ones
     */
    public Set<String> ancestors(final String uid) {
        return traverse(uid, itemParents);
    }

    /**
     * Returns every uid reachable downward from an item, nearest first.
     *
     * @param uid the starting uid
     * @return the descendant uids
     */
    public Set<String> descendants(final String uid) {
        return traverse(uid, itemChildren);
    }

    /**
     * Returns the direct parents and children of an item.
     *
     * @param uid the item uid
     * @return the neighbour uids, parents first
     */
    public Set<String> neighbors(final String uid) {
        final Set<String> result = new LinkedHashSet<>(parentsOf(uid));
        result.addAll(childrenOf(uid));
        return Collections.unmodifiableSet(result);
    }

    // -- documents ---------------------------------------------------------

    /**
     * Registers a document and its parent documents.
     *
     * @param prefix the document prefix
     * @param parents the parent prefixes
     */
    public void setDocumentParents(final String prefix,
            final List<String> parents) {
        documents.put(prefix, parents);
    }

    public DocumentHierarchy documentHierarchy() {
        return documents;
    }

    public Set<String> documentPrefixes() {
        return documents.prefixes();
    }

    public List<String> rootDocuments() {
        return documents.roots();
    }

    public List<String> leafDocuments() {
        return documents.leaves();
    }

    /**
     * Returns the items of a document.
     *
     * @param prefix the document prefix
     * @return the items in insertion order
     */
    public List<Item> itemsInDocument(final String prefix) {
        final List<Item> result = new ArrayList<>();
        for (final Item item : items.values()) {
            if (item.documentPrefix().equals(prefix)) {
                result.add(item);
            }
        }
        return result;
    }

    // -- snapshot ----------------------------------------------------------

    /**
     * Serializes the graph to its JSON snapshot form.
     *
     * @return the JSON text
     */
    public String toJson() {
        final ObjectNode root = MAPPER.createObjectNode();

        final ObjectNode itemsObj = root.putObject("items");
        for (final Item item : items.values()) {
            itemsObj.set(item.uid(), ItemJson.toNode(item));
        }

        final ObjectNode parentsObj = root.putObject("item_parents");
        for (final String uid : items.keySet()) {
            final ArrayNode array = parentsObj.putArray(uid);
            parentsOf(uid).forEach(array::add);
        }

        final ObjectNode childrenObj = root.putObject("item_children");
        for (final String uid : items.keySet()) {
            final ArrayNode array = childrenObj.putArray(uid);
            childrenOf(uid).forEach(array::add);
        }

        final ObjectNode documentsObj = root.putObject("document_parents");
        for (final String prefix : documents.prefixes()) {
            final ArrayNode array = documentsObj.putArray(prefix);
            documents.parents(prefix).forEach(array::add);
        }

        try {
            return MAPPER.writeValueAsString(root);
        } catch (final JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize graph", e);
        }
    }

    /**
     * Rebuilds a graph from its JSON snapshot form. Edges are derived
     * from the items' links.
     *
     * @param json the JSON text
     * @return the graph
     */
    public static TraceabilityGraph fromJson(final String json) {
        Preconditions.requireNonBlank(json, "JSON is required");

        final JsonNode root;
        try {
            root = MAPPER.readTree(json);
        } catch (final JsonProcessingException e) {
            throw new IllegalArgumentException("Invalid graph JSON", e);
        }

        final TraceabilityGraph graph = new TraceabilityGraph();

        final Iterator<Map.Entry<String, JsonNode>> documentFields =
                root.path("document_parents").fields();
        while (documentFields.hasNext()) {
            final Map.Entry<String, JsonNode> entry = documentFields.next();
            final List<String> parents = new ArrayList<>();
            entry.getValue().forEach(p -> parents.add(p.asText()));
            graph.setDocumentParents(entry.getKey(), parents);
        }

        for (final JsonNode itemNode : root.path("items")) {
            graph.addItem(ItemJson.fromNode(itemNode));
        }
        return graph;
    }

    private void dropOutgoingEdges(final String uid) {
        final Set<String> oldParents = itemParents.remove(uid);
        if (oldParents == null) {
            return;
        }
        for (final String parent : oldParents) {
            final Set<String> children = itemChildren.get(parent);
            if (children != null) {
                children.remove(uid);
                if (children.isEmpty()) {
                    itemChildren.remove(parent);
                }
            }
        }
    }

    private List<Item> resolve(final Collection<String> uids) {
        final List<Item> result = new ArrayList<>();
        for (final String uid : uids) {
            final Item item = items.get(uid);
            if (item != null) {
                result.add(item);
            }
        }
        return result;
    }

    private static Set<String> traverse(final String start,
            final Map<String, Set<String>> edges) {
        final Set<String> visited = new LinkedHashSet<>();
        final Queue<String> queue = new ArrayDeque<>(
                edges.getOrDefault(start, Set.of()));

        while (!queue.isEmpty()) {
            final String current = queue.poll();
            if (current.equals(start) || !visited.add(current)) {
                continue;
            }
            queue.addAll(edges.getOrDefault(current, Set.of()));
        }
        return Collections.unmodifiableSet(visited);
    }

}
