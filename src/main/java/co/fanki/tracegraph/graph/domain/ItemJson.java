package co.fanki.tracegraph.graph.domain;

import co.fanki.tracegraph.item.domain.Item;
import co.fanki.tracegraph.item.domain.ItemType;
import co.fanki.tracegraph.item.domain.Link;
import co.fanki.tracegraph.shared.Preconditions;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Iterator;
import java.util.Map;

/**
 * JSON snapshot form of an item, as read by test-run tooling.
 *
 * <p>Field names are snake_case. Links are split into the list of parent
 * uids ({@code links}) and the stored hashes of the verified ones
 * ({@code link_hashes}).</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class ItemJson {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private ItemJson() {
    }

    /**
     * Converts an item to its snapshot node.
     *
     * @param item the item
     * @return the JSON object
     */
    public static ObjectNode toNode(final Item item) {
        Preconditions.requireNonNull(item, "Item is required");

        final ObjectNode node = MAPPER.createObjectNode();
        node.put("uid", item.uid());
        node.put("text", item.text());
        node.put("document_prefix", item.documentPrefix());
        node.put("active", item.isActive());
        node.put("type", item.type().wireName());
        if (item.header() != null) {
            node.put("header", item.header());
        } else {
            node.putNull("header");
        }

        final ArrayNode links = node.putArray("links");
        final ObjectNode hashes = node.putObject("link_hashes");
        for (final Link link : item.links()) {
            links.add(link.parentUid());
            link.storedHash().ifPresent(h -> hashes.put(link.parentUid(), h));
        }

        if (item.isReviewed()) {
            node.put("reviewed", item.reviewed().orElseThrow());
        } else {
            node.putNull("reviewed");
        }
        node.put("derived", item.isDerived());
        node.put("testable", item.isTestable());

        final ObjectNode custom = node.putObject("custom_attributes");
        item.customAttributes().forEach(custom::set);
        return node;
    }

    /**
     * Converts an item to a JSON string.
     *
     * @param item the item
     * @return the JSON text
     */
    public static String toJson(final Item item) {
        try {
            return MAPPER.writeValueAsString(toNode(item));
        } catch (final JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize item "
                    + item.uid(), e);
        }
    }

    /**
     * Reads an item from its snapshot node.
     *
     * @param node the JSON object
     * @return the item
     */
    public static Item fromNode(final JsonNode node) {
        Preconditions.require(node != null && node.isObject(),
                "Item JSON must be an object");

        final Item.Builder builder = Item.builder(
                node.path("uid").asText(null),
                node.path("document_prefix").asText(null));

        builder.text(node.path("text").asText(""));
        builder.header(textOrNull(node.get("header")));
        final ItemType type = ItemType.parse(node.path("type")
                .asText("requirement"));
        Preconditions.require(type != null, "Unknown item type in JSON: "
                + node.path("type").asText());
        builder.type(type);
        builder.active(node.path("active").asBoolean(true));
        builder.derived(node.path("derived").asBoolean(false));
        builder.testable(node.path("testable").asBoolean(true));
        builder.reviewed(textOrNull(node.get("reviewed")));

        final JsonNode hashes = node.path("link_hashes");
        for (final JsonNode link : node.path("links")) {
            final String parentUid = link.asText();
            builder.link(Link.of(parentUid, textOrNull(hashes.get(parentUid))));
        }

        final JsonNode custom = node.path("custom_attributes");
        final Iterator<Map.Entry<String, JsonNode>> fields = custom.fields();
        while (fields.hasNext()) {
            final Map.Entry<String, JsonNode> field = fields.next();
            builder.customAttribute(field.getKey(), field.getValue());
        }
        return builder.build();
    }

    private static String textOrNull(final JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        return node.asText();
    }

}
