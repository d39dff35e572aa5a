package co.fanki.tracegraph.item.domain;

import co.fanki.tracegraph.shared.Preconditions;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.dataformat.yaml.YAMLGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Iterator;
import java.util.Map;
import java.util.Set;

/**
 * Converts between item files and {@link Item} values.
 *
 * <p>Links are read in either form, a bare {@code - UID} or a single
 * entry map {@code - UID: hash}. A stored hash that does not look like a
 * content hash is dropped with a warning and the link stays
 * unverified.</p>
 *
 * <p>Keys are written in a fixed order ({@code header}, {@code active},
 * {@code type}, {@code links}, {@code text}, {@code reviewed}, then
 * {@code derived} and {@code testable} only when they differ from their
 * defaults), followed by the custom attributes in their original
 * order. Multi-line strings use the YAML literal block style.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class ItemCodec {

    private static final Logger LOG = LoggerFactory.getLogger(ItemCodec.class);

    private static final ObjectMapper MAPPER = new ObjectMapper(
            YAMLFactory.builder()
                    .disable(YAMLGenerator.Feature.WRITE_DOC_START_MARKER)
                    .enable(YAMLGenerator.Feature.LITERAL_BLOCK_STYLE)
                    .build());

    /** Keys interpreted by the model; everything else is custom. */
    private static final Set<String> STANDARD_KEYS = Set.of("active", "type",
            "text", "header", "links", "reviewed", "derived", "testable");

    private ItemCodec() {
    }

    /**
     * Decodes an item file.
     *
     * @param uid the item uid, taken from the file name
     * @param documentPrefix the owning document's prefix
     * @param content the raw file content
     * @return the item
     * @throws ItemParseException if the content is not a valid item
     */
    public static Item decode(final String uid, final String documentPrefix,
            final byte[] content) {

        Preconditions.requireNonBlank(uid, "Item uid is required");
        Preconditions.requireNonNull(content, "Content is required");

        final JsonNode root;
        try {
            root = MAPPER.readTree(content);
        } catch (final IOException e) {
            throw new ItemParseException(uid, "Invalid YAML", e);
        }

        final Item.Builder builder = Item.builder(uid, documentPrefix);

        if (root == null || root.isMissingNode() || root.isNull()) {
            return builder.build();
        }
        if (!root.isObject()) {
            throw new ItemParseException(uid,
                    "Item file must contain a mapping");
        }

        builder.text(readString(uid, root, "text", ""));
        builder.header(readString(uid, root, "header", null));
        builder.type(readType(uid, root.get("type")));
        builder.active(readFlag(uid, root, "active", true));
        builder.derived(readFlag(uid, root, "derived", false));
        builder.testable(readFlag(uid, root, "testable", true));
        readLinks(uid, root.get("links"), builder);
        builder.reviewed(readReviewed(uid, root.get("reviewed")));

        final Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
        while (fields.hasNext()) {
            final Map.Entry<String, JsonNode> field = fields.next();
            if (STANDARD_KEYS.contains(field.getKey())) {
                continue;
            }
            if (field.getKey().isBlank()) {
                throw new ItemParseException(uid, "Blank attribute name");
            }
            builder.customAttribute(field.getKey(), field.getValue());
        }

        try {
            return builder.build();
        } catch (final IllegalArgumentException e) {
            throw new ItemParseException(uid, e.getMessage(), e);
        }
    }

    /**
     * Encodes an item with stored link hashes.
     *
     * @param item the item
     * @return the file content
     */
    public static byte[] encode(final Item item) {
        return encode(item, LinkEncoding.WITH_HASHES);
    }

    /**
     * Encodes an item.
     *
     * @param item the item
     * @param encoding how links are written
     * @return the file content
     */
    public static byte[] encode(final Item item, final LinkEncoding encoding) {
        Preconditions.requireNonNull(item, "Item is required");
        Preconditions.requireNonNull(encoding, "Link encoding is required");

        final ObjectNode root = MAPPER.createObjectNode();
        if (item.header() != null) {
            root.put("header", item.header());
        }
        root.put("active", item.isActive());
        root.put("type", item.type().wireName());

        final ArrayNode links = root.putArray("links");
        for (final Link link : item.links()) {
            if (encoding == LinkEncoding.WITH_HASHES && link.isVerified()) {
                links.addObject().put(link.parentUid(),
                        link.storedHash().orElseThrow());
            } else {
                links.add(link.parentUid());
            }
        }

        root.put("text", item.text());
        if (item.isReviewed()) {
            root.put("reviewed", item.reviewed().orElseThrow());
        } else {
            root.putNull("reviewed");
        }
        if (item.isDerived()) {
            root.put("derived", true);
        }
        if (!item.isTestable()) {
            root.put("testable", false);
        }

        for (final Map.Entry<String, JsonNode> attribute
                : item.customAttributes().entrySet()) {
            if (!STANDARD_KEYS.contains(attribute.getKey())) {
                root.set(attribute.getKey(), attribute.getValue());
            }
        }

        try {
            return MAPPER.writeValueAsBytes(root);
        } catch (final JsonProcessingException e) {
            throw new IllegalStateException("Cannot encode item "
                    + item.uid(), e);
        }
    }

    private static String readString(final String uid, final JsonNode root,
            final String key, final String defaultValue) {
        final JsonNode node = root.get(key);
        if (node == null || node.isNull()) {
            return defaultValue;
        }
        if (!node.isValueNode()) {
            throw new ItemParseException(uid, "'" + key + "' must be text");
        }
        return node.asText();
    }

    private static ItemType readType(final String uid, final JsonNode node) {
        if (node == null || node.isNull()) {
            return ItemType.REQUIREMENT;
        }
        final ItemType type = node.isTextual() ? ItemType.parse(node.asText())
                : null;
        if (type == null) {
            throw new ItemParseException(uid, "Unknown item type '"
                    + node.asText() + "', expected requirement, heading"
                    + " or info");
        }
        return type;
    }

    private static boolean readFlag(final String uid, final JsonNode root,
            final String key, final boolean defaultValue) {
        final JsonNode node = root.get(key);
        if (node == null || node.isNull()) {
            return defaultValue;
        }
        if (!node.isBoolean()) {
            throw new ItemParseException(uid, "'" + key
                    + "' must be true or false, got " + node.asText());
        }
        return node.booleanValue();
    }

    private static void readLinks(final String uid, final JsonNode node,
            final Item.Builder builder) {
        if (node == null || node.isNull()) {
            return;
        }
        if (!node.isArray()) {
            throw new ItemParseException(uid, "'links' must be a list");
        }
        for (final JsonNode entry : node) {
            if (entry.isTextual()) {
                builder.link(Link.unverified(requireLinkUid(uid,
                        entry.asText())));
            } else if (entry.isObject() && entry.size() == 1) {
                final Map.Entry<String, JsonNode> pair =
                        entry.fields().next();
                final String parentUid = requireLinkUid(uid, pair.getKey());
                builder.link(readLinkHash(uid, parentUid, pair.getValue()));
            } else {
                throw new ItemParseException(uid, "Invalid link entry "
                        + entry + ", expected a uid or a single uid: hash"
                        + " pair");
            }
        }
    }

    private static String requireLinkUid(final String uid,
            final String value) {
        final String parentUid = value == null ? "" : value.trim();
        if (parentUid.isEmpty()) {
            throw new ItemParseException(uid, "Empty link uid");
        }
        return parentUid;
    }

    private static Link readLinkHash(final String uid, final String parentUid,
            final JsonNode hashNode) {
        if (hashNode == null || hashNode.isNull()) {
            return Link.unverified(parentUid);
        }
        final String hash = hashNode.asText();
        if (!ContentHash.isWellFormed(hash)) {
            LOG.warn("Discarding malformed hash on link {} -> {}", uid,
                    parentUid);
            return Link.unverified(parentUid);
        }
        return Link.verified(parentUid, hash);
    }

    private static String readReviewed(final String uid, final JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        if (!node.isTextual()) {
            LOG.warn("Ignoring non-text 'reviewed' value on {}: {}", uid,
                    node);
            return null;
        }
        final String value = node.asText();
        return value.isBlank() ? null : value;
    }

}
