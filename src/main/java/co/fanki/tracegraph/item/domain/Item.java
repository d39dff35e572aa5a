package co.fanki.tracegraph.item.domain;

import co.fanki.tracegraph.shared.Preconditions;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * A single requirement, heading or informational entry of a document.
 *
 * <p>Items are immutable. Every change to the reviewable content (text,
 * header, type or the set of parent links) produces an item whose
 * {@code reviewed} mark is cleared; {@link #markReviewed()} records the
 * current {@link ContentHash} again.</p>
 *
 * <p>Keys found in the item file that the model does not know are kept in
 * {@link #customAttributes()} untouched, so rewriting an item never loses
 * them.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class Item {

    private static final int DISPLAY_LIMIT = 80;

    private static final int WORD_BOUNDARY_MIN = 60;

    private final String uid;
    private final String documentPrefix;
    private final String text;
    private final String header;
    private final ItemType type;
    private final boolean active;
    private final boolean derived;
    private final boolean testable;
    private final List<Link> links;
    private final String reviewed;
    private final Map<String, JsonNode> customAttributes;

    private Item(final Builder builder) {
        this.uid = Preconditions.requireNonBlank(builder.uid,
                "Item uid is required").trim();
        this.documentPrefix = Preconditions.requireNonBlank(
                builder.documentPrefix, "Item document prefix is required");
        this.text = builder.text == null ? "" : builder.text;
        this.header = builder.header == null || builder.header.isBlank()
                ? null : builder.header;
        this.type = builder.type == null ? ItemType.REQUIREMENT : builder.type;
        this.active = builder.active;
        this.derived = builder.derived;
        this.testable = builder.testable;
        this.links = Collections.unmodifiableList(
                new ArrayList<>(builder.links.values()));
        this.reviewed = builder.reviewed;

        final Map<String, JsonNode> attributes = new LinkedHashMap<>();
        builder.customAttributes.forEach((key, value) ->
                attributes.put(key, value == null ? null : value.deepCopy()));
        this.customAttributes = Collections.unmodifiableMap(attributes);
    }

    /**
     * Starts building an item.
     *
     * @param uid the item uid
     * @param documentPrefix the prefix of the owning document
     * @return a builder with every other field at its default
     */
    public static Builder builder(final String uid,
            final String documentPrefix) {
        return new Builder(uid, documentPrefix);
    }

    /**
     * Creates an active requirement with text only.
     *
     * @param uid the item uid
     * @param documentPrefix the prefix of the owning document
     * @param text the requirement text
     * @return the item
     */
    public static Item requirement(final String uid,
            final String documentPrefix, final String text) {
        return builder(uid, documentPrefix).text(text).build();
    }

    /** Returns a builder initialized with this item's values. */
    public Builder toBuilder() {
        final Builder builder = new Builder(uid, documentPrefix)
                .text(text)
                .header(header)
                .type(type)
                .active(active)
                .derived(derived)
                .testable(testable)
                .reviewed(reviewed);
        links.forEach(builder::link);
        customAttributes.forEach(builder::customAttribute);
        return builder;
    }

    public String uid() {
        return uid;
    }

    public String documentPrefix() {
        return documentPrefix;
    }

    public String text() {
        return text;
    }

    /**
     * Returns the header.
     *
     * @return the header, or null if the item has none
     */
    public String header() {
        return header;
    }

    public ItemType type() {
        return type;
    }

    public boolean isActive() {
        return active;
    }

    public boolean isDerived() {
        return derived;
    }

    public boolean isTestable() {
        return testable;
    }

    public boolean isNormative() {
        return type.isNormative();
    }

    /**
     * Returns the links in file order, unique by parent uid.
     *
     * @return unmodifiable list of links
     */
    public List<Link> links() {
        return links;
    }

    /**
     * Returns the parent uids in link order.
     *
     * @return the parent uids
     */
    public List<String> parentUids() {
        final List<String> result = new ArrayList<>(links.size());
        for (final Link link : links) {
            result.add(link.parentUid());
        }
        return Collections.unmodifiableList(result);
    }

    /**
     * Finds the link to a parent.
     *
     * @param parentUid the parent uid
     * @return the link, or null if the item does not link to it
     */
    public Link link(final String parentUid) {
        for (final Link link : links) {
            if (link.parentUid().equals(parentUid)) {
                return link;
            }
        }
        return null;
    }

    public boolean linksTo(final String parentUid) {
        return link(parentUid) != null;
    }

    public boolean hasLinks() {
        return !links.isEmpty();
    }

    /**
     * Returns the content hash recorded at the last review.
     *
     * @return the review hash, empty if never reviewed
     */
    public Optional<String> reviewed() {
        return Optional.ofNullable(reviewed);
    }

    public boolean isReviewed() {
        return reviewed != null;
    }

    /**
     * Returns the attributes the model does not interpret, in file order.
     *
     * @return unmodifiable map of custom attributes
     */
    public Map<String, JsonNode> customAttributes() {
        return customAttributes;
    }

    /** Computes the current content hash. */
    public String contentHash() {
        return ContentHash.of(this);
    }

    /** Checks if the item was reviewed and has not changed since. */
    public boolean isReviewCurrent() {
        return reviewed != null && reviewed.equals(contentHash());
    }

    /**
     * Returns a short label for listings: the header when present,
     * otherwise the text cut at 80 characters, preferably at a word
     * boundary.
     *
     * @return the display text
     */
    public String displayText() {
        if (header != null) {
            return header;
        }
        if (text.length() <= DISPLAY_LIMIT) {
            return text;
        }
        String truncated = text.substring(0, DISPLAY_LIMIT);
        final int lastSpace = truncated.lastIndexOf(' ');
        if (lastSpace > WORD_BOUNDARY_MIN) {
            truncated = truncated.substring(0, lastSpace);
        }
        return truncated + "...";
    }

    /**
     * Returns {@code header - text} when a header exists, else the text.
     *
     * @return the full display text
     */
    public String fullDisplayText() {
        return header == null ? text : header + " - " + text;
    }

    // -- content changes, each clears the review mark ---------------------

    public Item withText(final String newText) {
        final String value = newText == null ? "" : newText;
        if (value.equals(text)) {
            return this;
        }
        return toBuilder().text(value).reviewed(null).build();
    }

    public Item withHeader(final String newHeader) {
        final String value = newHeader == null || newHeader.isBlank()
                ? null : newHeader;
        if (Objects.equals(value, header)) {
            return this;
        }
        return toBuilder().header(value).reviewed(null).build();
    }

    public Item withType(final ItemType newType) {
        Preconditions.requireNonNull(newType, "Item type is required");
        if (newType == type) {
            return this;
        }
        return toBuilder().type(newType).reviewed(null).build();
    }

    /**
     * Adds a link, replacing an existing link to the same parent.
     *
     * @param link the link to add
     * @return the changed item
     */
    public Item withLink(final Link link) {
        Preconditions.requireNonNull(link, "Link is required");
        final Link existing = link(link.parentUid());
        if (link.equals(existing)) {
            return this;
        }
        final Builder builder = toBuilder().link(link);
        if (existing == null) {
            builder.reviewed(null);
        }
        return builder.build();
    }

    /**
     * Removes the link to a parent.
     *
     * @param parentUid the parent uid
     * @return the changed item, or this item if there was no such link
     */
    public Item withoutLink(final String parentUid) {
        if (!linksTo(parentUid)) {
            return this;
        }
        final Builder builder = toBuilder().reviewed(null);
        builder.links.remove(parentUid);
        return builder.build();
    }

    /**
     * Retargets links to renamed parents, keeping their stored hashes.
     *
     * @param renames maps old parent uid to new parent uid
     * @return the changed item, or this item if no link was affected
     */
    public Item withLinksRenamed(final Map<String, String> renames) {
        boolean changed = false;
        final Builder builder = toBuilder();
        builder.links.clear();
        for (final Link link : links) {
            final String target = renames.get(link.parentUid());
            if (target != null && !target.equals(link.parentUid())) {
                builder.link(link.withParentUid(target));
                changed = true;
            } else {
                builder.link(link);
            }
        }
        if (!changed) {
            return this;
        }
        return builder.reviewed(null).build();
    }

    // -- flag changes, the review mark survives --------------------------

    public Item withActive(final boolean value) {
        return value == active ? this : toBuilder().active(value).build();
    }

    public Item withDerived(final boolean value) {
        return value == derived ? this : toBuilder().derived(value).build();
    }

    public Item withTestable(final boolean value) {
        return value == testable ? this : toBuilder().testable(value).build();
    }

    // -- review ------------------------------------------------------------

    /** Returns this item marked as reviewed with its current hash. */
    public Item markReviewed() {
        return toBuilder().reviewed(contentHash()).build();
    }

    /** Returns this item with its review mark cleared. */
    public Item withReviewCleared() {
        return reviewed == null ? this : toBuilder().reviewed(null).build();
    }

    /**
     * Stores a parent's hash on the link to it.
     *
     * @param parentUid the parent uid
     * @param parentHash the parent's current content hash
     * @return the changed item
     */
    public Item withLinkVerified(final String parentUid,
            final String parentHash) {
        final Link existing = link(parentUid);
        Preconditions.require(existing != null,
                uid + " does not link to " + parentUid);
        return withLinkReplaced(existing.withHash(parentHash));
    }

    /** Returns this item with every stored link hash removed. */
    public Item withLinkHashesStripped() {
        final Builder builder = toBuilder();
        builder.links.replaceAll((key, link) -> link.withoutHash());
        return builder.build();
    }

    /**
     * Returns a copy with a different uid, used when renumbering.
     *
     * @param newUid the new uid
     * @return the renamed item
     */
    Item withUid(final String newUid) {
        final Builder builder = toBuilder();
        builder.uid = newUid;
        return builder.build();
    }

    private Item withLinkReplaced(final Link link) {
        final Builder builder = toBuilder();
        builder.links.replace(link.parentUid(), link);
        return builder.build();
    }

    @Override
    public boolean equals(final Object obj) {
        if (this == obj) {
            return true;
        }
        if (obj == null || getClass() != obj.getClass()) {
            return false;
        }
        final Item that = (Item) obj;
        return active == that.active
                && derived == that.derived
                && testable == that.testable
                && uid.equals(that.uid)
                && documentPrefix.equals(that.documentPrefix)
                && text.equals(that.text)
                && Objects.equals(header, that.header)
                && type == that.type
                && links.equals(that.links)
                && Objects.equals(reviewed, that.reviewed)
                && customAttributes.equals(that.customAttributes);
    }

    @Override
    public int hashCode() {
        return Objects.hash(uid, documentPrefix, text, header, type, active,
                derived, testable, links, reviewed);
    }

    @Override
    public String toString() {
        return uid + " (" + type.wireName() + ")";
    }

    /**
     * Mutable builder of {@link Item}.
     */
    public static final class Builder {

        private String uid;
        private final String documentPrefix;
        private String text = "";
        private String header;
        private ItemType type = ItemType.REQUIREMENT;
        private boolean active = true;
        private boolean derived;
        private boolean testable = true;
        private final Map<String, Link> links = new LinkedHashMap<>();
        private String reviewed;
        private final Map<String, JsonNode> customAttributes =
                new LinkedHashMap<>();

        private Builder(final String theUid, final String theDocumentPrefix) {
            this.uid = theUid;
            this.documentPrefix = theDocumentPrefix;
        }

        public Builder text(final String value) {
            this.text = value;
            return this;
        }

        public Builder header(final String value) {
            this.header = value;
            return this;
        }

        public Builder type(final ItemType value) {
            this.type = value;
            return this;
        }

        public Builder active(final boolean value) {
            this.active = value;
            return this;
        }

        public Builder derived(final boolean value) {
            this.derived = value;
            return this;
        }

        public Builder testable(final boolean value) {
            this.testable = value;
            return this;
        }

        /**
         * Adds a link; a later link to the same parent replaces the
         * earlier one in place.
         *
         * @param link the link
         * @return this builder
         */
        public Builder link(final Link link) {
            Preconditions.requireNonNull(link, "Link is required");
            links.put(link.parentUid(), link);
            return this;
        }

        /**
         * Adds an unverified link to a parent.
         *
         * @param parentUid the parent uid
         * @return this builder
         */
        public Builder link(final String parentUid) {
            return link(Link.unverified(parentUid));
        }

        public Builder reviewed(final String value) {
            this.reviewed = value;
            return this;
        }

        public Builder customAttribute(final String key, final JsonNode value) {
            Preconditions.requireNonBlank(key, "Attribute name is required");
            customAttributes.put(key, value);
            return this;
        }

        public Item build() {
            return new Item(this);
        }
    }

}
