package co.fanki.tracegraph.item.domain;

import java.util.Locale;

/**
 * The kind of an item.
 *
 * <p>Only requirements are normative: they take part in linkage, review
 * and coverage rules. Headings and informational items structure a
 * document and must not carry links.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public enum ItemType {

    /** A normative requirement. */
    REQUIREMENT("requirement"),

    /** A section heading. */
    HEADING("heading"),

    /** Informational, non-normative text. */
    INFO("info");

    private final String wireName;

    ItemType(final String theWireName) {
        this.wireName = theWireName;
    }

    /**
     * Returns the lowercase name used in item files and content hashes.
     *
     * @return the wire name
     */
    public String wireName() {
        return wireName;
    }

    /** Checks if items of this type are normative requirements. */
    public boolean isNormative() {
        return this == REQUIREMENT;
    }

    /**
     * Parses a wire name, ignoring case and surrounding blanks.
     *
     * @param value the name to parse
     * @return the type, or null if not recognized
     */
    public static ItemType parse(final String value) {
        if (value == null) {
            return null;
        }
        final String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (final ItemType type : values()) {
            if (type.wireName.equals(normalized)) {
                return type;
            }
        }
        return null;
    }

}
