package co.fanki.tracegraph.document.domain;

import co.fanki.tracegraph.shared.Preconditions;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * A named collection of items sharing a uid prefix and a position in
 * the document hierarchy.
 *
 * <p>Item uids are built as {@code prefix + sep + number}, the number
 * zero-padded to {@code digits}. Because uid generation relies on the
 * prefix alone, prefixes are unique across a project.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class Document {

    /** Name of the per-document configuration file. */
    public static final String CONFIG_FILE = ".tracegraph.yml";

    /** Digit width used when a configuration does not declare one. */
    public static final int DEFAULT_DIGITS = 3;

    /** Widest accepted digit width. */
    public static final int MAX_DIGITS = 10;

    private static final Pattern PREFIX_PATTERN =
            Pattern.compile("^[A-Z][A-Z0-9_]*$");

    private static final Pattern ALPHANUMERIC_START =
            Pattern.compile("^[A-Za-z0-9]");

    private final String prefix;
    private final Path path;
    private final List<String> parents;
    private final int digits;
    private final String sep;

    private Document(final String thePrefix, final Path thePath,
            final List<String> theParents, final int theDigits,
            final String theSep) {
        this.prefix = thePrefix;
        this.path = thePath;
        this.parents = theParents;
        this.digits = theDigits;
        this.sep = theSep;
    }

    /**
     * Creates a validated document.
     *
     * @param prefix the uid prefix, uppercase alphanumeric or underscore,
     *        at least two characters, starting with a letter
     * @param path the document directory
     * @param parents the parent document prefixes, empty for a root
     * @param digits the zero-padding width of item numbers (1 to 10)
     * @param sep the separator between prefix and number, may be empty
     * @return the document
     * @throws IllegalArgumentException if any value is invalid
     */
    public static Document of(final String prefix, final Path path,
            final List<String> parents, final int digits, final String sep) {

        Preconditions.requireNonBlank(prefix, "Document prefix is required");
        Preconditions.require(prefix.length() >= 2,
                "Document prefix must be at least 2 characters: " + prefix);
        Preconditions.require(PREFIX_PATTERN.matcher(prefix).matches(),
                "Invalid document prefix '" + prefix + "': must start with"
                        + " an uppercase letter and contain only uppercase"
                        + " letters, digits, and underscores");
        Preconditions.requireNonNull(path, "Document path is required");
        Preconditions.requireInRange(digits, 1, MAX_DIGITS,
                "Document digits must be between 1 and " + MAX_DIGITS
                        + ", got " + digits);

        final String separator = sep == null ? "" : sep;
        Preconditions.require(
                !ALPHANUMERIC_START.matcher(separator).find(),
                "Separator '" + separator + "' cannot start with a letter"
                        + " or digit (ambiguous uids)");

        final List<String> parentList = parents == null
                ? List.of() : List.copyOf(parents);
        for (final String parent : parentList) {
            Preconditions.requireNonBlank(parent,
                    "Parent prefix of " + prefix + " cannot be blank");
        }

        return new Document(prefix, path, parentList, digits, separator);
    }

    /**
     * Creates a root document with default numbering.
     *
     * @param prefix the uid prefix
     * @param path the document directory
     * @return the document
     */
    public static Document root(final String prefix, final Path path) {
        return of(prefix, path, List.of(), DEFAULT_DIGITS, "");
    }

    public String prefix() {
        return prefix;
    }

    public Path path() {
        return path;
    }

    public List<String> parents() {
        return parents;
    }

    public int digits() {
        return digits;
    }

    public String sep() {
        return sep;
    }

    /** Checks if this document has no parent documents. */
    public boolean isRoot() {
        return parents.isEmpty();
    }

    /**
     * Returns the configuration file of this document.
     *
     * @return the path of the config file inside the document directory
     */
    public Path configFile() {
        return path.resolve(CONFIG_FILE);
    }

    /**
     * Returns a case-insensitive pattern matching this document's uids,
     * capturing the numeric part in group 1. The number is limited to 18
     * digits so that it always fits a {@code long}.
     *
     * @return the uid pattern
     */
    public Pattern uidPattern() {
        return Pattern.compile("^" + Pattern.quote(prefix) + Pattern.quote(sep)
                + "(\\d{1,18})$", Pattern.CASE_INSENSITIVE);
    }

    /**
     * Checks whether a uid belongs to this document.
     *
     * @param uid the uid to check
     * @return true if the uid has this document's prefix and separator
     */
    public boolean owns(final String uid) {
        return uid != null && uidPattern().matcher(uid).matches();
    }

    /**
     * Formats an item number as a uid of this document.
     *
     * @param number the item number, positive
     * @return the uid, e.g. {@code SRS004}
     */
    public String formatUid(final long number) {
        Preconditions.require(number > 0, "Item number must be positive");
        return prefix + sep + String.format("%0" + digits + "d", number);
    }

    /**
     * Returns a copy of this document with different parents.
     *
     * @param newParents the parent prefixes
     * @return the reconfigured document
     */
    public Document withParents(final List<String> newParents) {
        return of(prefix, path, newParents, digits, sep);
    }

    @Override
    public boolean equals(final Object obj) {
        if (this == obj) {
            return true;
        }
        if (obj == null || getClass() != obj.getClass()) {
            return false;
        }
        final Document that = (Document) obj;
        return digits == that.digits
                && prefix.equals(that.prefix)
                && path.equals(that.path)
                && parents.equals(that.parents)
                && sep.equals(that.sep);
    }

    @Override
    public int hashCode() {
        return Objects.hash(prefix, path, parents, digits, sep);
    }

    @Override
    public String toString() {
        return prefix + " (" + path + ")";
    }

}
