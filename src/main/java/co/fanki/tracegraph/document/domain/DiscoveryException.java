package co.fanki.tracegraph.document.domain;

import co.fanki.tracegraph.shared.DomainException;

import java.util.Collection;
import java.util.List;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Raised when the document set as a whole cannot be ordered: two
 * documents share a prefix, or the parent relation contains a cycle.
 *
 * <p>Either condition invalidates the parents-before-children load order,
 * so the whole build stops before any item is read.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class DiscoveryException extends DomainException {

    private static final long serialVersionUID = 1L;

    /** Two documents declare the same prefix. */
    public static final String DUPLICATE_PREFIX = "DUPLICATE_DOCUMENT_PREFIX";

    /** The document parent relation is cyclic. */
    public static final String CYCLE = "DOCUMENT_CYCLE";

    private final List<String> prefixes;

    private DiscoveryException(final String message, final String errorCode,
            final Collection<String> thePrefixes) {
        super(message, errorCode);
        this.prefixes = List.copyOf(thePrefixes);
    }

    /**
     * Creates the exception for a prefix declared twice.
     *
     * @param prefix the duplicated prefix
     * @param first where the prefix was first declared
     * @param second where it was declared again
     * @return the exception
     */
    public static DiscoveryException duplicatePrefix(final String prefix,
            final Object first, final Object second) {
        return new DiscoveryException("Duplicate document prefix '" + prefix
                + "' declared by " + first + " and " + second,
                DUPLICATE_PREFIX, List.of(prefix));
    }

    /**
     * Creates the exception for a cyclic document hierarchy.
     *
     * @param cyclicPrefixes the prefixes that lie on a cycle
     * @return the exception
     */
    public static DiscoveryException cycle(
            final Collection<String> cyclicPrefixes) {
        final SortedSet<String> sorted = new TreeSet<>(cyclicPrefixes);
        return new DiscoveryException("Cycle detected among documents: "
                + String.join(", ", sorted), CYCLE, sorted);
    }

    /**
     * Returns the prefixes involved, sorted.
     *
     * @return the offending prefixes
     */
    public List<String> prefixes() {
        return prefixes;
    }

}
