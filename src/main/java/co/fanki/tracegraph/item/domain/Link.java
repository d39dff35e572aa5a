package co.fanki.tracegraph.item.domain;

import co.fanki.tracegraph.shared.Preconditions;
import co.fanki.tracegraph.shared.ValueObject;

import java.util.Objects;
import java.util.Optional;

/**
 * A child item's reference to a parent item.
 *
 * <p>A verified link remembers the parent's content hash at the time the
 * link was last confirmed; when the parent changes, the stored hash no
 * longer matches and the link becomes suspect. An unverified link has no
 * stored hash at all.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class Link implements ValueObject {

    private static final long serialVersionUID = 1L;

    private final String parentUid;
    private final String storedHash;

    private Link(final String theParentUid, final String theStoredHash) {
        this.parentUid = Preconditions.requireNonBlank(theParentUid,
                "Link parent uid is required").trim();
        this.storedHash = theStoredHash;
    }

    /**
     * Creates a link without a stored hash.
     *
     * @param parentUid the parent item uid
     * @return the link
     */
    public static Link unverified(final String parentUid) {
        return new Link(parentUid, null);
    }

    /**
     * Creates a link carrying the parent's content hash.
     *
     * @param parentUid the parent item uid
     * @param hash the parent's content hash
     * @return the link
     */
    public static Link verified(final String parentUid, final String hash) {
        Preconditions.requireNonBlank(hash, "Link hash is required");
        return new Link(parentUid, hash);
    }

    /**
     * Creates a link with an optional hash.
     *
     * @param parentUid the parent item uid
     * @param hash the stored hash, null for unverified
     * @return the link
     */
    public static Link of(final String parentUid, final String hash) {
        return hash == null ? unverified(parentUid) : verified(parentUid, hash);
    }

    public String parentUid() {
        return parentUid;
    }

    public Optional<String> storedHash() {
        return Optional.ofNullable(storedHash);
    }

    public boolean isVerified() {
        return storedHash != null;
    }

    /**
     * Returns this link confirmed against a parent hash.
     *
     * @param hash the parent's current content hash
     * @return the verified link
     */
    public Link withHash(final String hash) {
        return verified(parentUid, hash);
    }

    /** Returns this link without its stored hash. */
    public Link withoutHash() {
        return unverified(parentUid);
    }

    /**
     * Returns this link pointing at a renamed parent, keeping the hash.
     *
     * @param newParentUid the new parent uid
     * @return the retargeted link
     */
    public Link withParentUid(final String newParentUid) {
        return new Link(newParentUid, storedHash);
    }

    @Override
    public boolean equals(final Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof Link)) {
            return false;
        }
        final Link that = (Link) obj;
        return parentUid.equals(that.parentUid)
                && Objects.equals(storedHash, that.storedHash);
    }

    @Override
    public int hashCode() {
        return Objects.hash(parentUid, storedHash);
    }

    @Override
    public String toString() {
        return storedHash == null ? parentUid : parentUid + ": " + storedHash;
    }

}
