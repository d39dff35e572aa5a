package co.fanki.tracegraph.item.domain;

import co.fanki.tracegraph.shared.DomainException;

/**
 * Raised when an item file's content cannot be turned into an item.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class ItemParseException extends DomainException {

    private static final long serialVersionUID = 1L;

    /** Error code carried by every item parse failure. */
    public static final String CODE = "ITEM_PARSE_FAILED";

    private final String uid;

    private final String reason;

    /**
     * Creates a new parse exception.
     *
     * @param theUid the uid of the item being parsed
     * @param message the error message
     */
    public ItemParseException(final String theUid, final String message) {
        super(theUid + ": " + message, CODE);
        this.uid = theUid;
        this.reason = message;
    }

    /**
     * Creates a new parse exception with a cause.
     *
     * @param theUid the uid of the item being parsed
     * @param message the error message
     * @param cause the underlying cause
     */
    public ItemParseException(final String theUid, final String message,
            final Throwable cause) {
        super(theUid + ": " + message, CODE, cause);
        this.uid = theUid;
        this.reason = message;
    }

    public String uid() {
        return uid;
    }

    /**
     * Returns what was wrong with the file, without the uid.
     *
     * @return the failure reason
     */
    public String reason() {
        return reason;
    }

}
