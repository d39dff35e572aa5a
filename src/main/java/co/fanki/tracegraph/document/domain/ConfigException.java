package co.fanki.tracegraph.document.domain;

import co.fanki.tracegraph.shared.DomainException;

/**
 * Raised when a document configuration file is missing required
 * settings or cannot be parsed.
 *
 * <p>Fatal for the one document only: discovery records the problem and
 * keeps going with the remaining documents.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class ConfigException extends DomainException {

    private static final long serialVersionUID = 1L;

    /** Error code carried by every configuration failure. */
    public static final String CODE = "DOCUMENT_CONFIG_INVALID";

    private final String source;

    /**
     * Creates a new configuration exception.
     *
     * @param theSource the configuration file that failed
     * @param message the error message
     */
    public ConfigException(final String theSource, final String message) {
        super(message + ": " + theSource, CODE);
        this.source = theSource;
    }

    /**
     * Creates a new configuration exception with a cause.
     *
     * @param theSource the configuration file that failed
     * @param message the error message
     * @param cause the underlying cause
     */
    public ConfigException(final String theSource, final String message,
            final Throwable cause) {
        super(message + ": " + theSource, CODE, cause);
        this.source = theSource;
    }

    /**
     * Returns the configuration file that failed.
     *
     * @return the file path as a string
     */
    public String source() {
        return source;
    }

}
