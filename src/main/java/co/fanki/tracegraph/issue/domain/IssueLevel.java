package co.fanki.tracegraph.issue.domain;

import java.util.Locale;

/**
 * Severity of a validation issue, most severe first.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public enum IssueLevel {

    /** Fails a check run. */
    ERROR,

    /** Reported, but the run still passes. */
    WARNING,

    /** Informational only. */
    INFO;

    /**
     * Parses a level name, ignoring case.
     *
     * @param value the level name, e.g. {@code warning}
     * @return the level
     * @throws IllegalArgumentException if the name is not a level
     */
    public static IssueLevel parse(final String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Issue level is required");
        }
        final String normalized = value.trim().toUpperCase(Locale.ROOT);
        if ("WARN".equals(normalized)) {
            return WARNING;
        }
        try {
            return valueOf(normalized);
        } catch (final IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown issue level '" + value
                    + "', expected error, warning or info", e);
        }
    }

    /**
     * Returns the next more severe level.
     *
     * @return ERROR for WARNING, WARNING for INFO, ERROR for ERROR
     */
    public IssueLevel raised() {
        return this == INFO ? WARNING : ERROR;
    }

}
