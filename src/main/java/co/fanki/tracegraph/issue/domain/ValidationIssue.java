package co.fanki.tracegraph.issue.domain;

import co.fanki.tracegraph.shared.Preconditions;

/**
 * One finding about a project: what, where and how severe.
 *
 * @param level the severity
 * @param subject the uid, document prefix or file path concerned
 * @param code the kind of finding
 * @param message a human-readable description
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record ValidationIssue(
        IssueLevel level,
        String subject,
        IssueCode code,
        String message) {

    public ValidationIssue {
        Preconditions.requireNonNull(level, "Issue level is required");
        Preconditions.requireNonNull(subject, "Issue subject is required");
        Preconditions.requireNonNull(code, "Issue code is required");
        Preconditions.requireNonNull(message, "Issue message is required");
    }

    public static ValidationIssue error(final String subject,
            final IssueCode code, final String message) {
        return new ValidationIssue(IssueLevel.ERROR, subject, code, message);
    }

    public static ValidationIssue warning(final String subject,
            final IssueCode code, final String message) {
        return new ValidationIssue(IssueLevel.WARNING, subject, code, message);
    }

    public static ValidationIssue info(final String subject,
            final IssueCode code, final String message) {
        return new ValidationIssue(IssueLevel.INFO, subject, code, message);
    }

    /**
     * Returns this issue with another severity.
     *
     * @param newLevel the severity
     * @return the issue
     */
    public ValidationIssue withLevel(final IssueLevel newLevel) {
        return newLevel == level ? this
                : new ValidationIssue(newLevel, subject, code, message);
    }

    public boolean isError() {
        return level == IssueLevel.ERROR;
    }

    @Override
    public String toString() {
        return "[" + level + "] " + subject + ": " + message;
    }

}
