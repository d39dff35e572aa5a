package co.fanki.tracegraph.validation.domain;

import co.fanki.tracegraph.issue.domain.IssueLevel;
import co.fanki.tracegraph.issue.domain.ValidationIssue;
import co.fanki.tracegraph.shared.Preconditions;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * The issues found by a validation run.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class ValidationReport {

    private final List<ValidationIssue> issues;

    /**
     * Creates a report.
     *
     * @param theIssues the issues, in the order found
     */
    public ValidationReport(final Collection<ValidationIssue> theIssues) {
        Preconditions.requireNonNull(theIssues, "Issues are required");
        this.issues = List.copyOf(theIssues);
    }

    /** Returns a report without issues. */
    public static ValidationReport empty() {
        return new ValidationReport(List.of());
    }

    public List<ValidationIssue> issues() {
        return issues;
    }

    public boolean isEmpty() {
        return issues.isEmpty();
    }

    /**
     * Raises severities: {@code warnAll} turns info into warnings, then
     * {@code errorAll} turns warnings into errors.
     *
     * @param warnAll promote info to warning
     * @param errorAll promote warning to error
     * @return the escalated report
     */
    public ValidationReport escalate(final boolean warnAll,
            final boolean errorAll) {
        if (!warnAll && !errorAll) {
            return this;
        }
        final List<ValidationIssue> escalated = new ArrayList<>(issues.size());
        for (final ValidationIssue issue : issues) {
            IssueLevel level = issue.level();
            if (warnAll && level == IssueLevel.INFO) {
                level = level.raised();
            }
            if (errorAll && level == IssueLevel.WARNING) {
                level = level.raised();
            }
            escalated.add(issue.withLevel(level));
        }
        return new ValidationReport(escalated);
    }

    /**
     * Returns a report holding the issues of another report first,
     * followed by these.
     *
     * @param earlier the issues to put in front, e.g. from loading
     * @return the combined report
     */
    public ValidationReport prepend(final Collection<ValidationIssue> earlier) {
        final List<ValidationIssue> merged = new ArrayList<>(earlier);
        merged.addAll(issues);
        return new ValidationReport(merged);
    }

    public boolean hasErrors() {
        return count(IssueLevel.ERROR) > 0;
    }

    /**
     * Returns the process exit code for this report.
     *
     * @return 1 if any issue is an error, 0 otherwise
     */
    public int exitCode() {
        return hasErrors() ? 1 : 0;
    }

    /**
     * Counts the issues of a level.
     *
     * @param level the level
     * @return the number of issues
     */
    public long count(final IssueLevel level) {
        return issues.stream().filter(i -> i.level() == level).count();
    }

    /** Returns the number of issues per level, every level present. */
    public Map<IssueLevel, Long> counts() {
        final Map<IssueLevel, Long> result = new EnumMap<>(IssueLevel.class);
        for (final IssueLevel level : IssueLevel.values()) {
            result.put(level, count(level));
        }
        return Collections.unmodifiableMap(result);
    }

    /**
     * Returns the issues about one subject.
     *
     * @param subject a uid, prefix or file path
     * @return the matching issues in report order
     */
    public List<ValidationIssue> issuesFor(final String subject) {
        final List<ValidationIssue> result = new ArrayList<>();
        for (final ValidationIssue issue : issues) {
            if (issue.subject().equals(subject)) {
                result.add(issue);
            }
        }
        return result;
    }

    @Override
    public String toString() {
        final Map<IssueLevel, Long> counts = counts();
        return counts.get(IssueLevel.ERROR) + " errors, "
                + counts.get(IssueLevel.WARNING) + " warnings, "
                + counts.get(IssueLevel.INFO) + " info";
    }

}
