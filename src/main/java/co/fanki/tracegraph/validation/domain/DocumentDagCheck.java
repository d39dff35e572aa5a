package co.fanki.tracegraph.validation.domain;

import co.fanki.tracegraph.document.domain.TopologicalSort;
import co.fanki.tracegraph.issue.domain.IssueCode;
import co.fanki.tracegraph.issue.domain.ValidationIssue;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Reports document cycles and parents that name no known document.
 * Always enabled; skipped prefixes are still checked.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class DocumentDagCheck implements ValidationCheck {

    @Override
    public String name() {
        return "document-dag";
    }

    @Override
    public boolean isEnabled(final ValidationOptions options) {
        return true;
    }

    @Override
    public List<ValidationIssue> check(final ValidationContext context) {
        final List<ValidationIssue> issues = new ArrayList<>();

        final TopologicalSort sort = context.hierarchy().sort();
        if (!sort.isAcyclic()) {
            final String prefixes = String.join(", ", sort.cyclicPrefixes());
            issues.add(ValidationIssue.error(prefixes,
                    IssueCode.DOCUMENT_CYCLE,
                    "Cycle detected among documents: " + prefixes));
        }

        for (final Map.Entry<String, List<String>> entry
                : context.hierarchy().unknownParents().entrySet()) {
            for (final String parent : entry.getValue()) {
                issues.add(ValidationIssue.error(entry.getKey(),
                        IssueCode.UNKNOWN_PARENT_DOCUMENT,
                        "Parent document '" + parent + "' of "
                                + entry.getKey() + " does not exist"));
            }
        }
        return issues;
    }

}
