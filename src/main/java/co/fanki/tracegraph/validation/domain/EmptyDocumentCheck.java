package co.fanki.tracegraph.validation.domain;

import co.fanki.tracegraph.issue.domain.IssueCode;
import co.fanki.tracegraph.issue.domain.ValidationIssue;
import co.fanki.tracegraph.item.domain.Item;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Warns about documents that hold no items.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class EmptyDocumentCheck implements ValidationCheck {

    @Override
    public String name() {
        return "empty-documents";
    }

    @Override
    public boolean isEnabled(final ValidationOptions options) {
        return options.emptyDocuments();
    }

    @Override
    public List<ValidationIssue> check(final ValidationContext context) {
        final Set<String> populated = new HashSet<>();
        for (final Item item : context.graph().items()) {
            populated.add(item.documentPrefix());
        }

        final List<ValidationIssue> issues = new ArrayList<>();
        for (final String prefix : context.documents()) {
            if (!populated.contains(prefix)) {
                issues.add(ValidationIssue.warning(prefix,
                        IssueCode.EMPTY_DOCUMENT, "Document has no items"));
            }
        }
        return issues;
    }

}
