package co.fanki.tracegraph.validation.domain;

import co.fanki.tracegraph.issue.domain.IssueCode;
import co.fanki.tracegraph.issue.domain.ValidationIssue;
import co.fanki.tracegraph.item.domain.Item;

import java.util.ArrayList;
import java.util.List;

/**
 * Reports active, non-derived requirements of documents with parents
 * that link to nothing.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class UnlinkedItemCheck implements ValidationCheck {

    @Override
    public String name() {
        return "unlinked-items";
    }

    @Override
    public boolean isEnabled(final ValidationOptions options) {
        return options.unlinkedItems();
    }

    @Override
    public List<ValidationIssue> check(final ValidationContext context) {
        final List<ValidationIssue> issues = new ArrayList<>();

        for (final Item item : context.activeRequirements()) {
            if (item.isDerived() || item.hasLinks()) {
                continue;
            }
            final List<String> parents =
                    context.hierarchy().parents(item.documentPrefix());
            if (parents.isEmpty()) {
                continue;
            }
            issues.add(new ValidationIssue(
                    context.options().unlinkedItemLevel(), item.uid(),
                    IssueCode.UNLINKED_ITEM,
                    "Has no links to a parent document (expected one of: "
                            + String.join(", ", parents) + ")"));
        }
        return issues;
    }

}
