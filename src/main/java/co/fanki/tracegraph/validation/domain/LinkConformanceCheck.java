package co.fanki.tracegraph.validation.domain;

import co.fanki.tracegraph.issue.domain.IssueCode;
import co.fanki.tracegraph.issue.domain.ValidationIssue;
import co.fanki.tracegraph.item.domain.Item;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Warns about links whose parent item lives in a document that is not an
 * ancestor of the child item's document.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class LinkConformanceCheck implements ValidationCheck {

    @Override
    public String name() {
        return "link-conformance";
    }

    @Override
    public boolean isEnabled(final ValidationOptions options) {
        return options.linkConformance();
    }

    @Override
    public List<ValidationIssue> check(final ValidationContext context) {
        final List<ValidationIssue> issues = new ArrayList<>();

        for (final Item item : context.activeItems()) {
            final String document = item.documentPrefix();
            final Set<String> ancestors = context.hierarchy().ancestors(document);

            for (final String parentUid : item.parentUids()) {
                final Item parent = context.graph().item(parentUid);
                if (parent == null || parentUid.equals(item.uid())) {
                    continue;
                }
                final String parentDocument = parent.documentPrefix();
                if (ancestors.contains(parentDocument)) {
                    continue;
                }
                final String expected = ancestors.isEmpty()
                        ? "none, " + document + " is a root document"
                        : String.join(", ", ancestors);
                issues.add(ValidationIssue.warning(item.uid(),
                        IssueCode.NONCONFORMING_LINK,
                        "Links to " + parentUid + " in document "
                                + parentDocument + ", which is not an"
                                + " ancestor of " + document
                                + " (expected: " + expected + ")"));
            }
        }
        return issues;
    }

}
