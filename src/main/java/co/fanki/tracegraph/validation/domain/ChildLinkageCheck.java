package co.fanki.tracegraph.validation.domain;

import co.fanki.tracegraph.issue.domain.IssueCode;
import co.fanki.tracegraph.issue.domain.ValidationIssue;
import co.fanki.tracegraph.item.domain.Item;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Reports active requirements of non-leaf documents that no active item
 * of a descendant document links to.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class ChildLinkageCheck implements ValidationCheck {

    @Override
    public String name() {
        return "child-linkage";
    }

    @Override
    public boolean isEnabled(final ValidationOptions options) {
        return options.childLinkage();
    }

    @Override
    public List<ValidationIssue> check(final ValidationContext context) {
        final List<ValidationIssue> issues = new ArrayList<>();

        for (final Item item : context.activeRequirements()) {
            final String document = item.documentPrefix();
            if (context.hierarchy().isLeaf(document)) {
                continue;
            }
            final Set<String> descendants =
                    context.hierarchy().descendants(document);
            if (!hasChildIn(context, item, descendants)) {
                issues.add(new ValidationIssue(
                        context.options().childLinkageLevel(), item.uid(),
                        IssueCode.NO_CHILD_LINKS,
                        "No item in a child document links to it"
                                + " (child documents: "
                                + String.join(", ",
                                        context.hierarchy().children(document))
                                + ")"));
            }
        }
        return issues;
    }

    private static boolean hasChildIn(final ValidationContext context,
            final Item item, final Set<String> descendants) {
        for (final Item child : context.graph().childItems(item.uid())) {
            if (child.isActive()
                    && descendants.contains(child.documentPrefix())) {
                return true;
            }
        }
        return false;
    }

}
