package co.fanki.tracegraph.validation.domain;

import co.fanki.tracegraph.issue.domain.IssueCode;
import co.fanki.tracegraph.issue.domain.ValidationIssue;
import co.fanki.tracegraph.item.domain.Item;

import java.util.ArrayList;
import java.util.List;

/**
 * Checks each link for a usable target.
 *
 * <p>Self links are reported for every item. The remaining rules apply
 * to active items only: the target must exist and be active, a
 * requirement should link to requirements, and headings or info items
 * must not link at all.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class LinkValidityCheck implements ValidationCheck {

    @Override
    public String name() {
        return "link-validity";
    }

    @Override
    public boolean isEnabled(final ValidationOptions options) {
        return options.linkValidity();
    }

    @Override
    public List<ValidationIssue> check(final ValidationContext context) {
        final List<ValidationIssue> issues = new ArrayList<>();

        for (final Item item : context.items()) {
            if (item.linksTo(item.uid())) {
                issues.add(ValidationIssue.error(item.uid(),
                        IssueCode.SELF_LINK, "Links to itself"));
            }
            if (!item.isActive()) {
                continue;
            }

            if (!item.isNormative() && item.hasLinks()) {
                issues.add(ValidationIssue.error(item.uid(),
                        IssueCode.LINKS_ON_NON_NORMATIVE_ITEM,
                        "Non-normative " + item.type().wireName()
                                + " item has links: "
                                + String.join(", ", item.parentUids())));
            }

            for (final String parentUid : item.parentUids()) {
                if (parentUid.equals(item.uid())) {
                    continue;
                }
                final Item parent = context.graph().item(parentUid);
                if (parent == null) {
                    issues.add(ValidationIssue.error(item.uid(),
                            IssueCode.MISSING_LINK_TARGET,
                            "Links to non-existent item: " + parentUid));
                    continue;
                }
                if (!parent.isActive()) {
                    issues.add(ValidationIssue.warning(item.uid(),
                            IssueCode.INACTIVE_LINK_TARGET,
                            "Links to inactive item: " + parentUid));
                }
                if (item.isNormative() && !parent.isNormative()) {
                    issues.add(ValidationIssue.warning(item.uid(),
                            IssueCode.NON_NORMATIVE_LINK_TARGET,
                            "Links to non-normative " + parent.type()
                                    .wireName() + " item: " + parentUid));
                }
            }
        }
        return issues;
    }

}
