package co.fanki.tracegraph.validation.domain;

import co.fanki.tracegraph.issue.domain.IssueCode;
import co.fanki.tracegraph.issue.domain.ValidationIssue;
import co.fanki.tracegraph.item.domain.Item;
import co.fanki.tracegraph.item.domain.Link;

import java.util.ArrayList;
import java.util.List;

/**
 * Compares each stored link hash with the parent's current content hash.
 * A mismatch makes the link suspect; a link with no stored hash is
 * reported as unverified.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class SuspectLinkCheck implements ValidationCheck {

    @Override
    public String name() {
        return "suspect-links";
    }

    @Override
    public boolean isEnabled(final ValidationOptions options) {
        return options.suspectLinks();
    }

    @Override
    public List<ValidationIssue> check(final ValidationContext context) {
        final List<ValidationIssue> issues = new ArrayList<>();

        for (final Item item : context.activeItems()) {
            for (final Link link : item.links()) {
                final Item parent = context.graph().item(link.parentUid());
                if (parent == null || parent.uid().equals(item.uid())) {
                    continue;
                }
                final String edge = item.uid() + " -> " + parent.uid();
                if (!link.isVerified()) {
                    issues.add(ValidationIssue.warning(item.uid(),
                            IssueCode.UNVERIFIED_LINK,
                            "Unverified link " + edge
                                    + " (no parent hash stored)"));
                } else if (!link.storedHash().orElseThrow()
                        .equals(parent.contentHash())) {
                    issues.add(ValidationIssue.warning(item.uid(),
                            IssueCode.SUSPECT_LINK,
                            "Suspect link " + edge
                                    + " (parent changed since the link was"
                                    + " verified)"));
                }
            }
        }
        return issues;
    }

}
