package co.fanki.tracegraph.validation.domain;

import co.fanki.tracegraph.issue.domain.IssueCode;
import co.fanki.tracegraph.issue.domain.ValidationIssue;
import co.fanki.tracegraph.item.domain.Item;

import java.util.ArrayList;
import java.util.List;

/**
 * Flags active requirements that were never reviewed or that changed
 * after their last review.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class ReviewStatusCheck implements ValidationCheck {

    @Override
    public String name() {
        return "review-status";
    }

    @Override
    public boolean isEnabled(final ValidationOptions options) {
        return options.reviewStatus();
    }

    @Override
    public List<ValidationIssue> check(final ValidationContext context) {
        final List<ValidationIssue> issues = new ArrayList<>();
        for (final Item item : context.activeRequirements()) {
            if (!item.isReviewed()) {
                issues.add(ValidationIssue.warning(item.uid(),
                        IssueCode.NEVER_REVIEWED, "Has not been reviewed"));
            } else if (!item.isReviewCurrent()) {
                issues.add(ValidationIssue.warning(item.uid(),
                        IssueCode.MODIFIED_SINCE_REVIEW,
                        "Has been modified since the last review"));
            }
        }
        return issues;
    }

}
