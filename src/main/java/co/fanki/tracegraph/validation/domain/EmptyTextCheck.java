package co.fanki.tracegraph.validation.domain;

import co.fanki.tracegraph.issue.domain.IssueCode;
import co.fanki.tracegraph.issue.domain.ValidationIssue;
import co.fanki.tracegraph.item.domain.Item;

import java.util.ArrayList;
import java.util.List;

/**
 * Warns about active items whose text is empty or blank.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class EmptyTextCheck implements ValidationCheck {

    @Override
    public String name() {
        return "empty-text";
    }

    @Override
    public boolean isEnabled(final ValidationOptions options) {
        return options.emptyText();
    }

    @Override
    public List<ValidationIssue> check(final ValidationContext context) {
        final List<ValidationIssue> issues = new ArrayList<>();
        for (final Item item : context.activeItems()) {
            if (item.text().isBlank()) {
                issues.add(ValidationIssue.warning(item.uid(),
                        IssueCode.EMPTY_TEXT, "Has no text"));
            }
        }
        return issues;
    }

}
