package co.fanki.tracegraph.validation.domain;

import co.fanki.tracegraph.issue.domain.IssueLevel;
import co.fanki.tracegraph.shared.Preconditions;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Which validation checks run and how their findings are graded.
 *
 * <p>The document hierarchy check has no toggle: it always runs.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class ValidationOptions {

    private static final ValidationOptions DEFAULTS = builder().build();

    private final boolean itemCycles;
    private final boolean linkConformance;
    private final boolean linkValidity;
    private final boolean suspectLinks;
    private final boolean reviewStatus;
    private final boolean emptyText;
    private final boolean childLinkage;
    private final IssueLevel childLinkageLevel;
    private final boolean unlinkedItems;
    private final IssueLevel unlinkedItemLevel;
    private final boolean emptyDocuments;
    private final boolean warnAll;
    private final boolean errorAll;
    private final Set<String> skipPrefixes;

    private ValidationOptions(final Builder builder) {
        this.itemCycles = builder.itemCycles;
        this.linkConformance = builder.linkConformance;
        this.linkValidity = builder.linkValidity;
        this.suspectLinks = builder.suspectLinks;
        this.reviewStatus = builder.reviewStatus;
        this.emptyText = builder.emptyText;
        this.childLinkage = builder.childLinkage;
        this.childLinkageLevel = builder.childLinkageLevel;
        this.unlinkedItems = builder.unlinkedItems;
        this.unlinkedItemLevel = builder.unlinkedItemLevel;
        this.emptyDocuments = builder.emptyDocuments;
        this.warnAll = builder.warnAll;
        this.errorAll = builder.errorAll;
        this.skipPrefixes = Set.copyOf(builder.skipPrefixes);
    }

    /** Returns options with every check enabled at its default level. */
    public static ValidationOptions defaults() {
        return DEFAULTS;
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Returns a builder initialized with these options. */
    public Builder toBuilder() {
        return new Builder()
                .itemCycles(itemCycles)
                .linkConformance(linkConformance)
                .linkValidity(linkValidity)
                .suspectLinks(suspectLinks)
                .reviewStatus(reviewStatus)
                .emptyText(emptyText)
                .childLinkage(childLinkage)
                .childLinkageLevel(childLinkageLevel)
                .unlinkedItems(unlinkedItems)
                .unlinkedItemLevel(unlinkedItemLevel)
                .emptyDocuments(emptyDocuments)
                .warnAll(warnAll)
                .errorAll(errorAll)
                .skipPrefixes(skipPrefixes);
    }

    public boolean itemCycles() {
        return itemCycles;
    }

    public boolean linkConformance() {
        return linkConformance;
    }

    public boolean linkValidity() {
        return linkValidity;
    }

    public boolean suspectLinks() {
        return suspectLinks;
    }

    public boolean reviewStatus() {
        return reviewStatus;
    }

    public boolean emptyText() {
        return emptyText;
    }

    public boolean childLinkage() {
        return childLinkage;
    }

    public IssueLevel childLinkageLevel() {
        return childLinkageLevel;
    }

    public boolean unlinkedItems() {
        return unlinkedItems;
    }

    public IssueLevel unlinkedItemLevel() {
        return unlinkedItemLevel;
    }

    public boolean emptyDocuments() {
        return emptyDocuments;
    }

    /** Promote info findings to warnings. */
    public boolean warnAll() {
        return warnAll;
    }

    /** Promote warnings to errors. */
    public boolean errorAll() {
        return errorAll;
    }

    public Set<String> skipPrefixes() {
        return skipPrefixes;
    }

    /**
     * Checks whether a document's items are excluded from item checks.
     *
     * @param prefix the document prefix
     * @return true if the document is skipped
     */
    public boolean isSkipped(final String prefix) {
        return skipPrefixes.contains(prefix);
    }

    @Override
    public String toString() {
        return "ValidationOptions{itemCycles=" + itemCycles
                + ", linkConformance=" + linkConformance
                + ", linkValidity=" + linkValidity
                + ", suspectLinks=" + suspectLinks
                + ", reviewStatus=" + reviewStatus
                + ", emptyText=" + emptyText
                + ", childLinkage=" + childLinkage + "@" + childLinkageLevel
                + ", unlinkedItems=" + unlinkedItems + "@" + unlinkedItemLevel
                + ", emptyDocuments=" + emptyDocuments
                + ", warnAll=" + warnAll
                + ", errorAll=" + errorAll
                + ", skipPrefixes=" + skipPrefixes + "}";
    }

    /**
     * Mutable builder of {@link ValidationOptions}; starts with every
     * check enabled.
     */
    public static final class Builder {

        private boolean itemCycles = true;
        private boolean linkConformance = true;
        private boolean linkValidity = true;
        private boolean suspectLinks = true;
        private boolean reviewStatus = true;
        private boolean emptyText = true;
        private boolean childLinkage = true;
        private IssueLevel childLinkageLevel = IssueLevel.INFO;
        private boolean unlinkedItems = true;
        private IssueLevel unlinkedItemLevel = IssueLevel.WARNING;
        private boolean emptyDocuments = true;
        private boolean warnAll;
        private boolean errorAll;
        private final Set<String> skipPrefixes = new LinkedHashSet<>();

        private Builder() {
        }

        public Builder itemCycles(final boolean value) {
            this.itemCycles = value;
            return this;
        }

        public Builder linkConformance(final boolean value) {
            this.linkConformance = value;
            return this;
        }

        public Builder linkValidity(final boolean value) {
            this.linkValidity = value;
            return this;
        }

        public Builder suspectLinks(final boolean value) {
            this.suspectLinks = value;
            return this;
        }

        public Builder reviewStatus(final boolean value) {
            this.reviewStatus = value;
            return this;
        }

        public Builder emptyText(final boolean value) {
            this.emptyText = value;
            return this;
        }

        public Builder childLinkage(final boolean value) {
            this.childLinkage = value;
            return this;
        }

        public Builder childLinkageLevel(final IssueLevel value) {
            this.childLinkageLevel = Preconditions.requireNonNull(value,
                    "Child linkage level is required");
            return this;
        }

        public Builder unlinkedItems(final boolean value) {
            this.unlinkedItems = value;
            return this;
        }

        public Builder unlinkedItemLevel(final IssueLevel value) {
            this.unlinkedItemLevel = Preconditions.requireNonNull(value,
                    "Unlinked item level is required");
            return this;
        }

        public Builder emptyDocuments(final boolean value) {
            this.emptyDocuments = value;
            return this;
        }

        public Builder warnAll(final boolean value) {
            this.warnAll = value;
            return this;
        }

        public Builder errorAll(final boolean value) {
            this.errorAll = value;
            return this;
        }

        /**
         * Replaces the skipped prefixes.
         *
         * @param prefixes the prefixes whose items are not checked
         * @return this builder
         */
        public Builder skipPrefixes(final Collection<String> prefixes) {
            skipPrefixes.clear();
            if (prefixes != null) {
                for (final String prefix : prefixes) {
                    if (prefix != null && !prefix.isBlank()) {
                        skipPrefixes.add(prefix.trim());
                    }
                }
            }
            return this;
        }

        public ValidationOptions build() {
            return new ValidationOptions(this);
        }
    }

}
