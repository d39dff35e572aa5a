package co.fanki.tracegraph.issue.domain;

/**
 * What a validation issue is about.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public enum IssueCode {

    // Build
    DOCUMENT_CONFIG_INVALID,
    ITEM_PARSE_FAILED,

    // Document hierarchy
    DOCUMENT_CYCLE,
    UNKNOWN_PARENT_DOCUMENT,

    // Links
    ITEM_CYCLE,
    NONCONFORMING_LINK,
    SELF_LINK,
    MISSING_LINK_TARGET,
    INACTIVE_LINK_TARGET,
    NON_NORMATIVE_LINK_TARGET,
    LINKS_ON_NON_NORMATIVE_ITEM,
    SUSPECT_LINK,
    UNVERIFIED_LINK,

    // Review and content
    NEVER_REVIEWED,
    MODIFIED_SINCE_REVIEW,
    EMPTY_TEXT,

    // Coverage of the hierarchy
    NO_CHILD_LINKS,
    UNLINKED_ITEM,
    EMPTY_DOCUMENT

}
