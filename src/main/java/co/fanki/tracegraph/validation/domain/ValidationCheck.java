package co.fanki.tracegraph.validation.domain;

import co.fanki.tracegraph.issue.domain.ValidationIssue;

import java.util.List;

/**
 * One independent validation rule.
 *
 * <p>Implementations are stateless and must not modify the graph.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public interface ValidationCheck {

    /**
     * Returns a short name for logging.
     *
     * @return the check name
     */
    String name();

    /**
     * Tells whether this check runs under the given options.
     *
     * @param options the options in force
     * @return true if the check should run
     */
    boolean isEnabled(ValidationOptions options);

    /**
     * Runs the check.
     *
     * @param context the graph and options
     * @return the findings, empty if none
     */
    List<ValidationIssue> check(ValidationContext context);

}
