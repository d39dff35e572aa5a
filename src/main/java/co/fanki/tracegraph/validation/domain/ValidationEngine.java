package co.fanki.tracegraph.validation.domain;

import co.fanki.tracegraph.graph.domain.TraceabilityGraph;
import co.fanki.tracegraph.issue.domain.ValidationIssue;
import co.fanki.tracegraph.shared.Preconditions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Runs the enabled validation checks over a graph and collects their
 * findings, in check order, into one report.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class ValidationEngine {

    private static final Logger LOG =
            LoggerFactory.getLogger(ValidationEngine.class);

    private final List<ValidationCheck> checks;

    /** Creates an engine with the standard checks. */
    public ValidationEngine() {
        this(standardChecks());
    }

    /**
     * Creates an engine with a custom set of checks.
     *
     * @param theChecks the checks, run in list order
     */
    public ValidationEngine(final List<ValidationCheck> theChecks) {
        Preconditions.requireNonNull(theChecks, "Checks are required");
        this.checks = List.copyOf(theChecks);
    }

    /**
     * Returns the standard checks in their reporting order.
     *
     * @return the ten standard checks
     */
    public static List<ValidationCheck> standardChecks() {
        return List.of(
                new DocumentDagCheck(),
                new ItemCycleCheck(),
                new LinkConformanceCheck(),
                new LinkValidityCheck(),
                new SuspectLinkCheck(),
                new ReviewStatusCheck(),
                new EmptyTextCheck(),
                new ChildLinkageCheck(),
                new UnlinkedItemCheck(),
                new EmptyDocumentCheck());
    }

    /**
     * Validates a graph.
     *
     * @param graph the graph, left unchanged
     * @param options the checks to run and the escalation to apply
     * @return the report, escalated as the options ask
     */
    public ValidationReport validate(final TraceabilityGraph graph,
            final ValidationOptions options) {

        final ValidationContext context = new ValidationContext(graph, options);
        final List<ValidationIssue> issues = new ArrayList<>();

        for (final ValidationCheck check : checks) {
            if (!check.isEnabled(options)) {
                LOG.debug("Skipping disabled check {}", check.name());
                continue;
            }
            final List<ValidationIssue> found = check.check(context);
            LOG.debug("Check {} found {} issues", check.name(), found.size());
            issues.addAll(found);
        }

        final ValidationReport report = new ValidationReport(issues)
                .escalate(options.warnAll(), options.errorAll());
        LOG.info("Validated {} items: {}", graph.itemCount(), report);
        return report;
    }

}
