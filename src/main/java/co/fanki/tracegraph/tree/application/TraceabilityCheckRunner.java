package co.fanki.tracegraph.tree.application;

import co.fanki.tracegraph.document.domain.DiscoveryException;
import co.fanki.tracegraph.issue.domain.ValidationIssue;
import co.fanki.tracegraph.validation.domain.ValidationReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.IOException;

/**
 * Startup component that validates the configured project once and
 * reports the result as the process exit code.
 *
 * <p>Every issue is logged at its own level. The exit code is 1 when the
 * report holds an error or the project cannot be loaded, 0 otherwise.</p>
 *
 * <p>Opt-in via {@code tracegraph.check-on-startup=true}. Disabled by
 * default.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Component
@ConditionalOnProperty(
        name = "tracegraph.check-on-startup",
        havingValue = "true",
        matchIfMissing = false)
public class TraceabilityCheckRunner implements ApplicationRunner,
        ExitCodeGenerator {

    private static final Logger LOG = LoggerFactory.getLogger(
            TraceabilityCheckRunner.class);

    private final TraceabilityService traceabilityService;

    private int exitCode;

    /**
     * Creates a new TraceabilityCheckRunner.
     *
     * @param theTraceabilityService loads and validates the project
     */
    public TraceabilityCheckRunner(
            final TraceabilityService theTraceabilityService) {
        this.traceabilityService = theTraceabilityService;
    }

    @Override
    public void run(final ApplicationArguments args) {
        LOG.info("Checking project at {}", traceabilityService.root());

        final ValidationReport report;
        try {
            report = traceabilityService.check();
        } catch (final DiscoveryException e) {
            LOG.error("Project structure is invalid: {}", e.getMessage());
            exitCode = 1;
            return;
        } catch (final IOException e) {
            LOG.error("Could not read project at {}",
                    traceabilityService.root(), e);
            exitCode = 1;
            return;
        }

        for (final ValidationIssue issue : report.issues()) {
            switch (issue.level()) {
                case ERROR -> LOG.error("{}", issue);
                case WARNING -> LOG.warn("{}", issue);
                default -> LOG.info("{}", issue);
            }
        }

        exitCode = report.exitCode();
        LOG.info("Check finished: {}", report);
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

}
