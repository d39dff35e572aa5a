package co.fanki.tracegraph.tree.application;

import co.fanki.tracegraph.document.domain.DiscoveryException;
import co.fanki.tracegraph.graph.domain.GraphBuilder;
import co.fanki.tracegraph.graph.domain.TraceabilityGraph;
import co.fanki.tracegraph.shared.Preconditions;
import co.fanki.tracegraph.validation.domain.ValidationEngine;
import co.fanki.tracegraph.validation.domain.ValidationOptions;
import co.fanki.tracegraph.validation.domain.ValidationReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Path;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Application service that loads a project and validates it.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Service
public class TraceabilityService {

    private static final Logger LOG = LoggerFactory.getLogger(
            TraceabilityService.class);

    private final GraphBuilder graphBuilder;
    private final ValidationEngine validationEngine;
    private final ValidationOptions defaultOptions;
    private final Path root;

    /**
     * Creates a new TraceabilityService.
     *
     * @param theGraphBuilder loads projects into graphs
     * @param theValidationEngine runs the checks
     * @param theDefaultOptions the configured validation options
     * @param theRoot the configured project root
     */
    public TraceabilityService(final GraphBuilder theGraphBuilder,
            final ValidationEngine theValidationEngine,
            final ValidationOptions theDefaultOptions,
            @Value("${tracegraph.root:.}") final String theRoot) {
        this.graphBuilder = theGraphBuilder;
        this.validationEngine = theValidationEngine;
        this.defaultOptions = theDefaultOptions;
        this.root = Path.of(Preconditions.requireNonBlank(theRoot,
                "Project root is required"));
    }

    public Path root() {
        return root;
    }

    public ValidationOptions defaultOptions() {
        return defaultOptions;
    }

    /**
     * Loads the configured project.
     *
     * @return the build result
     * @throws IOException if the project cannot be read
     * @throws DiscoveryException on a duplicate prefix or document cycle
     */
    public GraphBuilder.BuildResult buildGraph() throws IOException {
        return buildGraph(root);
    }

    /**
     * Loads a project.
     *
     * @param projectRoot the project root
     * @return the build result
     * @throws IOException if the project cannot be read
     * @throws DiscoveryException on a duplicate prefix or document cycle
     */
    public GraphBuilder.BuildResult buildGraph(final Path projectRoot)
            throws IOException {
        LOG.info("Loading traceability graph from {}", projectRoot);
        return graphBuilder.build(projectRoot);
    }

    /**
     * Validates a graph.
     *
     * @param graph the graph
     * @param options the options to apply
     * @return the report
     */
    public ValidationReport validate(final TraceabilityGraph graph,
            final ValidationOptions options) {
        return validationEngine.validate(graph, options);
    }

    /**
     * Loads and validates the configured project with the configured
     * options.
     *
     * @return the report, load issues first
     * @throws IOException if the project cannot be read
     * @throws DiscoveryException on a duplicate prefix or document cycle
     */
    public ValidationReport check() throws IOException {
        return check(defaultOptions);
    }

    /**
     * Loads and validates the configured project.
     *
     * @param options the options to apply
     * @return the report, load issues first
     * @throws IOException if the project cannot be read
     * @throws DiscoveryException on a duplicate prefix or document cycle
     */
    public ValidationReport check(final ValidationOptions options)
            throws IOException {
        final GraphBuilder.BuildResult result = buildGraph();
        return validate(result.graph(), options).prepend(result.issues());
    }

    /**
     * Loads the configured project and validates only some of its
     * documents. The other documents stay in the graph, so links into
     * them resolve, but their items and themselves are not checked.
     *
     * @param prefixes the documents to check
     * @param options the options to apply
     * @return the report, load issues first
     * @throws IOException if the project cannot be read
     * @throws DiscoveryException on a duplicate prefix or document cycle
     */
    public ValidationReport check(final Set<String> prefixes,
            final ValidationOptions options) throws IOException {
        Preconditions.requireNonNull(prefixes, "Prefixes are required");

        final GraphBuilder.BuildResult result = buildGraph();

        final Set<String> skipped = new LinkedHashSet<>(options.skipPrefixes());
        for (final String prefix : result.graph().documentPrefixes()) {
            if (!prefixes.contains(prefix)) {
                skipped.add(prefix);
            }
        }
        final ValidationOptions narrowed = options.toBuilder()
                .skipPrefixes(skipped)
                .build();

        return validate(result.graph(), narrowed).prepend(result.issues());
    }

}
