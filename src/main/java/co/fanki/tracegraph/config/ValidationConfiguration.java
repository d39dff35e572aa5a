package co.fanki.tracegraph.config;

import co.fanki.tracegraph.document.domain.DocumentDiscovery;
import co.fanki.tracegraph.graph.domain.GraphBuilder;
import co.fanki.tracegraph.issue.domain.IssueLevel;
import co.fanki.tracegraph.item.domain.DocumentRenumberer;
import co.fanki.tracegraph.item.domain.ItemStore;
import co.fanki.tracegraph.validation.domain.ValidationEngine;
import co.fanki.tracegraph.validation.domain.ValidationOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;

/**
 * Wires the traceability engine and binds the default validation options
 * from the {@code tracegraph.validation.*} properties.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Configuration
public class ValidationConfiguration {

    private static final Logger LOG = LoggerFactory.getLogger(
            ValidationConfiguration.class);

    @Bean
    public DocumentDiscovery documentDiscovery() {
        return new DocumentDiscovery();
    }

    @Bean
    public ItemStore itemStore() {
        return new ItemStore();
    }

    /**
     * Creates the graph builder.
     *
     * @param discovery the document discovery
     * @param store the item store
     * @return the builder
     */
    @Bean
    public GraphBuilder graphBuilder(final DocumentDiscovery discovery,
            final ItemStore store) {
        return new GraphBuilder(discovery, store);
    }

    @Bean
    public DocumentRenumberer documentRenumberer(final ItemStore store) {
        return new DocumentRenumberer(store);
    }

    @Bean
    public ValidationEngine validationEngine() {
        return new ValidationEngine();
    }

    /**
     * Builds the default validation options.
     *
     * @param itemCycles run the item cycle check
     * @param linkConformance run the link conformance check
     * @param linkValidity run the link validity check
     * @param suspectLinks run the suspect link check
     * @param reviewStatus run the review status check
     * @param emptyText run the empty text check
     * @param childLinkage run the child linkage check
     * @param childLinkageLevel level of child linkage findings
     * @param unlinkedItems run the unlinked item check
     * @param unlinkedItemLevel level of unlinked item findings
     * @param emptyDocuments run the empty document check
     * @param warnAll promote info to warning
     * @param errorAll promote warning to error
     * @param skipPrefixes comma separated prefixes to leave out
     * @return the options
     */
    @Bean
    public ValidationOptions validationOptions(
            @Value("${tracegraph.validation.item-cycles:true}")
            final boolean itemCycles,
            @Value("${tracegraph.validation.link-conformance:true}")
            final boolean linkConformance,
            @Value("${tracegraph.validation.link-validity:true}")
            final boolean linkValidity,
            @Value("${tracegraph.validation.suspect-links:true}")
            final boolean suspectLinks,
            @Value("${tracegraph.validation.review-status:true}")
            final boolean reviewStatus,
            @Value("${tracegraph.validation.empty-text:true}")
            final boolean emptyText,
            @Value("${tracegraph.validation.child-linkage:true}")
            final boolean childLinkage,
            @Value("${tracegraph.validation.child-linkage-level:info}")
            final String childLinkageLevel,
            @Value("${tracegraph.validation.unlinked-items:true}")
            final boolean unlinkedItems,
            @Value("${tracegraph.validation.unlinked-item-level:warning}")
            final String unlinkedItemLevel,
            @Value("${tracegraph.validation.empty-documents:true}")
            final boolean emptyDocuments,
            @Value("${tracegraph.validation.warn-all:false}")
            final boolean warnAll,
            @Value("${tracegraph.validation.error-all:false}")
            final boolean errorAll,
            @Value("${tracegraph.validation.skip-prefixes:}")
            final String skipPrefixes) {

        final ValidationOptions options = ValidationOptions.builder()
                .itemCycles(itemCycles)
                .linkConformance(linkConformance)
                .linkValidity(linkValidity)
                .suspectLinks(suspectLinks)
                .reviewStatus(reviewStatus)
                .emptyText(emptyText)
                .childLinkage(childLinkage)
                .childLinkageLevel(IssueLevel.parse(childLinkageLevel))
                .unlinkedItems(unlinkedItems)
                .unlinkedItemLevel(IssueLevel.parse(unlinkedItemLevel))
                .emptyDocuments(emptyDocuments)
                .warnAll(warnAll)
                .errorAll(errorAll)
                .skipPrefixes(splitPrefixes(skipPrefixes))
                .build();

        LOG.debug("Default validation options: {}", options);
        return options;
    }

    /**
     * Splits a comma separated prefix list, dropping blanks.
     *
     * @param value the property value, may be null
     * @return the prefixes
     */
    static List<String> splitPrefixes(final String value) {
        final List<String> result = new ArrayList<>();
        if (value == null) {
            return result;
        }
        for (final String part : value.split(",")) {
            if (!part.isBlank()) {
                result.add(part.trim());
            }
        }
        return result;
    }

}
