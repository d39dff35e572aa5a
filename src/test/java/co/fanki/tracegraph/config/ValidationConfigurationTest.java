package co.fanki.tracegraph.config;

import co.fanki.tracegraph.issue.domain.IssueLevel;
import co.fanki.tracegraph.validation.domain.ValidationOptions;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Unit tests for ValidationConfiguration.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class ValidationConfigurationTest {

    private final ValidationConfiguration configuration =
            new ValidationConfiguration();

    @Test
    void whenSplitPrefixes_givenCommaList_shouldTrimAndDropBlanks() {
        assertEquals(List.of("SRS", "TST"),
                ValidationConfiguration.splitPrefixes(" SRS, ,TST,"));
        assertTrue(ValidationConfiguration.splitPrefixes("").isEmpty());
        assertTrue(ValidationConfiguration.splitPrefixes(null).isEmpty());
    }

    @Test
    void whenValidationOptions_givenProperties_shouldBindThem() {
        final ValidationOptions options = configuration.validationOptions(
                true, false, true, true, false, true, true, "warn", true,
                "error", false, true, false, "HAZ");

        assertFalse(options.linkConformance());
        assertFalse(options.reviewStatus());
        assertFalse(options.emptyDocuments());
        assertTrue(options.warnAll());
        assertEquals(IssueLevel.WARNING, options.childLinkageLevel());
        assertEquals(IssueLevel.ERROR, options.unlinkedItemLevel());
        assertEquals(Set.of("HAZ"), options.skipPrefixes());
        assertTrue(options.isSkipped("HAZ"));
    }

    @Test
    void whenValidationOptions_givenUnknownLevel_shouldFail() {
        assertThrows(IllegalArgumentException.class,
                () -> configuration.validationOptions(true, true, true, true,
                        true, true, true, "loud", true, "warning", true,
                        false, false, ""));
    }

}
