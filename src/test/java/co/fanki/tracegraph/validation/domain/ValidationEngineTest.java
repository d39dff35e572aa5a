package co.fanki.tracegraph.validation.domain;

import co.fanki.tracegraph.graph.domain.TraceabilityGraph;
import co.fanki.tracegraph.issue.domain.IssueCode;
import co.fanki.tracegraph.issue.domain.IssueLevel;
import co.fanki.tracegraph.issue.domain.ValidationIssue;
import co.fanki.tracegraph.item.domain.Item;
import co.fanki.tracegraph.item.domain.ItemType;
import co.fanki.tracegraph.item.domain.Link;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Unit tests for ValidationEngine and the standard checks.
 *
 * <p>Every test starts from a clean two level project, SYS above SRS,
 * where each item is reviewed and each link verified, and then breaks
 * one thing.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class ValidationEngineTest {

    private ValidationEngine engine;
    private TraceabilityGraph graph;
    private Item sys001;

    @BeforeEach
    void setUp() {
        engine = new ValidationEngine();
        graph = new TraceabilityGraph();
        graph.setDocumentParents("SYS", List.of());
        graph.setDocumentParents("SRS", List.of("SYS"));

        sys001 = Item.requirement("SYS001", "SYS", "The pump shall stop.")
                .markReviewed();
        graph.addItem(sys001);
        graph.addItem(childOf("SRS001", "Stop within 2s", sys001));
    }

    private static Item childOf(final String uid, final String text,
            final Item parent) {
        final String prefix = uid.substring(0, 3);
        return Item.builder(uid, prefix)
                .text(text)
                .link(Link.verified(parent.uid(), parent.contentHash()))
                .build()
                .markReviewed();
    }

    private ValidationReport validate() {
        return engine.validate(graph, ValidationOptions.defaults());
    }

    private static List<ValidationIssue> issues(final ValidationReport report,
            final IssueCode code) {
        return report.issues().stream()
                .filter(i -> i.code() == code)
                .toList();
    }

    @Test
    void whenValidate_givenCleanProject_shouldReportNothing() {
        final ValidationReport report = validate();

        assertTrue(report.isEmpty(), report.issues().toString());
        assertEquals(0, report.exitCode());
    }

    @Test
    void whenValidate_givenParentTextChanged_shouldFlagOneSuspectLink() {
        graph.addItem(sys001.withText("The pump shall halt."));

        final List<ValidationIssue> suspect = issues(validate(),
                IssueCode.SUSPECT_LINK);

        assertEquals(1, suspect.size());
        assertEquals("SRS001", suspect.get(0).subject());
        assertTrue(suspect.get(0).message().contains("SRS001 -> SYS001"));
        assertEquals(IssueLevel.WARNING, suspect.get(0).level());
    }

    @Test
    void whenValidate_givenLinkWithoutHash_shouldFlagUnverified() {
        graph.addItem(Item.builder("SRS002", "SRS").text("Alarm")
                .link("SYS001").build().markReviewed());

        assertEquals(1, issues(validate(), IssueCode.UNVERIFIED_LINK).size());
    }

    @Test
    void whenValidate_givenSelfLink_shouldReportError() {
        graph.addItem(Item.builder("SRS002", "SRS").text("Loop")
                .link("SRS002").link("SYS001").build());

        final List<ValidationIssue> self = issues(validate(),
                IssueCode.SELF_LINK);

        assertEquals(1, self.size());
        assertEquals(IssueLevel.ERROR, self.get(0).level());
        assertTrue(issues(validate(), IssueCode.ITEM_CYCLE).isEmpty());
    }

    @Test
    void whenValidate_givenHeadingWithLinks_shouldReportError() {
        graph.addItem(Item.builder("SRS002", "SRS").header("Alarms")
                .type(ItemType.HEADING).link("SYS001").build());

        final List<ValidationIssue> found = issues(validate(),
                IssueCode.LINKS_ON_NON_NORMATIVE_ITEM);

        assertEquals(1, found.size());
        assertEquals(IssueLevel.ERROR, found.get(0).level());
    }

    @Test
    void whenValidate_givenLinkToHeading_shouldWarnNonNormativeTarget() {
        graph.addItem(Item.builder("SYS002", "SYS").header("Safety")
                .type(ItemType.HEADING).build());
        graph.addItem(childOf("SRS002", "Alarm", graph.item("SYS002")));

        assertEquals(1, issues(validate(),
                IssueCode.NON_NORMATIVE_LINK_TARGET).size());
    }

    @Test
    void whenValidate_givenMissingAndInactiveTargets_shouldReportBoth() {
        graph.addItem(Item.builder("SYS002", "SYS").text("Retired")
                .active(false).build());
        graph.addItem(Item.builder("SRS002", "SRS").text("Alarm")
                .link("SYS404").link("SYS002").build());

        final ValidationReport report = validate();

        final List<ValidationIssue> missing = issues(report,
                IssueCode.MISSING_LINK_TARGET);
        assertEquals(1, missing.size());
        assertEquals(IssueLevel.ERROR, missing.get(0).level());
        assertEquals(1, issues(report, IssueCode.INACTIVE_LINK_TARGET).size());
        assertEquals(1, report.exitCode());
    }

    @Test
    void whenValidate_givenItemCycle_shouldReportItOnce() {
        graph.addItem(Item.builder("SRS002", "SRS").text("A")
                .link("SRS003").link("SYS001").build());
        graph.addItem(Item.builder("SRS003", "SRS").text("B")
                .link("SRS002").link("SYS001").build());

        final List<ValidationIssue> cycles = issues(validate(),
                IssueCode.ITEM_CYCLE);

        assertEquals(1, cycles.size());
        assertEquals("Cycle detected: SRS002 -> SRS003 -> SRS002",
                cycles.get(0).message());
    }

    @Test
    void whenValidate_givenLinkFromRootDocument_shouldBeNonconforming() {
        graph.addItem(childOf("SYS002", "Upward", graph.item("SRS001")));

        final List<ValidationIssue> found = issues(validate(),
                IssueCode.NONCONFORMING_LINK);

        assertEquals(1, found.size());
        assertTrue(found.get(0).message().contains("SYS is a root document"));
    }

    @Test
    void whenValidate_givenLinkWithinSameDocument_shouldBeNonconforming() {
        graph.addItem(childOf("SRS002", "Sibling", graph.item("SRS001")));

        assertEquals(1, issues(validate(),
                IssueCode.NONCONFORMING_LINK).size());
    }

    @Test
    void whenValidate_givenChangedItem_shouldReportModifiedSinceReview() {
        graph.addItem(graph.item("SRS001").toBuilder().text("Changed")
                .build());

        assertEquals(1, issues(validate(),
                IssueCode.MODIFIED_SINCE_REVIEW).size());
    }

    @Test
    void whenValidate_givenUnreviewedItem_shouldReportNeverReviewed() {
        graph.addItem(graph.item("SRS001").withReviewCleared());

        assertEquals(1, issues(validate(), IssueCode.NEVER_REVIEWED).size());
    }

    @Test
    void whenValidate_givenEmptyText_shouldWarn() {
        graph.addItem(childOf("SRS002", " ", sys001));

        assertEquals(1, issues(validate(), IssueCode.EMPTY_TEXT).size());
    }

    @Test
    void whenValidate_givenUnlinkedItem_shouldWarnUnlessDerived() {
        graph.addItem(Item.requirement("SRS002", "SRS", "Orphan")
                .markReviewed());
        graph.addItem(Item.builder("SRS003", "SRS").text("Derived")
                .derived(true).build().markReviewed());

        final List<ValidationIssue> found = issues(validate(),
                IssueCode.UNLINKED_ITEM);

        assertEquals(1, found.size());
        assertEquals("SRS002", found.get(0).subject());
        assertEquals(IssueLevel.WARNING, found.get(0).level());
    }

    @Test
    void whenValidate_givenEmptyDocument_shouldWarn() {
        graph.setDocumentParents("TST", List.of("SRS"));

        final List<ValidationIssue> found = issues(validate(),
                IssueCode.EMPTY_DOCUMENT);

        assertEquals(1, found.size());
        assertEquals("TST", found.get(0).subject());
    }

    @Test
    void whenValidate_givenUnknownParentDocument_shouldReportError() {
        graph.setDocumentParents("SRS", List.of("SYS", "GONE"));

        final List<ValidationIssue> found = issues(validate(),
                IssueCode.UNKNOWN_PARENT_DOCUMENT);

        assertEquals(1, found.size());
        assertEquals("SRS", found.get(0).subject());
    }

    @Test
    void whenValidate_givenDocumentCycle_shouldReportCyclicPrefixes() {
        graph.setDocumentParents("SYS", List.of("SRS"));

        final List<ValidationIssue> found = issues(validate(),
                IssueCode.DOCUMENT_CYCLE);

        assertEquals(1, found.size());
        assertEquals("SRS, SYS", found.get(0).subject());
    }

    @Test
    void whenValidate_givenOnlyChildDocumentRemoved_shouldFlagNoChildLinks() {
        final TraceabilityGraph withHazards = new TraceabilityGraph();
        withHazards.setDocumentParents("SYS", List.of());
        withHazards.setDocumentParents("SRS", List.of("SYS"));
        withHazards.setDocumentParents("HAZ", List.of("SYS"));
        withHazards.addItem(sys001);
        withHazards.addItem(graph.item("SRS001"));
        withHazards.addItem(childOf("HAZ001", "Occlusion", Item.requirement(
                "SYS009", "SYS", "unrelated")));

        assertTrue(issues(engine.validate(withHazards,
                ValidationOptions.defaults()), IssueCode.NO_CHILD_LINKS)
                .stream().noneMatch(i -> i.subject().equals("SYS001")));

        final TraceabilityGraph withoutSrs = new TraceabilityGraph();
        withoutSrs.setDocumentParents("SYS", List.of());
        withoutSrs.setDocumentParents("HAZ", List.of("SYS"));
        withoutSrs.addItem(sys001);
        withoutSrs.addItem(withHazards.item("HAZ001"));

        final List<ValidationIssue> found = issues(engine.validate(
                withoutSrs, ValidationOptions.defaults()),
                IssueCode.NO_CHILD_LINKS);

        assertEquals(1, found.size());
        assertEquals("SYS001", found.get(0).subject());
        assertEquals(IssueLevel.INFO, found.get(0).level());
    }

    @Test
    void whenValidate_givenWarnAllAndErrorAll_shouldPromoteInfoToError() {
        graph.setDocumentParents("HAZ", List.of("SYS"));
        graph.addItem(childOf("HAZ001", "Hazard", sys001));
        graph.addItem(Item.requirement("SYS002", "SYS", "No children")
                .markReviewed());

        final ValidationOptions options = ValidationOptions.builder()
                .warnAll(true)
                .errorAll(true)
                .build();
        final ValidationReport report = engine.validate(graph, options);

        final List<ValidationIssue> found = issues(report,
                IssueCode.NO_CHILD_LINKS);
        assertEquals(1, found.size());
        assertEquals(IssueLevel.ERROR, found.get(0).level());
        assertEquals(0, report.count(IssueLevel.INFO));
        assertEquals(0, report.count(IssueLevel.WARNING));
    }

    @Test
    void whenValidate_givenSkippedDocument_shouldIgnoreItsItems() {
        graph.addItem(Item.requirement("SRS002", "SRS", "").markReviewed());

        final ValidationOptions options = ValidationOptions.builder()
                .skipPrefixes(List.of("SRS"))
                .build();

        assertTrue(engine.validate(graph, options).issuesFor("SRS002")
                .isEmpty());
    }

    @Test
    void whenValidate_givenChecksDisabled_shouldOnlyCheckDocuments() {
        graph.addItem(Item.builder("SRS002", "SRS").link("SRS002").build());
        graph.setDocumentParents("SRS", List.of("SYS", "GONE"));

        final ValidationOptions options = ValidationOptions.builder()
                .itemCycles(false)
                .linkConformance(false)
                .linkValidity(false)
                .suspectLinks(false)
                .reviewStatus(false)
                .emptyText(false)
                .childLinkage(false)
                .unlinkedItems(false)
                .emptyDocuments(false)
                .build();
        final ValidationReport report = engine.validate(graph, options);

        assertEquals(1, report.issues().size());
        assertEquals(IssueCode.UNKNOWN_PARENT_DOCUMENT,
                report.issues().get(0).code());
    }

    @Test
    void whenValidate_givenGraph_shouldNotModifyIt() {
        graph.addItem(sys001.withText("Changed"));
        final String before = graph.toJson();

        validate();

        assertEquals(before, graph.toJson());
        assertFalse(graph.item("SYS001").isReviewed());
    }

}
