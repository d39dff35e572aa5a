package co.fanki.tracegraph.item.domain;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Unit tests for ItemCodec.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class ItemCodecTest {

    private static final String HASH = "abcdefghijklmnopqrstuvwxyz_0123456789-AB";

    private static Item decode(final String yaml) {
        return ItemCodec.decode("SRS001", "SRS",
                yaml.getBytes(StandardCharsets.UTF_8));
    }

    private static String encode(final Item item, final LinkEncoding mode) {
        return new String(ItemCodec.encode(item, mode), StandardCharsets.UTF_8);
    }

    @Test
    void whenDecode_givenFullItem_shouldReadEveryField() {
        final Item item = decode("""
                header: Stop
                active: false
                type: requirement
                links:
                - SYS001
                - SYS002: %s
                text: |
                  The pump shall stop.
                  Immediately.
                reviewed: %s
                derived: true
                testable: false
                """.formatted(HASH, HASH));

        assertEquals("Stop", item.header());
        assertFalse(item.isActive());
        assertEquals(List.of("SYS001", "SYS002"), item.parentUids());
        assertFalse(item.link("SYS001").isVerified());
        assertEquals(HASH, item.link("SYS002").storedHash().orElseThrow());
        assertEquals("The pump shall stop.\nImmediately.\n", item.text());
        assertEquals(HASH, item.reviewed().orElseThrow());
        assertTrue(item.isDerived());
        assertFalse(item.isTestable());
    }

    @Test
    void whenDecode_givenEmptyFile_shouldUseDefaults() {
        final Item item = decode("");

        assertEquals("SRS001", item.uid());
        assertEquals("", item.text());
        assertTrue(item.isActive());
    }

    @Test
    void whenDecode_givenMalformedLinkHash_shouldDropIt() {
        final Item item = decode("links:\n- SYS001: not-a-hash\n");

        assertTrue(item.linksTo("SYS001"));
        assertFalse(item.link("SYS001").isVerified());
    }

    @Test
    void whenDecode_givenNonTextReviewed_shouldIgnoreIt() {
        assertFalse(decode("text: x\nreviewed: 12\n").isReviewed());
    }

    @Test
    void whenDecode_givenUnknownType_shouldThrowParseException() {
        final ItemParseException e = assertThrows(ItemParseException.class,
                () -> decode("type: chapter\n"));

        assertEquals("SRS001", e.uid());
        assertEquals(ItemParseException.CODE, e.getErrorCode());
    }

    @Test
    void whenDecode_givenInvalidInput_shouldThrowParseException() {
        assertThrows(ItemParseException.class,
                () -> decode("active: maybe\n"));
        assertThrows(ItemParseException.class,
                () -> decode("links: SYS001\n"));
        assertThrows(ItemParseException.class,
                () -> decode("links:\n- [SYS001]\n"));
        assertThrows(ItemParseException.class,
                () -> decode("- just\n- a list\n"));
        assertThrows(ItemParseException.class,
                () -> decode("text: [unclosed\n"));
    }

    @Test
    void whenRoundTrip_givenCustomAttributes_shouldPreserveThem() {
        final Item item = decode("""
                text: The pump shall stop.
                owner: qa-team
                risk:
                  level: 3
                  tags: [pump, safety]
                verified: true
                """);

        final Item again = ItemCodec.decode("SRS001", "SRS",
                ItemCodec.encode(item));

        assertEquals(item, again);
        assertEquals("qa-team", again.customAttributes().get("owner")
                .asText());
        assertEquals(3, again.customAttributes().get("risk").get("level")
                .asInt());
        assertTrue(again.customAttributes().get("verified").asBoolean());
    }

    @Test
    void whenEncode_givenItem_shouldWriteKeysInFixedOrder() {
        final Item item = Item.builder("SRS001", "SRS")
                .header("Stop")
                .text("The pump shall stop.")
                .link(Link.verified("SYS001", HASH))
                .build();

        final String yaml = encode(item, LinkEncoding.WITH_HASHES);

        final int header = yaml.indexOf("header:");
        final int active = yaml.indexOf("active:");
        final int type = yaml.indexOf("type:");
        final int links = yaml.indexOf("links:");
        final int text = yaml.indexOf("text:");
        final int reviewed = yaml.indexOf("reviewed:");
        assertTrue(header < active && active < type && type < links
                && links < text && text < reviewed);
        assertTrue(yaml.contains("SYS001: \"" + HASH + "\"")
                || yaml.contains("SYS001: " + HASH));
        assertFalse(yaml.contains("derived"));
        assertFalse(yaml.contains("testable"));
    }

    @Test
    void whenEncode_givenUidsOnly_shouldOmitHashes() {
        final Item item = Item.builder("SRS001", "SRS")
                .link(Link.verified("SYS001", HASH))
                .build();

        final String yaml = encode(item, LinkEncoding.UIDS_ONLY);

        assertFalse(yaml.contains(HASH));
        assertTrue(yaml.contains("- SYS001") || yaml.contains("- \"SYS001\""));
    }

    @Test
    void whenEncode_givenNonDefaultFlags_shouldWriteThem() {
        final Item item = Item.builder("SRS001", "SRS")
                .derived(true).testable(false).build();

        final Item again = ItemCodec.decode("SRS001", "SRS",
                ItemCodec.encode(item));

        assertTrue(again.isDerived());
        assertFalse(again.isTestable());
        assertNull(again.header());
    }

}
