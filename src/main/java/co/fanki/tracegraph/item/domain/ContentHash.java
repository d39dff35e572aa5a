package co.fanki.tracegraph.item.domain;

import co.fanki.tracegraph.shared.Preconditions;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.text.Normalizer;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Fingerprint of the reviewable content of an item.
 *
 * <p>The digest covers text, header, the sorted set of parent uids and
 * the type, joined by {@code |}. Text and header are normalized to
 * Unicode NFC first, so equivalent spellings hash identically on every
 * platform. Stored link hashes are not part of the content.</p>
 *
 * <p>The result is the unpadded URL-safe base64 form of a SHA-256
 * digest, always 43 characters long.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class ContentHash {

    /** Shortest string accepted as a stored hash. */
    public static final int MIN_LENGTH = 20;

    private static final Pattern URL_SAFE_BASE64 =
            Pattern.compile("^[A-Za-z0-9_-]+$");

    private ContentHash() {
    }

    /**
     * Computes the content hash of an item.
     *
     * @param item the item
     * @return the hash
     */
    public static String of(final Item item) {
        Preconditions.requireNonNull(item, "Item is required");
        final List<String> parents = new ArrayList<>();
        for (final Link link : item.links()) {
            parents.add(link.parentUid());
        }
        return of(item.text(), item.header(), parents, item.type());
    }

    /**
     * Computes a content hash from its parts.
     *
     * @param text the item text
     * @param header the header, or null
     * @param parentUids the parent uids in any order
     * @param type the item type
     * @return the hash
     */
    public static String of(final String text, final String header,
            final List<String> parentUids, final ItemType type) {

        final String content = String.join("|",
                nfc(text == null ? "" : text),
                nfc(header == null ? "" : header),
                renderUids(parentUids),
                type.wireName());

        return Base64.getUrlEncoder().withoutPadding()
                .encodeToString(sha256(content));
    }

    /**
     * Checks whether a string can be a stored hash.
     *
     * @param value the candidate
     * @return true if it has at least 20 URL-safe base64 characters
     */
    public static boolean isWellFormed(final String value) {
        return value != null && value.length() >= MIN_LENGTH
                && URL_SAFE_BASE64.matcher(value).matches();
    }

    /** Renders uids sorted, in the form {@code ['A', 'B']}. */
    private static String renderUids(final List<String> uids) {
        return uids.stream()
                .sorted()
                .map(uid -> "'" + uid + "'")
                .collect(Collectors.joining(", ", "[", "]"));
    }

    private static String nfc(final String value) {
        return Normalizer.normalize(value, Normalizer.Form.NFC);
    }

    private static byte[] sha256(final String content) {
        try {
            return MessageDigest.getInstance("SHA-256")
                    .digest(content.getBytes(StandardCharsets.UTF_8));
        } catch (final NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 is not available", e);
        }
    }

}
