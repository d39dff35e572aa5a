package co.fanki.tracegraph.item.domain;

import co.fanki.tracegraph.document.domain.Document;
import co.fanki.tracegraph.shared.Preconditions;

import java.util.Collection;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Chooses the uid of a new item.
 *
 * <p>The next uid is one past the highest number in use, so gaps left by
 * removed items stay gaps.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class UidAllocator {

    private UidAllocator() {
    }

    /**
     * Returns the next uid of a document.
     *
     * @param document the document
     * @param existingUids the uids already in use; uids of other documents
     *        are ignored
     * @return the new uid, zero-padded to the document's digits
     */
    public static String next(final Document document,
            final Collection<String> existingUids) {
        Preconditions.requireNonNull(document, "Document is required");
        return document.formatUid(highestNumber(document, existingUids) + 1);
    }

    /**
     * Returns the numeric part of a uid.
     *
     * @param document the owning document
     * @param uid the uid
     * @return the number, or -1 if the uid does not belong to the document
     */
    public static long number(final Document document, final String uid) {
        final Matcher matcher = document.uidPattern().matcher(uid);
        if (!matcher.matches()) {
            return -1;
        }
        return Long.parseLong(matcher.group(1));
    }

    private static long highestNumber(final Document document,
            final Collection<String> uids) {
        final Pattern pattern = document.uidPattern();
        long max = 0;
        if (uids == null) {
            return max;
        }
        for (final String uid : uids) {
            final Matcher matcher = pattern.matcher(uid);
            if (matcher.matches()) {
                max = Math.max(max, Long.parseLong(matcher.group(1)));
            }
        }
        return max;
    }

}
