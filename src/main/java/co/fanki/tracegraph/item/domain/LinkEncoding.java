package co.fanki.tracegraph.item.domain;

/**
 * How links are written to an item file.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public enum LinkEncoding {

    /** {@code - UID: hash} for verified links, {@code - UID} otherwise. */
    WITH_HASHES,

    /** Always {@code - UID}, dropping stored hashes. */
    UIDS_ONLY

}
