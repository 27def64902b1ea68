package dev.distroblog.feed;

/** Wire format a feed document was read as. */
public enum FeedFormat {
    /** RSS 0.9x / 2.0 read by ROME. */
    RSS,
    /** RSS 1.0 (RDF) read by ROME. */
    RDF,
    /** Atom 0.3 / 1.0 read by ROME. */
    ATOM,
    /** JSON Feed 1.x ({@code version} + {@code items}). */
    JSON_FEED,
    /** XML that failed strict parsing on a cosmetic error and was read leniently. */
    LENIENT_XML
}
