package dev.distroblog.feed;

/**
 * A feed body could not be read. {@link #isCosmetic()} marks XML errors such as an unescaped
 * ampersand that do not mean the document is not a feed.
 */
public class FeedParseException extends RuntimeException {

    private final boolean cosmetic;

    public FeedParseException(String message, boolean cosmetic, Throwable cause) {
        super(message, cause);
        this.cosmetic = cosmetic;
    }

    public boolean isCosmetic() {
        return cosmetic;
    }
}
