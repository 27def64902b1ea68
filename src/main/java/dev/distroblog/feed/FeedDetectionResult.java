package dev.distroblog.feed;

import org.jspecify.annotations.Nullable;

/**
 * @param url   the feed URL when one was found, otherwise the URL that was checked
 * @param error user-facing explanation, null when {@link DetectionStatus#VALID}
 */
public record FeedDetectionResult(String url, String type, DetectionStatus status, @Nullable String error) {

    static final String TYPE_RSS = "RSS";

    static FeedDetectionResult of(String url, DetectionStatus status, @Nullable String error) {
        return new FeedDetectionResult(url, TYPE_RSS, status, error);
    }
}
