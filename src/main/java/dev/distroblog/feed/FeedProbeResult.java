package dev.distroblog.feed;

import org.jspecify.annotations.Nullable;

/**
 * Outcome of an end-to-end feed check.
 *
 * @param status      HTTP status of the deciding response, null when no response was received
 * @param contentType content type of the GET response, when one was received
 * @param error       why the URL was rejected, null on success
 */
public record FeedProbeResult(
        boolean success,
        @Nullable Integer status,
        @Nullable String contentType,
        @Nullable String error
) {

    static FeedProbeResult ok(int status, @Nullable String contentType) {
        return new FeedProbeResult(true, status, contentType, null);
    }

    static FeedProbeResult rejected(@Nullable Integer status, @Nullable String contentType, String error) {
        return new FeedProbeResult(false, status, contentType, error);
    }
}
