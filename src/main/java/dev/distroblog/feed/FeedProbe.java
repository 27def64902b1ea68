package dev.distroblog.feed;

import java.time.Duration;
import java.util.Locale;

import dev.distroblog.fetch.FetchException;
import dev.distroblog.fetch.FetchResponse;
import dev.distroblog.fetch.RateLimitedFetcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Checks candidate feed URLs.
 *
 * <p>{@link #probe} backs the feed test and source detection endpoints: a HEAD that must not report
 * HTML, then a GET that must return 200 with a non-HTML content type and a body accepted by
 * {@link FeedValidator}. {@link #isFeed} backs discovery and looks at the body only, since many
 * servers label their feeds {@code text/html}.
 */
@Component
public class FeedProbe {

    private static final Logger log = LoggerFactory.getLogger(FeedProbe.class);

    private final RateLimitedFetcher fetcher;
    private final FeedValidator feedValidator;
    private final FeedProperties properties;

    public FeedProbe(RateLimitedFetcher fetcher, FeedValidator feedValidator, FeedProperties properties) {
        this.fetcher = fetcher;
        this.feedValidator = feedValidator;
        this.properties = properties;
    }

    public FeedProbeResult probe(String feedUrl) {
        try {
            FetchResponse head = fetcher.head(feedUrl);
            if (lower(head.contentType()).contains("html")) {
                return FeedProbeResult.rejected(head.status(), head.contentType(), "HTML content-type");
            }
        } catch (FetchException e) {
            // servers that refuse HEAD still get the GET
            log.debug("HEAD {} failed, continuing with GET: {}", feedUrl, e.getMessage());
        }

        FetchResponse response;
        try {
            response = fetcher.get(feedUrl, Duration.ofMillis(properties.probeTimeoutMs()));
        } catch (FetchException e) {
            Integer status = e.getStatusCode() > 0 ? e.getStatusCode() : null;
            return FeedProbeResult.rejected(status, null, e.getMessage());
        }
        if (lower(response.contentType()).contains("text/html")) {
            return FeedProbeResult.rejected(response.status(), response.contentType(), "HTML page, not a feed");
        }
        if (response.isOk() && feedValidator.isValidFeed(response.body())) {
            return FeedProbeResult.ok(response.status(), response.contentType());
        }
        return FeedProbeResult.rejected(response.status(), response.contentType(), "Invalid feed content");
    }

    /** 200 and a body {@link FeedValidator} accepts, whatever the content type says. */
    public boolean isFeed(String feedUrl) {
        FetchResponse response;
        try {
            response = fetcher.get(feedUrl, Duration.ofMillis(properties.probeTimeoutMs()));
        } catch (FetchException e) {
            log.debug("Rejected feed candidate {}: {}", feedUrl, e.getMessage());
            return false;
        }
        boolean feed = response.isOk() && feedValidator.isValidFeed(response.body());
        if (!feed) {
            log.debug("Rejected feed candidate {}: status {}, not a feed body", feedUrl, response.status());
        }
        return feed;
    }

    private static String lower(String value) {
        return value == null ? "" : value.toLowerCase(Locale.ROOT);
    }
}
