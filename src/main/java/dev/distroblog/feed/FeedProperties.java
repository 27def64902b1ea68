package dev.distroblog.feed;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Discovery and feed reading settings.
 *
 * @param discoveryCacheTtl   how long a discovery outcome (found or not) is reused
 * @param probeTimeoutMs      read timeout for candidate feed GETs
 * @param maxSitemapSizeBytes sitemaps larger than this are ignored
 * @param maxSitemapSections  cap on blog/news sections taken from the sitemap
 */
@ConfigurationProperties(prefix = "distroblog.feed")
public record FeedProperties(
        Duration discoveryCacheTtl,
        int probeTimeoutMs,
        long maxSitemapSizeBytes,
        int maxSitemapSections
) {
    public FeedProperties {
        if (discoveryCacheTtl == null) {
            discoveryCacheTtl = Duration.ofMinutes(30);
        }
    }
}
