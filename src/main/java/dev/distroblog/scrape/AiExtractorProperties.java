package dev.distroblog.scrape;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Settings of the external AI extraction service.
 *
 * @param minIntervalMs minimum time between two calls, the service's upstream model is rate limited
 * @param articleLimit  number of articles requested per source
 */
@ConfigurationProperties(prefix = "distroblog.ai-extractor")
public record AiExtractorProperties(
        boolean enabled,
        String baseUrl,
        int connectTimeoutMs,
        int readTimeoutMs,
        long minIntervalMs,
        int articleLimit,
        Retry retry
) {
    public AiExtractorProperties {
        if (baseUrl == null || baseUrl.isBlank()) {
            baseUrl = "http://localhost:8000";
        }
        if (minIntervalMs <= 0) {
            minIntervalMs = 7_000;
        }
        if (articleLimit <= 0) {
            articleLimit = 3;
        }
        if (retry == null) {
            retry = new Retry(3, 1_000, 2.0);
        }
    }

    public record Retry(int maxAttempts, long delayMs, double multiplier) {}
}
