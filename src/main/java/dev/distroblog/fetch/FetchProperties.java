package dev.distroblog.fetch;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Outbound HTTP settings shared by every component that talks to third-party sites.
 *
 * @param userAgent          identity sent with every request
 * @param minDomainSpacingMs minimum delay between two requests to the same host
 * @param connectTimeoutMs   TCP connect timeout
 * @param defaultTimeoutMs   read timeout used when a caller does not pass one
 * @param headTimeoutMs      read timeout for HEAD probes
 * @param maxBodyBytes       responses larger than this are truncated
 * @param retry              retry budget for 429, 5xx and transport failures
 */
@ConfigurationProperties(prefix = "distroblog.fetch")
public record FetchProperties(
        String userAgent,
        long minDomainSpacingMs,
        int connectTimeoutMs,
        int defaultTimeoutMs,
        int headTimeoutMs,
        int maxBodyBytes,
        Retry retry
) {
    public static final String DEFAULT_USER_AGENT = "Mozilla/5.0 (compatible; RSS Feed Discovery Bot)";

    public FetchProperties {
        if (userAgent == null || userAgent.isBlank()) {
            userAgent = DEFAULT_USER_AGENT;
        }
        if (retry == null) {
            retry = new Retry(3, 1000);
        }
    }

    public record Retry(int maxAttempts, long baseDelayMs) {}
}
