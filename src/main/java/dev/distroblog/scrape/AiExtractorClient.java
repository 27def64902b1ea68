package dev.distroblog.scrape;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

import dev.distroblog.extract.RawItem;
import dev.distroblog.source.Source;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Recover;
import org.springframework.retry.annotation.Retryable;
import org.springframework.retry.backoff.Sleeper;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

/**
 * Client of the external AI extraction service, which reads a site and returns its latest articles.
 * Callers verify that the returned links belong to the source's domain.
 */
@Service
public class AiExtractorClient {

    private static final Logger log = LoggerFactory.getLogger(AiExtractorClient.class);

    private final RestClient restClient;
    private final AiExtractorProperties properties;
    private final Clock clock;
    private final Sleeper sleeper;

    private Instant lastCall;

    public AiExtractorClient(@Qualifier("aiExtractorRestClient") RestClient restClient,
                             AiExtractorProperties properties, Clock clock, Sleeper sleeper) {
        this.restClient = restClient;
        this.properties = properties;
        this.clock = clock;
        this.sleeper = sleeper;
    }

    public boolean isEnabled() {
        return properties.enabled();
    }

    /**
     * Ask the service for the source's latest articles. Calls are spaced by {@code min-interval-ms}.
     * Transport failures are retried; when retries are exhausted the result is empty.
     */
    @Retryable(
            retryFor = RestClientException.class,
            maxAttemptsExpression = "${distroblog.ai-extractor.retry.max-attempts:3}",
            backoff = @Backoff(
                    delayExpression = "${distroblog.ai-extractor.retry.delay-ms:1000}",
                    multiplierExpression = "${distroblog.ai-extractor.retry.multiplier:2.0}"
            )
    )
    public List<RawItem> extractArticles(Source source) {
        if (!properties.enabled()) {
            return List.of();
        }
        throttle();
        AiExtractResponse response = restClient.post()
                .uri("/extract")
                .body(new AiExtractRequest(source.getUrl(), source.getName(), properties.articleLimit()))
                .retrieve()
                .body(AiExtractResponse.class);

        if (response == null) {
            log.warn("AI extractor returned an empty body for {}", source.getUrl());
            return List.of();
        }
        List<RawItem> items = response.articles().stream()
                .filter(article -> article.url() != null && !article.url().isBlank())
                .map(AiExtractorClient::toRawItem)
                .toList();
        log.info("AI extractor returned {} articles for {}", items.size(), source.getName());
        return items;
    }

    @Recover
    List<RawItem> recoverExtract(RestClientException e, Source source) {
        log.warn("AI extractor failed after retries for {}: {}", source.getUrl(), e.getMessage());
        return List.of();
    }

    private synchronized void throttle() {
        Instant now = clock.instant();
        if (lastCall != null) {
            long wait = properties.minIntervalMs() - Duration.between(lastCall, now).toMillis();
            if (wait > 0) {
                log.debug("Waiting {}ms before next AI extractor call", wait);
                try {
                    sleeper.sleep(wait);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new IllegalStateException("Interrupted while waiting for the AI extractor", e);
                }
                now = clock.instant();
            }
        }
        lastCall = now;
    }

    private static RawItem toRawItem(AiExtractResponse.Article article) {
        return RawItem.builder()
                .title(article.title())
                .link(article.url().trim())
                .description(article.description())
                .contentSnippet(article.description())
                .dateCandidate(article.datePublished())
                .build();
    }
}
