package dev.distroblog.ingestion;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import jakarta.annotation.PostConstruct;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Externalised configuration for ingestion passes.
 *
 * <p>Properties are bound from {@code distroblog.ingestion.*} in application.yml.
 *
 * <ul>
 *   <li>{@code poll-interval} - time between scheduled passes (default 30 min)
 *   <li>{@code max-feed-items} - items read from one feed per pass (default 50)
 *   <li>{@code batch-size} - scraped or extracted items processed together (default 3)
 *   <li>{@code memory-hard-limit-mb} / {@code memory-soft-limit-mb} - resident memory above which
 *       browser-backed sources are skipped / delayed (defaults 450 / 400)
 *   <li>{@code skip-list} - source names or URLs that are never scraped
 * </ul>
 *
 * <p>Validated at startup via {@link #validate()}.
 */
@Configuration
@ConfigurationProperties(prefix = "distroblog.ingestion")
public class IngestionProperties {

    private boolean autoStart = false;
    private Duration pollInterval = Duration.ofMinutes(30);
    private int maxFeedItems = 50;
    private int batchSize = 3;
    private long memoryHardLimitMb = 450;
    private long memorySoftLimitMb = 400;
    private long preScrapeDelayMs = 2_000;
    private long browserCooldownMs = 2_000;
    private boolean gcAfterBrowser = true;
    private List<String> skipList = new ArrayList<>();
    private final Enrichment enrichment = new Enrichment();

    @PostConstruct
    void validate() {
        if (pollInterval == null || pollInterval.compareTo(Duration.ofMinutes(1)) < 0) {
            throw new IllegalStateException(
                    "distroblog.ingestion.poll-interval must be at least 1 minute, got: " + pollInterval);
        }
        if (maxFeedItems < 1 || maxFeedItems > 500) {
            throw new IllegalStateException(
                    "distroblog.ingestion.max-feed-items must be in [1, 500], got: " + maxFeedItems);
        }
        if (batchSize < 1 || batchSize > 20) {
            throw new IllegalStateException(
                    "distroblog.ingestion.batch-size must be in [1, 20], got: " + batchSize);
        }
        if (memorySoftLimitMb > memoryHardLimitMb) {
            throw new IllegalStateException(
                    "distroblog.ingestion.memory-soft-limit-mb must not exceed memory-hard-limit-mb");
        }
        if (enrichment.maxArticles < 1 || enrichment.batchSize < 1) {
            throw new IllegalStateException(
                    "distroblog.ingestion.enrichment.max-articles and batch-size must be positive");
        }
    }

    public boolean isAutoStart() {
        return autoStart;
    }

    public void setAutoStart(boolean autoStart) {
        this.autoStart = autoStart;
    }

    public Duration getPollInterval() {
        return pollInterval;
    }

    public void setPollInterval(Duration pollInterval) {
        this.pollInterval = pollInterval;
    }

    public int getMaxFeedItems() {
        return maxFeedItems;
    }

    public void setMaxFeedItems(int maxFeedItems) {
        this.maxFeedItems = maxFeedItems;
    }

    public int getBatchSize() {
        return batchSize;
    }

    public void setBatchSize(int batchSize) {
        this.batchSize = batchSize;
    }

    public long getMemoryHardLimitMb() {
        return memoryHardLimitMb;
    }

    public void setMemoryHardLimitMb(long memoryHardLimitMb) {
        this.memoryHardLimitMb = memoryHardLimitMb;
    }

    public long getMemorySoftLimitMb() {
        return memorySoftLimitMb;
    }

    public void setMemorySoftLimitMb(long memorySoftLimitMb) {
        this.memorySoftLimitMb = memorySoftLimitMb;
    }

    public long getPreScrapeDelayMs() {
        return preScrapeDelayMs;
    }

    public void setPreScrapeDelayMs(long preScrapeDelayMs) {
        this.preScrapeDelayMs = preScrapeDelayMs;
    }

    public long getBrowserCooldownMs() {
        return browserCooldownMs;
    }

    public void setBrowserCooldownMs(long browserCooldownMs) {
        this.browserCooldownMs = browserCooldownMs;
    }

    public boolean isGcAfterBrowser() {
        return gcAfterBrowser;
    }

    public void setGcAfterBrowser(boolean gcAfterBrowser) {
        this.gcAfterBrowser = gcAfterBrowser;
    }

    public List<String> getSkipList() {
        return skipList;
    }

    public void setSkipList(List<String> skipList) {
        this.skipList = skipList == null ? new ArrayList<>() : new ArrayList<>(skipList);
    }

    public Enrichment getEnrichment() {
        return enrichment;
    }

    /** Settings of the missing-date backfill. */
    public static class Enrichment {

        private Duration window = Duration.ofHours(2);
        private int maxArticles = 50;
        private int batchSize = 2;
        private long articleDelayMs = 500;
        private long batchDelayMs = 1_000;

        public Duration getWindow() {
            return window;
        }

        public void setWindow(Duration window) {
            this.window = window;
        }

        public int getMaxArticles() {
            return maxArticles;
        }

        public void setMaxArticles(int maxArticles) {
            this.maxArticles = maxArticles;
        }

        public int getBatchSize() {
            return batchSize;
        }

        public void setBatchSize(int batchSize) {
            this.batchSize = batchSize;
        }

        public long getArticleDelayMs() {
            return articleDelayMs;
        }

        public void setArticleDelayMs(long articleDelayMs) {
            this.articleDelayMs = articleDelayMs;
        }

        public long getBatchDelayMs() {
            return batchDelayMs;
        }

        public void setBatchDelayMs(long batchDelayMs) {
            this.batchDelayMs = batchDelayMs;
        }
    }
}
