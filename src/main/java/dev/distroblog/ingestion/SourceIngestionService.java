package dev.distroblog.ingestion;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import dev.distroblog.extract.RawItem;
import dev.distroblog.feed.FeedReader;
import dev.distroblog.feed.ParsedFeed;
import dev.distroblog.fetch.UrlNormalizer;
import dev.distroblog.scrape.AiExtractorClient;
import dev.distroblog.scrape.TraditionalScraper;
import dev.distroblog.source.MonitoringType;
import dev.distroblog.source.Source;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Ingests one source. RSS sources read their stored feed URL; every other source asks the AI
 * extractor first and scrapes its listing page when that yields nothing usable.
 *
 * <p>Items are processed one by one in source order. A failing item is logged and skipped; a
 * failure reading the source itself propagates to the caller.
 */
@Service
public class SourceIngestionService {

    private static final Logger log = LoggerFactory.getLogger(SourceIngestionService.class);

    private final FeedReader feedReader;
    private final AiExtractorClient aiExtractor;
    private final TraditionalScraper scraper;
    private final ResourceGovernor governor;
    private final DeduplicationGuard deduplicationGuard;
    private final ArticleProcessor articleProcessor;
    private final IngestionProperties properties;

    public SourceIngestionService(FeedReader feedReader, AiExtractorClient aiExtractor,
                                  TraditionalScraper scraper, ResourceGovernor governor,
                                  DeduplicationGuard deduplicationGuard, ArticleProcessor articleProcessor,
                                  IngestionProperties properties) {
        this.feedReader = feedReader;
        this.aiExtractor = aiExtractor;
        this.scraper = scraper;
        this.governor = governor;
        this.deduplicationGuard = deduplicationGuard;
        this.articleProcessor = articleProcessor;
        this.properties = properties;
    }

    /**
     * @return number of articles inserted for the source
     */
    public int ingest(Source source, PassContext pass) {
        if (source.getMonitoringType() == MonitoringType.RSS) {
            return ingestFeed(source, pass);
        }
        return ingestListed(source, pass);
    }

    int ingestFeed(Source source, PassContext pass) {
        ParsedFeed feed = feedReader.fetch(source.getUrl());
        List<RawItem> items = feed.items().subList(0, Math.min(feed.items().size(), properties.getMaxFeedItems()));
        log.info("[{}] Feed has {} items, checking {}", source.getName(), feed.items().size(), items.size());

        int inserted = 0;
        for (RawItem item : items) {
            if (!item.hasLink() || !deduplicationGuard.shouldIngest(item.link())) {
                continue;
            }
            if (processSafely(() -> articleProcessor.processFeedItem(item, source, pass), item) == ItemOutcome.INSERTED) {
                inserted++;
            }
        }
        return inserted;
    }

    int ingestListed(Source source, PassContext pass) {
        List<RawItem> candidates = onSourceDomain(source, aiExtractor.extractArticles(source));
        if (candidates.isEmpty()) {
            candidates = scrapeFallback(source);
        }

        List<RawItem> fresh = new ArrayList<>();
        Set<String> seen = new LinkedHashSet<>();
        for (RawItem item : candidates) {
            if (item.hasLink() && seen.add(item.link().trim()) && deduplicationGuard.shouldIngest(item.link())) {
                fresh.add(item);
            }
        }
        log.info("[{}] {} candidate articles, {} new", source.getName(), candidates.size(), fresh.size());

        int inserted = 0;
        for (int start = 0; start < fresh.size(); start += properties.getBatchSize()) {
            List<RawItem> batch = fresh.subList(start, Math.min(fresh.size(), start + properties.getBatchSize()));
            for (RawItem item : batch) {
                if (processSafely(() -> articleProcessor.processListedItem(item, source, pass), item) == ItemOutcome.INSERTED) {
                    inserted++;
                }
            }
        }
        return inserted;
    }

    private List<RawItem> scrapeFallback(Source source) {
        if (!governor.shouldAttemptScraping(source)) {
            log.warn("[{}] Not scraping, resource limits reached", source.getName());
            return List.of();
        }
        governor.preScrapeDelay();
        try {
            return scraper.scrape(source);
        } finally {
            governor.afterBrowserUse();
        }
    }

    /**
     * Keeps the extracted articles whose host matches the source's host ({@code www.} ignored).
     * The extractor sometimes answers with articles from unrelated sites.
     */
    static List<RawItem> onSourceDomain(Source source, List<RawItem> items) {
        if (items.isEmpty()) {
            return items;
        }
        List<RawItem> matching = items.stream()
                .filter(item -> item.hasLink() && UrlNormalizer.isSameDomain(source.getUrl(), item.link()))
                .toList();
        if (matching.size() < items.size()) {
            log.warn("[{}] Dropped {} of {} extracted articles from other domains",
                    source.getName(), items.size() - matching.size(), items.size());
        }
        return matching;
    }

    private ItemOutcome processSafely(ItemWork work, RawItem item) {
        try {
            return work.run();
        } catch (RuntimeException e) {
            log.warn("Skipping article {}: {}", item.link(), e.getMessage());
            return ItemOutcome.SKIPPED;
        }
    }

    @FunctionalInterface
    private interface ItemWork {
        ItemOutcome run();
    }
}
