package dev.distroblog.ingestion;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

import dev.distroblog.article.Article;
import dev.distroblog.article.ArticleStore;
import dev.distroblog.extract.ContentExtractionPipeline;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.retry.backoff.Sleeper;
import org.springframework.stereotype.Service;

/**
 * Backfills publication dates of recently scraped articles by re-reading their pages. Runs in
 * small paced batches and stops early under memory pressure.
 */
@Service
public class DateEnrichmentService {

    private static final Logger log = LoggerFactory.getLogger(DateEnrichmentService.class);

    private final ArticleStore articleStore;
    private final ContentExtractionPipeline pipeline;
    private final ResourceGovernor governor;
    private final IngestionProperties.Enrichment settings;
    private final Clock clock;
    private final Sleeper sleeper;

    public DateEnrichmentService(ArticleStore articleStore, ContentExtractionPipeline pipeline,
                                 ResourceGovernor governor, IngestionProperties properties,
                                 Clock clock, Sleeper sleeper) {
        this.articleStore = articleStore;
        this.pipeline = pipeline;
        this.governor = governor;
        this.settings = properties.getEnrichment();
        this.clock = clock;
        this.sleeper = sleeper;
    }

    /**
     * @param limit requested number of articles, capped at {@code max-articles}
     * @return number of articles that received a date
     */
    public int enrichMissingDates(int limit) {
        int capped = Math.min(Math.max(limit, 0), settings.getMaxArticles());
        if (capped == 0) {
            return 0;
        }
        Instant since = clock.instant().minus(settings.getWindow());
        List<Article> undated = articleStore.findRecentUndatedScrapedArticles(since, capped);
        log.info("Enriching dates of {} recent scraped articles", undated.size());

        int enriched = 0;
        for (int start = 0; start < undated.size(); start += settings.getBatchSize()) {
            if (governor.isAboveHardLimit()) {
                log.warn("Memory limit reached, stopping date enrichment after {} articles", start);
                break;
            }
            if (start > 0 && !pause(settings.getBatchDelayMs())) {
                break;
            }
            List<Article> batch = undated.subList(start, Math.min(undated.size(), start + settings.getBatchSize()));
            for (int i = 0; i < batch.size(); i++) {
                if (i > 0 && !pause(settings.getArticleDelayMs())) {
                    return enriched;
                }
                Article article = batch.get(i);
                Instant pubDate = pipeline.extractDateStatic(article.getLink());
                if (pubDate != null) {
                    articleStore.updateArticlePubDate(article.getId(), pubDate);
                    enriched++;
                }
            }
        }
        log.info("Date enrichment finished, {} of {} articles dated", enriched, undated.size());
        return enriched;
    }

    private boolean pause(long millis) {
        try {
            sleeper.sleep(millis);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
