package dev.distroblog.ingestion;

import java.time.Clock;
import java.util.UUID;

import dev.distroblog.article.Article;
import dev.distroblog.article.ArticleStore;
import dev.distroblog.article.InsertOutcome;
import dev.distroblog.extract.ContentExtractionPipeline;
import dev.distroblog.extract.PageMetadata;
import dev.distroblog.extract.Snippets;
import dev.distroblog.extract.TitleHeuristics;
import dev.distroblog.fetch.UrlNormalizer;
import dev.distroblog.summary.Summarizer;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/** Adds a single article by URL, outside of any source. */
@Service
public class ManualArticleService {

    private static final Logger log = LoggerFactory.getLogger(ManualArticleService.class);

    public static final String MANUAL_CATEGORY = "Manual";

    private final ContentExtractionPipeline pipeline;
    private final Summarizer summarizer;
    private final ArticleStore articleStore;
    private final Clock clock;

    public ManualArticleService(ContentExtractionPipeline pipeline, Summarizer summarizer,
                                ArticleStore articleStore, Clock clock) {
        this.pipeline = pipeline;
        this.summarizer = summarizer;
        this.articleStore = articleStore;
        this.clock = clock;
    }

    /**
     * Reads the page and stores it as a manual article. An already stored link is reported, not
     * re-read.
     *
     * @throws IllegalArgumentException when the URL is blank or has no host
     * @throws dev.distroblog.fetch.FetchException when the page cannot be fetched
     */
    public Result addByUrl(String url) {
        if (url == null || url.isBlank() || UrlNormalizer.bareHost(url) == null) {
            throw new IllegalArgumentException("A valid article URL is required");
        }
        String link = url.trim();
        if (articleStore.articleExistsByLink(link)) {
            return new Result(false, null, link, null, "Article already exists");
        }

        PageMetadata page = pipeline.extractArticleMetadata(link);
        String title = page.title() == null ? TitleHeuristics.UNTITLED : page.title();
        String sourceName = page.sourceName() == null ? UrlNormalizer.bareHost(link) : page.sourceName();

        Article article = new Article(link, title);
        article.setContent(page.content());
        article.setPubDate(page.pubDate());
        article.setPublisherDescription(page.description());
        article.setPreview(ContentExtractionPipeline.preview(page.description(), null, page.content()));
        article.setArticleHook(summaryOf(title, page.content(), sourceName));
        article.setSourceName(sourceName);
        article.setCategory(MANUAL_CATEGORY);
        article.setManual(true);
        article.setSessionId(PassContext.start(clock.instant(), true).sessionId());

        InsertOutcome outcome = articleStore.insertArticle(article);
        if (outcome.isDuplicate()) {
            return new Result(false, null, link, title, "Article already exists");
        }
        log.info("Manually added article {} ({})", title, link);
        return new Result(true, outcome.id(), link, title, "Article added");
    }

    private @Nullable String summaryOf(String title, String content, String sourceName) {
        String summary = summarizer.summarize(title, content, sourceName);
        return Snippets.isBlank(summary) ? null : summary;
    }

    /** Outcome of a manual add. */
    public record Result(boolean added, @Nullable UUID id, String link, @Nullable String title, String message) {}
}
