package dev.distroblog.ingestion;

import java.net.URI;
import java.net.URISyntaxException;
import java.time.Instant;
import java.util.Locale;

import dev.distroblog.article.Article;
import dev.distroblog.article.ArticleStore;
import dev.distroblog.article.InsertOutcome;
import dev.distroblog.extract.ContentCleaner;
import dev.distroblog.extract.ContentExtractionPipeline;
import dev.distroblog.extract.DateExtractor;
import dev.distroblog.extract.ExtractedArticle;
import dev.distroblog.extract.PageMetadata;
import dev.distroblog.extract.RawItem;
import dev.distroblog.extract.Snippets;
import dev.distroblog.extract.TitleHeuristics;
import dev.distroblog.fetch.FetchException;
import dev.distroblog.source.Source;
import dev.distroblog.summary.Summarizer;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Turns one candidate item into a stored {@link Article}. Feed items already carry most of their
 * data; scraped and extracted items are completed from their article page.
 */
@Component
public class ArticleProcessor {

    private static final Logger log = LoggerFactory.getLogger(ArticleProcessor.class);

    static final int MIN_DESCRIPTION = 50;
    static final int MIN_HOOK_CONTENT = 50;

    private final ContentExtractionPipeline pipeline;
    private final DateExtractor dateExtractor;
    private final Summarizer summarizer;
    private final ArticleStore articleStore;

    public ArticleProcessor(ContentExtractionPipeline pipeline, DateExtractor dateExtractor,
                            Summarizer summarizer, ArticleStore articleStore) {
        this.pipeline = pipeline;
        this.dateExtractor = dateExtractor;
        this.summarizer = summarizer;
        this.articleStore = articleStore;
    }

    public ItemOutcome processFeedItem(RawItem item, Source source, PassContext pass) {
        ExtractedArticle extracted = pipeline.extract(item);
        if (TitleHeuristics.isGenericTitle(extracted.title())) {
            log.debug("Skipping feed item with generic title '{}': {}", extracted.title(), item.link());
            return ItemOutcome.SKIPPED;
        }
        Article article = new Article(extracted.link(), extracted.title());
        article.setContent(extracted.content());
        article.setPublisherDescription(extracted.description());
        article.setAuthor(extracted.author());
        article.setPubDate(extracted.pubDate());
        return store(article, source, pass, extracted.preview(), extracted.description());
    }

    public ItemOutcome processListedItem(RawItem item, Source source, PassContext pass) {
        String link = item.link().trim();
        String title = TitleHeuristics.cleanTitle(item.title());
        if (TitleHeuristics.isGenericTitle(title)) {
            log.debug("Skipping listed item with generic title '{}': {}", title, link);
            return ItemOutcome.SKIPPED;
        }
        Instant pubDate = dateExtractor.fromCandidates(item.dateCandidates());
        String content = ContentCleaner.clean(firstNonBlank(item.content(), item.contentSnippet(), item.description()));
        String description = Snippets.isBlank(item.description()) ? null : ContentCleaner.clean(item.description());

        if (pass.manual()) {
            if (pubDate == null) {
                pubDate = pipeline.extractDateStatic(link);
            }
            if (Snippets.length(description) < MIN_DESCRIPTION) {
                String fromPage = pipeline.extractDescriptionStatic(link);
                if (fromPage != null) {
                    description = fromPage;
                }
            }
        } else if (!skipsMetadata(link)) {
            try {
                PageMetadata page = pipeline.extractArticleMetadata(link);
                if (page.title() != null && !TitleHeuristics.isGenericTitle(page.title())) {
                    title = page.title();
                }
                if (page.content().length() > content.length()) {
                    content = page.content();
                }
                if (pubDate == null) {
                    pubDate = page.pubDate();
                }
                if (Snippets.length(description) < MIN_DESCRIPTION && page.description() != null) {
                    description = page.description();
                }
            } catch (FetchException e) {
                log.info("Metadata extraction failed for {}: {}", link, e.getMessage());
            }
        }

        String preview = ContentExtractionPipeline.preview(description, item.contentSnippet(), content);
        if (content.length() < 20 && preview.length() < 20) {
            log.debug("Skipping near-empty item {}", link);
            return ItemOutcome.SKIPPED;
        }
        Article article = new Article(link, title);
        article.setContent(content);
        article.setPublisherDescription(description);
        article.setAuthor(item.author());
        article.setPubDate(pubDate);
        return store(article, source, pass, preview, description);
    }

    private ItemOutcome store(Article article, Source source, PassContext pass,
                              String heuristicPreview, @Nullable String description) {
        String summary = summarizer.summarize(article.getTitle(), article.getContent(), source.getName());
        article.setPreview(Snippets.isBlank(summary) ? heuristicPreview : summary);
        article.setArticleHook(hook(article, source, description, heuristicPreview));
        article.setSourceId(source.getId());
        article.setSourceName(source.getName());
        article.setCategory(source.getCategory());
        article.setSessionId(pass.sessionId());

        InsertOutcome outcome = articleStore.insertArticle(article);
        if (outcome.isDuplicate()) {
            return ItemOutcome.DUPLICATE;
        }
        log.info("[{}] New article: {}", source.getName(), article.getTitle());
        return ItemOutcome.INSERTED;
    }

    private @Nullable String hook(Article article, Source source, @Nullable String description, String preview) {
        String hookContent = firstNonBlank(article.getContent(), description, preview);
        if (hookContent.length() <= MIN_HOOK_CONTENT) {
            return null;
        }
        try {
            return summarizer.hook(article.getTitle(), hookContent, source.getName());
        } catch (RuntimeException e) {
            log.info("Hook generation failed for {}: {}", article.getLink(), e.getMessage());
            return null;
        }
    }

    /** Redirect links and bare domains have no article page worth rendering. */
    static boolean skipsMetadata(String link) {
        try {
            URI uri = new URI(link);
            String host = uri.getHost() == null ? "" : uri.getHost().toLowerCase(Locale.ROOT);
            String path = uri.getPath() == null ? "" : uri.getPath();
            if (host.contains("google.") && path.startsWith("/url")) {
                return true;
            }
            return path.isEmpty() || path.equals("/");
        } catch (URISyntaxException e) {
            return true;
        }
    }

    private static String firstNonBlank(@Nullable String... values) {
        for (String value : values) {
            if (!Snippets.isBlank(value)) {
                return value;
            }
        }
        return "";
    }
}
