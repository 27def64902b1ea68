package dev.distroblog.extract;

import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.distroblog.browser.BrowserSessions;
import dev.distroblog.fetch.FetchException;
import dev.distroblog.fetch.UrlNormalizer;
import org.jspecify.annotations.Nullable;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Normalizes raw feed and scraped items into articles, and reads metadata from article pages.
 */
@Service
public class ContentExtractionPipeline {

  private static final Logger log = LoggerFactory.getLogger(ContentExtractionPipeline.class);

  static final int PREVIEW_LENGTH = 200;

  private final ArticleBodyExtractor bodyExtractor;
  private final DateExtractor dateExtractor;
  private final BrowserSessions browserSessions;
  private final ExtractionProperties properties;
  private final ObjectMapper objectMapper;

  public ContentExtractionPipeline(
      ArticleBodyExtractor bodyExtractor,
      DateExtractor dateExtractor,
      BrowserSessions browserSessions,
      ExtractionProperties properties,
      ObjectMapper objectMapper) {
    this.bodyExtractor = bodyExtractor;
    this.dateExtractor = dateExtractor;
    this.browserSessions = browserSessions;
    this.properties = properties;
    this.objectMapper = objectMapper;
  }

  /**
   * Apply the feed-path heuristics to one item. Short content is replaced by the full article text
   * when that is longer; a failing full fetch keeps the feed content.
   */
  public ExtractedArticle extract(RawItem item) {
    FeedItemText text = FeedItemText.from(item);
    String content = ContentCleaner.clean(text.content());
    String link = item.link() == null ? "" : item.link().trim();

    if (content.length() < properties.fullFetchBelowChars() && !link.isEmpty()) {
      try {
        String full = bodyExtractor.fetchFullText(link, item.description());
        if (full.length() > content.length()) {
          content = full;
        }
      } catch (FetchException e) {
        log.warn("Full article fetch failed for {}: {}", link, e.getMessage());
      }
    }

    String description = publisherDescription(item);
    String title = TitleHeuristics.cleanTitle(text.title());
    return new ExtractedArticle(
        link,
        title,
        content,
        preview(description, item.contentSnippet(), content),
        dateExtractor.fromCandidates(item.dateCandidates()),
        item.author() == null || item.author().isBlank() ? null : item.author().trim(),
        description);
  }

  /**
   * Read title, body, date, description and site name from an article page. The browser is tried
   * first; the static page is used when rendering is unavailable.
   *
   * @throws FetchException when the page cannot be fetched at all
   */
  public PageMetadata extractArticleMetadata(String url) {
    Optional<String> rendered = browserSessions.render(url);
    Document doc = rendered.isPresent() ? Jsoup.parse(rendered.get(), url) : bodyExtractor.fetchDocument(url);
    List<JsonNode> jsonLd = JsonLd.objects(doc, objectMapper);

    String title = TitleHeuristics.pageTitle(doc, url, jsonLd);
    if (title != null && isErrorPage(title)) {
      log.info("Page {} looks like an error page ('{}'), ignoring its title", url, title);
      title = null;
    }
    String content = bodyExtractor.bodyText(doc);
    return new PageMetadata(
        url,
        title == null ? null : TitleHeuristics.cleanTitle(title),
        content,
        dateExtractor.fromDocument(doc, jsonLd),
        DescriptionExtractor.fromDocument(doc, title),
        siteName(doc, url));
  }

  /** Date of an article page from a static fetch only; null when none is found or the fetch fails. */
  public @Nullable Instant extractDateStatic(String url) {
    try {
      Document doc = bodyExtractor.fetchDocument(url);
      return dateExtractor.fromDocument(doc, JsonLd.objects(doc, objectMapper));
    } catch (FetchException e) {
      if (e.getStatusCode() != 404) {
        log.info("Static date extraction failed for {}: {}", url, e.getMessage());
      }
      return null;
    }
  }

  /** Description of an article page from a static fetch only; null when none is found. */
  public @Nullable String extractDescriptionStatic(String url) {
    try {
      Document doc = bodyExtractor.fetchDocument(url);
      String title = doc.select("meta[property=og:title]").attr("content");
      return DescriptionExtractor.fromDocument(doc, title.isBlank() ? doc.title() : title);
    } catch (FetchException e) {
      log.debug("Static description extraction failed for {}: {}", url, e.getMessage());
      return null;
    }
  }

  /**
   * Description, then snippet, then the start of the content, cut to {@value #PREVIEW_LENGTH}
   * characters.
   */
  public static String preview(@Nullable String description, @Nullable String snippet, String content) {
    String source;
    if (!Snippets.isBlank(description)) {
      source = description;
    } else if (!Snippets.isBlank(snippet)) {
      source = ContentCleaner.clean(snippet);
    } else {
      source = content;
    }
    return Snippets.truncate(source, PREVIEW_LENGTH);
  }

  private static @Nullable String publisherDescription(RawItem item) {
    String raw = !Snippets.isBlank(item.description()) ? item.description() : item.summary();
    if (Snippets.isBlank(raw)) {
      return null;
    }
    String cleaned = ContentCleaner.clean(raw);
    return cleaned.isEmpty() ? null : Snippets.truncate(cleaned, DescriptionExtractor.MAX_LENGTH);
  }

  private static boolean isErrorPage(String title) {
    String lower = title.toLowerCase(Locale.ROOT);
    return lower.contains("404") || lower.contains("page not found") || lower.contains("not found");
  }

  private static @Nullable String siteName(Document doc, String url) {
    String site = doc.select("meta[property=og:site_name]").attr("content").trim();
    if (!site.isEmpty()) {
      return site;
    }
    return UrlNormalizer.bareHost(url);
  }
}
