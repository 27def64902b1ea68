package dev.distroblog.extract;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

import dev.distroblog.browser.BrowserSessions;
import dev.distroblog.fetch.FetchException;
import dev.distroblog.fetch.FetchResponse;
import dev.distroblog.fetch.RateLimitedFetcher;
import org.jspecify.annotations.Nullable;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Fetches an article page and pulls out its readable body text.
 */
@Component
public class ArticleBodyExtractor {

  private static final Logger log = LoggerFactory.getLogger(ArticleBodyExtractor.class);

  static final List<String> CONTAINER_SELECTORS =
      List.of(
          "article",
          ".post-content",
          ".entry-content",
          ".article-content",
          ".content",
          "main article",
          "section[data-testid=post]",
          "div[data-article-body=true]",
          "div.post",
          ".body");

  private static final String BLOCKS = "p, li, h2, h3, blockquote";

  private static final int MIN_BLOCK_CHARS = 20;

  private final RateLimitedFetcher fetcher;
  private final BrowserSessions browserSessions;
  private final ExtractionProperties properties;

  public ArticleBodyExtractor(
      RateLimitedFetcher fetcher, BrowserSessions browserSessions, ExtractionProperties properties) {
    this.fetcher = fetcher;
    this.browserSessions = browserSessions;
    this.properties = properties;
  }

  /**
   * Full text of the article: the rendered page when the browser yields enough text, otherwise the
   * static page. A 403 from the site gives the cleaned description instead.
   *
   * @throws FetchException when the static fetch fails for any reason other than 403
   */
  public String fetchFullText(String url, @Nullable String description) {
    Optional<String> rendered = browserSessions.render(url);
    if (rendered.isPresent()) {
      String text = bodyText(Jsoup.parse(rendered.get(), url));
      if (text.length() > properties.minBodyChars()) {
        return text;
      }
      log.debug("Rendered page {} gave only {} chars, trying static fetch", url, text.length());
    }
    try {
      return bodyText(fetchDocument(url));
    } catch (FetchException e) {
      if (e.isForbidden()) {
        log.info("Article {} refused with 403, keeping the description", url);
        return ContentCleaner.clean(description);
      }
      throw e;
    }
  }

  /** Static GET of a page, parsed with the page URL as base URI. */
  public Document fetchDocument(String url) {
    FetchResponse response = fetcher.get(url, Duration.ofMillis(properties.articleFetchTimeoutMs()));
    return Jsoup.parse(response.text(), url);
  }

  /**
   * Text of the first content container longer than the minimum; otherwise the longest
   * container text or all paragraphs joined, whichever is longer.
   */
  public String bodyText(Document doc) {
    String best = "";
    for (String selector : CONTAINER_SELECTORS) {
      Element container = doc.selectFirst(selector);
      if (container == null) {
        continue;
      }
      String text = ContentCleaner.clean(joinBlocks(container.select(BLOCKS), MIN_BLOCK_CHARS));
      if (text.length() > properties.minBodyChars()) {
        return text;
      }
      if (text.length() > best.length()) {
        best = text;
      }
    }
    String allParagraphs = ContentCleaner.clean(joinBlocks(doc.select("p"), 0));
    return allParagraphs.length() > best.length() ? allParagraphs : best;
  }

  private static String joinBlocks(List<Element> blocks, int minChars) {
    return blocks.stream()
        .map(block -> block.text().trim())
        .filter(text -> text.length() >= minChars && !text.isEmpty())
        .collect(Collectors.joining("\n\n"));
  }
}
