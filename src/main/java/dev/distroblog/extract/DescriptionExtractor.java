package dev.distroblog.extract;

import java.util.List;

import org.jspecify.annotations.Nullable;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

/**
 * Publisher description of an article page.
 */
public final class DescriptionExtractor {

  static final int MIN_LENGTH = 50;

  static final int MAX_LENGTH = 300;

  private static final List<String> META_SELECTORS =
      List.of(
          "meta[name=description]",
          "meta[property=og:description]",
          "meta[name=twitter:description]",
          "meta[property=twitter:description]");

  private static final List<String> ELEMENT_SELECTORS =
      List.of(".article-summary", ".post-excerpt", ".entry-summary", ".excerpt");

  private static final String ARTICLE_PARAGRAPHS =
      "article p, main p, [class*=article-content] p, [class*=post-content] p";

  private DescriptionExtractor() {
    // utility class
  }

  /**
   * First description longer than 50 characters that is not just the title; otherwise the first
   * substantial article paragraph, truncated to 300 characters.
   */
  public static @Nullable String fromDocument(Document doc, @Nullable String title) {
    for (String selector : META_SELECTORS) {
      String candidate = doc.select(selector).attr("content").trim();
      if (isMeaningful(candidate, title)) {
        return Snippets.truncate(candidate, MAX_LENGTH);
      }
    }
    for (String selector : ELEMENT_SELECTORS) {
      Element el = doc.selectFirst(selector);
      if (el != null && isMeaningful(el.text().trim(), title)) {
        return Snippets.truncate(el.text().trim(), MAX_LENGTH);
      }
    }
    String paragraph = firstLongParagraph(doc.select(ARTICLE_PARAGRAPHS));
    if (paragraph == null) {
      paragraph = firstLongParagraph(doc.select("p"));
    }
    return paragraph == null ? null : Snippets.truncate(paragraph, MAX_LENGTH);
  }

  private static boolean isMeaningful(String candidate, @Nullable String title) {
    return candidate.length() > MIN_LENGTH && (title == null || !candidate.equalsIgnoreCase(title.trim()));
  }

  private static @Nullable String firstLongParagraph(List<Element> paragraphs) {
    for (Element p : paragraphs) {
      String text = p.text().trim();
      if (text.length() > MIN_LENGTH) {
        return text;
      }
    }
    return null;
  }
}
