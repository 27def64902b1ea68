package dev.distroblog.extract;

import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

import com.fasterxml.jackson.databind.JsonNode;
import dev.distroblog.fetch.UrlNormalizer;
import org.jspecify.annotations.Nullable;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

/**
 * Title cleanup and selection rules for feed items and article pages.
 */
public final class TitleHeuristics {

  public static final String UNTITLED = "Untitled Article";

  private static final List<Pattern> GENERIC_TITLES =
      List.of(
          "^follow us on", "^posts? related to", "^latest by topic", "^read more", "^view all",
          "^see more", "^click here", "^subscribe", "^newsletter", "^blog$", "^home$", "^search$",
          "^category", "^tag:", "^author:", "^article$", "^untitled", "^page not found", "^404",
          "^500", "internal server error", "^just a moment", "^cloudflare", "access denied",
          "forbidden", "could not be found", "not found")
          .stream()
          .map(regex -> Pattern.compile(regex, Pattern.CASE_INSENSITIVE))
          .toList();

  /** Page titles that say nothing about the article; the URL slug is a better title. */
  private static final List<String> GENERIC_PAGE_TITLES =
      List.of("blog", "news", "home", "articles", "posts", "all posts", "latest by topic", "updates");

  private static final List<String> ARTICLE_H1_EXCLUDES = List.of("blog", "all posts", "latest by topic");

  private static final List<String> ANY_H1_EXCLUDES =
      List.of("blog", "all posts", "latest by topic", "menu", "navigation", "search", "subscribe");

  private static final Pattern TITLE_SEPARATOR = Pattern.compile("\\s+[|\\u2013\\u2014-]\\s+|\\s*\\|\\s*");

  private static final Pattern FIRST_SENTENCE = Pattern.compile("[.!?]+");

  private TitleHeuristics() {
    // utility class
  }

  /** Strip listing prefixes, reading-time and date suffixes; never returns blank. */
  public static String cleanTitle(@Nullable String title) {
    if (title == null || title.isBlank()) {
      return UNTITLED;
    }
    String cleaned = title.trim();
    cleaned = cleaned.replaceFirst("(?i)^articlePINNED\\s*", "");
    cleaned = cleaned.replaceFirst("(?i)^article\\s*pinned\\s*", "");
    cleaned = cleaned.replaceFirst("(?i)^pinned\\s*article\\s*", "");
    cleaned = cleaned.replaceFirst("^(?i:PINNED|article)(\\s+|(?=[A-Z]))", "");
    cleaned = cleaned.replaceFirst("(?i)\\s*\\d{4}-\\d{2}-\\d{1,2}\\s*\\d+\\s*min\\s*read.*$", "");
    cleaned = cleaned.replaceFirst("(?i)\\s*\\d+\\s*min\\s*read.*$", "");
    cleaned = cleaned.replaceFirst("\\s*\\d{4}-\\d{2}-\\d{2}.*$", "");
    cleaned = cleaned.replaceAll("\\s+", " ").trim();
    cleaned = cleaned.replaceAll("\\.{3,}", "...");
    return cleaned.isEmpty() ? UNTITLED : cleaned;
  }

  /** Navigation labels, error pages, bot walls and anything under 10 characters. */
  public static boolean isGenericTitle(@Nullable String title) {
    if (title == null || title.trim().length() < 10) {
      return true;
    }
    String trimmed = title.trim();
    return GENERIC_TITLES.stream().anyMatch(p -> p.matcher(trimmed).find());
  }

  /**
   * First sentence of an overlong title, when it is 10 to 100 characters long; otherwise null.
   */
  static @Nullable String firstSentence(String title) {
    String[] sentences = FIRST_SENTENCE.split(title);
    if (sentences.length < 2) {
      return null;
    }
    String first = sentences[0].trim();
    return first.length() >= 10 && first.length() <= 100 ? first : null;
  }

  /**
   * Best title of a rendered article page, or null when the page offers nothing usable.
   */
  public static @Nullable String pageTitle(Document doc, String pageUrl, List<JsonNode> jsonLd) {
    String title = selectPageTitle(doc, jsonLd);
    if (title == null || GENERIC_PAGE_TITLES.contains(title.trim().toLowerCase(Locale.ROOT))) {
      String slug = slugTitle(pageUrl);
      if (slug != null) {
        return slug;
      }
    }
    return title;
  }

  private static @Nullable String selectPageTitle(Document doc, List<JsonNode> jsonLd) {
    String og = doc.select("meta[property=og:title]").attr("content").trim();
    if (og.length() > 10) {
      return og;
    }
    for (JsonNode node : jsonLd) {
      for (String field : List.of("headline", "name")) {
        String value = JsonLd.text(node, field);
        if (value != null && value.length() >= 10 && value.length() <= 200) {
          return value;
        }
      }
    }
    String articleH1 =
        firstH1(doc.select("article h1, main h1, [class*=article] h1, [class*=post] h1"), ARTICLE_H1_EXCLUDES);
    if (articleH1 != null) {
      return articleH1;
    }
    String anyH1 = firstH1(doc.select("h1"), ANY_H1_EXCLUDES);
    if (anyH1 != null) {
      return anyH1;
    }
    return fromTitleTag(doc.title(), doc.select("meta[property=og:site_name]").attr("content"));
  }

  private static @Nullable String firstH1(List<Element> headings, List<String> excludes) {
    for (Element h1 : headings) {
      String text = h1.text().trim();
      if (!text.isEmpty() && !excludes.contains(text.toLowerCase(Locale.ROOT))) {
        return text;
      }
    }
    return null;
  }

  /**
   * {@code <title>} text without the site name: "Post | Site", "Site | Post", "Site: Post" and
   * dash-separated variants all give "Post".
   */
  static @Nullable String fromTitleTag(@Nullable String title, @Nullable String siteName) {
    if (title == null || title.isBlank()) {
      return null;
    }
    String cleaned = title.trim();
    if (siteName != null && !siteName.isBlank()) {
      String site = Pattern.quote(siteName.trim());
      cleaned = cleaned.replaceFirst("(?i)^" + site + "\\s*:\\s+", "");
    }
    String best =
        Arrays.stream(TITLE_SEPARATOR.split(cleaned))
            .map(String::trim)
            .filter(s -> !s.isEmpty())
            .filter(s -> siteName == null || !s.equalsIgnoreCase(siteName.trim()))
            .max(Comparator.comparingInt(String::length))
            .orElse(cleaned);
    return best.isBlank() ? null : best;
  }

  /** "my-first-post.html" gives "My First Post"; null when the slug is 10 characters or fewer. */
  static @Nullable String slugTitle(String url) {
    String slug = UrlNormalizer.lastPathSegment(url).replaceFirst("\\.[a-zA-Z0-9]{2,5}$", "");
    if (slug.length() <= 10) {
      return null;
    }
    return Arrays.stream(slug.split("[-_+]+"))
        .filter(word -> !word.isEmpty())
        .map(word -> Character.toUpperCase(word.charAt(0)) + word.substring(1))
        .collect(Collectors.joining(" "));
  }
}
