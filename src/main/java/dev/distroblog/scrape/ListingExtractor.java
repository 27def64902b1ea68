package dev.distroblog.scrape;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.distroblog.extract.JsonLd;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import org.jspecify.annotations.Nullable;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

/**
 * Finds article entries on a listing page: JSON-LD first, then article-like containers, then plain
 * list items when nothing else matched.
 */
final class ListingExtractor {

  static final List<String> CONTAINER_SELECTORS =
      List.of(
          "article",
          "[class*=article]",
          "[class*=post]",
          "[class*=blog]",
          "[id*=article]",
          "[id*=post]",
          ".entry",
          ".blog-post",
          ".news-item");

  static final int MAX_EXCERPT = 500;

  private static final String TITLE = "h1, h2, h3, [class*=title], [class*=headline]";
  private static final String EXCERPT = "[class*=excerpt], [class*=summary], [class*=preview], p";
  private static final String DATE = "[class*=date], time, [datetime]";

  private ListingExtractor() {
    // utility class
  }

  static List<ListingEntry> extract(Document doc, ObjectMapper objectMapper) {
    List<ListingEntry> entries = new ArrayList<>(fromJsonLd(JsonLd.objects(doc, objectMapper)));
    entries.addAll(fromContainers(doc));
    if (entries.isEmpty()) {
      entries.addAll(fromListItems(doc));
    }
    return entries;
  }

  static List<ListingEntry> fromJsonLd(List<JsonNode> objects) {
    List<ListingEntry> entries = new ArrayList<>();
    for (JsonNode node : objects) {
      if (JsonLd.hasType(node, JsonLd.ARTICLE_TYPES)) {
        addPosting(node, entries);
      } else if (JsonLd.hasType(node, Set.of("Blog")) && node.has("blogPost")) {
        JsonNode posts = node.get("blogPost");
        if (posts.isArray()) {
          posts.forEach(post -> addPosting(post, entries));
        } else {
          addPosting(posts, entries);
        }
      } else if (JsonLd.hasType(node, Set.of("ItemList")) && node.has("itemListElement")) {
        for (JsonNode element : node.get("itemListElement")) {
          JsonNode item = element.get("item");
          if (item != null && item.isObject()) {
            addPosting(item, entries);
          } else {
            addPosting(element, entries);
          }
        }
      }
    }
    return entries;
  }

  private static void addPosting(JsonNode node, List<ListingEntry> entries) {
    if (node == null || !node.isObject()) {
      return;
    }
    String title = firstNonNull(JsonLd.text(node, "headline"), JsonLd.text(node, "name"));
    String link = JsonLd.url(node);
    if (title == null || link == null) {
      return;
    }
    String date = firstNonNull(JsonLd.text(node, "datePublished"), JsonLd.text(node, "dateCreated"));
    entries.add(new ListingEntry(title, link, JsonLd.text(node, "description"), date));
  }

  static List<ListingEntry> fromContainers(Document doc) {
    List<ListingEntry> entries = new ArrayList<>();
    for (String selector : CONTAINER_SELECTORS) {
      for (Element container : doc.select(selector)) {
        Element heading = container.selectFirst(TITLE);
        Element anchor = container.selectFirst("a[href]");
        if (heading == null || anchor == null) {
          continue;
        }
        String title = heading.text().trim();
        String href = anchor.attr("href").trim();
        if (title.isEmpty() || href.isEmpty()) {
          continue;
        }
        Element excerpt = container.selectFirst(EXCERPT);
        String excerptText = excerpt == null ? null : truncate(excerpt.text().trim());
        entries.add(new ListingEntry(title, href, excerptText, dateOf(container)));
      }
    }
    return entries;
  }

  static List<ListingEntry> fromListItems(Document doc) {
    List<ListingEntry> entries = new ArrayList<>();
    for (Element item : doc.select("ul li, ol li")) {
      Element anchor = item.selectFirst("a[href]");
      if (anchor == null) {
        continue;
      }
      String href = anchor.attr("href").trim();
      if (href.isEmpty() || href.startsWith("#")) {
        continue;
      }
      String title = anchor.text().isBlank() ? item.text().trim() : anchor.text().trim();
      if (!title.isEmpty()) {
        entries.add(new ListingEntry(title, href, null, null));
      }
    }
    return entries;
  }

  private static @Nullable String dateOf(Element container) {
    Element dated = container.selectFirst(DATE);
    if (dated == null) {
      return null;
    }
    String datetime = dated.attr("datetime");
    if (!datetime.isBlank()) {
      return datetime.trim();
    }
    String text = dated.text().trim();
    return text.isEmpty() ? null : text;
  }

  private static String truncate(String text) {
    return text.length() <= MAX_EXCERPT ? text : text.substring(0, MAX_EXCERPT);
  }

  private static @Nullable String firstNonNull(@Nullable String first, @Nullable String second) {
    return first != null ? first : second;
  }
}
