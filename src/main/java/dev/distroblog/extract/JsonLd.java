package dev.distroblog.extract;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.jspecify.annotations.Nullable;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads schema.org JSON-LD blocks of a page. Top-level arrays and {@code @graph} containers are
 * flattened so callers see one list of objects.
 */
public final class JsonLd {

  private static final Logger log = LoggerFactory.getLogger(JsonLd.class);

  public static final Set<String> ARTICLE_TYPES = Set.of("Article", "BlogPosting", "NewsArticle");

  private JsonLd() {
    // utility class
  }

  public static List<JsonNode> objects(Document doc, ObjectMapper objectMapper) {
    List<JsonNode> objects = new ArrayList<>();
    for (Element script : doc.select("script[type=application/ld+json]")) {
      String json = script.data();
      if (json.isBlank()) {
        continue;
      }
      try {
        flatten(objectMapper.readTree(json), objects);
      } catch (JsonProcessingException e) {
        log.debug("Skipping invalid JSON-LD block: {}", e.getOriginalMessage());
      }
    }
    return objects;
  }

  private static void flatten(JsonNode node, List<JsonNode> out) {
    if (node == null) {
      return;
    }
    if (node.isArray()) {
      node.forEach(child -> flatten(child, out));
    } else if (node.isObject()) {
      out.add(node);
      if (node.has("@graph")) {
        flatten(node.get("@graph"), out);
      }
    }
  }

  /** True when {@code @type} (a string or an array of strings) contains one of the types. */
  public static boolean hasType(JsonNode node, Set<String> types) {
    JsonNode type = node.get("@type");
    if (type == null) {
      return false;
    }
    if (type.isArray()) {
      for (JsonNode t : type) {
        if (types.contains(t.asText())) {
          return true;
        }
      }
      return false;
    }
    return types.contains(type.asText());
  }

  public static @Nullable String text(JsonNode node, String field) {
    JsonNode value = node.get(field);
    if (value == null || value.isNull() || value.isContainerNode()) {
      return null;
    }
    String text = value.asText().trim();
    return text.isEmpty() ? null : text;
  }

  /** Article URL: {@code url}, then {@code mainEntityOfPage.@id} or its string form, then {@code @id}. */
  public static @Nullable String url(JsonNode node) {
    String url = text(node, "url");
    if (url != null) {
      return url;
    }
    JsonNode main = node.get("mainEntityOfPage");
    if (main != null) {
      if (main.isTextual() && !main.asText().isBlank()) {
        return main.asText().trim();
      }
      if (main.isObject()) {
        String id = text(main, "@id");
        if (id != null) {
          return id;
        }
      }
    }
    return text(node, "@id");
  }
}
