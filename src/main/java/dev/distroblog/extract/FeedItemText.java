package dev.distroblog.extract;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Title and content of a raw item before cleaning, after correcting feeds that put the body in the
 * title, a URL in the title, or nothing useful in any content field.
 */
record FeedItemText(String title, String content) {

  /** Content of at most this many characters is not worth keeping over the link. */
  static final int PLACEHOLDER_BELOW = 50;

  static FeedItemText from(RawItem item) {
    String title = item.title() == null || item.title().isBlank() ? "Untitled" : item.title().trim();
    String content = firstPresent(item.contentSnippet(), item.description(), item.content(),
        item.summary(), item.contentEncoded(), item.mediaDescription());

    if (title.length() > 200 && content.length() < 100) {
      String swapped = title;
      title = content.isEmpty() ? "Untitled" : content;
      content = swapped;
    }

    if (Snippets.isUrl(title) && !Snippets.isUrl(content)) {
      String swapped = title;
      title = content.isEmpty() ? "Untitled" : content;
      content = swapped;
    }

    if (title.length() > 150) {
      String first = TitleHeuristics.firstSentence(title);
      if (first != null) {
        title = first;
      }
    }

    if (Snippets.isUrl(content) && Snippets.length(item.contentSnippet()) > PLACEHOLDER_BELOW) {
      content = item.contentSnippet().trim();
    }

    if (content.length() <= PLACEHOLDER_BELOW && noCandidateLongEnough(item)) {
      content = item.link() == null ? "" : item.link().trim();
    }
    return new FeedItemText(title, content);
  }

  private static boolean noCandidateLongEnough(RawItem item) {
    return candidates(item).stream().noneMatch(c -> c.trim().length() > PLACEHOLDER_BELOW);
  }

  private static List<String> candidates(RawItem item) {
    return Arrays.asList(item.contentSnippet(), item.description(), item.content(), item.summary(),
            item.contentEncoded(), item.mediaDescription()).stream()
        .filter(Objects::nonNull)
        .toList();
  }

  private static String firstPresent(String... values) {
    for (String value : values) {
      if (value != null && !value.isBlank()) {
        return value.trim();
      }
    }
    return "";
  }
}
