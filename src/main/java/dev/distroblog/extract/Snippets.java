package dev.distroblog.extract;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/** Short-text helpers shared by previews, descriptions and summaries. */
public final class Snippets {

  private static final Pattern SENTENCE_END = Pattern.compile("(?<=[.!?])\\s+");

  private static final Pattern URL = Pattern.compile("^https?://\\S+$", Pattern.CASE_INSENSITIVE);

  private Snippets() {
    // utility class
  }

  /** Cut to {@code max} characters, ending with "..." when anything was removed. */
  public static String truncate(String text, int max) {
    if (text == null) {
      return "";
    }
    String trimmed = text.strip();
    if (trimmed.length() <= max) {
      return trimmed;
    }
    return trimmed.substring(0, max).stripTrailing() + "...";
  }

  public static List<String> sentences(String text) {
    List<String> sentences = new ArrayList<>();
    if (text == null) {
      return sentences;
    }
    for (String sentence : SENTENCE_END.split(text.strip())) {
      String s = sentence.strip();
      if (!s.isEmpty()) {
        sentences.add(s);
      }
    }
    return sentences;
  }

  public static boolean isUrl(String text) {
    return text != null && URL.matcher(text.strip()).matches();
  }

  public static boolean isBlank(String text) {
    return text == null || text.isBlank();
  }

  public static int length(String text) {
    return text == null ? 0 : text.strip().length();
  }
}
