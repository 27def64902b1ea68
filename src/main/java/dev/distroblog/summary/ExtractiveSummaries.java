package dev.distroblog.summary;

import java.util.List;
import java.util.regex.Pattern;

/** Summaries built from the article's own sentences, used when no language model is available. */
public final class ExtractiveSummaries {

  static final int MAX_SUMMARY = 300;

  private static final Pattern SENTENCE_SPLIT = Pattern.compile("[.!?]+");

  private static final Pattern METADATA_SENTENCE = Pattern.compile("^[A-Z][a-z]+:\\s");

  private static final Pattern DATE_SENTENCE = Pattern.compile("^\\d{4}-\\d{2}-\\d{2}");

  private static final List<Pattern> NOISE =
      List.of(
          Pattern.compile("Category:\\s*[\\w\\s,]+\\s+\\w{3}\\s+\\d{1,2},\\s*\\d{4}", Pattern.CASE_INSENSITIVE),
          Pattern.compile("By\\s+[\\w\\s]+,\\s*\\w{3}\\s+\\d{1,2},\\s*\\d{4}", Pattern.CASE_INSENSITIVE),
          Pattern.compile("\\b\\w{3}\\s+\\d{1,2},\\s*\\d{4}"),
          Pattern.compile("(Author|Tags?):[ \\t]*[\\w \\t,]+", Pattern.CASE_INSENSITIVE),
          Pattern.compile("(Read more|Continue reading)\\s*→?", Pattern.CASE_INSENSITIVE),
          Pattern.compile("View all articles|Related Articles", Pattern.CASE_INSENSITIVE));

  private ExtractiveSummaries() {
    // utility class
  }

  /**
   * First three sentences longer than 20 characters that do not look like metadata, capped at
   * {@value #MAX_SUMMARY} characters. Content under 100 characters is returned as is.
   */
  public static String summary(String content) {
    if (content == null || content.length() < 100) {
      return content == null ? "" : content;
    }
    String cleaned = content;
    for (Pattern noise : NOISE) {
      cleaned = noise.matcher(cleaned).replaceAll("");
    }
    List<String> sentences =
        SENTENCE_SPLIT.splitAsStream(cleaned)
            .map(String::strip)
            .filter(s -> s.length() > 20)
            .filter(s -> !METADATA_SENTENCE.matcher(s).find() && !DATE_SENTENCE.matcher(s).find())
            .limit(3)
            .toList();
    if (sentences.isEmpty()) {
      return "";
    }
    String summary = String.join(". ", sentences).strip();
    return summary.length() > MAX_SUMMARY
        ? summary.substring(0, MAX_SUMMARY - 3) + "..."
        : summary + ".";
  }

  /** First sentence of 21 to 199 characters, or "Read more about: title". */
  public static String description(String title, String content) {
    if (content == null || content.length() < 50) {
      return "Read more about: " + title;
    }
    return SENTENCE_SPLIT.splitAsStream(content)
        .map(String::strip)
        .filter(s -> s.length() > 20 && s.length() < 200)
        .findFirst()
        .map(s -> s + ".")
        .orElse("Read more about: " + title);
  }
}
