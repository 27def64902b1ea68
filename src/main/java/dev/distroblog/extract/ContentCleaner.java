package dev.distroblog.extract;

import java.util.Arrays;
import java.util.List;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.parser.Parser;
import org.jsoup.safety.Safelist;

/**
 * Turns feed or page markup into readable plain text with paragraph breaks, stripped of bylines,
 * date stamps, share widgets and similar boilerplate.
 *
 * <p>Markup stripping and the text rules run repeatedly until the output stops changing, so
 * cleaning already cleaned text is a no-op.
 */
public final class ContentCleaner {

  private static final int MAX_PASSES = 16;

  private static final String MONTH =
      "(?:Jan(?:uary)?|Feb(?:ruary)?|Mar(?:ch)?|Apr(?:il)?|May|June?|July?|Aug(?:ust)?"
          + "|Sep(?:t(?:ember)?)?|Oct(?:ober)?|Nov(?:ember)?|Dec(?:ember)?)";

  private static final String DATE = MONTH + "\\.? \\d{1,2},? \\d{4}";

  /** A {@code <} that jsoup would read as the start of a tag, comment or declaration. */
  private static final Pattern TAG_OPENER = Pattern.compile("<(?=[A-Za-z/!?])");

  static final List<CleaningRule> MARKUP_RULES =
      List.of(
          CleaningRule.replace("br-to-newline", "(?i)<br\\s*/?>", "\n"),
          CleaningRule.replace("paragraph-end-to-blank-line", "(?i)</p\\s*>", "\n\n"));

  static final List<CleaningRule> TEXT_RULES =
      List.of(
          CleaningRule.replace("horizontal-whitespace", "[ \\t\\x0B\\f\\r\\u00A0]+", " "),
          CleaningRule.remove("byline-with-date", "\\bBy [A-Z][\\w.'-]*(?: [A-Z][\\w.'-]*){0,3}, " + DATE),
          CleaningRule.remove("posted-on", "\\b(?:Posted|Published|Updated) on " + DATE),
          CleaningRule.remove("category-with-date", "\\bCategory: ?[\\w ,]+? " + DATE),
          CleaningRule.remove("date-stamp", "\\b" + DATE + "\\b"),
          CleaningRule.remove("min-read-with-date", "\\b\\d+ ?min read ?· ?" + DATE),
          CleaningRule.remove("min-read", "\\b\\d+ ?min read\\b"),
          CleaningRule.remove("read-more", "\\b(?:Read more|Continue reading)(?: ?(?:→|»|\\.\\.\\.|…))?"),
          CleaningRule.remove("share-count", "\\b\\d+ ?Share this post\\b"),
          CleaningRule.remove("share-this-post", "\\bShare this post(?: [\\w']+'s Substack)?"),
          CleaningRule.remove("share-bar", "\\bCopy link Facebook Email Notes More\\b"),
          CleaningRule.remove("listen-share", "(?:--)?\\bListen Share\\b"),
          CleaningRule.remove("tweet-this", "\\bTweet this\\b"),
          CleaningRule.remove("view-all-articles", "\\bView all articles\\b"),
          CleaningRule.remove("image-placeholder", "\\bPress enter or click to view image in full size\\b"),
          CleaningRule.replace("repeated-run", "(.{20,}?)\\1+", "$1"),
          CleaningRule.replace("space-around-newline", " *\\n *", "\n"),
          CleaningRule.replace("sentence-break", "([.!?])\\s+(?=[A-Z])", "$1\n\n"),
          CleaningRule.replace("max-two-line-breaks", "\\n{3,}", "\n\n"));

  private static final List<Pattern> METADATA_LINES =
      List.of(
          Pattern.compile("^(?:Category|Categories|Author|Tags?|Filed under|Posted in):.*"),
          Pattern.compile("^(?:\\d{4}-\\d{2}-\\d{2}|\\d{1,2}/\\d{1,2}/\\d{4})\\b.*"),
          Pattern.compile("^By [\\w ]+, ?\\w{3} \\d{1,2}, ?\\d{4}$"),
          Pattern.compile("^[A-Z][a-z]+ \\d{1,2}, ?\\d{4}$"),
          Pattern.compile("^[A-Z ]{1,19}$"),
          Pattern.compile("^[\\w ]+ \\d+ ?min read.*"),
          Pattern.compile("^(?i:share|copy|facebook|email|notes|more|listen)$"),
          Pattern.compile("^\\d+ ?Share this post$"));

  private ContentCleaner() {
    // utility class
  }

  /** Clean markup or plain text. Blank input gives an empty string. */
  public static String clean(String content) {
    if (content == null || content.isBlank()) {
      return "";
    }
    String text = content;
    for (int pass = 0; pass < MAX_PASSES; pass++) {
      String next = cleanPass(text);
      if (next.equals(text)) {
        break;
      }
      text = next;
    }
    return text;
  }

  private static String cleanPass(String text) {
    String plain = text.indexOf('<') >= 0 || text.indexOf('&') >= 0 ? toPlainText(text) : text;
    return applyTextRules(plain);
  }

  /**
   * Tag-free text of a markup fragment, keeping line and paragraph breaks. Escaped markup such as
   * {@code &lt;div&gt;} comes out as {@code < div>}, so it stays text when cleaned again.
   */
  static String toPlainText(String markup) {
    String text = markup;
    for (CleaningRule rule : MARKUP_RULES) {
      text = rule.apply(text);
    }
    String stripped =
        Jsoup.clean(
            text,
            "",
            Safelist.none(),
            new Document.OutputSettings().prettyPrint(false).outline(false));
    return TAG_OPENER.matcher(Parser.unescapeEntities(stripped, false)).replaceAll("< ");
  }

  static String applyTextRules(String text) {
    String result = text;
    for (CleaningRule rule : TEXT_RULES) {
      result = rule.apply(result);
    }
    result = dropMetadataLines(result);
    return result.strip();
  }

  static boolean isMetadataLine(String line) {
    String trimmed = line.trim();
    return !trimmed.isEmpty() && METADATA_LINES.stream().anyMatch(p -> p.matcher(trimmed).matches());
  }

  private static String dropMetadataLines(String text) {
    return Arrays.stream(text.split("\n", -1))
        .filter(line -> !isMetadataLine(line))
        .collect(Collectors.joining("\n"));
  }
}
