package dev.distroblog.extract;

import java.time.Clock;
import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.fasterxml.jackson.databind.JsonNode;
import org.jspecify.annotations.Nullable;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Component;

/**
 * Finds publication dates in feed fields and article pages.
 *
 * <p>A date is only returned when its year lies between ten years before and five years after the
 * current year. Nothing here ever substitutes "now" for a missing date.
 */
@Component
public class DateExtractor {

  static final int BODY_SCAN_LIMIT = 5000;

  private static final String MONTH_NAMES =
      "January|February|March|April|May|June|July|August|September|October|November|December"
          + "|Jan|Feb|Mar|Apr|Jun|Jul|Aug|Sept|Sep|Oct|Nov|Dec";

  private static final Map<String, Integer> MONTHS =
      Map.ofEntries(
          Map.entry("jan", 1), Map.entry("feb", 2), Map.entry("mar", 3), Map.entry("apr", 4),
          Map.entry("may", 5), Map.entry("jun", 6), Map.entry("jul", 7), Map.entry("aug", 8),
          Map.entry("sep", 9), Map.entry("oct", 10), Map.entry("nov", 11), Map.entry("dec", 12));

  private static final List<String> DATE_SELECTORS =
      List.of(
          "meta[property=article:published_time]",
          "meta[name=article:published_time]",
          "meta[property=og:article:published_time]",
          "meta[name=publishdate]",
          "meta[name=pubdate]",
          "meta[name=date]",
          "time[datetime]",
          "time",
          "[datetime]",
          "[data-date]",
          "[data-published]",
          "[class*=date]",
          "[class*=published]",
          "[class*=publish]");

  private static final List<TextPattern> TEXT_PATTERNS =
      List.of(
          // November 12, 2025 / Nov 12 2025
          new TextPattern(
              "\\b(" + MONTH_NAMES + ")\\.?\\s+(\\d{1,2}),?\\s+(\\d{4})\\b",
              m -> date(m.group(3), month(m.group(1)), m.group(2))),
          // 12 November 2025
          new TextPattern(
              "\\b(\\d{1,2})\\s+(" + MONTH_NAMES + ")\\.?,?\\s+(\\d{4})\\b",
              m -> date(m.group(3), month(m.group(2)), m.group(1))),
          // 06-Nov-25
          new TextPattern(
              "\\b(\\d{1,2})[-/](Jan|Feb|Mar|Apr|May|Jun|Jul|Aug|Sep|Oct|Nov|Dec)[-/](\\d{2}|\\d{4})\\b",
              m -> date(fullYear(m.group(3)), month(m.group(2)), m.group(1))),
          // 2025-12-15T10:00:00Z
          new TextPattern(
              "\\b\\d{4}-\\d{2}-\\d{2}T\\d{2}:\\d{2}(?::\\d{2}(?:\\.\\d+)?)?(?:Z|[+-]\\d{2}:?\\d{2})?",
              m -> parseIso(m.group())),
          // 2025-11-12 / 2025/11/12
          new TextPattern(
              "\\b(\\d{4})[-/](\\d{1,2})[-/](\\d{1,2})\\b",
              m -> date(m.group(1), Integer.parseInt(m.group(2)), m.group(3))),
          // 12-11-25, day first
          new TextPattern(
              "\\b(\\d{1,2})-(\\d{1,2})-(\\d{2})\\b",
              m -> date(fullYear(m.group(3)), Integer.parseInt(m.group(2)), m.group(1))),
          // 11/12/2025, month first
          new TextPattern(
              "\\b(\\d{1,2})[-/](\\d{1,2})[-/](\\d{4})\\b",
              m -> date(m.group(3), Integer.parseInt(m.group(1)), m.group(2))));

  private final Clock clock;

  public DateExtractor(Clock clock) {
    this.clock = clock;
  }

  /** First candidate, in order, that parses to a plausible date. */
  public @Nullable Instant fromCandidates(List<String> candidates) {
    for (String candidate : candidates) {
      Instant parsed = parse(candidate);
      if (parsed != null) {
        return parsed;
      }
    }
    return null;
  }

  /**
   * Parse a single date value: ISO-8601, RFC 1123, then the free-text patterns.
   */
  public @Nullable Instant parse(@Nullable String value) {
    if (value == null || value.isBlank()) {
      return null;
    }
    String trimmed = value.trim();
    Instant structured = parseIso(trimmed);
    if (structured == null) {
      structured = parseRfc1123(trimmed);
    }
    if (structured != null && isPlausible(structured)) {
      return structured;
    }
    return fromText(trimmed);
  }

  /** First plausible date found by the text patterns, tried in order. */
  public @Nullable Instant fromText(@Nullable String text) {
    if (text == null || text.isBlank()) {
      return null;
    }
    for (TextPattern pattern : TEXT_PATTERNS) {
      Matcher m = pattern.regex().matcher(text);
      if (m.find()) {
        Instant parsed;
        try {
          parsed = pattern.converter().apply(m);
        } catch (DateTimeException | NumberFormatException e) {
          parsed = null;
        }
        if (parsed != null && isPlausible(parsed)) {
          return parsed;
        }
      }
    }
    return null;
  }

  /**
   * Page publication date: date meta tags and elements, then JSON-LD {@code datePublished} or
   * {@code dateCreated} of an article object, then the beginning of the body text.
   */
  public @Nullable Instant fromDocument(Document doc, List<JsonNode> jsonLd) {
    for (String selector : DATE_SELECTORS) {
      Element el = doc.selectFirst(selector);
      if (el == null) {
        continue;
      }
      Instant parsed = parse(firstNonBlank(el.attr("content"), el.attr("datetime"), el.attr("date"),
          el.attr("data-date"), el.attr("data-published"), el.text()));
      if (parsed != null) {
        return parsed;
      }
    }
    for (JsonNode node : jsonLd) {
      if (!JsonLd.hasType(node, JsonLd.ARTICLE_TYPES)) {
        continue;
      }
      Instant parsed = parse(JsonLd.text(node, "datePublished"));
      if (parsed == null) {
        parsed = parse(JsonLd.text(node, "dateCreated"));
      }
      if (parsed != null) {
        return parsed;
      }
    }
    String body = doc.body() == null ? "" : doc.body().text();
    return fromText(body.substring(0, Math.min(body.length(), BODY_SCAN_LIMIT)));
  }

  public boolean isPlausible(Instant date) {
    int year = date.atZone(ZoneOffset.UTC).getYear();
    int currentYear = clock.instant().atZone(ZoneOffset.UTC).getYear();
    int diff = year - currentYear;
    return diff >= -10 && diff <= 5;
  }

  static @Nullable Instant parseIso(String value) {
    try {
      return OffsetDateTime.parse(value, DateTimeFormatter.ISO_OFFSET_DATE_TIME).toInstant();
    } catch (DateTimeParseException e) {
      // try the next shape
    }
    try {
      return LocalDateTime.parse(value, DateTimeFormatter.ISO_LOCAL_DATE_TIME).toInstant(ZoneOffset.UTC);
    } catch (DateTimeParseException e) {
      // try the next shape
    }
    try {
      return LocalDate.parse(value, DateTimeFormatter.ISO_LOCAL_DATE).atStartOfDay(ZoneOffset.UTC).toInstant();
    } catch (DateTimeParseException e) {
      return null;
    }
  }

  private static @Nullable Instant parseRfc1123(String value) {
    try {
      return ZonedDateTime.parse(value, DateTimeFormatter.RFC_1123_DATE_TIME).toInstant();
    } catch (DateTimeParseException e) {
      return null;
    }
  }

  private static Instant date(String year, int month, String day) {
    return LocalDate.of(Integer.parseInt(year), month, Integer.parseInt(day))
        .atStartOfDay(ZoneOffset.UTC)
        .toInstant();
  }

  private static int month(String name) {
    Integer month = MONTHS.get(name.substring(0, 3).toLowerCase(Locale.ROOT));
    if (month == null) {
      throw new DateTimeException("Unknown month " + name);
    }
    return month;
  }

  /** Two-digit years are read as 20YY. */
  private static String fullYear(String year) {
    return year.length() == 2 ? "20" + year : year;
  }

  private static @Nullable String firstNonBlank(String... values) {
    for (String value : values) {
      if (value != null && !value.isBlank()) {
        return value;
      }
    }
    return null;
  }

  private record TextPattern(Pattern regex, Function<Matcher, Instant> converter) {

    TextPattern(String regex, Function<Matcher, Instant> converter) {
      this(Pattern.compile(regex, Pattern.CASE_INSENSITIVE), converter);
    }
  }
}
