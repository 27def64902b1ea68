package dev.distroblog.extract;

import static org.assertj.core.api.Assertions.assertThat;

import org.jsoup.Jsoup;
import org.junit.jupiter.api.Test;

class DescriptionExtractorTest {

  private static final String LONG =
      "This release focuses on faster boot times and a reworked package manager for everyone.";

  @Test
  void meta_description_wins() {
    var doc =
        Jsoup.parse(
            "<meta name=description content='" + LONG + "'>"
                + "<meta property=og:description content='Another description that is long enough to count.'>");

    assertThat(DescriptionExtractor.fromDocument(doc, "Release notes")).isEqualTo(LONG);
  }

  @Test
  void short_or_title_equal_meta_is_skipped() {
    var doc =
        Jsoup.parse(
            "<meta name=description content='Too short'>"
                + "<meta property=og:description content='" + LONG + "'>"
                + "<meta name=twitter:description content='Twitter text that is also long enough to count here.'>");

    assertThat(DescriptionExtractor.fromDocument(doc, LONG))
        .isEqualTo("Twitter text that is also long enough to count here.");
  }

  @Test
  void summary_element_after_meta() {
    var doc = Jsoup.parse("<div class=entry-summary>" + LONG + "</div>");

    assertThat(DescriptionExtractor.fromDocument(doc, null)).isEqualTo(LONG);
  }

  @Test
  void article_paragraph_fallback_is_truncated() {
    String paragraph = "word ".repeat(100).trim();
    var doc = Jsoup.parse("<p>Short intro</p><article><p>Tiny</p><p>" + paragraph + "</p></article>");

    String description = DescriptionExtractor.fromDocument(doc, null);

    assertThat(description).hasSizeLessThanOrEqualTo(303).endsWith("...").startsWith("word word");
  }

  @Test
  void nothing_substantial_gives_null() {
    assertThat(DescriptionExtractor.fromDocument(Jsoup.parse("<p>Hi</p>"), null)).isNull();
  }
}
