package dev.distroblog.scrape;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.List;
import org.jsoup.Jsoup;
import org.junit.jupiter.api.Test;

class ListingExtractorTest {

  private final ObjectMapper objectMapper = new ObjectMapper();

  @Test
  void blog_post_array_from_json_ld() {
    String html =
        """
        <script type="application/ld+json">
        {"@type": "Blog", "blogPost": [
          {"@type": "BlogPosting", "headline": "First post", "url": "/p/1", "datePublished": "2025-05-01"},
          {"@type": "BlogPosting", "name": "Second post", "mainEntityOfPage": {"@id": "/p/2"}},
          {"@type": "BlogPosting", "headline": "No link"}
        ]}
        </script>
        """;

    List<ListingEntry> entries = ListingExtractor.extract(Jsoup.parse(html), objectMapper);

    assertThat(entries)
        .containsExactly(
            new ListingEntry("First post", "/p/1", null, "2025-05-01"),
            new ListingEntry("Second post", "/p/2", null, null));
  }

  @Test
  void containers_read_title_link_excerpt_and_date() {
    String html =
        """
        <div class="news-item">
          <h2>Kernel update released</h2>
          <a href="/news/kernel">Read</a>
          <p>Short excerpt of the news.</p>
          <span class="date">May 3, 2025</span>
        </div>
        <div class="news-item"><h2>No link here</h2></div>
        """;

    assertThat(ListingExtractor.fromContainers(Jsoup.parse(html)))
        .containsExactly(
            new ListingEntry("Kernel update released", "/news/kernel", "Short excerpt of the news.", "May 3, 2025"));
  }

  @Test
  void datetime_attribute_preferred_over_text() {
    String html =
        "<article><h3>Post</h3><a href='/x'>x</a><time datetime='2025-05-04T10:00:00Z'>yesterday</time></article>";

    assertThat(ListingExtractor.fromContainers(Jsoup.parse(html)).get(0).date())
        .isEqualTo("2025-05-04T10:00:00Z");
  }

  @Test
  void long_excerpts_are_cut() {
    String html = "<article><h2>Post</h2><a href='/x'>x</a><p>" + "a".repeat(800) + "</p></article>";

    assertThat(ListingExtractor.fromContainers(Jsoup.parse(html)).get(0).excerpt())
        .hasSize(ListingExtractor.MAX_EXCERPT);
  }

  @Test
  void list_items_only_when_nothing_else_matched() {
    String html =
        """
        <ul>
          <li><a href="/one">One release</a></li>
          <li><a href="#top">Back to top</a></li>
          <li>No anchor</li>
        </ul>
        """;

    assertThat(ListingExtractor.extract(Jsoup.parse(html), objectMapper))
        .containsExactly(new ListingEntry("One release", "/one", null, null));

    String withArticle = html + "<article><h2>Real post</h2><a href='/real'>r</a></article>";
    assertThat(ListingExtractor.extract(Jsoup.parse(withArticle), objectMapper))
        .extracting(ListingEntry::href)
        .containsExactly("/real");
  }

  @Test
  void entry_maps_to_raw_item() {
    var item = new ListingEntry("Title", "/x", "Excerpt", "2025-05-01").toRawItem("https://a.org/x");

    assertThat(item.link()).isEqualTo("https://a.org/x");
    assertThat(item.description()).isEqualTo("Excerpt");
    assertThat(item.contentSnippet()).isEqualTo("Excerpt");
    assertThat(item.dateCandidates()).containsExactly("2025-05-01");
  }
}
