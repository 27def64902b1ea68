package dev.distroblog.scrape;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.distroblog.browser.BrowserSessions;
import dev.distroblog.extract.DateExtractor;
import dev.distroblog.extract.RawItem;
import dev.distroblog.fetch.FetchException;
import dev.distroblog.fixture.FetcherStub;
import dev.distroblog.fixture.MutableClock;
import dev.distroblog.fixture.SourceBuilder;
import dev.distroblog.source.MonitoringType;
import dev.distroblog.source.Source;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class TraditionalScraperTest {

  private static final String SITE = "https://news.example.com";

  private static final String LISTING =
      """
      <html><body>
      <nav><ul><li><a href="/about">About us</a></li></ul></nav>
      <article>
        <h2><a href="/blog/older-post">Older post</a></h2>
        <time datetime="2025-04-01">April 1</time>
        <p>The older excerpt.</p>
      </article>
      <article>
        <h2><a href="/blog/newest-post">Newest post</a></h2>
        <time datetime="2025-05-20">May 20</time>
        <p>The newest excerpt.</p>
      </article>
      <article>
        <h2><a href="/blog/middle-post">Middle post</a></h2>
        <time datetime="2025-05-01">May 1</time>
      </article>
      </body></html>
      """;

  private FetcherStub http;
  private MutableClock clock;
  private BrowserSessions browser;
  private Source source;

  @BeforeEach
  void setUp() {
    http = new FetcherStub();
    clock = MutableClock.at("2025-06-01T00:00:00Z");
    browser = mock(BrowserSessions.class);
    source = new SourceBuilder().url(SITE).name("Example News").type(MonitoringType.SCRAPING).build();
  }

  private TraditionalScraper scraper(int maxItems) {
    return new TraditionalScraper(
        http.fetcher(),
        browser,
        new DateExtractor(clock),
        new ObjectMapper(),
        new ScrapeProperties(maxItems, Duration.ofHours(24), null),
        clock);
  }

  @Nested
  class Scrape {

    @Test
    void listing_entries_are_resolved_and_sorted_newest_first() {
      http.head(SITE + "/blog", 200, "text/html");
      http.page(SITE + "/blog", LISTING);

      List<RawItem> items = scraper(20).scrape(source);

      assertThat(items)
          .extracting(RawItem::link)
          .containsExactly(
              SITE + "/blog/newest-post", SITE + "/blog/middle-post", SITE + "/blog/older-post");
      RawItem newest = items.get(0);
      assertThat(newest.title()).isEqualTo("Newest post");
      assertThat(newest.description()).isEqualTo("The newest excerpt.");
      assertThat(newest.dateCandidates()).containsExactly("2025-05-20");
    }

    @Test
    void site_root_is_used_without_a_blog_section() {
      http.page(SITE, LISTING);

      assertThat(scraper(20).scrape(source)).hasSize(3);
    }

    @Test
    void rendered_page_is_preferred() {
      when(browser.render(SITE)).thenReturn(Optional.of(LISTING));

      assertThat(scraper(20).scrape(source)).hasSize(3);
      assertThat(http.requested()).doesNotContain(SITE);
    }

    @Test
    void unchanged_page_yields_nothing_new() {
      http.page(SITE, LISTING);
      TraditionalScraper scraper = scraper(20);

      scraper.scrape(source);

      assertThat(scraper.scrape(source)).isEmpty();
    }

    @Test
    void unchanged_page_is_reported_again_after_fingerprint_expiry() {
      http.page(SITE, LISTING);
      TraditionalScraper scraper = scraper(20);
      scraper.scrape(source);
      clock.advance(Duration.ofHours(25));

      assertThat(scraper.scrape(source)).hasSize(3);
    }

    @Test
    void list_items_only_when_nothing_else_matched() {
      http.page(
          SITE,
          """
          <html><body><ul>
            <li><a href="#top">Top</a></li>
            <li><a href="/notes/first-note">First note</a></li>
            <li><a href="https://news.example.com/notes/second-note">Second note</a></li>
          </ul></body></html>
          """);

      assertThat(scraper(20).scrape(source))
          .extracting(RawItem::link)
          .containsExactly(SITE + "/notes/first-note", SITE + "/notes/second-note");
    }

    @Test
    void json_ld_item_list() {
      http.page(
          SITE,
          """
          <html><head><script type="application/ld+json">
          {"@type":"ItemList","itemListElement":[
            {"@type":"ListItem","item":{"@type":"BlogPosting","headline":"From JSON-LD",
             "url":"https://news.example.com/p/json-ld","datePublished":"2025-05-05"}}
          ]}
          </script></head><body></body></html>
          """);

      List<RawItem> items = scraper(20).scrape(source);

      assertThat(items).extracting(RawItem::title).containsExactly("From JSON-LD");
    }

    @Test
    void page_fetch_failure_propagates() {
      http.getFails(SITE, FetchException.httpStatus(SITE, 503));

      assertThatThrownBy(() -> scraper(20).scrape(source)).isInstanceOf(FetchException.class);
    }
  }

  @Nested
  class ResolveAndSort {

    @Test
    void undated_entries_keep_their_positions() {
      List<ListingEntry> entries =
          List.of(
              new ListingEntry("A", "/a", null, null),
              new ListingEntry("B", "/b", null, "2025-01-01"),
              new ListingEntry("C", "/c", null, null),
              new ListingEntry("D", "/d", null, "2025-03-01"));

      assertThat(scraper(20).resolveAndSort(SITE + "/", entries))
          .extracting(RawItem::title)
          .containsExactly("A", "D", "C", "B");
    }

    @Test
    void duplicates_are_dropped_and_list_is_capped() {
      List<ListingEntry> entries =
          List.of(
              new ListingEntry("A", "/a", null, null),
              new ListingEntry("A again", "https://news.example.com/a", null, null),
              new ListingEntry("B", "/b", null, null),
              new ListingEntry("C", "/c", null, null));

      assertThat(scraper(2).resolveAndSort(SITE + "/", entries))
          .extracting(RawItem::title)
          .containsExactly("A", "B");
    }
  }
}
