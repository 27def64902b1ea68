package dev.distroblog.feed;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

import dev.distroblog.fetch.FetchException;
import dev.distroblog.fixture.FetcherStub;
import dev.distroblog.fixture.MutableClock;
import java.net.UnknownHostException;
import java.time.Duration;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class FeedDiscoveryEngineTest {

    private static final String SITE = "https://blog.example.com";

    private static final String RSS = """
            <?xml version="1.0"?>
            <rss version="2.0"><channel><title>t</title>
            <item><title>a</title><link>https://blog.example.com/a</link></item>
            </channel></rss>
            """;

    private FetcherStub http;
    private MutableClock clock;
    private FeedDiscoveryEngine engine;

    @BeforeEach
    void setUp() {
        http = new FetcherStub();
        clock = MutableClock.at("2025-06-01T00:00:00Z");
        FeedProperties properties = new FeedProperties(Duration.ofMinutes(30), 5000, 1_000_000, 3);
        FeedValidator validator = new FeedValidator();
        engine = new FeedDiscoveryEngine(
                http.fetcher(),
                new FeedProbe(http.fetcher(), validator, properties),
                new SitemapParser(http.fetcher(), properties),
                properties,
                clock);
    }

    @Nested
    class Strategies {

        @Test
        void alternate_link_in_site_html_wins() {
            http.page(SITE, """
                    <html><head>
                    <link rel="alternate" type="application/rss+xml" href="/feed.xml">
                    </head><body></body></html>
                    """);
            http.feed(SITE + "/feed.xml", RSS);

            assertThat(engine.discoverFeedUrl(SITE)).contains(SITE + "/feed.xml");
        }

        @Test
        void falls_back_to_conventional_paths() {
            http.page(SITE, "<html><body>no hints</body></html>");
            http.feed(SITE + "/rss", RSS);

            assertThat(engine.discoverFeedUrl(SITE)).contains(SITE + "/rss");
        }

        @Test
        void full_path_list_is_tried_under_sections() {
            http.page(SITE, "<html><body>no hints</body></html>");
            http.feed(SITE + "/blog/index.xml", RSS);

            assertThat(engine.discoverFeedUrl(SITE)).contains(SITE + "/blog/index.xml");
        }

        @Test
        void parent_page_hints_are_followed() {
            http.page(SITE + "/blog", "<html><head>"
                    + "<link rel=\"alternate\" type=\"application/atom+xml\" href=\"/blog/atom.xml\">"
                    + "</head></html>");
            http.feed(SITE + "/blog/atom.xml", RSS);

            assertThat(engine.discoverFeedUrl(SITE + "/blog/2025/hello")).contains(SITE + "/blog/atom.xml");
        }

        @Test
        void feed_listed_in_sitemap_is_found() {
            http.page(SITE, "<html><body></body></html>");
            http.get(SITE + "/sitemap.xml", 200, "application/xml", """
                    <urlset xmlns="http://www.sitemaps.org/schemas/sitemap/0.9">
                      <url><loc>https://blog.example.com/journal/feed/</loc></url>
                    </urlset>
                    """);
            http.feed(SITE + "/journal/feed/", RSS);

            assertThat(engine.discoverFeedUrl(SITE)).contains(SITE + "/journal/feed/");
        }

        @Test
        void platform_candidates_for_matching_hosts() {
            http.page("https://www.youtube.com/channel/UC123", "<html></html>");
            http.feed("https://www.youtube.com/feeds/videos.xml?channel_id=UC123", RSS);

            assertThat(engine.discoverFeedUrl("https://www.youtube.com/channel/UC123"))
                    .contains("https://www.youtube.com/feeds/videos.xml?channel_id=UC123");
        }
    }

    @Nested
    class Soundness {

        @Test
        void html_served_as_feed_is_rejected() {
            http.page(SITE, "<html><head><link rel=\"alternate\" type=\"application/rss+xml\" href=\"/feed\">"
                    + "</head></html>");
            http.get(SITE + "/feed", 200, "application/rss+xml",
                    "<!DOCTYPE html><html><body>Subscribe</body></html>");

            assertThat(engine.discoverFeedUrl(SITE)).isEmpty();
        }

        @Test
        void feed_served_as_text_html_is_still_discovered() {
            http.page(SITE, "<html><body>no hints</body></html>");
            http.get(SITE + "/feed", 200, "text/html; charset=utf-8", RSS);

            assertThat(engine.discoverFeedUrl(SITE)).contains(SITE + "/feed");
        }

        @Test
        void discovery_never_sends_head() {
            http.page(SITE, "<html></html>");
            http.head(SITE + "/feed", 200, "text/html");
            http.feed(SITE + "/feed", RSS);

            assertThat(engine.discoverFeedUrl(SITE)).contains(SITE + "/feed");
            verify(http.fetcher(), never()).head(anyString());
        }

        @Test
        void each_candidate_is_requested_once_per_run() {
            http.page(SITE, "<html></html>");

            engine.discover(SITE);

            assertThat(http.requestCount(SITE + "/feed.xml")).isEqualTo(1);
        }
    }

    @Nested
    class ProbeFeed {

        @Test
        void html_content_type_fails_the_typed_check() {
            http.get(SITE + "/feed", 200, "text/html; charset=utf-8", RSS);

            FeedProbeResult result = engine.probeFeed(SITE + "/feed");

            assertThat(result.success()).isFalse();
            assertThat(result.status()).isEqualTo(200);
        }

        @Test
        void head_reporting_html_skips_the_get() {
            http.head(SITE + "/feed", 200, "text/html");
            http.feed(SITE + "/feed", RSS);

            assertThat(engine.probeFeed(SITE + "/feed").success()).isFalse();
            assertThat(http.requested()).filteredOn((SITE + "/feed")::equals).hasSize(1);
        }

        @Test
        void labelled_feed_passes() {
            http.feed(SITE + "/feed", RSS);

            assertThat(engine.probeFeed(SITE + "/feed").success()).isTrue();
        }
    }

    @Nested
    class Caching {

        @Test
        void found_feed_is_served_from_cache() {
            http.page(SITE, "<html><head><link rel=\"alternate\" type=\"application/rss+xml\" href=\"/feed.xml\">"
                    + "</head></html>");
            http.feed(SITE + "/feed.xml", RSS);

            engine.discoverFeedUrl(SITE);
            int requests = http.requested().size();

            assertThat(engine.discoverFeedUrl("Blog.Example.com/")).contains(SITE + "/feed.xml");
            assertThat(http.requested()).hasSize(requests);
        }

        @Test
        void absence_is_cached_until_ttl() {
            http.page(SITE, "<html></html>");

            assertThat(engine.discoverFeedUrl(SITE)).isEmpty();
            int requests = http.requested().size();

            assertThat(engine.discoverFeedUrl(SITE)).isEmpty();
            assertThat(http.requested()).hasSize(requests);

            clock.advance(Duration.ofMinutes(31));
            http.feed(SITE + "/feed", RSS);

            assertThat(engine.discoverFeedUrl(SITE)).contains(SITE + "/feed");
        }

        @Test
        void clear_cache_forces_rediscovery() {
            http.page(SITE, "<html></html>");
            engine.discoverFeedUrl(SITE);
            engine.clearCache();
            http.feed(SITE + "/feed", RSS);

            assertThat(engine.discoverFeedUrl(SITE)).contains(SITE + "/feed");
        }
    }

    @Test
    void site_page_failure_is_reported_when_nothing_is_found() {
        FetchException failure = FetchException.network(SITE, new UnknownHostException("blog.example.com"));
        http.getFails(SITE, failure);

        FeedDiscoveryEngine.DiscoveryOutcome outcome = engine.discover(SITE);

        assertThat(outcome.feedUrl()).isEmpty();
        assertThat(outcome.siteFailure()).isSameAs(failure);
    }
}
