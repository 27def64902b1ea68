package dev.distroblog.feed;

import static org.assertj.core.api.Assertions.assertThat;

import dev.distroblog.fixture.FetcherStub;
import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class SitemapParserTest {

  private FetcherStub http;
  private SitemapParser sitemapParser;

  @BeforeEach
  void setUp() {
    http = new FetcherStub();
    sitemapParser =
        new SitemapParser(http.fetcher(), new FeedProperties(Duration.ofMinutes(30), 5000, 10_000, 3));
  }

  @Test
  void discoverFromSitemapValidSitemapReturnsUrls() {
    http.get(
        "https://blog.example.com/sitemap.xml",
        200,
        "application/xml",
        """
        <?xml version="1.0" encoding="UTF-8"?>
        <urlset xmlns="http://www.sitemaps.org/schemas/sitemap/0.9">
            <url><loc>https://blog.example.com/blog/</loc></url>
            <url><loc>https://blog.example.com/news/launch</loc></url>
        </urlset>
        """);

    List<String> urls = sitemapParser.discoverFromSitemap("https://blog.example.com/about");

    assertThat(urls)
        .containsExactly("https://blog.example.com/blog/", "https://blog.example.com/news/launch");
  }

  @Test
  void discoverFromSitemapFollowsIndexOneLevel() {
    http.get(
        "https://blog.example.com/sitemap.xml",
        200,
        "application/xml",
        """
        <?xml version="1.0" encoding="UTF-8"?>
        <sitemapindex xmlns="http://www.sitemaps.org/schemas/sitemap/0.9">
            <sitemap><loc>https://blog.example.com/sitemap-posts.xml</loc></sitemap>
        </sitemapindex>
        """);
    http.get(
        "https://blog.example.com/sitemap-posts.xml",
        200,
        "application/xml",
        """
        <?xml version="1.0" encoding="UTF-8"?>
        <urlset xmlns="http://www.sitemaps.org/schemas/sitemap/0.9">
            <url><loc>https://blog.example.com/posts/hello</loc></url>
        </urlset>
        """);

    assertThat(sitemapParser.discoverFromSitemap("https://blog.example.com"))
        .containsExactly("https://blog.example.com/posts/hello");
  }

  @Test
  void discoverFromSitemapDropsOtherOrigins() {
    http.get(
        "https://blog.example.com/sitemap.xml",
        200,
        "application/xml",
        """
        <?xml version="1.0" encoding="UTF-8"?>
        <urlset xmlns="http://www.sitemaps.org/schemas/sitemap/0.9">
            <url><loc>https://blog.example.com/blog</loc></url>
            <url><loc>https://cdn.other.com/blog</loc></url>
        </urlset>
        """);

    assertThat(sitemapParser.discoverFromSitemap("https://blog.example.com"))
        .containsExactly("https://blog.example.com/blog");
  }

  @Test
  void discoverFromSitemapMissingSitemapReturnsEmpty() {
    assertThat(sitemapParser.discoverFromSitemap("https://blog.example.com")).isEmpty();
  }

  @Test
  void discoverFromSitemapOversizedSitemapIsSkipped() {
    http.get(
        "https://blog.example.com/sitemap.xml",
        200,
        "application/xml",
        "<urlset>" + "x".repeat(20_000) + "</urlset>");

    assertThat(sitemapParser.discoverFromSitemap("https://blog.example.com")).isEmpty();
  }

  @Test
  void discoverFromSitemapGarbageReturnsEmpty() {
    http.get("https://blog.example.com/sitemap.xml", 200, "text/html", "<html>not a sitemap</html>");

    assertThat(sitemapParser.discoverFromSitemap("https://blog.example.com")).isEmpty();
  }
}
