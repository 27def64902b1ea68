package dev.distroblog.feed;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class HtmlFeedLinkExtractorTest {

    private static final String PAGE = "https://distro.org/blog/";

    @Test
    void typedLinksComeBeforeAnchors() {
        String html = """
                <html><head>
                  <link rel="alternate" type="application/atom+xml" href="/atom.xml">
                  <link rel="alternate" type="application/rss+xml" href="https://distro.org/rss.xml">
                </head><body>
                  <a href="/feed.json">JSON feed</a>
                </body></html>
                """;

        List<String> candidates = HtmlFeedLinkExtractor.extract(PAGE, html);

        assertThat(candidates).containsExactly(
                "https://distro.org/rss.xml", "https://distro.org/atom.xml", "https://distro.org/feed.json");
    }

    @Test
    void relFeedAndSyndicationAreHints() {
        String html = """
                <link rel="feed" href="posts.xml">
                <link rel="syndication" href="//cdn.distro.org/all.rss">
                """;

        assertThat(HtmlFeedLinkExtractor.extract(PAGE, html)).containsExactly(
                "https://distro.org/blog/posts.xml", "https://cdn.distro.org/all.rss");
    }

    @Test
    void anchorsNeedFeedWordsInTheirText() {
        String html = """
                <a href="/feedback">Contact us</a>
                <a href="/atom-editor">Our editor</a>
                <a href="/rss">Subscribe via RSS</a>
                """;

        assertThat(HtmlFeedLinkExtractor.extract(PAGE, html)).containsExactly("https://distro.org/rss");
    }

    @Test
    void repeatedHintsAreReportedOnce() {
        String html = """
                <link type="application/rss+xml" href="/rss.xml">
                <link rel="alternate" type="application/rss+xml" href="/rss.xml">
                <a href="/rss.xml">RSS</a>
                """;

        assertThat(HtmlFeedLinkExtractor.extract(PAGE, html)).containsExactly("https://distro.org/rss.xml");
    }

    @Test
    void pageWithoutHintsYieldsNothing() {
        assertThat(HtmlFeedLinkExtractor.extract(PAGE, "<html><body><p>Hello</p></body></html>")).isEmpty();
    }
}
