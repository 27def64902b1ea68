package dev.distroblog.feed;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

import dev.distroblog.fetch.UrlNormalizer;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

/**
 * Collects feed hints from an HTML page: typed and alternate {@code <link>} elements first, then
 * anchors whose href and text both suggest a feed.
 */
final class HtmlFeedLinkExtractor {

    private static final List<String> LINK_SELECTORS = List.of(
            "link[type=application/rss+xml]",
            "link[type=application/atom+xml]",
            "link[type=application/json]",
            "link[type=application/feed+json]",
            "link[type=application/xml]",
            "link[rel=alternate][type*=xml]",
            "link[rel=alternate][type*=json]",
            "link[rel=alternate][type*=rss]",
            "link[rel=alternate][type*=atom]",
            "link[rel=alternate][type*=feed]",
            "link[rel=feed]",
            "link[rel=syndication]");

    private static final String ANCHOR_SELECTOR = "a[href*=feed], a[href*=rss], a[href*=atom]";

    private static final List<String> ANCHOR_TEXT_HINTS = List.of("rss", "feed", "syndication", "json");

    private HtmlFeedLinkExtractor() {
        // utility class
    }

    /** Candidate feed URLs in document priority order, resolved against {@code pageUrl}. */
    static List<String> extract(String pageUrl, String html) {
        Document doc = Jsoup.parse(html, pageUrl);
        Set<String> candidates = new LinkedHashSet<>();
        for (String selector : LINK_SELECTORS) {
            for (Element link : doc.select(selector)) {
                addResolved(candidates, pageUrl, link.attr("href"));
            }
        }
        for (Element anchor : doc.select(ANCHOR_SELECTOR)) {
            String text = anchor.text().toLowerCase(Locale.ROOT);
            if (ANCHOR_TEXT_HINTS.stream().anyMatch(text::contains)) {
                addResolved(candidates, pageUrl, anchor.attr("href"));
            }
        }
        return List.copyOf(candidates);
    }

    private static void addResolved(Set<String> candidates, String pageUrl, String href) {
        String resolved = UrlNormalizer.resolve(pageUrl, href);
        if (resolved != null) {
            candidates.add(resolved);
        }
    }
}
