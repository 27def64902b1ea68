package dev.distroblog.feed;

import java.util.List;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * Conventional feed locations probed during discovery.
 */
final class FeedPaths {

    private FeedPaths() {
        // utility class
    }

    /** Tried first wherever conventional paths are probed. */
    static final List<String> PRIORITIZED = List.of(
            "/feed", "/feed.json", "/rss", "/feed.xml", "/rss.xml", "/atom.xml", "/feeds/all.xml");

    /** Section prefixes combined with {@link #ROOT_SWEEP} on parent paths. */
    static final List<String> SECTION_HINTS = List.of("", "/blog", "/news", "/posts", "/articles", "/updates");

    /** Conventional feed paths. */
    static final List<String> COMMON = List.of(
            "/feed", "/feed.xml", "/feed.json", "/rss", "/rss.xml", "/atom.xml", "/feeds/all.xml",
            "/feeds/posts/default", "/index.xml", "/feed.rss", "/rss2.xml", "/feed/", "/feeds/",
            "/blog/feed", "/blog/feed.json", "/blog/rss",
            "/news/feed", "/news/feed.json", "/news/rss",
            "/posts/feed", "/posts/feed.json", "/posts/rss",
            "/articles/feed", "/articles/feed.json", "/articles/rss",
            "/updates/feed", "/updates/feed.json", "/updates/rss",
            "/content/feed", "/content/rss", "/latest/feed", "/latest/rss",
            "/feed.rdf", "/feed.atom", "/sitemap.xml",
            "/feed/index.xml", "/rss/index.xml", "/atom/index.xml");

    /** {@link #PRIORITIZED} followed by the rest of {@link #COMMON}, probed under every prefix. */
    static final List<String> ROOT_SWEEP = Stream.concat(
            PRIORITIZED.stream(), COMMON.stream().filter(path -> !PRIORITIZED.contains(path))).toList();

    static final List<String> WORDPRESS = List.of(
            "/feed/", "/rdf/", "/rss/", "/atom/", "/feed/rss/", "/feed/rss2/", "/feed/atom/",
            "/wp-feed.php", "/?feed=rss", "/?feed=rss2", "/?feed=atom",
            "/category/uncategorized/feed/", "/tag/feed/");

    static final Pattern WORDPRESS_HINT = Pattern.compile("wordpress\\.com|wp-content|wp-json", Pattern.CASE_INSENSITIVE);

    /** Sitemap locations that are feeds themselves. */
    static final Pattern FEED_LIKE_URL =
            Pattern.compile("/(rss|atom|feed)\\.(xml|rss|atom)|/(rss|atom|feed)(/|$)", Pattern.CASE_INSENSITIVE);

    /** Sitemap locations worth probing with {@link #ROOT_SWEEP}. */
    static final Pattern SECTION_URL =
            Pattern.compile("/(blog|news|posts|articles|updates)(/|$)", Pattern.CASE_INSENSITIVE);
}
