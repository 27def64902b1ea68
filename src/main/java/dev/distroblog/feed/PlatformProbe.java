package dev.distroblog.feed;

import java.util.List;
import java.util.Locale;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Feed locations of a hosting platform that does not always advertise its feeds.
 *
 * @param matches        whether the site URL belongs to the platform
 * @param candidates     feed URLs to try for a site URL; may be empty when the URL lacks the needed id
 * @param tryOnAnySite   whether the candidates are also worth trying on unmatched sites, as a late guess
 */
record PlatformProbe(
        String name,
        Predicate<String> matches,
        Function<String, List<String>> candidates,
        boolean tryOnAnySite
) {

    private static final Pattern YOUTUBE_CHANNEL =
            Pattern.compile("youtube\\.com/(?:channel/|c/|user/|@)([a-zA-Z0-9_-]+)");

    private static final Pattern SUBREDDIT = Pattern.compile("reddit\\.com/r/([^/?#]+)");

    static final List<PlatformProbe> ALL = List.of(
            new PlatformProbe("substack", contains("substack.com"), url -> List.of(url + "/feed"), true),
            new PlatformProbe("medium", contains("medium.com"), url -> List.of(url + "/feed"), true),
            new PlatformProbe("youtube", contains("youtube.com"), PlatformProbe::youtubeFeeds, false),
            new PlatformProbe("reddit", contains("reddit.com"), PlatformProbe::redditFeeds, false),
            new PlatformProbe("github", contains("github.com"), url -> List.of(url + ".atom"), false),
            new PlatformProbe("blogger", contains("blogspot.com").or(contains("blogger.com")),
                    url -> List.of(url + "/feeds/posts/default"), false),
            new PlatformProbe("tumblr", contains("tumblr.com"), url -> List.of(url + "/rss"), false),
            new PlatformProbe("mastodon", contains("mastodon.").or(contains("mstdn.")),
                    url -> List.of(url + ".rss"), false));

    boolean appliesTo(String siteUrl) {
        return matches.test(siteUrl);
    }

    List<String> candidatesFor(String siteUrl) {
        return candidates.apply(siteUrl);
    }

    static List<String> youtubeFeeds(String url) {
        Matcher m = YOUTUBE_CHANNEL.matcher(url);
        if (!m.find()) {
            return List.of();
        }
        return List.of("https://www.youtube.com/feeds/videos.xml?channel_id=" + m.group(1));
    }

    static List<String> redditFeeds(String url) {
        Matcher m = SUBREDDIT.matcher(url);
        if (!m.find()) {
            return List.of();
        }
        return List.of("https://www.reddit.com/r/" + m.group(1) + ".rss");
    }

    private static Predicate<String> contains(String fragment) {
        return url -> url.toLowerCase(Locale.ROOT).contains(fragment);
    }
}
