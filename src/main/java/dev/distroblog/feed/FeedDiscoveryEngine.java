package dev.distroblog.feed;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import dev.distroblog.fetch.FetchException;
import dev.distroblog.fetch.FetchResponse;
import dev.distroblog.fetch.RateLimitedFetcher;
import dev.distroblog.fetch.UrlNormalizer;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Finds a working feed for an arbitrary website by running an ordered list of strategies until
 * one yields a URL that serves a feed body (see {@link FeedProbe#isFeed}):
 * <ol>
 *   <li>feed hints in the page's HTML</li>
 *   <li>feed hints on parent pages</li>
 *   <li>the conventional feed paths under parent paths and blog-like sections</li>
 *   <li>platform-specific locations (Substack, Medium, YouTube, ...) for matching hosts</li>
 *   <li>WordPress locations for sites that look like WordPress</li>
 *   <li>the full conventional path list at the site root</li>
 *   <li>feed-like and section URLs listed in {@code sitemap.xml}</li>
 *   <li>remaining platform and WordPress guesses</li>
 * </ol>
 * Outcomes, including "none found", are cached per normalized site URL.
 */
@Service
public class FeedDiscoveryEngine {

    private static final Logger log = LoggerFactory.getLogger(FeedDiscoveryEngine.class);

    private final RateLimitedFetcher fetcher;
    private final FeedProbe feedProbe;
    private final SitemapParser sitemapParser;
    private final FeedProperties properties;
    private final DiscoveryCache cache;

    public FeedDiscoveryEngine(RateLimitedFetcher fetcher, FeedProbe feedProbe, SitemapParser sitemapParser,
                               FeedProperties properties, Clock clock) {
        this.fetcher = fetcher;
        this.feedProbe = feedProbe;
        this.sitemapParser = sitemapParser;
        this.properties = properties;
        this.cache = new DiscoveryCache(clock, properties.discoveryCacheTtl());
    }

    public Optional<String> discoverFeedUrl(String siteUrl) {
        return discover(siteUrl).feedUrl();
    }

    /**
     * Run discovery, or answer from the cache.
     *
     * @return the feed URL if one was found, plus the failure of fetching the site page itself when
     *     that page could not be loaded
     */
    public DiscoveryOutcome discover(String siteUrl) {
        String key = UrlNormalizer.normalizeSiteUrl(siteUrl);
        Optional<Optional<String>> cached = cache.get(key);
        if (cached.isPresent()) {
            log.debug("Discovery cache hit for {}: {}", key, cached.get().orElse("none"));
            return new DiscoveryOutcome(cached.get(), null);
        }

        DiscoveryRun run = new DiscoveryRun(key);
        for (DiscoveryStrategy strategy : strategiesFor(key)) {
            Optional<String> found;
            try {
                found = strategy.run(run);
            } catch (RuntimeException e) {
                log.warn("Discovery strategy '{}' failed for {}: {}", strategy.name(), key, e.getMessage());
                found = Optional.empty();
            }
            if (found.isPresent()) {
                log.info("Found feed for {} via {}: {}", key, strategy.name(), found.get());
                cache.put(key, found.get());
                return new DiscoveryOutcome(found, null);
            }
        }
        log.info("No feed found for {} after {} probes", key, run.probed.size());
        cache.put(key, null);
        return new DiscoveryOutcome(Optional.empty(), run.siteFailure);
    }

    public FeedProbeResult probeFeed(String feedUrl) {
        return feedProbe.probe(feedUrl);
    }

    public void clearCache() {
        cache.clear();
    }

    List<DiscoveryStrategy> strategiesFor(String siteUrl) {
        boolean wordpress = FeedPaths.WORDPRESS_HINT.matcher(siteUrl).find();
        List<DiscoveryStrategy> strategies = new ArrayList<>();
        strategies.add(new DiscoveryStrategy("html-links", run -> htmlLinks(run, run.siteUrl, true)));
        strategies.add(new DiscoveryStrategy("parent-html-links", this::parentHtmlLinks));
        strategies.add(new DiscoveryStrategy("parent-common-paths", this::parentCommonPaths));
        strategies.add(new DiscoveryStrategy("platform", run -> platformProbes(run, true)));
        if (wordpress) {
            strategies.add(new DiscoveryStrategy("wordpress", this::wordpressPaths));
        }
        strategies.add(new DiscoveryStrategy("common-paths",
                run -> run.firstWorking(under(UrlNormalizer.normalizeToBase(run.siteUrl), FeedPaths.ROOT_SWEEP))));
        strategies.add(new DiscoveryStrategy("sitemap", this::sitemap));
        strategies.add(new DiscoveryStrategy("platform-fallback", run -> platformProbes(run, false)));
        if (!wordpress) {
            strategies.add(new DiscoveryStrategy("wordpress-fallback", this::wordpressPaths));
        }
        return strategies;
    }

    private Optional<String> htmlLinks(DiscoveryRun run, String pageUrl, boolean sitePage) {
        FetchResponse page;
        try {
            page = fetcher.get(pageUrl);
        } catch (FetchException e) {
            if (sitePage) {
                run.siteFailure = e;
            }
            log.debug("Cannot load {} for feed hints: {}", pageUrl, e.getMessage());
            return Optional.empty();
        }
        return run.firstWorking(HtmlFeedLinkExtractor.extract(pageUrl, page.text()));
    }

    private Optional<String> parentHtmlLinks(DiscoveryRun run) {
        for (String parent : parents(run.siteUrl)) {
            Optional<String> found = htmlLinks(run, parent, false);
            if (found.isPresent()) {
                return found;
            }
        }
        return Optional.empty();
    }

    private Optional<String> parentCommonPaths(DiscoveryRun run) {
        String origin = UrlNormalizer.normalizeToBase(run.siteUrl);
        Set<String> prefixes = new LinkedHashSet<>();
        List<String> parents = new ArrayList<>(parents(run.siteUrl));
        if (!parents.contains(origin)) {
            parents.add(origin);
        }
        for (String parent : parents) {
            for (String section : FeedPaths.SECTION_HINTS) {
                prefixes.add(section.isEmpty() ? parent : origin + section);
            }
        }
        for (String prefix : prefixes) {
            Optional<String> found = run.firstWorking(under(prefix, FeedPaths.ROOT_SWEEP));
            if (found.isPresent()) {
                return found;
            }
        }
        return Optional.empty();
    }

    private Optional<String> platformProbes(DiscoveryRun run, boolean matched) {
        for (PlatformProbe probe : PlatformProbe.ALL) {
            boolean applies = probe.appliesTo(run.siteUrl);
            if (matched != applies || (!matched && !probe.tryOnAnySite())) {
                continue;
            }
            Optional<String> found = run.firstWorking(probe.candidatesFor(run.siteUrl));
            if (found.isPresent()) {
                return found;
            }
        }
        return Optional.empty();
    }

    private Optional<String> wordpressPaths(DiscoveryRun run) {
        return run.firstWorking(under(run.siteUrl, FeedPaths.WORDPRESS));
    }

    private Optional<String> sitemap(DiscoveryRun run) {
        List<String> locations = sitemapParser.discoverFromSitemap(run.siteUrl);
        if (locations.isEmpty()) {
            return Optional.empty();
        }
        List<String> feedLike = locations.stream()
                .filter(url -> FeedPaths.FEED_LIKE_URL.matcher(url).find())
                .toList();
        Optional<String> direct = run.firstWorking(feedLike);
        if (direct.isPresent()) {
            return direct;
        }
        List<String> sections = locations.stream()
                .filter(url -> FeedPaths.SECTION_URL.matcher(url).find())
                .map(url -> url.endsWith("/") ? url.substring(0, url.length() - 1) : url)
                .distinct()
                .limit(properties.maxSitemapSections())
                .toList();
        for (String section : sections) {
            Optional<String> found = run.firstWorking(under(section, FeedPaths.ROOT_SWEEP));
            if (found.isPresent()) {
                return found;
            }
        }
        return Optional.empty();
    }

    /** Parent pages of the site URL, deepest first, without the site URL itself. */
    private static List<String> parents(String siteUrl) {
        return UrlNormalizer.parentPaths(siteUrl).stream()
                .filter(parent -> !parent.equals(siteUrl))
                .toList();
    }

    private static List<String> under(String prefix, List<String> paths) {
        String base = prefix.endsWith("/") ? prefix.substring(0, prefix.length() - 1) : prefix;
        return paths.stream().map(path -> base + path).toList();
    }

    /**
     * State of one uncached discovery: the normalized site URL, the candidates already probed and
     * the failure of the site page fetch, if any.
     */
    final class DiscoveryRun {

        private final String siteUrl;
        private final Set<String> probed = new HashSet<>();
        private @Nullable FetchException siteFailure;

        DiscoveryRun(String siteUrl) {
            this.siteUrl = siteUrl;
        }

        /** Probe candidates in order, skipping ones already probed during this run. */
        Optional<String> firstWorking(Collection<String> candidates) {
            for (String candidate : candidates) {
                if (probed.add(candidate) && feedProbe.isFeed(candidate)) {
                    return Optional.of(candidate);
                }
            }
            return Optional.empty();
        }
    }

    /**
     * @param siteFailure why the site page itself could not be loaded; only set when no feed was found
     */
    public record DiscoveryOutcome(Optional<String> feedUrl, @Nullable FetchException siteFailure) {}
}
