package dev.distroblog.feed;

import java.io.IOException;
import java.net.URI;
import java.net.URL;
import java.util.List;

import dev.distroblog.fetch.FetchException;
import dev.distroblog.fetch.FetchResponse;
import dev.distroblog.fetch.RateLimitedFetcher;
import dev.distroblog.fetch.UrlNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import crawlercommons.sitemaps.AbstractSiteMap;
import crawlercommons.sitemaps.SiteMap;
import crawlercommons.sitemaps.SiteMapIndex;
import crawlercommons.sitemaps.SiteMapURL;
import crawlercommons.sitemaps.UnknownFormatException;

/**
 * Reads {@code /sitemap.xml} with crawler-commons and returns the same-origin {@code <loc>} URLs.
 * Sitemap indexes are followed one level deep.
 */
@Component
public class SitemapParser {

    private static final Logger log = LoggerFactory.getLogger(SitemapParser.class);

    private final RateLimitedFetcher fetcher;
    private final long maxSitemapSizeBytes;

    public SitemapParser(RateLimitedFetcher fetcher, FeedProperties props) {
        this.fetcher = fetcher;
        this.maxSitemapSizeBytes = props.maxSitemapSizeBytes();
    }

    /**
     * Locations listed in the site's sitemap that share the site's origin.
     * Returns an empty list if there is no sitemap or it cannot be parsed.
     */
    public List<String> discoverFromSitemap(String siteUrl) {
        String baseUrl = UrlNormalizer.normalizeToBase(siteUrl);
        String sitemapUrl = baseUrl + "/sitemap.xml";
        AbstractSiteMap result = parse(sitemapUrl);
        List<String> urls;
        if (result instanceof SiteMapIndex index) {
            urls = index.getSitemaps().stream()
                    .map(AbstractSiteMap::getUrl)
                    .map(URL::toString)
                    .flatMap(url -> parseSingleSitemap(url).stream())
                    .toList();
        } else if (result instanceof SiteMap siteMap) {
            urls = extractUrls(siteMap);
        } else {
            return List.of();
        }
        return urls.stream()
                .filter(url -> UrlNormalizer.isSameSite(baseUrl, url))
                .distinct()
                .toList();
    }

    private AbstractSiteMap parse(String sitemapUrl) {
        byte[] content = fetchSitemap(sitemapUrl);
        if (content == null) {
            return null;
        }
        try {
            crawlercommons.sitemaps.SiteMapParser parser =
                    new crawlercommons.sitemaps.SiteMapParser(false);
            return parser.parseSiteMap(content, URI.create(sitemapUrl).toURL());
        } catch (UnknownFormatException | IOException | IllegalArgumentException e) {
            log.debug("Could not parse sitemap {}: {}", sitemapUrl, e.getMessage());
            return null;
        }
    }

    /**
     * Fetch sitemap content, skipping documents above the size limit.
     */
    private byte[] fetchSitemap(String sitemapUrl) {
        FetchResponse response;
        try {
            response = fetcher.get(sitemapUrl);
        } catch (FetchException e) {
            log.debug("Sitemap not available at {}: {}", sitemapUrl, e.getMessage());
            return null;
        }
        byte[] content = response.body();
        if (content.length == 0) {
            return null;
        }
        if (content.length >= maxSitemapSizeBytes) {
            log.warn("Sitemap at {} exceeds size limit ({} bytes), skipping", sitemapUrl, maxSitemapSizeBytes);
            return null;
        }
        return content;
    }

    private List<String> parseSingleSitemap(String sitemapUrl) {
        if (parse(sitemapUrl) instanceof SiteMap siteMap) {
            return extractUrls(siteMap);
        }
        return List.of();
    }

    private List<String> extractUrls(SiteMap siteMap) {
        return siteMap.getSiteMapUrls().stream()
                .map(SiteMapURL::getUrl)
                .map(URL::toString)
                .toList();
    }
}
