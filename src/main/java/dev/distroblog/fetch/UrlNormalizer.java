package dev.distroblog.fetch;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * URL helpers shared by discovery, scraping and the ingestion domain checks.
 */
public final class UrlNormalizer {

    private static final Logger log = LoggerFactory.getLogger(UrlNormalizer.class);

    private UrlNormalizer() {
        // utility class
    }

    /**
     * Canonical key for a user-supplied site URL: adds {@code https://} when the scheme is missing,
     * lowercases the host and drops a trailing slash. Used as the discovery cache key.
     *
     * @param siteUrl URL as typed by a user, e.g. {@code Example.com/blog/}
     * @return normalized URL, e.g. {@code https://example.com/blog}
     */
    public static String normalizeSiteUrl(String siteUrl) {
        String url = siteUrl.trim();
        if (!url.matches("(?i)^https?://.*")) {
            url = "https://" + url;
        }
        try {
            URI uri = new URI(url);
            if (uri.getHost() == null) {
                return stripTrailingSlash(url);
            }
            StringBuilder sb = new StringBuilder();
            sb.append(uri.getScheme().toLowerCase(Locale.ROOT)).append("://")
                    .append(uri.getHost().toLowerCase(Locale.ROOT));
            if (uri.getPort() != -1 && !isDefaultPort(uri.getScheme().toLowerCase(Locale.ROOT), uri.getPort())) {
                sb.append(':').append(uri.getPort());
            }
            if (uri.getRawPath() != null) {
                sb.append(uri.getRawPath());
            }
            if (uri.getRawQuery() != null) {
                sb.append('?').append(uri.getRawQuery());
            }
            return stripTrailingSlash(sb.toString());
        } catch (URISyntaxException e) {
            log.warn("Malformed site URL, using it as typed: {}", siteUrl);
            return stripTrailingSlash(url);
        }
    }

    /**
     * Extract the base URL (scheme://host[:port]) from a full URL.
     * Default ports are omitted.
     *
     * @param url the URL to extract the base from
     * @return the base URL, or the input unchanged if malformed
     */
    public static String normalizeToBase(String url) {
        try {
            URI uri = new URI(url);
            if (uri.getScheme() == null || uri.getHost() == null) {
                log.warn("URL missing scheme or host, returning unchanged: {}", url);
                return url;
            }
            String scheme = uri.getScheme().toLowerCase(Locale.ROOT);
            String host = uri.getHost().toLowerCase(Locale.ROOT);
            int port = uri.getPort();
            if (port == -1 || isDefaultPort(scheme, port)) {
                return scheme + "://" + host;
            }
            return scheme + "://" + host + ":" + port;
        } catch (URISyntaxException e) {
            log.warn("Malformed URL, returning unchanged: {}", url);
            return url;
        }
    }

    /**
     * Check if a candidate URL has the same scheme, host and port as the root URL.
     *
     * @return true if the candidate is on the same origin
     */
    public static boolean isSameSite(String rootUrl, String candidateUrl) {
        try {
            URI root = new URI(rootUrl);
            URI candidate = new URI(candidateUrl);
            if (root.getScheme() == null || candidate.getScheme() == null
                    || root.getHost() == null || candidate.getHost() == null) {
                return false;
            }
        } catch (URISyntaxException e) {
            return false;
        }
        return normalizeToBase(rootUrl).equals(normalizeToBase(candidateUrl));
    }

    /**
     * Lowercased host without a leading {@code www.}; null when the URL has no host.
     * {@code https://WWW.Example.com/x} and {@code http://example.com} share {@code example.com}.
     */
    public static @Nullable String bareHost(@Nullable String url) {
        if (url == null || url.isBlank()) {
            return null;
        }
        try {
            String host = new URI(url.trim()).getHost();
            if (host == null) {
                return null;
            }
            host = host.toLowerCase(Locale.ROOT);
            return host.startsWith("www.") ? host.substring(4) : host;
        } catch (URISyntaxException e) {
            return null;
        }
    }

    /** True when both URLs have the same {@link #bareHost(String)}. */
    public static boolean isSameDomain(String url, String otherUrl) {
        String host = bareHost(url);
        return host != null && host.equals(bareHost(otherUrl));
    }

    /**
     * Resolve an href found on {@code pageUrl}: absolute, protocol-relative ({@code //host/x}),
     * root-relative ({@code /x}) and document-relative ({@code x}) forms are supported.
     *
     * @return the absolute URL, or null when the href cannot be resolved
     */
    public static @Nullable String resolve(String pageUrl, @Nullable String href) {
        if (href == null || href.isBlank()) {
            return null;
        }
        String trimmed = href.trim();
        if (trimmed.matches("(?i)^https?://.*")) {
            return trimmed;
        }
        try {
            URI base = new URI(pageUrl);
            if (trimmed.startsWith("//")) {
                return base.getScheme() + ":" + trimmed;
            }
            return base.resolve(trimmed.replace(" ", "%20")).toString();
        } catch (URISyntaxException | IllegalArgumentException e) {
            log.debug("Cannot resolve {} against {}: {}", href, pageUrl, e.getMessage());
            return null;
        }
    }

    /**
     * Same-origin ancestors of a URL, deepest first, ending with the origin itself.
     * {@code https://a.com/x/y/z} yields {@code https://a.com/x/y}, {@code https://a.com/x} and
     * {@code https://a.com}. The input URL itself is not included.
     */
    public static List<String> parentPaths(String url) {
        String base = normalizeToBase(url);
        String path;
        try {
            path = new URI(url).getPath();
        } catch (URISyntaxException e) {
            return List.of(base);
        }
        List<String> segments = new ArrayList<>();
        if (path != null) {
            for (String segment : path.split("/")) {
                if (!segment.isEmpty()) {
                    segments.add(segment);
                }
            }
        }
        List<String> parents = new ArrayList<>();
        for (int depth = segments.size() - 1; depth >= 1; depth--) {
            parents.add(base + "/" + String.join("/", segments.subList(0, depth)));
        }
        parents.add(base);
        return parents;
    }

    /** Last non-empty path segment, or an empty string. */
    public static String lastPathSegment(String url) {
        try {
            String path = new URI(url).getPath();
            if (path == null) {
                return "";
            }
            String[] segments = stripTrailingSlash(path).split("/");
            return segments.length == 0 ? "" : segments[segments.length - 1];
        } catch (URISyntaxException e) {
            return "";
        }
    }

    private static String stripTrailingSlash(String url) {
        String result = url;
        while (result.endsWith("/")) {
            result = result.substring(0, result.length() - 1);
        }
        return result;
    }

    private static boolean isDefaultPort(String scheme, int port) {
        return ("http".equals(scheme) && port == 80)
                || ("https".equals(scheme) && port == 443);
    }
}
