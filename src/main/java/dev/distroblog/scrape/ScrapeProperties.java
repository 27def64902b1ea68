package dev.distroblog.scrape;

import java.time.Duration;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Listing-page scraper settings.
 *
 * @param maxItems       entries kept per listing page, newest first
 * @param fingerprintTtl how long a page fingerprint is trusted for change detection
 * @param sectionPaths   paths probed with HEAD to find the blog section of a site
 */
@ConfigurationProperties(prefix = "distroblog.scrape")
public record ScrapeProperties(int maxItems, Duration fingerprintTtl, List<String> sectionPaths) {

  public ScrapeProperties {
    if (maxItems <= 0) {
      maxItems = 20;
    }
    if (fingerprintTtl == null) {
      fingerprintTtl = Duration.ofHours(24);
    }
    if (sectionPaths == null || sectionPaths.isEmpty()) {
      sectionPaths =
          List.of(
              "/blog",
              "/posts",
              "/articles",
              "/news",
              "/press",
              "/press-releases",
              "/updates",
              "/announcements");
    } else {
      sectionPaths = List.copyOf(sectionPaths);
    }
  }
}
