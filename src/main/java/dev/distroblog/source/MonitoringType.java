package dev.distroblog.source;

/**
 * How articles are obtained for a {@link Source}.
 */
public enum MonitoringType {
  /** Parse the stored feed URL. */
  RSS,
  /** Scrape the site's listing page. */
  SCRAPING,
  /** Ask the external AI extraction service, falling back to scraping. */
  ADK
}
