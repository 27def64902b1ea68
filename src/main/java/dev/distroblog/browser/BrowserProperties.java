package dev.distroblog.browser;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Headless browser settings.
 *
 * @param enabled             when false every render falls back to static fetching
 * @param navigationTimeoutMs page navigation timeout
 * @param settleMs            extra wait after DOM content loaded, for client-rendered listings
 */
@ConfigurationProperties(prefix = "distroblog.browser")
public record BrowserProperties(boolean enabled, int navigationTimeoutMs, int settleMs, String userAgent) {

  public BrowserProperties {
    if (navigationTimeoutMs <= 0) {
      navigationTimeoutMs = 30_000;
    }
    if (userAgent == null || userAgent.isBlank()) {
      userAgent =
          "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 (KHTML, like Gecko)"
              + " Chrome/120.0.0.0 Safari/537.36";
    }
  }
}
