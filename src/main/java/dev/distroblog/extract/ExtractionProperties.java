package dev.distroblog.extract;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Article extraction thresholds.
 *
 * @param articleFetchTimeoutMs read timeout for full-article and metadata fetches
 * @param fullFetchBelowChars   feed content shorter than this triggers a full-article fetch
 * @param minBodyChars          extracted body text must be longer than this to be accepted
 */
@ConfigurationProperties(prefix = "distroblog.extraction")
public record ExtractionProperties(int articleFetchTimeoutMs, int fullFetchBelowChars, int minBodyChars) {

  public ExtractionProperties {
    if (articleFetchTimeoutMs <= 0) {
      articleFetchTimeoutMs = 15_000;
    }
    if (fullFetchBelowChars <= 0) {
      fullFetchBelowChars = 240;
    }
    if (minBodyChars <= 0) {
      minBodyChars = 200;
    }
  }
}
