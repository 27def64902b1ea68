package dev.distroblog.scrape;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HexFormat;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Per-source change detection for scraped listing pages. A fingerprint is the SHA-256 of the first
 * {@value #HASHED_PREFIX} characters of the page plus the joined entry titles.
 */
class PageFingerprints {

  static final int HASHED_PREFIX = 10_000;

  private final Clock clock;
  private final Duration ttl;
  private final ConcurrentHashMap<UUID, Fingerprint> bySource = new ConcurrentHashMap<>();

  PageFingerprints(Clock clock, Duration ttl) {
    this.clock = clock;
    this.ttl = ttl;
  }

  /**
   * Links that should be reported for this visit. An unchanged page yields only links that were not
   * seen on the previous visit; a new or changed page yields all of them and replaces the stored
   * fingerprint.
   */
  List<String> newLinks(UUID sourceId, String html, List<String> titles, List<String> links) {
    String hash = sha256(html.substring(0, Math.min(html.length(), HASHED_PREFIX)) + String.join("|", titles));
    Instant now = clock.instant();
    Fingerprint previous = bySource.get(sourceId);
    if (previous != null && !previous.isExpired(now, ttl) && previous.hash().equals(hash)) {
      return links.stream().filter(link -> !previous.links().contains(link)).toList();
    }
    bySource.put(sourceId, new Fingerprint(hash, now, Set.copyOf(links)));
    return links;
  }

  void evictExpired() {
    Instant now = clock.instant();
    bySource.values().removeIf(fingerprint -> fingerprint.isExpired(now, ttl));
  }

  int size() {
    return bySource.size();
  }

  static String sha256(String content) {
    try {
      MessageDigest digest = MessageDigest.getInstance("SHA-256");
      return HexFormat.of().formatHex(digest.digest(content.getBytes(StandardCharsets.UTF_8)));
    } catch (NoSuchAlgorithmException e) {
      throw new IllegalStateException("SHA-256 algorithm not available", e);
    }
  }

  private record Fingerprint(String hash, Instant checkedAt, Set<String> links) {
    boolean isExpired(Instant now, Duration ttl) {
      return checkedAt.plus(ttl).isBefore(now);
    }
  }
}
