package dev.distroblog.browser;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * The only way the rest of the application touches the browser. A session is opened for one unit
 * of work and closed when that work returns or throws.
 */
@Component
public class BrowserSessions {

  private static final Logger log = LoggerFactory.getLogger(BrowserSessions.class);

  private final BrowserRenderer renderer;
  private final BrowserProperties properties;
  private final AtomicInteger openSessions = new AtomicInteger();

  public BrowserSessions(BrowserRenderer renderer, BrowserProperties properties) {
    this.renderer = renderer;
    this.properties = properties;
  }

  public boolean isEnabled() {
    return properties.enabled();
  }

  /**
   * Run {@code work} against a fresh session.
   *
   * @throws BrowserException if the browser is disabled or fails
   */
  public <T> T withSession(Function<BrowserSession, T> work) {
    if (!properties.enabled()) {
      throw new BrowserException("Headless browser is disabled", null);
    }
    try (BrowserSession session = renderer.openSession()) {
      openSessions.incrementAndGet();
      try {
        return work.apply(session);
      } finally {
        openSessions.decrementAndGet();
      }
    }
  }

  /**
   * Rendered HTML of a single page, or empty when the browser is disabled or rendering failed.
   */
  public Optional<String> render(String url) {
    if (!properties.enabled()) {
      return Optional.empty();
    }
    try {
      return Optional.of(withSession(session -> session.render(url)));
    } catch (BrowserException e) {
      log.warn("Browser rendering failed for {}: {}", url, e.getMessage());
      return Optional.empty();
    }
  }

  /** Sessions currently open; zero between units of work. */
  public int openSessions() {
    return openSessions.get();
  }
}
