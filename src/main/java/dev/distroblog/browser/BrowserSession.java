package dev.distroblog.browser;

/**
 * One browser process with a single tab. Closing it releases the process.
 */
public interface BrowserSession extends AutoCloseable {

  /**
   * Navigate to the URL and return the rendered document HTML.
   *
   * @throws BrowserException if navigation fails or times out
   */
  String render(String url);

  @Override
  void close();
}
