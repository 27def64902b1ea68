package dev.distroblog.browser;

/** Starts browser sessions. */
public interface BrowserRenderer {

  /**
   * @throws BrowserException if the browser cannot be launched
   */
  BrowserSession openSession();
}
