package dev.distroblog.browser;

/** A page could not be rendered, or no browser could be started. */
public class BrowserException extends RuntimeException {

  public BrowserException(String message, Throwable cause) {
    super(message, cause);
  }
}
