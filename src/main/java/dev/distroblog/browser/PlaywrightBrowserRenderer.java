package dev.distroblog.browser;

import java.util.List;

import com.microsoft.playwright.Browser;
import com.microsoft.playwright.BrowserContext;
import com.microsoft.playwright.BrowserType;
import com.microsoft.playwright.Page;
import com.microsoft.playwright.Playwright;
import com.microsoft.playwright.PlaywrightException;
import com.microsoft.playwright.options.WaitUntilState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Headless Chromium through Playwright. Each session owns its own Playwright driver and browser,
 * so closing a session leaves no child process behind.
 */
@Component
public class PlaywrightBrowserRenderer implements BrowserRenderer {

  private static final Logger log = LoggerFactory.getLogger(PlaywrightBrowserRenderer.class);

  private final BrowserProperties properties;

  public PlaywrightBrowserRenderer(BrowserProperties properties) {
    this.properties = properties;
  }

  @Override
  public BrowserSession openSession() {
    Playwright playwright = null;
    try {
      playwright = Playwright.create();
      Browser browser =
          playwright
              .chromium()
              .launch(
                  new BrowserType.LaunchOptions()
                      .setHeadless(true)
                      .setArgs(List.of("--no-sandbox", "--disable-dev-shm-usage")));
      BrowserContext context =
          browser.newContext(new Browser.NewContextOptions().setUserAgent(properties.userAgent()));
      return new PlaywrightSession(playwright, browser, context, context.newPage());
    } catch (PlaywrightException e) {
      if (playwright != null) {
        playwright.close();
      }
      throw new BrowserException("Cannot launch headless browser: " + e.getMessage(), e);
    }
  }

  private final class PlaywrightSession implements BrowserSession {

    private final Playwright playwright;
    private final Browser browser;
    private final BrowserContext context;
    private final Page page;

    private PlaywrightSession(
        Playwright playwright, Browser browser, BrowserContext context, Page page) {
      this.playwright = playwright;
      this.browser = browser;
      this.context = context;
      this.page = page;
    }

    @Override
    public String render(String url) {
      try {
        page.navigate(
            url,
            new Page.NavigateOptions()
                .setWaitUntil(WaitUntilState.DOMCONTENTLOADED)
                .setTimeout(properties.navigationTimeoutMs()));
        if (properties.settleMs() > 0) {
          page.waitForTimeout(properties.settleMs());
        }
        return page.content();
      } catch (PlaywrightException e) {
        throw new BrowserException("Rendering " + url + " failed: " + e.getMessage(), e);
      }
    }

    @Override
    public void close() {
      try {
        context.close();
        browser.close();
      } catch (PlaywrightException e) {
        log.warn("Error closing browser: {}", e.getMessage());
      } finally {
        playwright.close();
      }
    }
  }
}
