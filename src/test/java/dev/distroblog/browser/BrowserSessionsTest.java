package dev.distroblog.browser;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class BrowserSessionsTest {

  @Mock private BrowserRenderer renderer;

  @Mock private BrowserSession session;

  private BrowserSessions sessions(boolean enabled) {
    return new BrowserSessions(renderer, new BrowserProperties(enabled, 10_000, 0, null));
  }

  @Test
  void render_closes_the_session() {
    when(renderer.openSession()).thenReturn(session);
    when(session.render("https://a.com")).thenReturn("<html></html>");
    BrowserSessions sessions = sessions(true);

    assertThat(sessions.render("https://a.com")).contains("<html></html>");
    verify(session).close();
    assertThat(sessions.openSessions()).isZero();
  }

  @Test
  void session_is_closed_when_work_throws() {
    when(renderer.openSession()).thenReturn(session);
    when(session.render(anyString())).thenThrow(new BrowserException("timeout", null));
    BrowserSessions sessions = sessions(true);

    assertThat(sessions.render("https://a.com")).isEmpty();
    verify(session).close();
    assertThat(sessions.openSessions()).isZero();
  }

  @Test
  void disabled_browser_never_launches() {
    BrowserSessions sessions = sessions(false);

    assertThat(sessions.render("https://a.com")).isEmpty();
    assertThatThrownBy(() -> sessions.withSession(s -> s.render("https://a.com")))
        .isInstanceOf(BrowserException.class);
    verify(renderer, never()).openSession();
  }

  @Test
  void launch_failure_renders_nothing() {
    when(renderer.openSession()).thenThrow(new BrowserException("no chromium", null));

    assertThat(sessions(true).render("https://a.com")).isEmpty();
  }
}
