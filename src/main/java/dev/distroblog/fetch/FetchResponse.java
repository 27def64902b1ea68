package dev.distroblog.fetch;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.Locale;
import org.jspecify.annotations.Nullable;
import org.springframework.http.MediaType;

/**
 * A completed HTTP exchange. Only 2xx and 3xx responses are returned by {@link
 * RateLimitedFetcher}; error statuses surface as {@link FetchException}.
 */
public record FetchResponse(String url, int status, @Nullable String contentType, byte[] body) {

  public FetchResponse {
    body = body == null ? new byte[0] : body;
  }

  /** Decodes the body with the charset announced in Content-Type, defaulting to UTF-8. */
  public String text() {
    return new String(body, charset());
  }

  public boolean isOk() {
    return status == 200;
  }

  /** True when the server labels the body as HTML. Feed servers often mislabel, so this is advisory. */
  public boolean isHtmlContentType() {
    return contentType != null && contentType.toLowerCase(Locale.ROOT).contains("text/html");
  }

  private Charset charset() {
    if (contentType == null) {
      return StandardCharsets.UTF_8;
    }
    try {
      Charset declared = MediaType.parseMediaType(contentType).getCharset();
      return declared != null ? declared : StandardCharsets.UTF_8;
    } catch (RuntimeException e) {
      return StandardCharsets.UTF_8;
    }
  }
}
