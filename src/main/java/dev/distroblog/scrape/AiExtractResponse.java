package dev.distroblog.scrape;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.List;
import org.jspecify.annotations.Nullable;

/** Articles returned by the extraction service; any field may be missing. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record AiExtractResponse(List<Article> articles) {

  public AiExtractResponse {
    articles = articles == null ? List.of() : articles.stream().filter(a -> a != null).toList();
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  public record Article(
      @Nullable String title,
      @Nullable String url,
      @Nullable String description,
      @Nullable String datePublished) {}
}
