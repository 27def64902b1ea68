package dev.distroblog.extract;

import java.util.ArrayList;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * Source-format-neutral intermediate for one candidate article. Every reader (ROME entries, JSON
 * Feed items, leniently parsed XML, scraped listings, AI-extractor results) maps into this shape,
 * leaving absent fields null. Never persisted.
 *
 * @param dateCandidates raw date strings in priority order (pubDate, isoDate, date, published,
 *     dc:date, atom:published); the first one that parses to a plausible date wins
 */
public record RawItem(
    @Nullable String title,
    @Nullable String link,
    @Nullable String contentSnippet,
    @Nullable String description,
    @Nullable String content,
    @Nullable String summary,
    @Nullable String contentEncoded,
    @Nullable String mediaDescription,
    @Nullable String author,
    List<String> categories,
    List<String> dateCandidates) {

  public RawItem {
    categories = categories == null ? List.of() : List.copyOf(categories);
    dateCandidates =
        dateCandidates == null
            ? List.of()
            : dateCandidates.stream().filter(d -> d != null && !d.isBlank()).toList();
  }

  public static Builder builder() {
    return new Builder();
  }

  public boolean hasLink() {
    return link != null && !link.isBlank();
  }

  /** Fluent builder; the adapters fill only what their format provides. */
  public static final class Builder {
    private @Nullable String title;
    private @Nullable String link;
    private @Nullable String contentSnippet;
    private @Nullable String description;
    private @Nullable String content;
    private @Nullable String summary;
    private @Nullable String contentEncoded;
    private @Nullable String mediaDescription;
    private @Nullable String author;
    private final List<String> categories = new ArrayList<>();
    private final List<String> dateCandidates = new ArrayList<>();

    private Builder() {}

    public Builder title(@Nullable String title) {
      this.title = title;
      return this;
    }

    public Builder link(@Nullable String link) {
      this.link = link;
      return this;
    }

    public Builder contentSnippet(@Nullable String contentSnippet) {
      this.contentSnippet = contentSnippet;
      return this;
    }

    public Builder description(@Nullable String description) {
      this.description = description;
      return this;
    }

    public Builder content(@Nullable String content) {
      this.content = content;
      return this;
    }

    public Builder summary(@Nullable String summary) {
      this.summary = summary;
      return this;
    }

    public Builder contentEncoded(@Nullable String contentEncoded) {
      this.contentEncoded = contentEncoded;
      return this;
    }

    public Builder mediaDescription(@Nullable String mediaDescription) {
      this.mediaDescription = mediaDescription;
      return this;
    }

    public Builder author(@Nullable String author) {
      this.author = author;
      return this;
    }

    public Builder category(@Nullable String category) {
      if (category != null && !category.isBlank()) {
        this.categories.add(category);
      }
      return this;
    }

    public Builder dateCandidate(@Nullable String date) {
      if (date != null && !date.isBlank()) {
        this.dateCandidates.add(date);
      }
      return this;
    }

    public RawItem build() {
      return new RawItem(
          title,
          link,
          contentSnippet,
          description,
          content,
          summary,
          contentEncoded,
          mediaDescription,
          author,
          categories,
          dateCandidates);
    }
  }
}
