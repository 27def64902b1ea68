package dev.distroblog.extract;

import java.time.Instant;
import org.jspecify.annotations.Nullable;

/**
 * A feed or scraped item after title, content, date and description heuristics.
 *
 * @param preview     teaser built from description, snippet or content, at most 200 characters
 * @param description publisher-supplied description, at most 300 characters
 */
public record ExtractedArticle(
    String link,
    String title,
    String content,
    String preview,
    @Nullable Instant pubDate,
    @Nullable String author,
    @Nullable String description) {}
