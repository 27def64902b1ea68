package dev.distroblog.extract;

import java.time.Instant;
import org.jspecify.annotations.Nullable;

/**
 * What an article page says about itself.
 *
 * @param title null for error pages and pages without a usable title
 */
public record PageMetadata(
    String url,
    @Nullable String title,
    String content,
    @Nullable Instant pubDate,
    @Nullable String description,
    @Nullable String sourceName) {}
