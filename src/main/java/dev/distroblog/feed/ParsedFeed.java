package dev.distroblog.feed;

import dev.distroblog.extract.RawItem;
import java.util.List;
import org.jspecify.annotations.Nullable;

/** A feed document mapped to canonical items, in document order. */
public record ParsedFeed(String url, @Nullable String title, FeedFormat format, List<RawItem> items) {
  public ParsedFeed {
    items = items == null ? List.of() : List.copyOf(items);
  }
}
