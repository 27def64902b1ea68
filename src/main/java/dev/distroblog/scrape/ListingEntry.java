package dev.distroblog.scrape;

import dev.distroblog.extract.RawItem;
import org.jspecify.annotations.Nullable;

/** One entry found on a listing page, before link resolution and sorting. */
record ListingEntry(String title, String href, @Nullable String excerpt, @Nullable String date) {

  RawItem toRawItem(String link) {
    return RawItem.builder()
        .title(title)
        .link(link)
        .description(excerpt)
        .contentSnippet(excerpt)
        .dateCandidate(date)
        .build();
  }
}
