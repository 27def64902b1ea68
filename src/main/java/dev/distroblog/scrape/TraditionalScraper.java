package dev.distroblog.scrape;

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.distroblog.browser.BrowserSessions;
import dev.distroblog.extract.DateExtractor;
import dev.distroblog.extract.RawItem;
import dev.distroblog.fetch.FetchException;
import dev.distroblog.fetch.FetchResponse;
import dev.distroblog.fetch.RateLimitedFetcher;
import dev.distroblog.fetch.UrlNormalizer;
import dev.distroblog.source.Source;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Scrapes the listing page of a site that has no usable feed. The page is rendered with the
 * headless browser when available and fetched statically otherwise.
 */
@Service
public class TraditionalScraper {

  private static final Logger log = LoggerFactory.getLogger(TraditionalScraper.class);

  private final RateLimitedFetcher fetcher;
  private final BrowserSessions browserSessions;
  private final DateExtractor dateExtractor;
  private final ObjectMapper objectMapper;
  private final ScrapeProperties properties;
  private final PageFingerprints fingerprints;

  public TraditionalScraper(
      RateLimitedFetcher fetcher,
      BrowserSessions browserSessions,
      DateExtractor dateExtractor,
      ObjectMapper objectMapper,
      ScrapeProperties properties,
      Clock clock) {
    this.fetcher = fetcher;
    this.browserSessions = browserSessions;
    this.dateExtractor = dateExtractor;
    this.objectMapper = objectMapper;
    this.properties = properties;
    this.fingerprints = new PageFingerprints(clock, properties.fingerprintTtl());
  }

  /**
   * Entries of the source's listing page, newest first, at most {@code maxItems}. When the page is
   * unchanged since the last visit only entries with unseen links are returned.
   *
   * @throws FetchException when neither the browser nor the static fetch produced a page
   */
  public List<RawItem> scrape(Source source) {
    String listingUrl = findBlogSection(source.getUrl());
    String html = loadPage(listingUrl);
    Document doc = Jsoup.parse(html, listingUrl);

    List<RawItem> items = resolveAndSort(listingUrl, ListingExtractor.extract(doc, objectMapper));
    log.info("Scraped {} entries from {}", items.size(), listingUrl);

    fingerprints.evictExpired();
    List<String> links = items.stream().map(RawItem::link).toList();
    List<String> titles = items.stream().map(RawItem::title).toList();
    Set<String> fresh = Set.copyOf(fingerprints.newLinks(source.getId(), html, titles, links));
    if (fresh.size() < items.size()) {
      log.debug("Listing {} unchanged, {} unseen entries", listingUrl, fresh.size());
    }
    return items.stream().filter(item -> fresh.contains(item.link())).toList();
  }

  /** First section path answering 200 to HEAD, or the site URL itself. */
  String findBlogSection(String siteUrl) {
    String base = siteUrl.endsWith("/") ? siteUrl.substring(0, siteUrl.length() - 1) : siteUrl;
    for (String path : properties.sectionPaths()) {
      String candidate = base + path;
      try {
        if (fetcher.head(candidate).status() == 200) {
          return candidate;
        }
      } catch (FetchException e) {
        log.trace("No blog section at {}: {}", candidate, e.getMessage());
      }
    }
    return siteUrl;
  }

  private String loadPage(String url) {
    return browserSessions.render(url).orElseGet(() -> {
      FetchResponse response = fetcher.get(url);
      return response.text();
    });
  }

  /**
   * Resolves links, drops duplicates, sorts dated entries newest first while undated entries keep
   * their positions, then caps the list.
   */
  List<RawItem> resolveAndSort(String pageUrl, List<ListingEntry> entries) {
    Map<String, RawItem> byLink = new LinkedHashMap<>();
    for (ListingEntry entry : entries) {
      String link = UrlNormalizer.resolve(pageUrl, entry.href());
      if (link != null && !byLink.containsKey(link)) {
        byLink.put(link, entry.toRawItem(link));
      }
    }
    List<RawItem> items = new ArrayList<>(byLink.values());

    List<Integer> datedSlots = new ArrayList<>();
    List<DatedItem> dated = new ArrayList<>();
    for (int i = 0; i < items.size(); i++) {
      Instant date = dateExtractor.fromCandidates(items.get(i).dateCandidates());
      if (date != null) {
        datedSlots.add(i);
        dated.add(new DatedItem(items.get(i), date));
      }
    }
    dated.sort(Comparator.comparing(DatedItem::date).reversed());
    for (int i = 0; i < datedSlots.size(); i++) {
      items.set(datedSlots.get(i), dated.get(i).item());
    }
    return List.copyOf(items.size() > properties.maxItems() ? items.subList(0, properties.maxItems()) : items);
  }

  private record DatedItem(RawItem item, Instant date) {}
}
