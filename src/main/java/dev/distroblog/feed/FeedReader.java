package dev.distroblog.feed;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Date;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.rometools.rome.feed.synd.SyndCategory;
import com.rometools.rome.feed.synd.SyndContent;
import com.rometools.rome.feed.synd.SyndEntry;
import com.rometools.rome.feed.synd.SyndFeed;
import com.rometools.rome.feed.synd.SyndPerson;
import com.rometools.rome.io.FeedException;
import com.rometools.rome.io.SyndFeedInput;
import com.rometools.rome.io.XmlReader;
import dev.distroblog.extract.RawItem;
import dev.distroblog.fetch.FetchException;
import dev.distroblog.fetch.FetchResponse;
import dev.distroblog.fetch.RateLimitedFetcher;
import org.jdom2.Element;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.parser.Parser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Reads RSS, RDF, Atom and JSON Feed documents into {@link RawItem}s.
 *
 * <p>XML goes through ROME first. When ROME rejects a document on a cosmetic error (unescaped
 * ampersand, unterminated tag, stray XML declaration) and the body still carries feed tags, the
 * document is re-read with jsoup's lenient XML parser instead of being dropped.
 *
 * <p>ROME drops date elements it cannot parse, so the raw text of each entry's date elements is
 * kept as further candidates after ROME's own dates.
 */
@Component
public class FeedReader {

    private static final Logger log = LoggerFactory.getLogger(FeedReader.class);

    /** Lowercased fragments of parser messages that indicate a recoverable XML defect. */
    static final List<String> COSMETIC_XML_ERRORS = List.of(
            "invalid character in entity name",
            "malformed",
            "unexpected end of file",
            "unclosed token",
            "invalid character reference",
            "unescaped &",
            "xml declaration allowed only at the start",
            "entity name must immediately follow",
            "must end with the ';' delimiter",
            "must start and end within the same entity",
            "must be terminated by the matching end-tag",
            "processing instruction target matching",
            "is an invalid xml character",
            "was referenced, but not declared"
    );

    /** Lowercased tag names of entry children whose text may hold a publication date. */
    static final Set<String> RAW_DATE_TAGS = Set.of(
            "pubdate", "dc:date", "published", "updated", "atom:published", "atom:updated", "date");

    private final RateLimitedFetcher fetcher;
    private final FeedValidator feedValidator;
    private final FeedProperties properties;
    private final ObjectMapper objectMapper;

    public FeedReader(RateLimitedFetcher fetcher, FeedValidator feedValidator,
                      FeedProperties properties, ObjectMapper objectMapper) {
        this.fetcher = fetcher;
        this.feedValidator = feedValidator;
        this.properties = properties;
        this.objectMapper = objectMapper;
    }

    /**
     * Fetch and parse a feed.
     *
     * @throws FetchException      when the feed cannot be downloaded
     * @throws FeedParseException  when the body is not a readable feed
     */
    public ParsedFeed fetch(String feedUrl) {
        FetchResponse response = fetcher.get(feedUrl, Duration.ofMillis(properties.probeTimeoutMs()));
        return read(feedUrl, response.body());
    }

    /**
     * True when the URL serves something this reader accepts, including XML with cosmetic defects.
     * Network and HTTP failures count as invalid.
     */
    public boolean validateFeed(String feedUrl) {
        FetchResponse response;
        try {
            response = fetcher.get(feedUrl, Duration.ofMillis(properties.probeTimeoutMs()));
        } catch (FetchException e) {
            log.info("Feed validation failed for {}: {}", feedUrl, e.getMessage());
            return false;
        }
        String text = response.text();
        if (looksLikeJson(text)) {
            try {
                readJsonFeed(feedUrl, text);
                return true;
            } catch (FeedParseException e) {
                log.info("Invalid JSON feed at {}: {}", feedUrl, e.getMessage());
                return false;
            }
        }
        try {
            readXml(feedUrl, response.body());
            return true;
        } catch (FeedParseException e) {
            if (e.isCosmetic() && feedValidator.looksLikeFeedMarkup(text)) {
                log.info("Accepting feed at {} despite XML defect: {}", feedUrl, e.getMessage());
                return true;
            }
            log.info("Invalid feed at {}: {}", feedUrl, e.getMessage());
            return false;
        }
    }

    /** Parse an already downloaded body. */
    public ParsedFeed read(String feedUrl, byte[] body) {
        String text = new String(body, StandardCharsets.UTF_8);
        if (looksLikeJson(text)) {
            return readJsonFeed(feedUrl, text);
        }
        try {
            return readXml(feedUrl, body);
        } catch (FeedParseException e) {
            if (e.isCosmetic() && feedValidator.looksLikeFeedMarkup(text)) {
                log.info("Reading {} leniently after XML defect: {}", feedUrl, e.getMessage());
                return readLenient(feedUrl, text);
            }
            throw e;
        }
    }

    static boolean isCosmeticXmlError(String message) {
        if (message == null) {
            return false;
        }
        String lower = message.toLowerCase(Locale.ROOT);
        return COSMETIC_XML_ERRORS.stream().anyMatch(lower::contains);
    }

    private static boolean looksLikeJson(String text) {
        return text.stripLeading().startsWith("{");
    }

    private ParsedFeed readXml(String feedUrl, byte[] body) {
        try (XmlReader reader = new XmlReader(new ByteArrayInputStream(body))) {
            SyndFeed feed = new SyndFeedInput().build(reader);
            FeedFormat format = formatOf(feed.getFeedType());
            List<SyndEntry> entries = feed.getEntries();
            List<List<String>> rawDates = rawEntryDates(body);
            boolean aligned = rawDates.size() == entries.size();
            List<RawItem> items = new ArrayList<>();
            for (int i = 0; i < entries.size(); i++) {
                items.add(toRawItem(entries.get(i), format, aligned ? rawDates.get(i) : List.of()));
            }
            return new ParsedFeed(feedUrl, feed.getTitle(), format, items);
        } catch (FeedException | IllegalArgumentException e) {
            String message = rootMessage(e);
            throw new FeedParseException(message, isCosmeticXmlError(message), e);
        } catch (IOException e) {
            throw new FeedParseException("Cannot read feed body: " + e.getMessage(), false, e);
        }
    }

    private static FeedFormat formatOf(String feedType) {
        if (feedType == null) {
            return FeedFormat.RSS;
        }
        if (feedType.startsWith("atom")) {
            return FeedFormat.ATOM;
        }
        if ("rss_1.0".equals(feedType) || "rss_0.90".equals(feedType)) {
            return FeedFormat.RDF;
        }
        return FeedFormat.RSS;
    }

    /**
     * Raw text of the date elements of every item or entry, in document order. Entries line up with
     * ROME's list only when both see the same number of them.
     */
    static List<List<String>> rawEntryDates(byte[] body) {
        Document doc = Jsoup.parse(new String(body, StandardCharsets.UTF_8), "", Parser.xmlParser());
        List<List<String>> dates = new ArrayList<>();
        for (org.jsoup.nodes.Element node : doc.select("item, entry")) {
            List<String> values = new ArrayList<>();
            for (org.jsoup.nodes.Element child : node.children()) {
                if (RAW_DATE_TAGS.contains(child.tagName().toLowerCase(Locale.ROOT)) && !child.text().isBlank()) {
                    values.add(child.text().trim());
                }
            }
            dates.add(values);
        }
        return dates;
    }

    private RawItem toRawItem(SyndEntry entry, FeedFormat format, List<String> rawDates) {
        String description = valueOf(entry.getDescription());
        String encoded = entry.getContents().isEmpty() ? null : valueOf(entry.getContents().get(0));
        String content = encoded != null ? encoded : description;

        RawItem.Builder builder = RawItem.builder()
                .title(entry.getTitle())
                .link(linkOf(entry))
                .description(description)
                .contentEncoded(encoded)
                .content(content)
                .contentSnippet(content == null ? null : Jsoup.parse(content).text())
                .summary(format == FeedFormat.ATOM ? description : null)
                .mediaDescription(mediaDescription(entry.getForeignMarkup()))
                .author(authorOf(entry));
        Set<String> dates = new LinkedHashSet<>();
        addIfPresent(dates, isoString(entry.getPublishedDate()));
        addIfPresent(dates, isoString(entry.getUpdatedDate()));
        rawDates.forEach(date -> addIfPresent(dates, date));
        dates.forEach(builder::dateCandidate);
        for (SyndCategory category : entry.getCategories()) {
            builder.category(category.getName());
        }
        return builder.build();
    }

    private static void addIfPresent(Set<String> dates, String date) {
        if (date != null) {
            dates.add(date);
        }
    }

    private static String linkOf(SyndEntry entry) {
        if (entry.getLink() != null && !entry.getLink().isBlank()) {
            return entry.getLink().trim();
        }
        String uri = entry.getUri();
        return uri != null && uri.startsWith("http") ? uri : null;
    }

    private static String authorOf(SyndEntry entry) {
        if (entry.getAuthor() != null && !entry.getAuthor().isBlank()) {
            return entry.getAuthor();
        }
        for (SyndPerson person : entry.getAuthors()) {
            if (person.getName() != null && !person.getName().isBlank()) {
                return person.getName();
            }
        }
        return null;
    }

    /** ROME core has no Media RSS module, so {@code media:description} lands in foreign markup. */
    private static String mediaDescription(List<Element> foreignMarkup) {
        for (Element element : foreignMarkup) {
            if ("media".equals(element.getNamespacePrefix())) {
                if ("description".equals(element.getName())) {
                    return element.getTextTrim();
                }
                for (Element child : element.getChildren()) {
                    if ("description".equals(child.getName())) {
                        return child.getTextTrim();
                    }
                }
            }
        }
        return null;
    }

    private ParsedFeed readJsonFeed(String feedUrl, String text) {
        JsonNode root;
        try {
            root = objectMapper.readTree(text);
        } catch (JsonProcessingException e) {
            throw new FeedParseException("Invalid JSON feed: " + e.getOriginalMessage(), false, e);
        }
        JsonNode items = root.has("items") ? root.get("items") : root.get("item");
        if (!root.hasNonNull("version") || items == null || !items.isArray()) {
            throw new FeedParseException("JSON document is not a JSON Feed", false, null);
        }
        List<RawItem> rawItems = new ArrayList<>();
        for (JsonNode item : items) {
            rawItems.add(jsonItem(item));
        }
        return new ParsedFeed(feedUrl, text(root, "title"), FeedFormat.JSON_FEED, rawItems);
    }

    private static RawItem jsonItem(JsonNode item) {
        String contentHtml = text(item, "content_html");
        String contentText = text(item, "content_text");
        String summary = text(item, "summary");
        String link = text(item, "url");
        if (link == null) {
            link = text(item, "id");
        }
        String author = null;
        JsonNode authors = item.get("authors");
        if (authors != null && authors.isArray() && !authors.isEmpty()) {
            author = text(authors.get(0), "name");
        } else if (item.has("author")) {
            author = text(item.get("author"), "name");
        }
        RawItem.Builder builder = RawItem.builder()
                .title(text(item, "title"))
                .link(link)
                .content(firstNonNull(contentHtml, contentText, summary))
                .contentSnippet(firstNonNull(contentText, summary))
                .description(firstNonNull(summary, contentText))
                .summary(summary)
                .author(author)
                .dateCandidate(text(item, "date_published"))
                .dateCandidate(text(item, "date_modified"));
        JsonNode tags = item.get("tags");
        if (tags != null && tags.isArray()) {
            tags.forEach(tag -> builder.category(tag.asText()));
        }
        return builder.build();
    }

    private ParsedFeed readLenient(String feedUrl, String text) {
        Document doc = Jsoup.parse(text, feedUrl, Parser.xmlParser());
        List<RawItem> items = new ArrayList<>();
        for (org.jsoup.nodes.Element node : doc.select("item, entry")) {
            String description = childText(node, "description", "summary");
            String encoded = childText(node, "content|encoded", "content");
            String content = encoded != null ? encoded : description;
            items.add(RawItem.builder()
                    .title(childText(node, "title"))
                    .link(lenientLink(node))
                    .description(description)
                    .contentEncoded(encoded)
                    .content(content)
                    .contentSnippet(content == null ? null : Jsoup.parse(content).text())
                    .author(childText(node, "author > name", "dc|creator", "author"))
                    .dateCandidate(childText(node, "pubDate"))
                    .dateCandidate(childText(node, "date"))
                    .dateCandidate(childText(node, "published"))
                    .dateCandidate(childText(node, "dc|date"))
                    .dateCandidate(childText(node, "atom|published"))
                    .dateCandidate(childText(node, "updated"))
                    .build());
        }
        String title = doc.selectFirst("channel > title, feed > title") != null
                ? doc.selectFirst("channel > title, feed > title").text()
                : null;
        return new ParsedFeed(feedUrl, title, FeedFormat.LENIENT_XML, items);
    }

    private static String lenientLink(org.jsoup.nodes.Element node) {
        org.jsoup.nodes.Element link = node.selectFirst("link");
        if (link == null) {
            return null;
        }
        if (link.hasAttr("href")) {
            return link.attr("href").trim();
        }
        String text = link.text().trim();
        return text.isEmpty() ? null : text;
    }

    private static String childText(org.jsoup.nodes.Element node, String... selectors) {
        for (String selector : selectors) {
            org.jsoup.nodes.Element child = node.selectFirst(selector);
            if (child != null && !child.text().isBlank()) {
                return child.text().trim();
            }
        }
        return null;
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node == null ? null : node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        String text = value.asText();
        return text.isBlank() ? null : text;
    }

    private static String valueOf(SyndContent content) {
        return content == null ? null : content.getValue();
    }

    private static String isoString(Date date) {
        return date == null ? null : date.toInstant().toString();
    }

    @SafeVarargs
    private static <T> T firstNonNull(T... values) {
        for (T value : values) {
            if (value != null) {
                return value;
            }
        }
        return null;
    }

    private static String rootMessage(Throwable e) {
        Throwable current = e;
        StringBuilder messages = new StringBuilder();
        while (current != null) {
            if (current.getMessage() != null) {
                if (messages.length() > 0) {
                    messages.append(" / ");
                }
                messages.append(current.getMessage());
            }
            current = current.getCause() == current ? null : current.getCause();
        }
        return messages.toString();
    }
}
