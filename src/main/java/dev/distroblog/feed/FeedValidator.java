package dev.distroblog.feed;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Locale;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import org.springframework.stereotype.Component;

/**
 * Classifies a response body as a feed by content sniffing only. Many servers label feeds as
 * {@code text/plain} or {@code text/html}, so the transport content type is never consulted here.
 */
@Component
public class FeedValidator {

    static final int SNIFF_LENGTH = 4096;

    private static final List<String> HTML_MARKERS = List.of("<html", "<!doctype html");

    private static final List<String> FEED_MARKERS = List.of("<rss", "<feed", "<rdf:rdf", "<channel", "<?xml");

    private static final List<String> FEED_TAGS = List.of("<rss", "<feed", "<channel", "<item", "<entry", "<?xml");

    private final JsonFactory jsonFactory = new JsonFactory();

    public boolean isValidFeed(byte[] body) {
        if (body == null || body.length == 0) {
            return false;
        }
        return isValidFeed(new String(body, StandardCharsets.UTF_8));
    }

    /**
     * Sniffs the first {@value #SNIFF_LENGTH} characters: HTML markers reject, XML feed markers
     * accept. Anything else is accepted only as a JSON Feed document (top-level {@code version}
     * plus {@code items} or {@code item}).
     */
    public boolean isValidFeed(String body) {
        if (body == null || body.isBlank()) {
            return false;
        }
        String sniff = body.substring(0, Math.min(body.length(), SNIFF_LENGTH)).toLowerCase(Locale.ROOT);
        if (HTML_MARKERS.stream().anyMatch(sniff::contains)) {
            return false;
        }
        if (FEED_MARKERS.stream().anyMatch(sniff::contains)) {
            return true;
        }
        return isJsonFeed(body);
    }

    /** Loose check used when an XML parser rejected the document: does it still carry feed tags? */
    public boolean looksLikeFeedMarkup(String body) {
        if (body == null) {
            return false;
        }
        String lower = body.toLowerCase(Locale.ROOT);
        return FEED_TAGS.stream().anyMatch(lower::contains);
    }

    /** Streams the top-level object looking for {@code version} and {@code items}/{@code item}. */
    boolean isJsonFeed(String body) {
        String trimmed = body.stripLeading();
        if (!trimmed.startsWith("{")) {
            return false;
        }
        boolean hasVersion = false;
        boolean hasItems = false;
        try (JsonParser parser = jsonFactory.createParser(trimmed)) {
            if (parser.nextToken() != JsonToken.START_OBJECT) {
                return false;
            }
            while (parser.nextToken() == JsonToken.FIELD_NAME) {
                String field = parser.currentName();
                JsonToken value = parser.nextToken();
                if ("version".equals(field) && value != JsonToken.VALUE_NULL) {
                    hasVersion = true;
                } else if (("items".equals(field) || "item".equals(field)) && value != JsonToken.VALUE_NULL) {
                    hasItems = true;
                }
                if (hasVersion && hasItems) {
                    return true;
                }
                parser.skipChildren();
            }
        } catch (IOException e) {
            return false;
        }
        return false;
    }
}
