package dev.distroblog.feed;

import static org.assertj.core.api.Assertions.assertThat;

import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class FeedValidatorTest {

    private final FeedValidator validator = new FeedValidator();

    @Nested
    class XmlSniffing {

        @ParameterizedTest
        @ValueSource(strings = {
                "<?xml version=\"1.0\"?><rss version=\"2.0\"><channel></channel></rss>",
                "<rss version=\"2.0\"><channel><title>x</title></channel></rss>",
                "<feed xmlns=\"http://www.w3.org/2005/Atom\"></feed>",
                "<rdf:RDF xmlns:rdf=\"http://www.w3.org/1999/02/22-rdf-syntax-ns#\"></rdf:RDF>"
        })
        void accepts_feed_markup(String body) {
            assertThat(validator.isValidFeed(body)).isTrue();
        }

        @Test
        void rejects_html_even_with_feed_words() {
            String html = "<!DOCTYPE html><html><head><link rel=\"alternate\" href=\"/feed\"></head>"
                    + "<body><p>Subscribe to our <rss> feed</p></body></html>";

            assertThat(validator.isValidFeed(html)).isFalse();
        }

        @Test
        void rejects_empty_bodies() {
            assertThat(validator.isValidFeed("   ")).isFalse();
            assertThat(validator.isValidFeed(new byte[0])).isFalse();
        }

        @Test
        void html_marker_beyond_sniff_window_is_ignored() {
            String body = "<rss version=\"2.0\">" + "x".repeat(FeedValidator.SNIFF_LENGTH) + "<html>";

            assertThat(validator.isValidFeed(body.getBytes(StandardCharsets.UTF_8))).isTrue();
        }
    }

    @Nested
    class JsonFeed {

        @Test
        void accepts_version_and_items() {
            String body = "{\"version\":\"https://jsonfeed.org/version/1.1\",\"title\":\"T\",\"items\":[]}";

            assertThat(validator.isValidFeed(body)).isTrue();
        }

        @Test
        void accepts_singular_item_field() {
            assertThat(validator.isValidFeed("{\"item\":[{\"id\":\"1\"}],\"version\":\"1\"}")).isTrue();
        }

        @Test
        void rejects_json_without_version() {
            assertThat(validator.isValidFeed("{\"items\":[{\"id\":\"1\"}]}")).isFalse();
        }

        @Test
        void rejects_arbitrary_json_and_garbage() {
            assertThat(validator.isValidFeed("{\"status\":\"ok\",\"data\":{\"version\":1}}")).isFalse();
            assertThat(validator.isValidFeed("{not json")).isFalse();
            assertThat(validator.isValidFeed("plain text")).isFalse();
        }
    }

    @Test
    void loose_markup_check_finds_item_tags() {
        assertThat(validator.looksLikeFeedMarkup("<channel><item><title>AT&T</title></item>")).isTrue();
        assertThat(validator.looksLikeFeedMarkup("<div>nothing</div>")).isFalse();
    }
}
