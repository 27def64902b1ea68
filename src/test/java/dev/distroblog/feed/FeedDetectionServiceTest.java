package dev.distroblog.feed;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import dev.distroblog.fetch.FetchException;
import java.net.ConnectException;
import java.net.UnknownHostException;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class FeedDetectionServiceTest {

    private static final String SITE = "https://blog.example.com";
    private static final String FEED = "https://blog.example.com/feed";

    @Mock
    private FeedDiscoveryEngine engine;

    private FeedDetectionService service;

    @BeforeEach
    void setUp() {
        service = new FeedDetectionService(engine);
    }

    private void found() {
        when(engine.discover(SITE)).thenReturn(new FeedDiscoveryEngine.DiscoveryOutcome(Optional.of(FEED), null));
    }

    private void notFound(FetchException siteFailure) {
        when(engine.discover(SITE))
                .thenReturn(new FeedDiscoveryEngine.DiscoveryOutcome(Optional.empty(), siteFailure));
    }

    @Test
    void valid_feed() {
        found();
        when(engine.probeFeed(FEED)).thenReturn(new FeedProbeResult(true, 200, "application/rss+xml", null));

        FeedDetectionResult result = service.detect(SITE);

        assertThat(result.status()).isEqualTo(DetectionStatus.VALID);
        assertThat(result.url()).isEqualTo(FEED);
        assertThat(result.type()).isEqualTo("RSS");
        assertThat(result.error()).isNull();
    }

    @Test
    void recheck_rate_limited() {
        found();
        when(engine.probeFeed(FEED)).thenReturn(new FeedProbeResult(false, 429, null, "HTTP 429"));

        assertThat(service.detect(SITE).status()).isEqualTo(DetectionStatus.RATE_LIMITED);
    }

    @Test
    void recheck_server_error() {
        found();
        when(engine.probeFeed(FEED)).thenReturn(new FeedProbeResult(false, 502, null, "HTTP 502"));

        assertThat(service.detect(SITE).status()).isEqualTo(DetectionStatus.SERVER_ERROR);
    }

    @Test
    void recheck_invalid_content() {
        found();
        when(engine.probeFeed(FEED))
                .thenReturn(new FeedProbeResult(false, 200, "application/xml", "Invalid feed content"));

        FeedDetectionResult result = service.detect(SITE);

        assertThat(result.status()).isEqualTo(DetectionStatus.INVALID);
        assertThat(result.url()).isEqualTo(FEED);
    }

    @Test
    void nothing_found() {
        notFound(null);

        FeedDetectionResult result = service.detect(SITE);

        assertThat(result.status()).isEqualTo(DetectionStatus.NOT_FOUND);
        assertThat(result.url()).isEqualTo(SITE);
        verify(engine, never()).probeFeed(FEED);
    }

    @Test
    void unknown_host_is_network_error() {
        notFound(FetchException.network(SITE, new UnknownHostException("blog.example.com")));

        assertThat(service.detect(SITE).status()).isEqualTo(DetectionStatus.NETWORK_ERROR);
    }

    @Test
    void refused_connection_is_connection_error() {
        notFound(FetchException.network(SITE, new RuntimeException(new ConnectException("refused"))));

        assertThat(service.detect(SITE).status()).isEqualTo(DetectionStatus.CONNECTION_ERROR);
    }

    @Test
    void http_failure_of_site_page_is_not_found() {
        notFound(FetchException.httpStatus(SITE, 403));

        assertThat(service.detect(SITE).status()).isEqualTo(DetectionStatus.NOT_FOUND);
    }

    @Test
    void unexpected_failure_is_error() {
        when(engine.discover(SITE)).thenThrow(new IllegalStateException("boom"));

        FeedDetectionResult result = service.detect(SITE);

        assertThat(result.status()).isEqualTo(DetectionStatus.ERROR);
        assertThat(result.error()).contains("direct RSS URL");
    }

    @Test
    void status_serializes_lowercase() {
        assertThat(DetectionStatus.RATE_LIMITED.wireName()).isEqualTo("rate_limited");
    }
}
