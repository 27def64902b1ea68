package dev.distroblog.ingestion;

import dev.distroblog.BaseIntegrationTest;
import dev.distroblog.fetch.FetchException;
import dev.distroblog.fetch.FetchResponse;
import dev.distroblog.fetch.RateLimitedFetcher;
import dev.distroblog.source.MonitoringType;
import dev.distroblog.source.Source;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.mock.mockito.MockBean;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.doReturn;

class IngestionPassIT extends BaseIntegrationTest {

    private static final String FEED_URL = "https://distro.example.org/feed.xml";

    private static final String FEED = """
            <?xml version="1.0" encoding="UTF-8"?>
            <rss version="2.0"><channel>
              <title>Distro News</title>
              <link>https://distro.example.org/</link>
              <item>
                <title>Release 4.2 is out</title>
                <link>https://distro.example.org/news/release-4-2</link>
                <pubDate>Mon, 02 Jun 2025 10:00:00 GMT</pubDate>
                <description>The 4.2 release brings a new installer and a refreshed desktop.</description>
              </item>
              <item>
                <title>Mirror network expanded</title>
                <link>https://distro.example.org/news/mirrors</link>
                <pubDate>Sun, 01 Jun 2025 08:00:00 GMT</pubDate>
                <description>Twelve new mirrors joined the network across three continents.</description>
              </item>
            </channel></rss>
            """;

    @MockBean
    RateLimitedFetcher fetcher;

    @Autowired
    IngestionScheduler scheduler;

    @BeforeEach
    void serveFeed() {
        doAnswer(inv -> {
            throw FetchException.httpStatus(inv.getArgument(0), 404);
        }).when(fetcher).get(anyString(), any(Duration.class));
        doAnswer(inv -> {
            throw FetchException.httpStatus(inv.getArgument(0), 404);
        }).when(fetcher).get(anyString());
        serve(FEED);
    }

    private void serve(String feed) {
        doReturn(new FetchResponse(FEED_URL, 200, "application/rss+xml", feed.getBytes(StandardCharsets.UTF_8)))
                .when(fetcher).get(eq(FEED_URL), any(Duration.class));
    }

    private static int newArticles(List<SourceResult> results) {
        return results.stream().mapToInt(SourceResult::newArticles).sum();
    }

    @Test
    void secondPassOverUnchangedSourcesInsertsNothing() {
        sourceRepository.saveAndFlush(new Source(FEED_URL, "Distro News", MonitoringType.RSS));

        List<SourceResult> first = scheduler.triggerManualPass();
        List<SourceResult> second = scheduler.triggerManualPass();

        assertThat(newArticles(first)).isEqualTo(2);
        assertThat(newArticles(second)).isZero();
        assertThat(second).allSatisfy(result -> assertThat(result.success()).isTrue());
        assertThat(articleRepository.count()).isEqualTo(2);
    }

    @Test
    void onlyItemsPublishedSinceThePreviousPassAreInserted() {
        sourceRepository.saveAndFlush(new Source(FEED_URL, "Distro News", MonitoringType.RSS));
        scheduler.triggerManualPass();

        String advisory = """
                <item>
                  <title>Security advisory for the kernel package</title>
                  <link>https://distro.example.org/news/advisory</link>
                  <pubDate>Tue, 03 Jun 2025 09:00:00 GMT</pubDate>
                  <description>Update the kernel package to pick up fixes for two local issues.</description>
                </item>
                """;
        int firstItem = FEED.indexOf("<item>");
        String updated = FEED.substring(0, firstItem) + advisory + FEED.substring(firstItem);
        serve(updated);

        assertThat(newArticles(scheduler.runIngestionPass(true))).isEqualTo(1);
        assertThat(articleRepository.count()).isEqualTo(3);
        assertThat(newArticles(scheduler.runIngestionPass(true))).isZero();
    }
}
