package dev.distroblog.ingestion;

import dev.distroblog.fixture.RecordingSleeper;
import dev.distroblog.fixture.SourceBuilder;
import dev.distroblog.source.MonitoringType;
import dev.distroblog.source.Source;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ResourceGovernorTest {

    private static final long MB = 1024L * 1024L;

    @Mock
    MemorySampler memorySampler;

    private final IngestionProperties properties = new IngestionProperties();
    private final RecordingSleeper sleeper = new RecordingSleeper();
    private ResourceGovernor governor;

    @BeforeEach
    void setUp() {
        properties.setGcAfterBrowser(false);
        governor = new ResourceGovernor(memorySampler, properties, sleeper);
    }

    private void residentMb(long mb) {
        when(memorySampler.sample()).thenReturn(new MemorySample(mb * MB, Instant.EPOCH));
    }

    private static Source scraping(String name, String url) {
        return new SourceBuilder().name(name).url(url).type(MonitoringType.SCRAPING).build();
    }

    // --- Memory gate ---

    @Test
    void rssSourcesAreAlwaysAllowedWithoutSampling() {
        Source rss = new SourceBuilder().type(MonitoringType.RSS).build();

        assertThat(governor.shouldAttemptScraping(rss)).isTrue();
        verifyNoInteractions(memorySampler);
    }

    @Test
    void scrapingSourceIsAllowedBelowHardLimit() {
        residentMb(300);

        assertThat(governor.shouldAttemptScraping(scraping("Distro", "https://distro.org/news"))).isTrue();
    }

    @Test
    void scrapingSourceIsSkippedAboveHardLimit() {
        residentMb(451);

        assertThat(governor.shouldAttemptScraping(scraping("Distro", "https://distro.org/news"))).isFalse();
    }

    @Test
    void hardLimitCheckReadsCurrentSample() {
        residentMb(500);

        assertThat(governor.isAboveHardLimit()).isTrue();
    }

    // --- Skip list ---

    @Test
    void skipListMatchesNameCaseInsensitively() {
        properties.setSkipList(List.of("  heavy SITE "));

        assertThat(governor.shouldAttemptScraping(scraping("Heavy Site", "https://heavy.example.com"))).isFalse();
        verifyNoInteractions(memorySampler);
    }

    @Test
    void skipListMatchesUrlFragment() {
        properties.setSkipList(List.of("heavy.example.com"));

        assertThat(governor.isSkipListed(scraping("Other", "https://HEAVY.example.com/blog"))).isTrue();
        assertThat(governor.isSkipListed(scraping("Other", "https://light.example.com/blog"))).isFalse();
    }

    @Test
    void skipListIgnoresBlankEntriesAndRssSources() {
        properties.setSkipList(List.of("", "   ", "feeds.example.com"));

        Source rss = new SourceBuilder().url("https://feeds.example.com/rss").type(MonitoringType.RSS).build();

        assertThat(governor.shouldAttemptScraping(rss)).isTrue();
        assertThat(governor.isSkipListed(scraping("Other", "https://else.example.com"))).isFalse();
    }

    @Test
    void skipReasonNamesTheSkipList() {
        properties.setSkipList(List.of("heavy.example.com"));

        assertThat(governor.skipReason(scraping("Heavy", "https://heavy.example.com")))
                .contains(SourceResult.SKIP_LISTED);
        verifyNoInteractions(memorySampler);
    }

    @Test
    void skipReasonNamesTheMemoryLimit() {
        residentMb(451);

        assertThat(governor.skipReason(scraping("Distro", "https://distro.org/news")))
                .contains(SourceResult.MEMORY_LIMIT);
    }

    @Test
    void skipReasonIsEmptyWhenAllowed() {
        residentMb(300);

        assertThat(governor.skipReason(scraping("Distro", "https://distro.org/news"))).isEmpty();
    }

    // --- Pacing ---

    @Test
    void preScrapeDelayWaitsOnlyAboveSoftLimit() {
        residentMb(350);
        governor.preScrapeDelay();
        assertThat(sleeper.sleeps()).isEmpty();

        residentMb(420);
        governor.preScrapeDelay();
        assertThat(sleeper.sleeps()).containsExactly(2_000L);
    }

    @Test
    void afterBrowserUseCoolsDown() {
        properties.setBrowserCooldownMs(750);

        governor.afterBrowserUse();

        assertThat(sleeper.sleeps()).containsExactly(750L);
    }

    @Test
    void zeroCooldownDoesNotSleep() {
        properties.setBrowserCooldownMs(0);

        governor.afterBrowserUse();

        assertThat(sleeper.sleeps()).isEmpty();
    }
}
