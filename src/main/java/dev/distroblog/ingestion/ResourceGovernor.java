package dev.distroblog.ingestion;

import java.util.Locale;
import java.util.Optional;

import dev.distroblog.source.Source;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.retry.backoff.Sleeper;
import org.springframework.stereotype.Component;

/**
 * Decides whether browser-backed work may start and paces it. RSS sources never need the browser
 * and are always allowed.
 */
@Component
public class ResourceGovernor {

    private static final Logger log = LoggerFactory.getLogger(ResourceGovernor.class);

    private static final long MB = 1024L * 1024L;

    private final MemorySampler memorySampler;
    private final IngestionProperties properties;
    private final Sleeper sleeper;

    public ResourceGovernor(MemorySampler memorySampler, IngestionProperties properties, Sleeper sleeper) {
        this.memorySampler = memorySampler;
        this.properties = properties;
        this.sleeper = sleeper;
    }

    public boolean shouldAttemptScraping(Source source) {
        return skipReason(source).isEmpty();
    }

    /** Why the source must be left out right now, as reported in its {@link SourceResult}. */
    public Optional<String> skipReason(Source source) {
        if (!source.usesBrowser()) {
            return Optional.empty();
        }
        if (isSkipListed(source)) {
            log.info("Source {} is on the skip list, not scraping", source.getName());
            return Optional.of(SourceResult.SKIP_LISTED);
        }
        MemorySample sample = memorySampler.sample();
        if (sample.residentBytes() > properties.getMemoryHardLimitMb() * MB) {
            log.warn("Memory at {}MB exceeds {}MB, skipping browser-backed source {}",
                    sample.residentMb(), properties.getMemoryHardLimitMb(), source.getName());
            return Optional.of(SourceResult.MEMORY_LIMIT);
        }
        return Optional.empty();
    }

    public boolean isAboveHardLimit() {
        return memorySampler.sample().residentBytes() > properties.getMemoryHardLimitMb() * MB;
    }

    /** Gives the collector a moment when memory is above the soft limit. */
    public void preScrapeDelay() {
        MemorySample sample = memorySampler.sample();
        if (sample.residentBytes() > properties.getMemorySoftLimitMb() * MB) {
            log.info("Memory at {}MB, waiting {}ms before scraping", sample.residentMb(), properties.getPreScrapeDelayMs());
            pause(properties.getPreScrapeDelayMs());
        }
    }

    public void afterBrowserUse() {
        pause(properties.getBrowserCooldownMs());
        if (properties.isGcAfterBrowser()) {
            System.gc();
        }
    }

    boolean isSkipListed(Source source) {
        String name = source.getName() == null ? "" : source.getName().toLowerCase(Locale.ROOT);
        String url = source.getUrl().toLowerCase(Locale.ROOT);
        return properties.getSkipList().stream()
                .map(entry -> entry.toLowerCase(Locale.ROOT).trim())
                .filter(entry -> !entry.isEmpty())
                .anyMatch(entry -> entry.equals(name) || url.contains(entry));
    }

    private void pause(long millis) {
        if (millis <= 0) {
            return;
        }
        try {
            sleeper.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
