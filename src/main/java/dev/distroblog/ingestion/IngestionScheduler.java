package dev.distroblog.ingestion;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicBoolean;

import dev.distroblog.article.ArticleStore;
import dev.distroblog.source.Source;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Service;

/**
 * Runs ingestion passes over all active sources, on demand and periodically.
 *
 * <p>At most one pass runs at a time, whether scheduled or manual. Sources are processed
 * sequentially in listing order; a failing source is recorded and the pass continues.
 */
@Service
public class IngestionScheduler {

    private static final Logger log = LoggerFactory.getLogger(IngestionScheduler.class);

    static final int MAX_ENRICHMENT_AFTER_PASS = 50;

    private final TaskScheduler taskScheduler;
    private final ArticleStore articleStore;
    private final SourceIngestionService sourceIngestion;
    private final ResourceGovernor governor;
    private final DateEnrichmentService dateEnrichment;
    private final IngestionProperties properties;
    private final Clock clock;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private volatile boolean monitoring;
    private ScheduledFuture<?> periodicTask;
    private volatile Instant lastPassAt;

    public IngestionScheduler(@Qualifier("ingestionTaskScheduler") TaskScheduler taskScheduler,
                              ArticleStore articleStore, SourceIngestionService sourceIngestion,
                              ResourceGovernor governor, DateEnrichmentService dateEnrichment,
                              IngestionProperties properties, Clock clock) {
        this.taskScheduler = taskScheduler;
        this.articleStore = articleStore;
        this.sourceIngestion = sourceIngestion;
        this.governor = governor;
        this.dateEnrichment = dateEnrichment;
        this.properties = properties;
        this.clock = clock;
    }

    @EventListener(ApplicationReadyEvent.class)
    void startOnReady() {
        if (properties.isAutoStart()) {
            start();
        }
    }

    /** Starts periodic monitoring; the first pass runs immediately. No-op when already started. */
    public synchronized void start() {
        if (periodicTask != null) {
            return;
        }
        Duration interval = properties.getPollInterval();
        monitoring = true;
        periodicTask = taskScheduler.scheduleAtFixedRate(() -> runIngestionPass(false), clock.instant(), interval);
        log.info("Monitoring started, polling every {}", interval);
    }

    /** Stops periodic monitoring. A pass already in progress completes. */
    public synchronized void stop() {
        if (periodicTask == null) {
            return;
        }
        monitoring = false;
        periodicTask.cancel(false);
        periodicTask = null;
        log.info("Monitoring stopped");
    }

    public IngestionState state() {
        if (running.get()) {
            return IngestionState.RUNNING;
        }
        return monitoring ? IngestionState.IDLE : IngestionState.STOPPED;
    }

    public Optional<Instant> lastPassAt() {
        return Optional.ofNullable(lastPassAt);
    }

    /**
     * Runs one pass. Returns an empty list when a scheduled pass fires while monitoring is stopped,
     * or when another pass is already running.
     */
    public List<SourceResult> runIngestionPass(boolean manual) {
        if (!manual && !monitoring) {
            log.debug("Monitoring stopped, skipping scheduled pass");
            return List.of();
        }
        return tryRun(manual).orElseGet(() -> {
            log.warn("Ingestion pass already running, ignoring {} request", manual ? "manual" : "scheduled");
            return List.of();
        });
    }

    /**
     * Runs a manual pass.
     *
     * @throws IngestionAlreadyRunningException when a pass is in progress
     */
    public List<SourceResult> triggerManualPass() {
        return tryRun(true).orElseThrow(IngestionAlreadyRunningException::new);
    }

    private Optional<List<SourceResult>> tryRun(boolean manual) {
        if (!running.compareAndSet(false, true)) {
            return Optional.empty();
        }
        try {
            return Optional.of(runPass(PassContext.start(clock.instant(), manual)));
        } finally {
            lastPassAt = clock.instant();
            running.set(false);
        }
    }

    private List<SourceResult> runPass(PassContext pass) {
        List<Source> sources = articleStore.listSources().stream().filter(s -> !s.isPaused()).toList();
        log.info("Starting {} pass {} over {} sources", pass.manual() ? "manual" : "scheduled",
                pass.sessionId(), sources.size());

        List<SourceResult> results = new ArrayList<>();
        for (Source source : sources) {
            results.add(processSource(source, pass));
        }

        int total = results.stream().mapToInt(SourceResult::newArticles).sum();
        long failed = results.stream().filter(r -> !r.success() && !r.skipped()).count();
        log.info("Pass {} finished: {} new articles, {} failed sources", pass.sessionId(), total, failed);

        if (pass.manual() && total > 0) {
            try {
                dateEnrichment.enrichMissingDates(Math.min(total, MAX_ENRICHMENT_AFTER_PASS));
            } catch (RuntimeException e) {
                log.warn("Date enrichment after pass {} failed: {}", pass.sessionId(), e.getMessage());
            }
        }
        return results;
    }

    private SourceResult processSource(Source source, PassContext pass) {
        Optional<String> skipReason = governor.skipReason(source);
        if (skipReason.isPresent()) {
            return SourceResult.skipped(source, skipReason.get());
        }
        try {
            int inserted = sourceIngestion.ingest(source, pass);
            return SourceResult.processed(source, inserted);
        } catch (RuntimeException e) {
            log.error("[{}] Source failed: {}", source.getName(), e.getMessage());
            return SourceResult.failed(source, e.getMessage());
        } finally {
            try {
                articleStore.updateSourceLastChecked(source.getId());
            } catch (RuntimeException e) {
                log.warn("[{}] Could not record last check: {}", source.getName(), e.getMessage());
            }
        }
    }
}
