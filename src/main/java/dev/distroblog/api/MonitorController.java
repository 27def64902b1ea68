package dev.distroblog.api;

import java.time.Instant;
import java.util.List;

import dev.distroblog.ingestion.IngestionScheduler;
import dev.distroblog.ingestion.IngestionState;
import dev.distroblog.ingestion.SourceResult;
import org.jspecify.annotations.Nullable;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** Ingestion pass trigger and monitoring lifecycle. */
@RestController
@RequestMapping("/api/monitor")
public class MonitorController {

    private final IngestionScheduler scheduler;

    public MonitorController(IngestionScheduler scheduler) {
        this.scheduler = scheduler;
    }

    @PostMapping("/trigger")
    public TriggerResponse trigger() {
        List<SourceResult> results = scheduler.triggerManualPass();
        int total = results.stream().mapToInt(SourceResult::newArticles).sum();
        return new TriggerResponse("Feed monitoring completed", total, results);
    }

    @PostMapping("/start")
    public StatusResponse start() {
        scheduler.start();
        return status();
    }

    @PostMapping("/stop")
    public StatusResponse stop() {
        scheduler.stop();
        return status();
    }

    @GetMapping("/status")
    public StatusResponse status() {
        return new StatusResponse(scheduler.state(), scheduler.lastPassAt().orElse(null));
    }

    public record TriggerResponse(String message, int newArticles, List<SourceResult> results) {}

    public record StatusResponse(IngestionState state, @Nullable Instant lastPassAt) {}
}
