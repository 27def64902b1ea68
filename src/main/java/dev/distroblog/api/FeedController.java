package dev.distroblog.api;

import java.util.Optional;

import dev.distroblog.feed.FeedDetectionResult;
import dev.distroblog.feed.FeedDetectionService;
import dev.distroblog.feed.FeedDiscoveryEngine;
import dev.distroblog.feed.FeedProbeResult;
import dev.distroblog.feed.FeedReader;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import org.jspecify.annotations.Nullable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** Feed discovery, validation and source detection endpoints. */
@RestController
@RequestMapping("/api")
public class FeedController {

    private final FeedDiscoveryEngine discoveryEngine;
    private final FeedReader feedReader;
    private final FeedDetectionService detectionService;

    public FeedController(FeedDiscoveryEngine discoveryEngine, FeedReader feedReader,
                          FeedDetectionService detectionService) {
        this.discoveryEngine = discoveryEngine;
        this.feedReader = feedReader;
        this.detectionService = detectionService;
    }

    @PostMapping("/feed/discover")
    public DiscoverResponse discover(@Valid @RequestBody DiscoverRequest request) {
        Optional<String> feedUrl = discoveryEngine.discoverFeedUrl(request.websiteUrl());
        if (feedUrl.isEmpty()) {
            return new DiscoverResponse(false, null, null, "No RSS feed found for this website");
        }
        FeedProbeResult probe = discoveryEngine.probeFeed(feedUrl.get());
        return new DiscoverResponse(true, feedUrl.get(), probe, null);
    }

    @PostMapping("/feed/validate")
    public ValidateResponse validate(@Valid @RequestBody ValidateRequest request) {
        return new ValidateResponse(request.feedUrl(), feedReader.validateFeed(request.feedUrl()));
    }

    @PostMapping("/sources/detect")
    public FeedDetectionResult detect(@Valid @RequestBody DetectRequest request) {
        return detectionService.detect(request.url());
    }

    public record DiscoverRequest(@NotBlank String websiteUrl) {}

    public record DiscoverResponse(boolean success, @Nullable String feedUrl,
                                   @Nullable FeedProbeResult testResult, @Nullable String message) {}

    public record ValidateRequest(@NotBlank String feedUrl) {}

    public record ValidateResponse(String feedUrl, boolean valid) {}

    public record DetectRequest(@NotBlank String url) {}
}
