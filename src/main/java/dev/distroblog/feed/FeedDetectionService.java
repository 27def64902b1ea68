package dev.distroblog.feed;

import java.net.ConnectException;
import java.net.UnknownHostException;
import java.util.Optional;

import dev.distroblog.fetch.FetchException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Source-setup helper: discovers a feed for a website and explains the outcome in terms a user can
 * act on.
 */
@Service
public class FeedDetectionService {

    private static final Logger log = LoggerFactory.getLogger(FeedDetectionService.class);

    private final FeedDiscoveryEngine discoveryEngine;

    public FeedDetectionService(FeedDiscoveryEngine discoveryEngine) {
        this.discoveryEngine = discoveryEngine;
    }

    public FeedDetectionResult detect(String siteUrl) {
        log.info("Detecting feeds for {}", siteUrl);
        FeedDiscoveryEngine.DiscoveryOutcome outcome;
        try {
            outcome = discoveryEngine.discover(siteUrl);
        } catch (RuntimeException e) {
            log.error("Feed detection failed for {}", siteUrl, e);
            return FeedDetectionResult.of(siteUrl, DetectionStatus.ERROR,
                    "Error detecting RSS feeds. Please try entering the direct RSS URL.");
        }

        Optional<String> feedUrl = outcome.feedUrl();
        if (feedUrl.isPresent()) {
            return checkFeed(feedUrl.get());
        }
        if (outcome.siteFailure() != null) {
            return fromSiteFailure(siteUrl, outcome.siteFailure());
        }
        return FeedDetectionResult.of(siteUrl, DetectionStatus.NOT_FOUND,
                "No RSS feeds found on this website. Try entering the direct RSS URL.");
    }

    private FeedDetectionResult checkFeed(String feedUrl) {
        FeedProbeResult probe = discoveryEngine.probeFeed(feedUrl);
        if (probe.success()) {
            return FeedDetectionResult.of(feedUrl, DetectionStatus.VALID, null);
        }
        log.info("Feed found but failed re-check: {} ({})", feedUrl, probe.error());
        Integer status = probe.status();
        if (status != null && status == 429) {
            return FeedDetectionResult.of(feedUrl, DetectionStatus.RATE_LIMITED,
                    "Website is rate limiting requests. Please try again later or enter the RSS URL directly.");
        }
        if (status != null && status >= 500) {
            return FeedDetectionResult.of(feedUrl, DetectionStatus.SERVER_ERROR,
                    "Website server error. Please try again later.");
        }
        return FeedDetectionResult.of(feedUrl, DetectionStatus.INVALID,
                "RSS feed found but appears to be invalid or inaccessible.");
    }

    private static FeedDetectionResult fromSiteFailure(String siteUrl, FetchException failure) {
        if (hasCause(failure, UnknownHostException.class)) {
            return FeedDetectionResult.of(siteUrl, DetectionStatus.NETWORK_ERROR,
                    "Website not found. Please check the URL and try again.");
        }
        if (hasCause(failure, ConnectException.class)) {
            return FeedDetectionResult.of(siteUrl, DetectionStatus.CONNECTION_ERROR,
                    "Cannot connect to website. Please check the URL and try again.");
        }
        if (failure.getKind() == FetchException.Kind.HTTP_STATUS) {
            return FeedDetectionResult.of(siteUrl, DetectionStatus.NOT_FOUND,
                    "No RSS feeds found on this website. Try entering the direct RSS URL.");
        }
        return FeedDetectionResult.of(siteUrl, DetectionStatus.ERROR,
                "Error detecting RSS feeds. Please try entering the direct RSS URL.");
    }

    private static boolean hasCause(Throwable failure, Class<? extends Throwable> type) {
        Throwable current = failure.getCause();
        while (current != null) {
            if (type.isInstance(current)) {
                return true;
            }
            current = current.getCause() == current ? null : current.getCause();
        }
        return false;
    }
}
