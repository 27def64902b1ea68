package dev.distroblog.feed;

import java.util.Optional;
import java.util.function.Function;

/**
 * One named step of feed discovery. Returns the first working feed it finds, or empty.
 */
record DiscoveryStrategy(String name, Function<FeedDiscoveryEngine.DiscoveryRun, Optional<String>> search) {

    Optional<String> run(FeedDiscoveryEngine.DiscoveryRun run) {
        return search.apply(run);
    }
}
