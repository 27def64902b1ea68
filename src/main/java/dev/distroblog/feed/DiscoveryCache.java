package dev.distroblog.feed;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

import org.jspecify.annotations.Nullable;

/**
 * Discovery outcomes per normalized site URL, including "no feed found", kept for a fixed TTL.
 */
class DiscoveryCache {

    private final Clock clock;
    private final Duration ttl;
    private final ConcurrentHashMap<String, Entry> entries = new ConcurrentHashMap<>();

    DiscoveryCache(Clock clock, Duration ttl) {
        this.clock = clock;
        this.ttl = ttl;
    }

    /**
     * @return empty when nothing fresh is cached; otherwise the cached outcome, itself empty when
     *     the last discovery found no feed
     */
    Optional<Optional<String>> get(String key) {
        Entry entry = entries.get(key);
        if (entry == null) {
            return Optional.empty();
        }
        if (!clock.instant().isBefore(entry.expiresAt())) {
            entries.remove(key, entry);
            return Optional.empty();
        }
        return Optional.of(Optional.ofNullable(entry.feedUrl()));
    }

    void put(String key, @Nullable String feedUrl) {
        entries.put(key, new Entry(feedUrl, clock.instant().plus(ttl)));
    }

    void clear() {
        entries.clear();
    }

    private record Entry(@Nullable String feedUrl, Instant expiresAt) {}
}
