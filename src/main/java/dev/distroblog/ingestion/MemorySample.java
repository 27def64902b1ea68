package dev.distroblog.ingestion;

import java.time.Instant;

/** Resident memory of the process at one instant. */
public record MemorySample(long residentBytes, Instant sampledAt) {

    public long residentMb() {
        return residentBytes / (1024 * 1024);
    }
}
