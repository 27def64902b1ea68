package dev.distroblog.ingestion;

import java.time.Instant;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Identifies one ingestion pass. Manual passes are triggered by a user and favor speed over
 * metadata completeness.
 */
public record PassContext(String sessionId, boolean manual) {

    /** {@code session_<epochMillis>_<random>}. */
    static PassContext start(Instant now, boolean manual) {
        String random = Long.toString(ThreadLocalRandom.current().nextLong(Long.MAX_VALUE), 36);
        return new PassContext("session_" + now.toEpochMilli() + "_" + random.substring(0, Math.min(9, random.length())), manual);
    }
}
