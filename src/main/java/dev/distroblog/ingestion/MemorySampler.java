package dev.distroblog.ingestion;

/** Source of {@link MemorySample}s; replaced in tests to simulate memory pressure. */
public interface MemorySampler {

    MemorySample sample();
}
