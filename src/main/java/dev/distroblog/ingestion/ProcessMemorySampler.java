package dev.distroblog.ingestion;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Reads {@code VmRSS} from {@code /proc/self/status}, which includes the memory of the JVM beyond
 * its heap. On systems without procfs the used heap is reported instead.
 */
@Component
public class ProcessMemorySampler implements MemorySampler {

    private static final Logger log = LoggerFactory.getLogger(ProcessMemorySampler.class);

    static final Path PROC_STATUS = Path.of("/proc/self/status");

    private final Clock clock;
    private final Path statusFile;

    public ProcessMemorySampler(Clock clock) {
        this(clock, PROC_STATUS);
    }

    ProcessMemorySampler(Clock clock, Path statusFile) {
        this.clock = clock;
        this.statusFile = statusFile;
    }

    @Override
    public MemorySample sample() {
        long rss = readVmRss();
        if (rss < 0) {
            Runtime runtime = Runtime.getRuntime();
            rss = runtime.totalMemory() - runtime.freeMemory();
        }
        return new MemorySample(rss, clock.instant());
    }

    /** VmRSS in bytes, or -1 when the status file is missing or has no such line. */
    long readVmRss() {
        if (!Files.isReadable(statusFile)) {
            return -1;
        }
        try {
            List<String> lines = Files.readAllLines(statusFile);
            return parseVmRss(lines);
        } catch (IOException e) {
            log.debug("Cannot read {}: {}", statusFile, e.getMessage());
            return -1;
        }
    }

    static long parseVmRss(List<String> lines) {
        for (String line : lines) {
            if (line.startsWith("VmRSS:")) {
                String[] parts = line.substring("VmRSS:".length()).trim().split("\\s+");
                try {
                    return Long.parseLong(parts[0]) * 1024;
                } catch (NumberFormatException e) {
                    return -1;
                }
            }
        }
        return -1;
    }
}
