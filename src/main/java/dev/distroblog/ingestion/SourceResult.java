package dev.distroblog.ingestion;

import dev.distroblog.source.MonitoringType;
import dev.distroblog.source.Source;
import org.jspecify.annotations.Nullable;

/** Outcome of one source within an ingestion pass. */
public record SourceResult(
        String sourceName,
        String url,
        int newArticles,
        boolean success,
        @Nullable String error,
        boolean skipped,
        MonitoringType monitoringType
) {
    public static final String MEMORY_LIMIT = "Skipped due to memory limit";
    public static final String SKIP_LISTED = "Skipped: source is on the skip list";

    public static SourceResult processed(Source source, int newArticles) {
        return new SourceResult(source.getName(), source.getUrl(), newArticles, true, null, false,
                source.getMonitoringType());
    }

    public static SourceResult failed(Source source, String error) {
        return new SourceResult(source.getName(), source.getUrl(), 0, false, error, false,
                source.getMonitoringType());
    }

    public static SourceResult skipped(Source source, String reason) {
        return new SourceResult(source.getName(), source.getUrl(), 0, false, reason, true,
                source.getMonitoringType());
    }
}
