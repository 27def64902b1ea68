package dev.distroblog.ingestion;

/** What happened to one candidate item. */
public enum ItemOutcome {
    INSERTED,
    DUPLICATE,
    SKIPPED
}
