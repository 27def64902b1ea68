package dev.distroblog.ingestion;

/** Lifecycle of periodic monitoring. */
public enum IngestionState {
    /** Periodic monitoring is off. */
    STOPPED,
    /** Monitoring is on and no pass is running. */
    IDLE,
    /** A pass is in progress. */
    RUNNING
}
