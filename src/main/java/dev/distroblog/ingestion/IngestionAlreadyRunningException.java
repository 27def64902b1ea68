package dev.distroblog.ingestion;

/** Thrown when a manual pass is requested while another pass is in progress. */
public class IngestionAlreadyRunningException extends RuntimeException {

    public IngestionAlreadyRunningException() {
        super("An ingestion pass is already running");
    }
}
