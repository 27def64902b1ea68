package dev.distroblog.fetch;

/**
 * Failure of a single outbound fetch, after retries were exhausted where applicable.
 *
 * <p>{@link Kind#HTTP_STATUS} carries the response status code; the other kinds carry the
 * transport exception as cause.
 */
public class FetchException extends RuntimeException {

    public enum Kind {
        /** DNS failure, refused connection, reset, invalid URL. */
        NETWORK,
        /** Connect or read timeout. */
        TIMEOUT,
        /** The server answered with a 4xx or 5xx status. */
        HTTP_STATUS
    }

    private final String url;
    private final Kind kind;
    private final int statusCode;

    private FetchException(String url, Kind kind, int statusCode, String message, Throwable cause) {
        super(message, cause);
        this.url = url;
        this.kind = kind;
        this.statusCode = statusCode;
    }

    public static FetchException httpStatus(String url, int statusCode) {
        return new FetchException(url, Kind.HTTP_STATUS, statusCode,
                "HTTP " + statusCode + " for " + url, null);
    }

    public static FetchException timeout(String url, Throwable cause) {
        return new FetchException(url, Kind.TIMEOUT, -1, "Timed out fetching " + url, cause);
    }

    public static FetchException network(String url, Throwable cause) {
        String detail = cause == null ? "" : ": " + cause.getMessage();
        return new FetchException(url, Kind.NETWORK, -1, "Network error fetching " + url + detail, cause);
    }

    public String getUrl() {
        return url;
    }

    public Kind getKind() {
        return kind;
    }

    /** Response status, or -1 when the failure happened below HTTP. */
    public int getStatusCode() {
        return statusCode;
    }

    public boolean isRateLimited() {
        return kind == Kind.HTTP_STATUS && statusCode == 429;
    }

    public boolean isServerError() {
        return kind == Kind.HTTP_STATUS && statusCode >= 500;
    }

    public boolean isForbidden() {
        return kind == Kind.HTTP_STATUS && statusCode == 403;
    }

    /** Client errors other than 429 are final; everything else may succeed on a later attempt. */
    public boolean isRetryable() {
        return kind != Kind.HTTP_STATUS || isRateLimited() || isServerError();
    }
}
