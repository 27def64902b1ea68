package dev.distroblog.feed;

import java.util.Locale;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Result classes reported when a user asks to set up a source from a website URL.
 */
public enum DetectionStatus {
    VALID,
    RATE_LIMITED,
    SERVER_ERROR,
    INVALID,
    NOT_FOUND,
    NETWORK_ERROR,
    CONNECTION_ERROR,
    ERROR;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
