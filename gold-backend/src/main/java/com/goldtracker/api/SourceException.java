package com.goldtracker.api;

/**
 * A provider answered, but not with something usable (non-2xx status, unexpected payload).
 */
public class SourceException extends Exception {

    private final int statusCode;

    public SourceException(String message) {
        this(message, -1);
    }

    public SourceException(String message, int statusCode) {
        super(message);
        this.statusCode = statusCode;
    }

    /**
     * HTTP status, or -1 when the failure did not come from a status line.
     */
    public int getStatusCode() {
        return statusCode;
    }
}
