package io.feedrecorder.ingestion.exception;

public enum ErrorCategory {
    TIMEOUT(true),              // Connection/read timeout
    CONNECTION_REFUSED(true),   // Connection refused
    DNS_ERROR(false),           // Unknown host
    NETWORK_ERROR(true),        // Other network issues
    IO_ERROR(false),            // I/O problems, local files included
    INVALID_URL(false),         // Malformed URL or path
    NOT_FOUND(false),           // 404 error
    ACCESS_FORBIDDEN(false),    // 403 error
    AUTH_REQUIRED(false),       // 401 error
    SERVER_ERROR(false),        // 500 error
    SERVER_UNAVAILABLE(true),   // 502/503/504
    HTTP_ERROR(false),          // Other HTTP errors
    PARSE_ERROR(false),         // Feed could not be parsed even leniently
    RATE_LIMITED(true),         // 429 Too Many Requests
    UNKNOWN(false);             // Unexpected errors

    private final boolean retryable;

    ErrorCategory(boolean retryable) {
        this.retryable = retryable;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
