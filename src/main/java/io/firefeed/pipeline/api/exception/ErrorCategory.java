package io.firefeed.pipeline.api.exception;

public enum ErrorCategory {
    TIMEOUT,              // Connection/read timeout or fetch deadline
    CONNECTION_REFUSED,
    DNS_ERROR,            // Unknown host
    NETWORK_ERROR,
    IO_ERROR,
    INVALID_URL,          // Malformed or non-http(s) URL
    NOT_FOUND,            // 404
    ACCESS_FORBIDDEN,     // 403
    AUTH_REQUIRED,        // 401
    SERVER_ERROR,         // 500
    SERVER_UNAVAILABLE,   // 502, 503, 504
    HTTP_ERROR,           // Other 4xx/5xx
    PARSE_ERROR,          // Not a parseable RSS/Atom document
    EMPTY_FEED,           // Parsed, but no entries
    RATE_LIMITED,         // 429
    UNKNOWN;

    /**
     * Whether a failure in this category is worth retrying within the same pass.
     */
    public boolean isTransient() {
        return switch (this) {
            case TIMEOUT, CONNECTION_REFUSED, NETWORK_ERROR, IO_ERROR,
                 SERVER_ERROR, SERVER_UNAVAILABLE -> true;
            default -> false;
        };
    }
}
