package io.firefeed.pipeline.api.exception;

public class FeedFetchException extends Exception {
    private final ErrorCategory category;

    public FeedFetchException(String message, ErrorCategory category) {
        super(message);
        this.category = category;
    }

    public FeedFetchException(String message, Throwable cause, ErrorCategory category) {
        super(message, cause);
        this.category = category;
    }

    public ErrorCategory getCategory() {
        return category;
    }

    public boolean isTransient() {
        return category.isTransient();
    }
}
