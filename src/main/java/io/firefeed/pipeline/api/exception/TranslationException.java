package io.firefeed.pipeline.api.exception;

public class TranslationException extends Exception {

    public enum Reason {
        MODEL_LOAD_FAILED,
        EXECUTION_FAILED,
        TIMEOUT,
        BROKEN_OUTPUT,
        QUEUE_FULL,
        CANCELLED
    }

    private final Reason reason;

    public TranslationException(String message, Reason reason) {
        super(message);
        this.reason = reason;
    }

    public TranslationException(String message, Throwable cause, Reason reason) {
        super(message, cause);
        this.reason = reason;
    }

    public Reason getReason() {
        return reason;
    }
}
