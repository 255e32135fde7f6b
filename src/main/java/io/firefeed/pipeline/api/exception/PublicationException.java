package io.firefeed.pipeline.api.exception;

public class PublicationException extends RuntimeException {

    public PublicationException(String message, Throwable cause) {
        super(message, cause);
    }
}
