package io.firefeed.pipeline.api.exception;

/**
 * Thrown when a translation task cannot be enqueued within the configured wait.
 */
public class QueueFullException extends RuntimeException {
    private final int capacity;

    public QueueFullException(int capacity) {
        super("Translation queue is full (capacity " + capacity + ")");
        this.capacity = capacity;
    }

    public int getCapacity() {
        return capacity;
    }
}
