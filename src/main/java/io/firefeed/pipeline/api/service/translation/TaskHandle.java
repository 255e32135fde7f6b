package io.firefeed.pipeline.api.service.translation;

import io.firefeed.pipeline.api.exception.TranslationException;

import java.time.Duration;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Caller side of a queued {@link TranslationTask}: its state, its result and cancellation.
 */
public final class TaskHandle {

    private final TranslationTask task;
    private final long sequence;
    private final CompletableFuture<String> result = new CompletableFuture<>();
    private final AtomicReference<TaskState> state = new AtomicReference<>(TaskState.QUEUED);
    private volatile Future<?> execution;

    TaskHandle(TranslationTask task, long sequence) {
        this.task = task;
        this.sequence = sequence;
    }

    public TranslationTask task() {
        return task;
    }

    public TaskState state() {
        return state.get();
    }

    long sequence() {
        return sequence;
    }

    /**
     * Wait for the translated text.
     *
     * @throws TranslationException on failure, cancellation or when the wait exceeds {@code timeout}
     */
    public String await(Duration timeout) throws TranslationException {
        try {
            return result.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            throw new TranslationException("Timed out waiting for task " + task.id(), e, TranslationException.Reason.TIMEOUT);
        } catch (CancellationException e) {
            throw new TranslationException("Task " + task.id() + " was cancelled", e, TranslationException.Reason.CANCELLED);
        } catch (ExecutionException e) {
            if (e.getCause() instanceof TranslationException te) {
                throw te;
            }
            throw new TranslationException("Task " + task.id() + " failed: " + e.getCause().getMessage(),
                    e.getCause(), TranslationException.Reason.EXECUTION_FAILED);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TranslationException("Interrupted waiting for task " + task.id(), e, TranslationException.Reason.CANCELLED);
        }
    }

    /**
     * Cancel the task. A queued task is skipped by the workers; a running one is interrupted.
     *
     * @return true if the task had not finished yet
     */
    public boolean cancel() {
        while (true) {
            TaskState current = state.get();
            if (current.isTerminal()) {
                return false;
            }
            if (state.compareAndSet(current, TaskState.CANCELLED)) {
                Future<?> running = execution;
                if (running != null) {
                    running.cancel(true);
                }
                result.cancel(false);
                return true;
            }
        }
    }

    public boolean isDone() {
        return state.get().isTerminal();
    }

    boolean markRunning() {
        return state.compareAndSet(TaskState.QUEUED, TaskState.RUNNING);
    }

    void attachExecution(Future<?> future) {
        this.execution = future;
        if (state.get() == TaskState.CANCELLED) {
            future.cancel(true);
        }
    }

    boolean complete(String translated) {
        if (state.compareAndSet(TaskState.RUNNING, TaskState.DONE)) {
            return result.complete(translated);
        }
        return false;
    }

    boolean fail(TranslationException error) {
        if (state.compareAndSet(TaskState.RUNNING, TaskState.FAILED)) {
            return result.completeExceptionally(error);
        }
        return false;
    }
}
