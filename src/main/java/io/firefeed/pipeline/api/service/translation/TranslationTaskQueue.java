package io.firefeed.pipeline.api.service.translation;

import io.firefeed.pipeline.api.exception.QueueFullException;
import io.firefeed.pipeline.api.exception.TranslationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.PriorityBlockingQueue;
import java.util.concurrent.Semaphore;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Bounded queue of translation tasks served by a fixed pool of workers.
 * <p>
 * A worker takes the highest priority task, drains further queued tasks for the same
 * direction into one batch, resolves the model once and runs every task of the batch
 * under its own timeout. Enqueueing waits at most {@code enqueueTimeout} for space.
 */
public class TranslationTaskQueue implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(TranslationTaskQueue.class);

    private static final Comparator<TaskHandle> ORDER = Comparator
            .comparingInt((TaskHandle h) -> h.task().priority()).reversed()
            .thenComparingLong(TaskHandle::sequence);

    private final ModelManager modelManager;
    private final int capacity;
    private final int workers;
    private final int maxBatchSize;
    private final Duration taskTimeout;
    private final Duration enqueueTimeout;

    private final PriorityBlockingQueue<TaskHandle> queue;
    private final Semaphore freeSlots;
    private final Set<TaskHandle> running = ConcurrentHashMap.newKeySet();
    private final ExecutorService workerPool;
    private final ExecutorService executionPool;
    private final AtomicBoolean accepting = new AtomicBoolean(true);
    private final AtomicLong sequence = new AtomicLong();

    private final AtomicLong submitted = new AtomicLong();
    private final AtomicLong processed = new AtomicLong();
    private final AtomicLong failed = new AtomicLong();
    private final AtomicLong cancelled = new AtomicLong();
    private final AtomicLong rejected = new AtomicLong();

    public TranslationTaskQueue(ModelManager modelManager,
                                int capacity,
                                int workers,
                                int maxBatchSize,
                                Duration taskTimeout,
                                Duration enqueueTimeout) {
        this.modelManager = modelManager;
        this.capacity = Math.max(1, capacity);
        this.workers = Math.max(1, workers);
        this.maxBatchSize = Math.max(1, maxBatchSize);
        this.taskTimeout = taskTimeout;
        this.enqueueTimeout = enqueueTimeout;
        this.queue = new PriorityBlockingQueue<>(this.capacity, ORDER);
        this.freeSlots = new Semaphore(this.capacity, true);
        this.workerPool = Executors.newFixedThreadPool(this.workers, namedThreads("translation-worker-"));
        // one execution per worker; a model call stuck past its timeout holds its thread
        this.executionPool = Executors.newFixedThreadPool(this.workers, namedThreads("translation-exec-"));
    }

    public void start() {
        for (int i = 0; i < workers; i++) {
            String workerId = "worker-" + i;
            workerPool.submit(() -> workLoop(workerId));
        }
        logger.info("Started {} translation workers (queue capacity {})", workers, capacity);
    }

    /**
     * Queue a task.
     *
     * @throws QueueFullException when no slot frees up within the enqueue timeout
     * @throws IllegalStateException after {@link #shutdown()}
     */
    public TaskHandle enqueue(TranslationTask task) {
        if (!accepting.get()) {
            throw new IllegalStateException("Translation queue is shut down");
        }
        boolean acquired;
        try {
            acquired = freeSlots.tryAcquire(enqueueTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for queue space", e);
        }
        if (!acquired) {
            rejected.incrementAndGet();
            logger.warn("Translation queue is full ({} tasks), rejecting task {}", capacity, task.id());
            throw new QueueFullException(capacity);
        }

        TaskHandle handle = new TaskHandle(task, sequence.incrementAndGet());
        queue.add(handle);
        submitted.incrementAndGet();
        logger.debug("Queued translation task {} for {} (in queue: {})", task.id(), task.modelKey(), queue.size());
        return handle;
    }

    /**
     * Stop accepting tasks, cancel everything still queued and interrupt running work.
     */
    public void shutdown() {
        if (!accepting.compareAndSet(true, false)) {
            return;
        }
        logger.info("Stopping translation queue ({} queued, {} running)", queue.size(), running.size());

        List<TaskHandle> pending = new ArrayList<>();
        queue.drainTo(pending);
        pending.forEach(handle -> {
            freeSlots.release();
            if (handle.cancel()) {
                cancelled.incrementAndGet();
            }
        });
        running.forEach(handle -> {
            if (handle.cancel()) {
                cancelled.incrementAndGet();
            }
        });

        workerPool.shutdownNow();
        executionPool.shutdownNow();
        try {
            if (!workerPool.awaitTermination(5, TimeUnit.SECONDS)) {
                logger.warn("Translation workers did not stop in time");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        logger.info("Translation queue stopped");
    }

    @Override
    public void close() {
        shutdown();
    }

    public QueueStats stats() {
        return new QueueStats(queue.size(), running.size(), capacity, workers,
                submitted.get(), processed.get(), failed.get(), cancelled.get(), rejected.get());
    }

    private void workLoop(String workerId) {
        while (accepting.get() && !Thread.currentThread().isInterrupted()) {
            try {
                TaskHandle first = queue.take();
                freeSlots.release();
                List<TaskHandle> batch = collectBatch(first);
                if (!batch.isEmpty()) {
                    runBatch(workerId, batch);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            } catch (RuntimeException e) {
                logger.error("[{}] Unexpected worker error: {}", workerId, e.getMessage(), e);
            }
        }
        logger.debug("[{}] Translation worker exiting", workerId);
    }

    private List<TaskHandle> collectBatch(TaskHandle first) {
        List<TaskHandle> batch = new ArrayList<>();
        if (first.markRunning()) {
            batch.add(first);
        }
        ModelKey key = first.task().modelKey();

        Iterator<TaskHandle> it = queue.iterator();
        while (batch.size() < maxBatchSize && it.hasNext()) {
            TaskHandle candidate = it.next();
            if (candidate.task().modelKey().equals(key) && queue.remove(candidate)) {
                freeSlots.release();
                if (candidate.markRunning()) {
                    batch.add(candidate);
                }
            }
        }
        return batch;
    }

    private void runBatch(String workerId, List<TaskHandle> batch) {
        ModelKey key = batch.get(0).task().modelKey();
        running.addAll(batch);
        try {
            TranslationModel model;
            try {
                model = modelManager.getModel(key);
            } catch (TranslationException e) {
                logger.error("[{}] Model for {} unavailable, failing {} tasks: {}", workerId, key, batch.size(), e.getMessage());
                batch.forEach(handle -> markFailed(handle, e));
                return;
            }

            logger.debug("[{}] Translating batch of {} for {}", workerId, batch.size(), key);
            for (TaskHandle handle : batch) {
                runTask(workerId, model, handle);
            }
        } finally {
            batch.forEach(running::remove);
        }
    }

    private void runTask(String workerId, TranslationModel model, TaskHandle handle) {
        if (handle.isDone()) {
            return;
        }
        long start = System.currentTimeMillis();
        Future<String> execution = executionPool.submit(() -> model.translate(handle.task().text()));
        handle.attachExecution(execution);
        try {
            String translated = execution.get(taskTimeout.toMillis(), TimeUnit.MILLISECONDS);
            if (handle.complete(translated)) {
                processed.incrementAndGet();
                logger.debug("[{}] Task {} completed in {}ms", workerId, handle.task().id(), System.currentTimeMillis() - start);
            }
        } catch (TimeoutException e) {
            execution.cancel(true);
            logger.warn("[{}] Task {} timed out after {}", workerId, handle.task().id(), taskTimeout);
            markFailed(handle, new TranslationException("Translation timed out after " + taskTimeout, e,
                    TranslationException.Reason.TIMEOUT));
        } catch (CancellationException e) {
            logger.debug("[{}] Task {} cancelled", workerId, handle.task().id());
        } catch (ExecutionException e) {
            TranslationException error = e.getCause() instanceof TranslationException te ? te
                    : new TranslationException("Translation failed: " + e.getCause().getMessage(), e.getCause(),
                    TranslationException.Reason.EXECUTION_FAILED);
            logger.error("[{}] Translation error for task {}: {}", workerId, handle.task().id(), error.getMessage());
            markFailed(handle, error);
        } catch (InterruptedException e) {
            execution.cancel(true);
            Thread.currentThread().interrupt();
            if (handle.cancel()) {
                cancelled.incrementAndGet();
            }
        }
    }

    private void markFailed(TaskHandle handle, TranslationException error) {
        if (handle.fail(error)) {
            failed.incrementAndGet();
        }
    }

    private static ThreadFactory namedThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    public record QueueStats(
            int queued,
            int running,
            int capacity,
            int workers,
            long submitted,
            long processed,
            long failed,
            long cancelled,
            long rejected
    ) {}
}
