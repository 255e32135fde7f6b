package io.firefeed.pipeline.api.service.translation;

import io.firefeed.pipeline.api.exception.TranslationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Keeps a bounded set of translation models resident.
 * <p>
 * Models are loaded on first use; concurrent requests for a direction that is still
 * loading wait for the same load. Past {@code maxCachedModels} the least recently used
 * model is closed before the load that displaced it returns.
 */
public class ModelManager implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(ModelManager.class);

    private final TranslationModelLoader loader;
    private final int maxCachedModels;
    private final Duration loadTimeout;
    private final Clock clock;
    private final ExecutorService loadExecutor;

    private final ReentrantLock lock = new ReentrantLock();
    private final LinkedHashMap<ModelKey, ResidentModel> resident = new LinkedHashMap<>(16, 0.75f, true);
    private final ConcurrentHashMap<ModelKey, CompletableFuture<TranslationModel>> loading = new ConcurrentHashMap<>();

    private final AtomicLong loads = new AtomicLong();
    private final AtomicLong loadFailures = new AtomicLong();
    private final AtomicLong evictions = new AtomicLong();

    public ModelManager(TranslationModelLoader loader, int maxCachedModels, Duration loadTimeout, Clock clock) {
        if (maxCachedModels <= 0) {
            throw new IllegalArgumentException("maxCachedModels must be positive: " + maxCachedModels);
        }
        this.loader = loader;
        this.maxCachedModels = maxCachedModels;
        this.loadTimeout = loadTimeout;
        this.clock = clock;
        this.loadExecutor = Executors.newCachedThreadPool(namedThreads());
    }

    public TranslationModel getModel(ModelKey key) throws TranslationException {
        TranslationModel model = touch(key);
        if (model != null) {
            logger.debug("Using cached model for {}", key);
            return model;
        }

        CompletableFuture<TranslationModel> future = loading.computeIfAbsent(key, k -> {
            TranslationModel alreadyLoaded = touch(k);
            if (alreadyLoaded != null) {
                return CompletableFuture.completedFuture(alreadyLoaded);
            }
            return CompletableFuture.supplyAsync(() -> loadAndRegister(k), loadExecutor);
        });
        future.whenComplete((m, e) -> loading.remove(key, future));

        try {
            return future.get(loadTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            throw new TranslationException("Loading model " + key + " exceeded " + loadTimeout, e,
                    TranslationException.Reason.TIMEOUT);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() instanceof CompletionException ce ? ce.getCause() : e.getCause();
            if (cause instanceof TranslationException te) {
                throw te;
            }
            throw new TranslationException("Failed to load model " + key + ": " + cause.getMessage(), cause,
                    TranslationException.Reason.MODEL_LOAD_FAILED);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TranslationException("Interrupted loading model " + key, e, TranslationException.Reason.CANCELLED);
        }
    }

    /**
     * Load the given directions ahead of use. Failures are logged and skipped.
     *
     * @return number of directions resident afterwards
     */
    public int preload(List<ModelKey> keys) {
        logger.info("Preloading {} translation models", keys.size());
        int ready = 0;
        for (ModelKey key : keys) {
            try {
                getModel(key);
                ready++;
            } catch (TranslationException e) {
                logger.error("Failed to preload model {}: {}", key, e.getMessage());
            }
        }
        logger.info("Preloaded {}/{} translation models", ready, keys.size());
        return ready;
    }

    /**
     * Unload models not used for longer than {@code maxIdle}.
     *
     * @return number of models unloaded
     */
    public int sweepIdle(Duration maxIdle) {
        Instant cutoff = clock.instant().minus(maxIdle);
        List<ResidentModel> idle = new ArrayList<>();

        lock.lock();
        try {
            Iterator<ResidentModel> it = resident.values().iterator();
            while (it.hasNext()) {
                ResidentModel entry = it.next();
                if (entry.lastUsed.isBefore(cutoff)) {
                    it.remove();
                    idle.add(entry);
                }
            }
        } finally {
            lock.unlock();
        }

        idle.forEach(entry -> unload(entry, "idle since " + entry.lastUsed));
        if (!idle.isEmpty()) {
            logger.info("Unloaded {} idle translation models", idle.size());
        }
        return idle.size();
    }

    public ModelStats stats() {
        lock.lock();
        try {
            List<String> keys = resident.keySet().stream().map(ModelKey::toString).toList();
            return new ModelStats(resident.size(), maxCachedModels, loading.size(),
                    loads.get(), loadFailures.get(), evictions.get(), keys);
        } finally {
            lock.unlock();
        }
    }

    public boolean isResident(ModelKey key) {
        lock.lock();
        try {
            return resident.containsKey(key);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Unload every resident model and stop loading new ones.
     */
    @Override
    public void close() {
        List<ResidentModel> all;
        lock.lock();
        try {
            all = new ArrayList<>(resident.values());
            resident.clear();
        } finally {
            lock.unlock();
        }
        loadExecutor.shutdownNow();
        all.forEach(entry -> unload(entry, "shutdown"));
        logger.info("Released {} translation models", all.size());
    }

    private TranslationModel touch(ModelKey key) {
        lock.lock();
        try {
            ResidentModel entry = resident.get(key);
            if (entry == null) {
                return null;
            }
            entry.lastUsed = clock.instant();
            return entry.model;
        } finally {
            lock.unlock();
        }
    }

    private TranslationModel loadAndRegister(ModelKey key) {
        logger.info("Loading translation model for {}", key);
        long start = System.currentTimeMillis();
        TranslationModel model;
        try {
            model = loader.load(key);
            loads.incrementAndGet();
        } catch (TranslationException e) {
            loadFailures.incrementAndGet();
            throw new CompletionException(e);
        } catch (RuntimeException e) {
            loadFailures.incrementAndGet();
            throw new CompletionException(new TranslationException("Failed to load model " + key + ": " + e.getMessage(),
                    e, TranslationException.Reason.MODEL_LOAD_FAILED));
        }

        List<ResidentModel> evicted = new ArrayList<>();
        lock.lock();
        try {
            resident.put(key, new ResidentModel(model, clock.instant()));
            Iterator<Map.Entry<ModelKey, ResidentModel>> it = resident.entrySet().iterator();
            while (resident.size() > maxCachedModels && it.hasNext()) {
                Map.Entry<ModelKey, ResidentModel> eldest = it.next();
                if (eldest.getKey().equals(key)) {
                    continue;
                }
                it.remove();
                evicted.add(eldest.getValue());
            }
        } finally {
            lock.unlock();
        }

        evicted.forEach(entry -> {
            evictions.incrementAndGet();
            unload(entry, "evicted by " + key);
        });
        logger.info("Model for {} loaded in {}ms", key, System.currentTimeMillis() - start);
        return model;
    }

    private void unload(ResidentModel entry, String reason) {
        try {
            entry.model.close();
            logger.info("Unloaded model {} ({})", entry.model.key(), reason);
        } catch (RuntimeException e) {
            logger.warn("Error unloading model {}: {}", entry.model.key(), e.getMessage());
        }
    }

    private static ThreadFactory namedThreads() {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "model-loader-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    private static final class ResidentModel {
        final TranslationModel model;
        volatile Instant lastUsed;

        ResidentModel(TranslationModel model, Instant lastUsed) {
            this.model = model;
            this.lastUsed = lastUsed;
        }
    }

    public record ModelStats(
            int residentModels,
            int maxCachedModels,
            int loadsInProgress,
            long totalLoads,
            long loadFailures,
            long evictions,
            List<String> residentDirections
    ) {}
}
