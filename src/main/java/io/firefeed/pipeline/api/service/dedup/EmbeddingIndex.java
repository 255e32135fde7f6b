package io.firefeed.pipeline.api.service.dedup;

import org.springframework.stereotype.Component;

import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Embeddings of recently accepted items, searched by exact cosine similarity.
 * <p>
 * An entry that passed the similarity check is held as a reservation until it is
 * either added (stored) or released (dropped), so that concurrent checks of the same
 * story from other feeds see it.
 */
@Component
public class EmbeddingIndex {

    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private final Map<String, float[]> vectors = new LinkedHashMap<>();
    private final Set<String> reserved = new HashSet<>();

    public void replaceAll(Map<String, float[]> recent) {
        lock.writeLock().lock();
        try {
            vectors.clear();
            reserved.clear();
            vectors.putAll(recent);
        } finally {
            lock.writeLock().unlock();
        }
    }

    public void add(String newsId, float[] vector) {
        if (vector == null || vector.length == 0) {
            return;
        }
        lock.writeLock().lock();
        try {
            vectors.put(newsId, vector);
            reserved.remove(newsId);
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Find the closest item and, when it is below {@code threshold}, reserve {@code newsId}
     * in the same step. The candidate's own reservation is not matched, so checking the
     * same entry again gives the same result.
     *
     * @return the closest other item, if any
     */
    public Optional<Match> reserveIfNoneSimilar(String newsId, float[] vector, double threshold) {
        if (vector == null || vector.length == 0) {
            return Optional.empty();
        }
        lock.writeLock().lock();
        try {
            Match best = closest(vector, reserved.contains(newsId) ? newsId : null);
            if (best == null || best.similarity() < threshold) {
                if (!vectors.containsKey(newsId)) {
                    reserved.add(newsId);
                }
                vectors.putIfAbsent(newsId, vector);
            }
            return Optional.ofNullable(best);
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Drop a reservation whose item was not stored. Added items are kept.
     */
    public void release(String newsId) {
        lock.writeLock().lock();
        try {
            if (reserved.remove(newsId)) {
                vectors.remove(newsId);
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Closest stored vector. Ties keep the earliest inserted item.
     */
    public Optional<Match> nearest(float[] query) {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(closest(query, null));
        } finally {
            lock.readLock().unlock();
        }
    }

    int reservations() {
        lock.readLock().lock();
        try {
            return reserved.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    private Match closest(float[] query, String excluded) {
        Match best = null;
        for (Map.Entry<String, float[]> entry : vectors.entrySet()) {
            if (entry.getKey().equals(excluded)) {
                continue;
            }
            double similarity = cosine(query, entry.getValue());
            if (best == null || similarity > best.similarity()) {
                best = new Match(entry.getKey(), similarity);
            }
        }
        return best;
    }

    public int size() {
        lock.readLock().lock();
        try {
            return vectors.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    static double cosine(float[] a, float[] b) {
        int n = Math.min(a.length, b.length);
        double dot = 0.0;
        double normA = 0.0;
        double normB = 0.0;
        for (int i = 0; i < n; i++) {
            dot += (double) a[i] * b[i];
            normA += (double) a[i] * a[i];
            normB += (double) b[i] * b[i];
        }
        if (normA == 0.0 || normB == 0.0) {
            return 0.0;
        }
        return dot / (Math.sqrt(normA) * Math.sqrt(normB));
    }

    public record Match(String newsId, double similarity) {}
}
