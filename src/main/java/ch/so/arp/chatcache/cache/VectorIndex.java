package ch.so.arp.chatcache.cache;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * In-process, append-only arena of cached answers. Every entry holds a vector and
 * the response associated with it, so the vector index and the handle to response
 * map always grow together. Handles are dense positions starting at 0 and are
 * unrelated to the ids of the durable store.
 * <p>
 * Nearest-neighbour search is an exact brute force scan over the inner product of
 * the vectors, which equals the cosine similarity for normalised embeddings.
 */
public final class VectorIndex {

    private static final Comparator<Neighbor> BY_SIMILARITY = Comparator
            .comparingDouble(Neighbor::similarity).reversed()
            .thenComparingInt(Neighbor::handle);

    private final int dimensions;
    private final List<Entry> entries = new ArrayList<>();
    private final Map<String, List<Integer>> handlesBySource = new HashMap<>();
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    public VectorIndex(int dimensions) {
        if (dimensions <= 0) {
            throw new IllegalArgumentException("dimensions must be positive");
        }
        this.dimensions = dimensions;
    }

    /**
     * Append a vector together with its response.
     *
     * @param vector      the vector to index, copied on insertion
     * @param sourceQuery text of the durable record the response was taken from
     * @param response    the response returned when this entry matches
     * @return the handle of the new entry, one past the previous maximum
     */
    public int add(float[] vector, String sourceQuery, String response) {
        checkDimensions(vector);
        Entry entry = new Entry(vector.clone(), response);
        lock.writeLock().lock();
        try {
            int handle = entries.size();
            entries.add(entry);
            handlesBySource.computeIfAbsent(sourceQuery, key -> new ArrayList<>()).add(handle);
            return handle;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Find the {@code k} entries with the highest inner product to the vector,
     * ordered by descending similarity. Equal similarities keep handle order.
     */
    public List<Neighbor> search(float[] vector, int k) {
        if (k <= 0) {
            throw new IllegalArgumentException("k must be positive");
        }
        checkDimensions(vector);
        lock.readLock().lock();
        try {
            List<Neighbor> neighbors = new ArrayList<>(entries.size());
            for (int handle = 0; handle < entries.size(); handle++) {
                neighbors.add(new Neighbor(handle, innerProduct(vector, entries.get(handle).vector)));
            }
            neighbors.sort(BY_SIMILARITY);
            return List.copyOf(neighbors.subList(0, Math.min(k, neighbors.size())));
        } finally {
            lock.readLock().unlock();
        }
    }

    public Optional<String> get(int handle) {
        lock.readLock().lock();
        try {
            if (handle < 0 || handle >= entries.size()) {
                return Optional.empty();
            }
            return Optional.ofNullable(entries.get(handle).response);
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Replace the response of an existing entry. Together with {@link #get(int)} this
     * is the handle to response map; the cache itself updates responses through
     * {@link #refresh(String, String)}. New handles are only created by
     * {@link #add(float[], String, String)}.
     */
    public void set(int handle, String response) {
        lock.writeLock().lock();
        try {
            if (handle < 0 || handle >= entries.size()) {
                throw new IllegalArgumentException("Unknown handle " + handle);
            }
            entries.get(handle).response = response;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Replace the response of every entry that was derived from the given durable
     * record.
     *
     * @return the number of entries updated
     */
    public int refresh(String sourceQuery, String response) {
        lock.writeLock().lock();
        try {
            List<Integer> handles = handlesBySource.getOrDefault(sourceQuery, List.of());
            handles.forEach(handle -> entries.get(handle).response = response);
            return handles.size();
        } finally {
            lock.writeLock().unlock();
        }
    }

    public int size() {
        lock.readLock().lock();
        try {
            return entries.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    static double innerProduct(float[] left, float[] right) {
        if (left.length != right.length) {
            throw new IllegalArgumentException(
                    "Vectors must have same dimension: " + left.length + " != " + right.length);
        }
        double sum = 0.0d;
        for (int i = 0; i < left.length; i++) {
            sum += (double) left[i] * right[i];
        }
        return sum;
    }

    private void checkDimensions(float[] vector) {
        if (vector.length != dimensions) {
            throw new IllegalArgumentException(
                    "Expected vector with " + dimensions + " dimensions but got " + vector.length);
        }
    }

    /**
     * Search result: the handle of an entry and its similarity to the query vector.
     */
    public record Neighbor(int handle, double similarity) {
    }

    private static final class Entry {

        private final float[] vector;
        private String response;

        Entry(float[] vector, String response) {
            this.vector = vector;
            this.response = response;
        }
    }
}
