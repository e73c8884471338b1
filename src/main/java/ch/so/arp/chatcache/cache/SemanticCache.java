package ch.so.arp.chatcache.cache;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantReadWriteLock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Semantic response cache in front of the language model. Lookups are first
 * answered from the in-memory {@link VectorIndex} (fast path) and fall back to a
 * scan of the {@link QueryStore} (slow path), which also teaches the index the new
 * phrasing. Fresh answers are written to the store and the index.
 * <p>
 * The index only lives as long as this object; {@link #rebuild()} replays the
 * store into a new index and has to run before the first lookup. Lookups and
 * records share a lock that a rebuild takes exclusively, so no write lands in an
 * index that is about to be replaced.
 */
public class SemanticCache {

    private static final Logger LOGGER = LoggerFactory.getLogger(SemanticCache.class);

    private final EmbeddingProvider embeddingProvider;
    private final QueryStore queryStore;
    private final double highThreshold;
    private final double lowThreshold;
    private final int topK;
    private final int dimensions;

    private final ReentrantReadWriteLock rebuildLock = new ReentrantReadWriteLock();
    private volatile VectorIndex index;

    public SemanticCache(EmbeddingProvider embeddingProvider, QueryStore queryStore,
            SemanticCacheProperties properties) {
        this.embeddingProvider = Objects.requireNonNull(embeddingProvider, "embeddingProvider");
        this.queryStore = Objects.requireNonNull(queryStore, "queryStore");
        Objects.requireNonNull(properties, "properties");
        if (properties.getHighThreshold() < properties.getLowThreshold()) {
            throw new IllegalArgumentException("chat.cache.high-threshold (" + properties.getHighThreshold()
                    + ") must not be lower than chat.cache.low-threshold (" + properties.getLowThreshold() + ")");
        }
        if (properties.getTopK() <= 0) {
            throw new IllegalArgumentException("chat.cache.top-k must be positive");
        }
        if (properties.getDimensions() <= 0) {
            throw new IllegalArgumentException("chat.cache.dimensions must be positive");
        }
        this.highThreshold = properties.getHighThreshold();
        this.lowThreshold = properties.getLowThreshold();
        this.topK = properties.getTopK();
        this.dimensions = properties.getDimensions();
    }

    /**
     * Replace the in-memory index with one built from all stored records, in store
     * order, so that handle {@code n} belongs to the n-th record.
     */
    public void rebuild() {
        rebuildLock.writeLock().lock();
        try {
            List<QueryRecord> records = queryStore.findAll();
            VectorIndex fresh = new VectorIndex(dimensions);
            for (QueryRecord record : records) {
                fresh.add(storedEmbedding(record), record.query(), record.response());
            }
            index = fresh;
            LOGGER.info("Semantic cache rebuilt with {} entries", fresh.size());
        } finally {
            rebuildLock.writeLock().unlock();
        }
    }

    /**
     * Look for a previously generated answer to the question or a semantically
     * similar one.
     *
     * @param query the question text
     * @return a fast or slow hit carrying the cached response, or a miss
     * @throws EmbeddingFailureException if the question cannot be embedded
     * @throws StoreFailureException     if the store scan fails
     */
    public CacheLookup lookup(String query) {
        rebuildLock.readLock().lock();
        try {
            return lookup(requireIndex(), query);
        } finally {
            rebuildLock.readLock().unlock();
        }
    }

    private CacheLookup lookup(VectorIndex current, String query) {
        float[] vector = embed(query);

        Optional<String> voted = voteOnNeighbors(current, vector);
        if (voted.isPresent()) {
            LOGGER.debug("Fast path hit for '{}'", query);
            return CacheLookup.fastHit(voted.get(), vector);
        }

        for (QueryRecord record : queryStore.findAll()) {
            double similarity = VectorIndex.innerProduct(vector, storedEmbedding(record));
            if (similarity > lowThreshold) {
                int handle = current.add(vector, record.query(), record.response());
                LOGGER.debug("Slow path hit for '{}' via stored question '{}' (similarity={}, handle={})", query,
                        record.query(), similarity, handle);
                return CacheLookup.slowHit(record.response(), vector);
            }
        }

        LOGGER.debug("Cache miss for '{}'", query);
        return CacheLookup.miss(vector);
    }

    /**
     * Store a freshly generated answer. A new question is appended to the index; for
     * a known question every index entry derived from it gets the new response.
     *
     * @param query     the question text
     * @param embedding the embedding of the question, as returned by the lookup
     * @param response  the generated answer
     * @return {@code true} if the question was not stored before
     * @throws StoreFailureException if the store rejects the write
     */
    public boolean record(String query, float[] embedding, String response) {
        Objects.requireNonNull(query, "query");
        Objects.requireNonNull(response, "response");
        rebuildLock.readLock().lock();
        try {
            return record(requireIndex(), query, embedding, response);
        } finally {
            rebuildLock.readLock().unlock();
        }
    }

    private boolean record(VectorIndex current, String query, float[] embedding, String response) {
        if (embedding.length != dimensions) {
            throw new IllegalArgumentException(
                    "Expected embedding with " + dimensions + " dimensions but got " + embedding.length);
        }

        boolean wasNew = queryStore.upsert(query, embedding, response);
        if (wasNew) {
            int handle = current.add(embedding, query, response);
            LOGGER.info("Cached answer for new question '{}' at handle {}", query, handle);
        } else {
            int refreshed = current.refresh(query, response);
            LOGGER.info("Updated answer for known question '{}' ({} index entries refreshed)", query, refreshed);
        }
        return wasNew;
    }

    /**
     * Number of entries in the in-memory index.
     */
    public int size() {
        VectorIndex current = index;
        return current == null ? 0 : current.size();
    }

    public boolean isReady() {
        return index != null;
    }

    private Optional<String> voteOnNeighbors(VectorIndex current, float[] vector) {
        Map<String, Integer> votes = new LinkedHashMap<>();
        for (VectorIndex.Neighbor neighbor : current.search(vector, topK)) {
            if (neighbor.similarity() <= highThreshold) {
                break;
            }
            String response = current.get(neighbor.handle())
                    .orElseThrow(() -> new InconsistentIndexStateException(
                            "No response cached for handle " + neighbor.handle()));
            votes.merge(response, 1, Integer::sum);
        }

        // insertion order is descending similarity, so the first of equally voted responses wins
        String winner = null;
        int best = 0;
        for (Map.Entry<String, Integer> vote : votes.entrySet()) {
            if (vote.getValue() > best) {
                winner = vote.getKey();
                best = vote.getValue();
            }
        }
        return Optional.ofNullable(winner);
    }

    private float[] embed(String query) {
        float[] vector;
        try {
            vector = embeddingProvider.embed(query);
        } catch (RuntimeException ex) {
            throw new EmbeddingFailureException("Unable to embed question: " + ex.getMessage(), ex);
        }
        if (vector == null || vector.length != dimensions) {
            throw new EmbeddingFailureException("Embedding provider returned "
                    + (vector == null ? "no vector" : vector.length + " dimensions") + ", expected " + dimensions);
        }
        return vector;
    }

    private float[] storedEmbedding(QueryRecord record) {
        float[] embedding = record.embedding();
        if (embedding.length != dimensions) {
            throw new StoreFailureException("Stored question " + record.id() + " has an embedding with "
                    + embedding.length + " dimensions, expected " + dimensions);
        }
        return embedding;
    }

    private VectorIndex requireIndex() {
        VectorIndex current = index;
        if (current == null) {
            throw new IllegalStateException("Semantic cache has not been rebuilt from the store yet");
        }
        return current;
    }
}
