package ch.so.arp.chatcache.cache;

import java.util.List;
import java.util.Optional;

/**
 * Durable storage of answered questions. Every method reports storage problems as
 * {@link StoreFailureException}.
 */
public interface QueryStore {

    /**
     * Insert the question or, if it is already known, replace its response and
     * increment its usage count. The stored embedding of an existing record is left
     * untouched. The read-modify-write of the usage count is atomic.
     *
     * @param query     the question text
     * @param embedding the question embedding
     * @param response  the answer
     * @return {@code true} if a new record was created
     */
    boolean upsert(String query, float[] embedding, String response);

    /**
     * All records in insertion order. This order defines the handles assigned when
     * the in-memory index is rebuilt.
     */
    List<QueryRecord> findAll();

    Optional<QueryRecord> findByQuery(String query);
}
