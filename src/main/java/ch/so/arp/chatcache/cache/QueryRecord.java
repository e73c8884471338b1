package ch.so.arp.chatcache.cache;

import java.util.Arrays;
import java.util.Objects;

/**
 * Durable cache entry. There is exactly one record per distinct query text; the
 * embedding is the one computed when the record was first inserted.
 *
 * @param id         surrogate key, increasing in insertion order
 * @param query      the question text, unique across the store
 * @param embedding  the question embedding
 * @param response   the answer last associated with the question
 * @param usageCount how often the identical question has been recorded
 */
public record QueryRecord(long id, String query, float[] embedding, String response, int usageCount) {

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof QueryRecord)) {
            return false;
        }
        QueryRecord that = (QueryRecord) other;
        return id == that.id
                && usageCount == that.usageCount
                && Objects.equals(query, that.query)
                && Objects.equals(response, that.response)
                && Arrays.equals(embedding, that.embedding);
    }

    @Override
    public int hashCode() {
        return 31 * Objects.hash(id, query, response, usageCount) + Arrays.hashCode(embedding);
    }

    @Override
    public String toString() {
        return "QueryRecord[id=" + id + ", query=" + query + ", embedding=" + Arrays.toString(embedding)
                + ", response=" + response + ", usageCount=" + usageCount + "]";
    }
}
