package ch.so.arp.chatcache.cache;

import java.util.Objects;

/**
 * Outcome of a cache lookup. The embedding of the question is handed back so that
 * a caller recording a freshly generated answer does not have to embed again.
 *
 * @param outcome   how the lookup was resolved
 * @param response  the cached answer, {@code null} on a miss
 * @param embedding the embedding of the looked up question
 */
public record CacheLookup(Outcome outcome, String response, float[] embedding) {

    public CacheLookup {
        Objects.requireNonNull(outcome, "outcome");
        Objects.requireNonNull(embedding, "embedding");
        if ((outcome == Outcome.MISS) != (response == null)) {
            throw new IllegalArgumentException("A response must be present exactly for hits");
        }
    }

    public static CacheLookup fastHit(String response, float[] embedding) {
        return new CacheLookup(Outcome.FAST_HIT, response, embedding);
    }

    public static CacheLookup slowHit(String response, float[] embedding) {
        return new CacheLookup(Outcome.SLOW_HIT, response, embedding);
    }

    public static CacheLookup miss(float[] embedding) {
        return new CacheLookup(Outcome.MISS, null, embedding);
    }

    public boolean isHit() {
        return outcome != Outcome.MISS;
    }

    public enum Outcome {
        /** Answered from the in-memory index without touching the store. */
        FAST_HIT,
        /** Answered by scanning the store; the index was extended afterwards. */
        SLOW_HIT,
        MISS
    }
}
