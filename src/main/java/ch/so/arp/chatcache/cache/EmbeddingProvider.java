package ch.so.arp.chatcache.cache;

/**
 * Strategy abstraction used to compute embeddings for questions. Implementations
 * can either call a remote embedding API or provide deterministic placeholders
 * that are suited for tests and local development.
 * <p>
 * The semantic cache compares vectors by their inner product, so implementations
 * must return L2-normalised vectors and the same vector for the same text.
 */
@FunctionalInterface
public interface EmbeddingProvider {

    /**
     * Create an embedding vector for the provided text.
     *
     * @param text the text to embed
     * @return the embedding represented as a float array
     */
    float[] embed(String text);
}
