package ch.so.arp.chatcache.cache;

/**
 * The embedding provider failed or returned a vector of the wrong size. No cache
 * lookup is possible for the current request.
 */
public class EmbeddingFailureException extends SemanticCacheException {

    public EmbeddingFailureException(String message) {
        super(message);
    }

    public EmbeddingFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}
