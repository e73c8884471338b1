package ch.so.arp.chatcache.cache;

/**
 * Base type of all failures raised by the semantic cache. A failure is never
 * reported as a cache miss; callers decide whether to fall back to a fresh
 * generation.
 */
public class SemanticCacheException extends RuntimeException {

    public SemanticCacheException(String message) {
        super(message);
    }

    public SemanticCacheException(String message, Throwable cause) {
        super(message, cause);
    }
}
