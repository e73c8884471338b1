package ch.so.arp.chatcache.cache;

/**
 * A handle returned by the vector index has no response attached to it.
 */
public class InconsistentIndexStateException extends SemanticCacheException {

    public InconsistentIndexStateException(String message) {
        super(message);
    }
}
