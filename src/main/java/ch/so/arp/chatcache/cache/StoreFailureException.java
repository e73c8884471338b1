package ch.so.arp.chatcache.cache;

/**
 * Reading from or writing to the durable query store failed.
 */
public class StoreFailureException extends SemanticCacheException {

    public StoreFailureException(String message) {
        super(message);
    }

    public StoreFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}
