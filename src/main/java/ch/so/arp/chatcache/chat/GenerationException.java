package ch.so.arp.chatcache.chat;

/**
 * The language model could not produce an answer. Nothing is cached in that case.
 */
public class GenerationException extends RuntimeException {

    private final Kind kind;

    public GenerationException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public Kind getKind() {
        return kind;
    }

    public enum Kind {
        /** Network problem, timeout or an overloaded service. */
        SERVICE_UNAVAILABLE,
        /** The service answered with an error status or an unusable body. */
        SERVICE_ERROR
    }
}
