package space.ketterling.climatecache;

/**
 * Base type for errors raised by the climate cache.
 *
 * <p>
 * Subclasses abort the current file or place only; callers higher up decide
 * whether to continue with the rest of a batch.
 * </p>
 */
public class CacheException extends RuntimeException {

    public CacheException(String message) {
        super(message);
    }

    public CacheException(String message, Throwable cause) {
        super(message, cause);
    }
}
