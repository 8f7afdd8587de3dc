package space.ketterling.climatecache.cache;

import space.ketterling.climatecache.CacheException;

/**
 * Raised when a current-version cache document does not have the layout the
 * schema registry declares.
 */
public class CacheFormatException extends CacheException {

    public CacheFormatException(String message) {
        super(message);
    }

    public CacheFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
