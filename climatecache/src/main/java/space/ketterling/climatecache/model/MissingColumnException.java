package space.ketterling.climatecache.model;

import space.ketterling.climatecache.CacheException;

/**
 * Raised when an observation table lacks the value column a measure needs.
 */
public class MissingColumnException extends CacheException {

    public MissingColumnException(String message) {
        super(message);
    }
}
