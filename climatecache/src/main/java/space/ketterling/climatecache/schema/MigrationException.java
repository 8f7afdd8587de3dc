package space.ketterling.climatecache.schema;

import space.ketterling.climatecache.CacheException;

/**
 * Raised when a legacy document cannot be upgraded to the current schema.
 * The source file is left as it was.
 */
public class MigrationException extends CacheException {

    public MigrationException(String message) {
        super(message);
    }

    public MigrationException(String message, Throwable cause) {
        super(message, cause);
    }
}
