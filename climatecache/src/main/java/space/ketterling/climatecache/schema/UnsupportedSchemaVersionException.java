package space.ketterling.climatecache.schema;

import space.ketterling.climatecache.CacheException;

/**
 * Raised for a cache document that is newer than the supported schema or
 * carries no schema_version at all. Such documents are never coerced.
 */
public class UnsupportedSchemaVersionException extends CacheException {

    public UnsupportedSchemaVersionException(String message) {
        super(message);
    }

    public UnsupportedSchemaVersionException(String message, Throwable cause) {
        super(message, cause);
    }
}
