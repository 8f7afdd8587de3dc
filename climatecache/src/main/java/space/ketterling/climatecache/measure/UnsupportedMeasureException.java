package space.ketterling.climatecache.measure;

import space.ketterling.climatecache.CacheException;

public class UnsupportedMeasureException extends CacheException {

    public UnsupportedMeasureException(String message) {
        super(message);
    }
}
