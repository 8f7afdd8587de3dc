package space.ketterling.climatecache.model;

import java.util.Objects;

/**
 * A named place to retrieve observations for.
 *
 * @param name     unique place name, also the cache file key
 * @param lat      latitude in degrees
 * @param lon      longitude in degrees
 * @param timezone IANA zone id used to turn UTC hours into local dates
 */
public record Location(String name, double lat, double lon, String timezone) {

    public Location {
        Objects.requireNonNull(name, "name");
        if (name.isBlank())
            throw new IllegalArgumentException("Location name must not be blank");
        if (timezone == null || timezone.isBlank())
            timezone = "UTC";
    }
}
