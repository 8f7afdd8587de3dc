package space.ketterling.climatecache.cache;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Place block of a cache document.
 *
 * <p>
 * Coordinates are boxed because legacy documents may omit them. The grid
 * coordinates record the nearest source grid point and are kept once set.
 * </p>
 */
public record Place(
        String name,
        Double lat,
        Double lon,
        String timezone,
        Double gridLat,
        Double gridLon) {

    static Place fromNode(JsonNode node) {
        if (node == null || !node.isObject())
            return null;
        return new Place(
                text(node.get("name")),
                number(node.get("lat")),
                number(node.get("lon")),
                text(node.get("timezone")),
                number(node.get("grid_lat")),
                number(node.get("grid_lon")));
    }

    /**
     * Keeps this place's grid coordinates when already recorded.
     */
    public Place withGridIfAbsent(double lat, double lon) {
        if (gridLat != null && gridLon != null)
            return this;
        return new Place(name, this.lat, this.lon, timezone, lat, lon);
    }

    private static String text(JsonNode v) {
        if (v == null || v.isNull())
            return null;
        return v.asText();
    }

    private static Double number(JsonNode v) {
        if (v == null || v.isNull())
            return null;
        if (v.isNumber())
            return v.asDouble();
        try {
            return Double.parseDouble(v.asText().trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
