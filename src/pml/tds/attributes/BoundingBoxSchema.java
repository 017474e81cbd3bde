package pml.tds.attributes;

/**
 * Names of the north, east, south and west bounds of a file, in order of
 * preference.
 */
public enum BoundingBoxSchema {

    GEOSPATIAL("geospatial_lat_max", "geospatial_lon_max", "geospatial_lat_min", "geospatial_lon_min"),
    EXTREMES("northernmost_latitude", "easternmost_longitude", "southernmost_latitude", "westernmost_longitude");

    private final String north;
    private final String east;
    private final String south;
    private final String west;

    BoundingBoxSchema(String north, String east, String south, String west) {
        this.north = north;
        this.east = east;
        this.south = south;
        this.west = west;
    }

    /**
     * @return the four names in N, E, S, W order
     */
    public String[] names() {
        return new String[]{north, east, south, west};
    }
}
