package pml.tds.jdo;

import pml.tds.aggregation.AggregationType;
import pml.tds.aggregation.CoordinateReader;
import pml.tds.aggregation.CoverageMidpointCoordinateReader;
import pml.tds.aggregation.NetcdfCoordinateReader;

import java.util.regex.Pattern;

/**
 * Per-dataset adjustments for products whose files need special handling.
 */
public class DatasetOverrides {

    public static final String VARIABLE_COORDINATES = "variable";
    public static final String MIDPOINT_COORDINATES = "coverage-midpoint";

    public static final DatasetOverrides DEFAULTS = new DatasetOverrides(null, AggregationType.JOIN_EXISTING, VARIABLE_COORDINATES);

    private final Pattern filePattern;
    private final AggregationType joinType;
    private final String coordinates;

    public DatasetOverrides(String filePattern, AggregationType joinType, String coordinates) {
        this.filePattern = filePattern == null ? null : Pattern.compile(filePattern);
        this.joinType = joinType;
        if ( !VARIABLE_COORDINATES.equals(coordinates) && !MIDPOINT_COORDINATES.equals(coordinates) ) {
            throw new IllegalArgumentException("Unknown coordinate source: " + coordinates);
        }
        this.coordinates = coordinates;
    }

    /**
     * @return true if the file belongs in the aggregation; with a file pattern
     * the path must contain a match of it
     */
    public boolean accepts(String path) {
        return filePattern == null || filePattern.matcher(path).find();
    }

    public CoordinateReader coordinateReader() {
        if ( MIDPOINT_COORDINATES.equals(coordinates) ) {
            return new CoverageMidpointCoordinateReader();
        }
        return new NetcdfCoordinateReader();
    }

    public String getFilePattern() {
        return filePattern == null ? null : filePattern.pattern();
    }

    public AggregationType getJoinType() {
        return joinType;
    }

    public String getCoordinates() {
        return coordinates;
    }
}
