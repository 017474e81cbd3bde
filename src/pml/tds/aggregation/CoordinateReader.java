package pml.tds.aggregation;

import java.util.List;

/**
 * Reads the per-file information an aggregation needs. Every call opens and
 * closes the file it is given; nothing is cached between calls.
 */
public interface CoordinateReader {

    /**
     * Read the coordinate value of the aggregation dimension in one file.
     *
     * @param file      absolute path of a NetCDF file
     * @param dimension name of the aggregation dimension, e.g. "time"
     * @return the value and units of the coordinate
     * @throws AggregationException if the file cannot be read or does not hold
     *                              a single coordinate value for the dimension
     */
    CoordinateSample read(String file, String dimension) throws AggregationException;

    /**
     * @return the names of the variables in the file that are not coordinate
     * variables, in file order
     */
    List<String> dataVariables(String file) throws AggregationException;

    /**
     * @return a variable the NcML document has to declare for the dimension,
     * or null when the files already carry one
     */
    NcmlVariable coordinateVariable(String dimension);
}
