package pml.tds.aggregation;

/**
 * Raised when an aggregation cannot be built for a group of files: the
 * aggregation dimension is missing or malformed in a file, a file cannot be
 * read, or no file in the group produced a usable coordinate.
 */
public class AggregationException extends Exception {

    public AggregationException(String message) {
        super(message);
    }

    public AggregationException(String message, Throwable cause) {
        super(message, cause);
    }
}
