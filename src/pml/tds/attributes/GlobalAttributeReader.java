package pml.tds.attributes;

import java.io.IOException;
import java.util.Map;

/**
 * Source of the global attributes of a data file.
 */
public interface GlobalAttributeReader {

    /**
     * @return attribute name to value, where a value is either a String or a Number
     */
    Map<String, Object> read(String file) throws IOException;
}
