package pml.tds.aggregation;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A variable declared directly in an NcML document, e.g. the coordinate
 * variable of a joinNew aggregation that the source files do not have.
 */
public class NcmlVariable {

    private final String name;
    private final String type;
    private final String shape;
    private final Map<String, String> attributes = new LinkedHashMap<>();

    public NcmlVariable(String name, String type, String shape) {
        this.name = name;
        this.type = type;
        this.shape = shape;
    }

    public NcmlVariable addAttribute(String attributeName, String value) {
        attributes.put(attributeName, value);
        return this;
    }

    public String getName() {
        return name;
    }

    public String getType() {
        return type;
    }

    public String getShape() {
        return shape;
    }

    public Map<String, String> getAttributes() {
        return Collections.unmodifiableMap(attributes);
    }
}
