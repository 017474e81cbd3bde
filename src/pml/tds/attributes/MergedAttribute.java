package pml.tds.attributes;

/**
 * One global attribute of an aggregation, as written to NcML.
 */
public class MergedAttribute {

    public static final String STRING = "String";
    public static final String FLOAT = "float";

    private final String name;
    private final String value;
    private final String type;

    public MergedAttribute(String name, String value, String type) {
        this.name = name;
        this.value = value;
        this.type = type;
    }

    public String getName() {
        return name;
    }

    public String getValue() {
        return value;
    }

    public String getType() {
        return type;
    }

    @Override
    public String toString() {
        return name + "=" + value + " (" + type + ")";
    }
}
