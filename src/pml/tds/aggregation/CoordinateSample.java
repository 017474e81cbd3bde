package pml.tds.aggregation;

/**
 * The units and value of a length-1 coordinate variable in one file.
 */
public class CoordinateSample {

    private final String units;
    private final Number value;

    public CoordinateSample(String units, Number value) {
        this.units = units;
        this.value = value;
    }

    /**
     * @return the units attribute, or null when the variable has none
     */
    public String getUnits() {
        return units;
    }

    public Number getValue() {
        return value;
    }

    /**
     * Integral values print without a decimal point, floating values the way
     * Java prints the boxed type.
     */
    public String getValueString() {
        return String.valueOf(value);
    }

    @Override
    public String toString() {
        return value + (units == null ? "" : " " + units);
    }
}
