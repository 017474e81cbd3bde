package pml.tds.aggregation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A virtual dataset joining a group of files along one dimension.
 */
public class AggregationDescriptor {

    private final String dimension;
    private final AggregationType type;
    private final List<Entry> entries;
    private final boolean timeUnitsChange;
    private final NcmlVariable coordinateVariable;
    private final List<String> variableAgg;

    public AggregationDescriptor(String dimension, AggregationType type, List<Entry> entries, boolean timeUnitsChange,
                                 NcmlVariable coordinateVariable, List<String> variableAgg) {
        this.dimension = dimension;
        this.type = type;
        this.entries = Collections.unmodifiableList(new ArrayList<>(entries));
        this.timeUnitsChange = timeUnitsChange;
        this.coordinateVariable = coordinateVariable;
        this.variableAgg = Collections.unmodifiableList(new ArrayList<>(variableAgg));
    }

    public String getDimension() {
        return dimension;
    }

    public AggregationType getType() {
        return type;
    }

    public List<Entry> getEntries() {
        return entries;
    }

    /**
     * @return the file locations in aggregation order
     */
    public List<String> getLocations() {
        List<String> locations = new ArrayList<>();
        for (int i = 0; i < entries.size(); i++) {
            locations.add(entries.get(i).getLocation());
        }
        return locations;
    }

    public boolean isTimeUnitsChange() {
        return timeUnitsChange;
    }

    public NcmlVariable getCoordinateVariable() {
        return coordinateVariable;
    }

    public List<String> getVariableAgg() {
        return variableAgg;
    }

    public static class Entry {
        private final String location;
        private final String coordValue;

        public Entry(String location, String coordValue) {
            this.location = location;
            this.coordValue = coordValue;
        }

        public String getLocation() {
            return location;
        }

        /**
         * @return the cached coordinate value, or null when none is attached
         */
        public String getCoordValue() {
            return coordValue;
        }

        @Override
        public String toString() {
            return coordValue == null ? location : location + " @ " + coordValue;
        }
    }
}
