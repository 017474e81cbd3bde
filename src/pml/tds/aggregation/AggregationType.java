package pml.tds.aggregation;

public enum AggregationType {

    JOIN_EXISTING("joinExisting"),
    JOIN_NEW("joinNew");

    private final String ncmlName;

    AggregationType(String ncmlName) {
        this.ncmlName = ncmlName;
    }

    public String getNcmlName() {
        return ncmlName;
    }

    public static AggregationType fromNcmlName(String name) {
        for (AggregationType type : values()) {
            if (type.ncmlName.equalsIgnoreCase(name)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown aggregation type: " + name);
    }
}
