package pml.tds.attributes;

/**
 * Names under which products record the start and end of the period a file
 * covers, in order of preference.
 */
public enum TimeCoverageSchema {

    TIME_COVERAGE("time_coverage_start", "time_coverage_end"),
    START_STOP_TIME("start_time", "stop_time"),
    START_STOP_DATE("start_date", "stop_date"),
    STARTDATE_STOPDATE("startdate", "stopdate"),
    CAPITALIZED_STARTDATE_STOPDATE("Startdate", "Stopdate");

    private final String startName;
    private final String endName;

    TimeCoverageSchema(String startName, String endName) {
        this.startName = startName;
        this.endName = endName;
    }

    public String getStartName() {
        return startName;
    }

    public String getEndName() {
        return endName;
    }
}
