package pml.tds.attributes;

import org.apache.commons.lang3.StringUtils;
import org.joda.time.DateTime;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pml.tds.util.DateTimes;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;
import java.util.UUID;

/**
 * Works out the global attributes of an aggregation from the attributes of
 * its files.
 * <p>
 * The files must be in aggregation order. The first file is the
 * representative one: its history is carried over, and it decides which
 * naming scheme is used for the time coverage and the bounding box. Values
 * are then combined over every file.
 */
public class GlobalAttributeMerger {

    private static final Logger LOG = LoggerFactory.getLogger(GlobalAttributeMerger.class);

    public static final String DEFAULT_HISTORY_TEXT =
            "The CCI Open Data Portal aggregated all files in the dataset over the time variable for OPeNDAP access";

    /**
     * Per-file attributes that are wrong for the aggregation as a whole.
     */
    public static final List<String> STALE_ATTRIBUTES = Collections.unmodifiableList(Arrays.asList(
            "number_of_processed_orbits",
            "number_of_files_composited",
            "creation_date"));

    /**
     * Attributes whose comma separated values are combined over all files.
     */
    public static final List<String> LIST_ATTRIBUTES = Collections.unmodifiableList(Arrays.asList("platform", "sensor"));

    public static final String SOURCE = "source";

    private final GlobalAttributeReader reader;
    private final String historyText;

    public GlobalAttributeMerger() {
        this(new NetcdfGlobalAttributeReader(), DEFAULT_HISTORY_TEXT);
    }

    public GlobalAttributeMerger(GlobalAttributeReader reader, String historyText) {
        this.reader = reader;
        this.historyText = historyText;
    }

    /**
     * @param files files of one aggregation, in aggregation order
     * @param drs   identifier of the aggregate dataset
     */
    public MergedAttributes merge(List<String> files, String drs) {
        MergedAttributes merged = new MergedAttributes();
        if ( files.isEmpty() ) {
            return merged;
        }

        // Read everything up front; each file is opened once.
        Map<String, Map<String, Object>> perFile = new LinkedHashMap<>();
        for (int i = 0; i < files.size(); i++) {
            String file = files.get(i);
            try {
                perFile.put(file, reader.read(file));
            } catch (IOException e) {
                LOG.warn("Could not read global attributes from '{}': {}", file, e.getMessage());
                perFile.put(file, Collections.<String, Object>emptyMap());
            }
        }
        String first = files.get(0);

        DateTime now = DateTimes.now();
        addHistory(merged, first, perFile.get(first), now);
        merged.put("id", drs);
        merged.put("tracking_id", UUID.randomUUID().toString());
        merged.put("date_created", DateTimes.format(now));

        addTimeCoverage(merged, first, perFile);
        addBoundingBox(merged, first, perFile);

        for (int i = 0; i < LIST_ATTRIBUTES.size(); i++) {
            addUnion(merged, LIST_ATTRIBUTES.get(i), perFile, true);
        }
        addUnion(merged, SOURCE, perFile, false);

        for (int i = 0; i < STALE_ATTRIBUTES.size(); i++) {
            merged.remove(STALE_ATTRIBUTES.get(i));
        }
        return merged;
    }

    private void addHistory(MergedAttributes merged, String file, Map<String, Object> attributes, DateTime now) {
        String extra = DateTimes.HISTORY.print(now) + ": " + historyText;
        Object history = attributes.get("history");
        if ( history == null ) {
            LOG.warn("Could not read 'history' global attribute from '{}'", file);
            merged.put("history", extra);
            return;
        }
        String text = String.valueOf(history);
        if ( !text.endsWith(". ") ) {
            text = StringUtils.removeEnd(StringUtils.stripEnd(text, null), ".") + ". ";
        }
        merged.put("history", text + extra);
    }

    private void addTimeCoverage(MergedAttributes merged, String first, Map<String, Map<String, Object>> perFile) {
        TimeCoverageSchema schema = selectTimeCoverage(perFile.get(first));
        if ( schema == null ) {
            LOG.warn("Could not read start/end coverage times from '{}'", first);
            return;
        }
        merged.setTimeCoverageSchema(schema);

        DateTime start = null;
        DateTime end = null;
        for (Map.Entry<String, Map<String, Object>> entry : perFile.entrySet()) {
            Map<String, Object> attributes = entry.getValue();
            try {
                DateTime fileStart = DateTimes.parse(string(attributes.get(schema.getStartName())));
                DateTime fileEnd = DateTimes.parse(string(attributes.get(schema.getEndName())));
                if ( start == null || fileStart.isBefore(start) ) {
                    start = fileStart;
                }
                if ( end == null || fileEnd.isAfter(end) ) {
                    end = fileEnd;
                }
            } catch (IllegalArgumentException e) {
                LOG.warn("Skipping coverage times of '{}': {}", entry.getKey(), e.getMessage());
            }
        }

        String startText = DateTimes.format(start);
        String endText = DateTimes.format(end);
        merged.put(schema.getStartName(), startText);
        merged.put(schema.getEndName(), endText);
        if ( schema != TimeCoverageSchema.TIME_COVERAGE ) {
            merged.put(TimeCoverageSchema.TIME_COVERAGE.getStartName(), startText);
            merged.put(TimeCoverageSchema.TIME_COVERAGE.getEndName(), endText);
        }
        merged.put("time_coverage_duration", DateTimes.duration(start, end));
    }

    /**
     * @return the first scheme whose start and end both parse as dates, or null
     */
    static TimeCoverageSchema selectTimeCoverage(Map<String, Object> attributes) {
        TimeCoverageSchema[] schemas = TimeCoverageSchema.values();
        for (int i = 0; i < schemas.length; i++) {
            Object start = attributes.get(schemas[i].getStartName());
            Object end = attributes.get(schemas[i].getEndName());
            if ( start == null || end == null ) {
                continue;
            }
            try {
                DateTimes.parse(string(start));
                DateTimes.parse(string(end));
                return schemas[i];
            } catch (IllegalArgumentException e) {
                LOG.debug("Coverage times under {} do not parse: {}", schemas[i], e.getMessage());
            }
        }
        return null;
    }

    private void addBoundingBox(MergedAttributes merged, String first, Map<String, Map<String, Object>> perFile) {
        BoundingBoxSchema schema = selectBoundingBox(perFile.get(first));
        if ( schema == null ) {
            LOG.warn("Could not read geospatial bounds from '{}'", first);
            return;
        }
        String[] names = schema.names();
        // N and E take the maximum, S and W the minimum
        double[] box = {Double.NEGATIVE_INFINITY, Double.NEGATIVE_INFINITY,
                Double.POSITIVE_INFINITY, Double.POSITIVE_INFINITY};
        int contributed = 0;
        for (Map.Entry<String, Map<String, Object>> entry : perFile.entrySet()) {
            double[] values = new double[4];
            try {
                for (int i = 0; i < names.length; i++) {
                    values[i] = number(entry.getValue().get(names[i]));
                }
            } catch (IllegalArgumentException e) {
                LOG.warn("Skipping geospatial bounds of '{}': {}", entry.getKey(), e.getMessage());
                continue;
            }
            box[0] = Math.max(box[0], values[0]);
            box[1] = Math.max(box[1], values[1]);
            box[2] = Math.min(box[2], values[2]);
            box[3] = Math.min(box[3], values[3]);
            contributed++;
        }
        if ( contributed == 0 ) {
            LOG.warn("No file has numeric geospatial bounds under {}; bounds left out", schema);
            return;
        }
        merged.setBoundingBoxSchema(schema);
        for (int i = 0; i < names.length; i++) {
            merged.put(names[i], String.valueOf((float) box[i]), MergedAttribute.FLOAT);
        }
    }

    static BoundingBoxSchema selectBoundingBox(Map<String, Object> attributes) {
        BoundingBoxSchema[] schemas = BoundingBoxSchema.values();
        for (int i = 0; i < schemas.length; i++) {
            String[] names = schemas[i].names();
            boolean present = true;
            for (int j = 0; j < names.length; j++) {
                present = present && attributes.containsKey(names[j]);
            }
            if ( present ) {
                return schemas[i];
            }
        }
        return null;
    }

    /**
     * Sorted, de-duplicated values of an attribute over all files. With
     * {@code split} each value is a comma separated list whose items are
     * combined; otherwise each value is taken whole.
     */
    private void addUnion(MergedAttributes merged, String name, Map<String, Map<String, Object>> perFile, boolean split) {
        TreeSet<String> values = new TreeSet<>();
        boolean found = false;
        for (Map<String, Object> attributes : perFile.values()) {
            Object value = attributes.get(name);
            if ( value == null ) {
                continue;
            }
            found = true;
            List<String> items = new ArrayList<>();
            if ( split ) {
                items.addAll(Arrays.asList(StringUtils.split(String.valueOf(value), ',')));
            } else {
                items.add(String.valueOf(value));
            }
            for (int i = 0; i < items.size(); i++) {
                String item = items.get(i).trim();
                if ( !item.isEmpty() ) {
                    values.add(item);
                }
            }
        }
        if ( !found ) {
            LOG.warn("Could not read '{}' global attribute from any file", name);
            return;
        }
        merged.put(name, StringUtils.join(values, ","));
    }

    private static String string(Object value) {
        return value == null ? null : String.valueOf(value);
    }

    private static double number(Object value) {
        if ( value == null ) {
            throw new IllegalArgumentException("attribute missing");
        }
        double number;
        if ( value instanceof Number ) {
            number = ((Number) value).doubleValue();
        } else {
            try {
                number = Double.parseDouble(String.valueOf(value).trim());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("not a number: '" + value + "'", e);
            }
        }
        if ( Double.isNaN(number) || Double.isInfinite(number) ) {
            throw new IllegalArgumentException("not a finite number: '" + value + "'");
        }
        return number;
    }
}
