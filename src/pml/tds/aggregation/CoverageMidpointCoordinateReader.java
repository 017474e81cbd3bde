package pml.tds.aggregation;

import org.joda.time.DateTime;
import org.joda.time.DateTimeZone;
import pml.tds.util.DateTimes;
import ucar.nc2.Attribute;
import ucar.nc2.NetcdfFile;

import java.io.File;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * For products whose files have no time variable: the time coordinate of a
 * file is the midpoint of the period it covers, in whole seconds since the
 * epoch. Aggregations built with this reader must be joinNew.
 */
public class CoverageMidpointCoordinateReader extends NetcdfCoordinateReader {

    public static final String UNITS = "seconds since 1970-01-01 00:00:00 UTC";

    private static final String[][] TIME_ATTRIBUTE_NAMES = {
            {"time_coverage_start", "time_coverage_end"},
            {"startdate", "stopdate"},
            {"Startdate", "Stopdate"}
    };

    // GOMOS files count days from the modified Julian day epoch
    private static final DateTime MJD_EPOCH = new DateTime(1858, 11, 17, 0, 0, 0, DateTimeZone.UTC);

    private static final Pattern FILENAME_DATES = Pattern.compile("^([0-9]{8})-([0-9]{8})");

    @Override
    public CoordinateSample read(String file, String dimension) throws AggregationException {
        if ( !"time".equals(dimension) ) {
            throw new AggregationException("Coverage midpoints only give time coordinates - not '" + dimension + "'");
        }
        DateTime[] range;
        NetcdfFile ncfile = open(file);
        try {
            range = startEnd(ncfile, file);
        } finally {
            close(ncfile);
        }
        long midpoint = (range[0].getMillis() / 1000 + range[1].getMillis() / 1000) / 2;
        return new CoordinateSample(UNITS, midpoint);
    }

    @Override
    public NcmlVariable coordinateVariable(String dimension) {
        return new NcmlVariable(dimension, "int", dimension)
                .addAttribute("units", UNITS)
                .addAttribute("standard_name", "time")
                .addAttribute("calendar", "standard")
                .addAttribute("_CoordinateAxisType", "Time");
    }

    private DateTime[] startEnd(NetcdfFile ncfile, String file) throws AggregationException {
        for (int i = 0; i < TIME_ATTRIBUTE_NAMES.length; i++) {
            Attribute start = ncfile.findGlobalAttribute(TIME_ATTRIBUTE_NAMES[i][0]);
            Attribute end = ncfile.findGlobalAttribute(TIME_ATTRIBUTE_NAMES[i][1]);
            if ( start != null && end != null ) {
                return new DateTime[]{parse(text(start), file), parse(text(end), file)};
            }
        }

        Attribute title = ncfile.findGlobalAttribute("title");
        Attribute startDate = ncfile.findGlobalAttribute("startDate");
        Attribute endDate = ncfile.findGlobalAttribute("endDate");
        if ( title != null && text(title).contains("GOMOS") && startDate != null && endDate != null ) {
            try {
                int startDay = Integer.parseInt(text(startDate).trim());
                int endDay = Integer.parseInt(text(endDate).trim());
                return new DateTime[]{
                        MJD_EPOCH.plusDays(startDay),
                        MJD_EPOCH.plusDays(endDay).plusHours(23).plusMinutes(59).plusSeconds(59)};
            } catch (NumberFormatException e) {
                throw new AggregationException("Error in file '" + new File(file).getName() + "': " + e.getMessage(), e);
            }
        }

        // Last resort: a leading YYYYMMDD-YYYYMMDD in the file name
        Matcher matcher = FILENAME_DATES.matcher(new File(file).getName());
        if ( matcher.find() ) {
            return new DateTime[]{parse(matcher.group(1), file), parse(matcher.group(2), file)};
        }
        throw new AggregationException("Could not determine start and end time for file '" + file + "'");
    }

    private DateTime parse(String text, String file) throws AggregationException {
        try {
            return DateTimes.parse(text);
        } catch (IllegalArgumentException e) {
            throw new AggregationException("Error in file '" + new File(file).getName() + "': " + e.getMessage(), e);
        }
    }

    private static String text(Attribute attribute) {
        if ( attribute.isString() ) {
            return attribute.getStringValue();
        }
        Number number = attribute.getNumericValue();
        return number == null ? "" : String.valueOf(number.longValue());
    }
}
