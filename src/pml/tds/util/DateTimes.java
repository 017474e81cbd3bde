package pml.tds.util;

import org.joda.time.DateTime;
import org.joda.time.DateTimeZone;
import org.joda.time.Period;
import org.joda.time.PeriodType;
import org.joda.time.format.DateTimeFormat;
import org.joda.time.format.DateTimeFormatter;
import org.joda.time.format.ISODateTimeFormat;
import org.joda.time.format.ISOPeriodFormat;

import java.util.Locale;

/**
 * Parsing and printing of the date strings found in NetCDF global attributes.
 * All times are UTC.
 */
public class DateTimes {

    public static final DateTimeFormatter COMPACT = DateTimeFormat.forPattern("yyyyMMdd'T'HHmmss'Z'").withZoneUTC();

    public static final DateTimeFormatter HISTORY = DateTimeFormat.forPattern("yyyy-MM-dd HH:mm:ss").withZoneUTC();

    // Tried in order. The numeric-only patterns come before the ISO parser, which
    // would otherwise read "20000101" as a year.
    private static final DateTimeFormatter[] FORMATS = {
            COMPACT,
            DateTimeFormat.forPattern("yyyyMMddHHmmss'Z'").withZoneUTC(),
            DateTimeFormat.forPattern("yyyyMMdd'T'HHmm'Z'").withZoneUTC(),
            DateTimeFormat.forPattern("yyyyMMddHHmm'Z'").withZoneUTC(),
            DateTimeFormat.forPattern("yyyy-MM-dd'T'HH:mm:ss'Z'").withZoneUTC(),
            // e.g. 24-JUL-2002 04:31:33.070626
            DateTimeFormat.forPattern("dd-MMM-yyyy HH:mm:ss.SSSSSS").withLocale(Locale.ENGLISH).withZoneUTC(),
            DateTimeFormat.forPattern("dd-MMM-yyyy").withLocale(Locale.ENGLISH).withZoneUTC(),
            DateTimeFormat.forPattern("yyyyMMdd").withZoneUTC(),
            ISODateTimeFormat.dateTimeParser().withZoneUTC()
    };

    private DateTimes() {
    }

    /**
     * @throws IllegalArgumentException if none of the known formats match
     */
    public static DateTime parse(String text) {
        if ( text == null ) {
            throw new IllegalArgumentException("No date string");
        }
        String trimmed = text.trim();
        for (int i = 0; i < FORMATS.length; i++) {
            try {
                return FORMATS[i].parseDateTime(trimmed);
            } catch (IllegalArgumentException e) {
                // try the next one
            }
        }
        throw new IllegalArgumentException("Could not parse date string '" + text + "'");
    }

    public static String format(DateTime dateTime) {
        return COMPACT.print(dateTime);
    }

    public static DateTime now() {
        return DateTime.now(DateTimeZone.UTC);
    }

    /**
     * @return end - start as an ISO 8601 duration using days and smaller fields, e.g. P5DT4H15M
     */
    public static String duration(DateTime start, DateTime end) {
        Period period = new Period(start, end, PeriodType.dayTime());
        return ISOPeriodFormat.standard().print(period);
    }
}
