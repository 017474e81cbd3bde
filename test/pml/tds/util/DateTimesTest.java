package pml.tds.util;

import org.joda.time.DateTime;
import org.joda.time.DateTimeZone;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class DateTimesTest {

    private static final DateTime EXPECTED = new DateTime(2002, 7, 24, 4, 31, 0, DateTimeZone.UTC);

    @Test
    @DisplayName("Parses the date formats found in CCI products")
    void parse_knownFormats() {
        assertThat(DateTimes.parse("20020724T043100Z")).isEqualTo(EXPECTED);
        assertThat(DateTimes.parse("20020724043100Z")).isEqualTo(EXPECTED);
        assertThat(DateTimes.parse("20020724T0431Z")).isEqualTo(EXPECTED);
        assertThat(DateTimes.parse("200207240431Z")).isEqualTo(EXPECTED);
        assertThat(DateTimes.parse("2002-07-24T04:31:00Z")).isEqualTo(EXPECTED);
        assertThat(DateTimes.parse(" 2002-07-24T04:31:00Z ")).isEqualTo(EXPECTED);
        assertThat(DateTimes.parse("24-JUL-2002 04:31:00.000000")).isEqualTo(EXPECTED);
        assertThat(DateTimes.parse("24-JUL-2002")).isEqualTo(EXPECTED.withTimeAtStartOfDay());
        assertThat(DateTimes.parse("20020724")).isEqualTo(EXPECTED.withTimeAtStartOfDay());
    }

    @Test
    @DisplayName("Falls back to ISO 8601 for anything else")
    void parse_iso() {
        assertThat(DateTimes.parse("2002-07-24T06:31:00+02:00").getMillis()).isEqualTo(EXPECTED.getMillis());
    }

    @Test
    @DisplayName("Unknown text is rejected")
    void parse_rejectsGarbage() {
        assertThatThrownBy(() -> DateTimes.parse("not a date")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> DateTimes.parse(null)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Formats as compact UTC")
    void format_compact() {
        assertThat(DateTimes.format(EXPECTED.withZone(DateTimeZone.forOffsetHours(5)))).isEqualTo("20020724T043100Z");
    }

    @Test
    @DisplayName("Durations use days and smaller fields")
    void duration_daysAndTime() {
        DateTime start = DateTimes.parse("20000101T074500Z");
        DateTime end = DateTimes.parse("20000106T120000Z");

        assertThat(DateTimes.duration(start, end)).isEqualTo("P5DT4H15M");
        assertThat(DateTimes.duration(start, start.plusDays(40))).isEqualTo("P40D");
    }
}
