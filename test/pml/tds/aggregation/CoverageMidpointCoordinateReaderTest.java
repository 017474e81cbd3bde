package pml.tds.aggregation;

import org.joda.time.DateTime;
import org.joda.time.DateTimeZone;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import pml.tds.NetcdfFixture;

import java.io.File;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("integration")
class CoverageMidpointCoordinateReaderTest {

    @TempDir
    File tempDir;

    private final CoverageMidpointCoordinateReader reader = new CoverageMidpointCoordinateReader();

    private static long seconds(int year, int month, int day, int hour) {
        return new DateTime(year, month, day, hour, 0, 0, DateTimeZone.UTC).getMillis() / 1000;
    }

    @Test
    @DisplayName("The midpoint of time_coverage_start and time_coverage_end")
    void read_timeCoverage() throws Exception {
        String file = NetcdfFixture.create(tempDir, "aerosol.nc")
                .global("time_coverage_start", "20080101T000000Z")
                .global("time_coverage_end", "20080103T000000Z")
                .write();

        CoordinateSample sample = reader.read(file, "time");

        assertThat(sample.getValue().longValue()).isEqualTo(seconds(2008, 1, 2, 0));
        assertThat(sample.getUnits()).isEqualTo(CoverageMidpointCoordinateReader.UNITS);
    }

    @Test
    @DisplayName("Falls back to startdate and stopdate")
    void read_startdateStopdate() throws Exception {
        String file = NetcdfFixture.create(tempDir, "s.nc")
                .global("startdate", "20080101")
                .global("stopdate", "20080101T120000Z")
                .write();

        assertThat(reader.read(file, "time").getValue().longValue()).isEqualTo(seconds(2008, 1, 1, 6));
    }

    @Test
    @DisplayName("GOMOS files count days from the modified Julian day epoch")
    void read_gomos() throws Exception {
        // Day 0 runs from 1858-11-17T00:00:00 to 23:59:59
        String file = NetcdfFixture.create(tempDir, "g.nc")
                .global("title", "GOMOS aerosol product")
                .global("startDate", "0")
                .global("endDate", "0")
                .write();

        long start = seconds(1858, 11, 17, 0);
        assertThat(reader.read(file, "time").getValue().longValue()).isBetween(start + 43199, start + 43200);
    }

    @Test
    @DisplayName("Uses dates at the start of the file name as a last resort")
    void read_filenameDates() throws Exception {
        String file = NetcdfFixture.create(tempDir, "20080101-20080105-ESACCI-L3C_AEROSOL.nc")
                .global("title", "aerosol")
                .write();

        assertThat(reader.read(file, "time").getValue().longValue()).isEqualTo(seconds(2008, 1, 3, 0));
    }

    @Test
    @DisplayName("Only time coordinates are supported")
    void read_otherDimension_throws() throws Exception {
        String file = NetcdfFixture.create(tempDir, "x.nc").global("title", "x").write();

        assertThatThrownBy(() -> reader.read(file, "lat")).isInstanceOf(AggregationException.class);
    }

    @Test
    @DisplayName("A file with no usable dates is an error")
    void read_noDates_throws() throws Exception {
        String file = NetcdfFixture.create(tempDir, "plain.nc").global("title", "x").write();

        assertThatThrownBy(() -> reader.read(file, "time"))
                .isInstanceOf(AggregationException.class)
                .hasMessageContaining("Could not determine start and end time");
    }

    @Test
    @DisplayName("Declares an int time variable for joinNew aggregations")
    void coordinateVariable_describesTime() {
        NcmlVariable variable = reader.coordinateVariable("time");

        assertThat(variable.getType()).isEqualTo("int");
        assertThat(variable.getAttributes()).containsEntry("units", CoverageMidpointCoordinateReader.UNITS)
                .containsEntry("standard_name", "time");
    }
}
