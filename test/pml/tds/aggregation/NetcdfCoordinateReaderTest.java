package pml.tds.aggregation;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import pml.tds.NetcdfFixture;
import ucar.ma2.DataType;

import java.io.File;
import java.util.Arrays;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("integration")
class NetcdfCoordinateReaderTest {

    @TempDir
    File tempDir;

    private final NetcdfCoordinateReader reader = new NetcdfCoordinateReader();

    @Test
    @DisplayName("Reads value and units of a length-1 time variable")
    void read_returnsValueAndUnits() throws Exception {
        String file = NetcdfFixture.create(tempDir, "a.nc").time("days since 1970-01-01", 300).write();

        CoordinateSample sample = reader.read(file, "time");

        assertThat(sample.getUnits()).isEqualTo("days since 1970-01-01");
        assertThat(sample.getValue().doubleValue()).isEqualTo(300.0);
    }

    @Test
    @DisplayName("Integer coordinates print without a decimal point")
    void read_integerCoordinate() throws Exception {
        String file = NetcdfFixture.create(tempDir, "i.nc")
                .coordinate("time", DataType.INT, "seconds since 1970-01-01", 86400).write();

        CoordinateSample sample = reader.read(file, "time");

        assertThat(sample.getValueString()).isEqualTo("86400");
    }

    @Test
    @DisplayName("A variable without units gives null units")
    void read_withoutUnits() throws Exception {
        String file = NetcdfFixture.create(tempDir, "n.nc").time(null, 1).write();

        assertThat(reader.read(file, "time").getUnits()).isNull();
    }

    @Test
    @DisplayName("More than one value in the coordinate variable is an error")
    void read_wrongShape_throws() throws Exception {
        String file = NetcdfFixture.create(tempDir, "five.nc").time("days since 1970-01-01", 1, 2, 3, 4, 5).write();

        assertThatThrownBy(() -> reader.read(file, "time"))
                .isInstanceOf(AggregationException.class)
                .hasMessageContaining("[5]");
    }

    @Test
    @DisplayName("A missing variable is an error")
    void read_missingVariable_throws() throws Exception {
        String file = NetcdfFixture.create(tempDir, "none.nc").global("title", "no time").write();

        assertThatThrownBy(() -> reader.read(file, "time"))
                .isInstanceOf(AggregationException.class)
                .hasMessageContaining("not found");
    }

    @Test
    @DisplayName("A file that does not exist is an error, not an IOException")
    void read_missingFile_throws() {
        String file = new File(tempDir, "absent.nc").getPath();

        assertThatThrownBy(() -> reader.read(file, "time")).isInstanceOf(AggregationException.class);
    }

    @Test
    @DisplayName("A shape-5 file makes a cached build fail")
    void build_fatalShape() throws Exception {
        String file = NetcdfFixture.create(tempDir, "five.nc").time("days since 1970-01-01", 1, 2, 3, 4, 5).write();

        assertThatThrownBy(() -> new AggregationBuilder().build(Arrays.asList(file), "time", true))
                .isInstanceOf(AggregationException.class);
    }

    @Test
    @DisplayName("Data variables exclude coordinate variables")
    void dataVariables_excludesCoordinates() throws Exception {
        String file = NetcdfFixture.create(tempDir, "v.nc").time("days since 1970-01-01", 1)
                .variable("chlor_a").variable("chlor_a_log10_rmsd").write();

        assertThat(reader.dataVariables(file)).containsExactly("chlor_a", "chlor_a_log10_rmsd");
    }
}
