package pml.tds.aggregation;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@Tag("unit")
@ExtendWith(MockitoExtension.class)
class AggregationBuilderTest {

    private static final String DAYS = "days since 1970-01-01";

    @Mock
    private CoordinateReader reader;

    @Test
    @DisplayName("With cache, files are sorted by coordinate value and the values attached")
    void build_withCache_sortsByValue() throws Exception {
        // Arrange
        when(reader.read("/d/a.nc", "time")).thenReturn(new CoordinateSample(DAYS, 300L));
        when(reader.read("/d/b.nc", "time")).thenReturn(new CoordinateSample(DAYS, 10L));
        AggregationBuilder builder = new AggregationBuilder(reader, AggregationType.JOIN_EXISTING);

        // Act
        AggregationDescriptor descriptor = builder.build(Arrays.asList("/d/a.nc", "/d/b.nc"), "time", true);

        // Assert
        assertThat(descriptor.getLocations()).containsExactly("/d/b.nc", "/d/a.nc");
        assertThat(descriptor.getEntries().get(0).getCoordValue()).isEqualTo("10");
        assertThat(descriptor.getEntries().get(1).getCoordValue()).isEqualTo("300");
        assertThat(descriptor.isTimeUnitsChange()).isFalse();
        assertThat(descriptor.getType()).isEqualTo(AggregationType.JOIN_EXISTING);
        assertThat(descriptor.getDimension()).isEqualTo("time");
    }

    @Test
    @DisplayName("Without cache, input order is kept and no file is opened")
    void build_withoutCache_doesNoIo() throws Exception {
        AggregationBuilder builder = new AggregationBuilder(reader, AggregationType.JOIN_EXISTING);

        AggregationDescriptor descriptor = builder.build(Arrays.asList("/d/a.nc", "/d/b.nc"), "no_such_dimension", false);

        assertThat(descriptor.getLocations()).containsExactly("/d/a.nc", "/d/b.nc");
        assertThat(descriptor.getEntries().get(0).getCoordValue()).isNull();
        verifyNoInteractions(reader);
    }

    @Test
    @DisplayName("Differing units mark the aggregation and drop the cached values")
    void build_differentUnits_setsTimeUnitsChange() throws Exception {
        when(reader.read("/d/1.nc", "time")).thenReturn(new CoordinateSample("days since 1970-01-01", 3L));
        when(reader.read("/d/2.nc", "time")).thenReturn(new CoordinateSample("hours since 1970-01-01", 2L));
        when(reader.read("/d/3.nc", "time")).thenReturn(new CoordinateSample("seconds since 1970-01-01", 1L));
        AggregationBuilder builder = new AggregationBuilder(reader, AggregationType.JOIN_EXISTING);

        AggregationDescriptor descriptor = builder.build(Arrays.asList("/d/1.nc", "/d/2.nc", "/d/3.nc"), "time", true);

        assertThat(descriptor.isTimeUnitsChange()).isTrue();
        for (AggregationDescriptor.Entry entry : descriptor.getEntries()) {
            assertThat(entry.getCoordValue()).isNull();
        }
    }

    @Test
    @DisplayName("Shared units keep a coordinate value on every file")
    void build_sameUnits_keepsValues() throws Exception {
        when(reader.read("/d/1.nc", "time")).thenReturn(new CoordinateSample(DAYS, 1.5));
        when(reader.read("/d/2.nc", "time")).thenReturn(new CoordinateSample(DAYS, 2.5));
        when(reader.read("/d/3.nc", "time")).thenReturn(new CoordinateSample(DAYS, 0.5));
        AggregationBuilder builder = new AggregationBuilder(reader, AggregationType.JOIN_EXISTING);

        AggregationDescriptor descriptor = builder.build(Arrays.asList("/d/1.nc", "/d/2.nc", "/d/3.nc"), "time", true);

        assertThat(descriptor.isTimeUnitsChange()).isFalse();
        assertThat(descriptor.getLocations()).containsExactly("/d/3.nc", "/d/1.nc", "/d/2.nc");
        for (AggregationDescriptor.Entry entry : descriptor.getEntries()) {
            assertThat(entry.getCoordValue()).isNotNull();
        }
    }

    @Test
    @DisplayName("Equal coordinate values keep their input order")
    void build_ties_areStable() throws Exception {
        when(reader.read("/d/z.nc", "time")).thenReturn(new CoordinateSample(DAYS, 5L));
        when(reader.read("/d/a.nc", "time")).thenReturn(new CoordinateSample(DAYS, 5L));
        when(reader.read("/d/m.nc", "time")).thenReturn(new CoordinateSample(DAYS, 1L));
        AggregationBuilder builder = new AggregationBuilder(reader, AggregationType.JOIN_EXISTING);
        List<String> files = Arrays.asList("/d/z.nc", "/d/a.nc", "/d/m.nc");

        AggregationDescriptor first = builder.build(files, "time", true);
        AggregationDescriptor second = builder.build(files, "time", true);

        assertThat(first.getLocations()).containsExactly("/d/m.nc", "/d/z.nc", "/d/a.nc");
        assertThat(second.getLocations()).isEqualTo(first.getLocations());
    }

    @Test
    @DisplayName("Unreadable files are left out; the rest still aggregate")
    void build_skipsUnreadableFiles() throws Exception {
        when(reader.read("/d/bad.nc", "time")).thenThrow(new AggregationException("Variable 'time' not found"));
        when(reader.read("/d/good.nc", "time")).thenReturn(new CoordinateSample(DAYS, 1L));
        AggregationBuilder builder = new AggregationBuilder(reader, AggregationType.JOIN_EXISTING);

        AggregationDescriptor descriptor = builder.build(Arrays.asList("/d/bad.nc", "/d/good.nc"), "time", true);

        assertThat(descriptor.getLocations()).containsExactly("/d/good.nc");
    }

    @Test
    @DisplayName("A group where no file gives a coordinate fails")
    void build_noUsableFile_throws() throws Exception {
        when(reader.read("/d/bad.nc", "time")).thenThrow(new AggregationException("Shape is [5]"));
        AggregationBuilder builder = new AggregationBuilder(reader, AggregationType.JOIN_EXISTING);

        assertThatThrownBy(() -> builder.build(Arrays.asList("/d/bad.nc"), "time", true))
                .isInstanceOf(AggregationException.class)
                .hasMessage("No aggregation could be created");
    }

    @Test
    @DisplayName("joinNew lists the data variables of the first file and declares the coordinate")
    void build_joinNew_addsVariables() throws Exception {
        NcmlVariable time = new NcmlVariable("time", "int", "time");
        when(reader.coordinateVariable("time")).thenReturn(time);
        when(reader.dataVariables("/d/a.nc")).thenReturn(Arrays.asList("AOD550", "AOD870"));
        AggregationBuilder builder = new AggregationBuilder(reader, AggregationType.JOIN_NEW);

        AggregationDescriptor descriptor = builder.build(Arrays.asList("/d/a.nc", "/d/b.nc"), "time", false);

        assertThat(descriptor.getVariableAgg()).containsExactly("AOD550", "AOD870");
        assertThat(descriptor.getCoordinateVariable()).isSameAs(time);
        verify(reader).dataVariables("/d/a.nc");
    }
}
