package pml.tds.publish;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.commons.io.FileUtils;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.File;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class MapfileWriterTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    @TempDir
    File tempDir;

    @Test
    @DisplayName("Versioned ids split into id and version")
    void splitVersionedId_valid() {
        assertThat(MapfileWriter.splitVersionedId("mydataset.v12345")).containsExactly("mydataset", "12345");
        assertThat(MapfileWriter.splitVersionedId("other.dataset.v9")).containsExactly("other.dataset", "9");
    }

    @Test
    @DisplayName("Ids without a numeric version are rejected")
    void splitVersionedId_invalid() {
        assertThatThrownBy(() -> MapfileWriter.splitVersionedId("noversion")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> MapfileWriter.splitVersionedId("badversion.vABCDE")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> MapfileWriter.splitVersionedId("other.v")).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("A mapfile line has id#version, path, size, mtime and checksum")
    void line_format() throws Exception {
        JsonNode file = MAPPER.readTree("{\"size\": 1, \"mtime\": 2.123456, \"sha256\": 3, \"path\": \"/some/file.nc\"}");
        MapfileWriter writer = new MapfileWriter(tempDir);

        assertThat(writer.line("mydataset", "12345", "mydataset.v12345", file, null))
                .isEqualTo("mydataset#12345 | /some/file.nc | 1 | mod_time=2.12346 | checksum=3 | checksum_type=SHA256\n");
        assertThat(writer.line("mydataset", "12345", "mydataset.v12345", file,
                new String[] {"http://tech.notes", "title for the tech notes"}))
                .isEqualTo("mydataset#12345 | /some/file.nc | 1 | mod_time=2.12346 | checksum=3 | checksum_type=SHA256"
                        + " | dataset_tech_notes=http://tech.notes | dataset_tech_notes_title=title for the tech notes\n");
    }

    @Test
    @DisplayName("A missing file key names the dataset")
    void line_missingKey() throws Exception {
        JsonNode file = MAPPER.readTree("{\"size\": 1, \"mtime\": 2, \"path\": \"/some/file.nc\"}");

        assertThatThrownBy(() -> new MapfileWriter(tempDir).line("ds", "1", "ds.v1", file, null))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("ds.v1")
                .hasMessageContaining("sha256");
    }

    @Test
    @DisplayName("Mapfiles go under one directory per leading facet")
    void mapfilePath_usesFacets() {
        MapfileWriter writer = new MapfileWriter(new File("/tmp"), 3);

        assertThat(writer.mapfilePath("my.dataset")).isEqualTo(new File("/tmp/my/dataset/my.dataset"));
        assertThat(writer.mapfilePath("lots.of.facets.in.dataset.name"))
                .isEqualTo(new File("/tmp/lots/of/facets/lots.of.facets.in.dataset.name"));
    }

    @Test
    @DisplayName("Tech notes only appear on the first line")
    void writeAll_techNotesOnFirstLine() throws Exception {
        // Arrange
        File json = new File(tempDir, "input.json");
        FileUtils.writeStringToFile(json, "{\"myds.v1234\": {"
                + "\"tech_note_url\": \"http://tech.notes\", \"tech_note_title\": \"my tech notes\","
                + "\"generate_aggregation\": false, \"include_in_wms\": false,"
                + "\"files\": ["
                + "{\"path\": \"/data/file1.nc\", \"sha256\": \"1\", \"mtime\": 1, \"size\": 1},"
                + "{\"path\": \"/data/file2.nc\", \"sha256\": \"2\", \"mtime\": 2, \"size\": 2}"
                + "]}}", StandardCharsets.UTF_8);
        File out = new File(tempDir, "mapfiles");

        // Act
        List<File> written = new MapfileWriter(out).writeAll(json);

        // Assert
        assertThat(written).containsExactly(new File(out, "myds/v1234/myds.v1234"));
        List<String> lines = FileUtils.readLines(written.get(0), StandardCharsets.UTF_8);
        assertThat(lines).hasSize(2);
        assertThat(lines.get(0)).contains("dataset_tech_notes").startsWith("myds#1234 | /data/file1.nc | 1 | mod_time=1.00000");
        assertThat(lines.get(1)).doesNotContain("dataset_tech_notes");
    }
}
