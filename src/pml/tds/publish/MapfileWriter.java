package pml.tds.publish;

import com.fasterxml.jackson.databind.JsonNode;
import org.apache.commons.io.FileUtils;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Writes ESGF publisher mapfiles, one per dataset, at
 * {@code <out>/A/B/C/D/E/<dataset id>} where A.B.C.D.E are the leading facets
 * of the id.
 */
public class MapfileWriter {

    private static final Logger LOG = LoggerFactory.getLogger(MapfileWriter.class);

    public static final Pattern VERSIONED_ID = Pattern.compile("(.*)\\.v([0-9]+)$");

    private final File outputDir;
    private final int depth;

    public MapfileWriter(File outputDir) {
        this(outputDir, 5);
    }

    public MapfileWriter(File outputDir, int depth) {
        this.outputDir = outputDir;
        this.depth = depth;
    }

    /**
     * @return the mapfiles written
     */
    public List<File> writeAll(File json) throws IOException {
        Map<String, JsonNode> datasets = DatasetJson.read(json);
        List<File> written = new ArrayList<>();
        for (Map.Entry<String, JsonNode> entry : datasets.entrySet()) {
            JsonNode dataset = entry.getValue();
            String[] techNotes = null;
            if ( dataset.hasNonNull("tech_note_url") ) {
                techNotes = new String[] {DatasetJson.text(entry.getKey(), dataset, "tech_note_url"),
                        DatasetJson.text(entry.getKey(), dataset, "tech_note_title")};
            }
            written.add(write(entry.getKey(), dataset.path("files"), techNotes));
        }
        return written;
    }

    public File write(String datasetId, JsonNode files, String[] techNotes) throws IOException {
        String[] split = splitVersionedId(datasetId);
        StringBuilder content = new StringBuilder();
        int i = 0;
        for (JsonNode file : files) {
            // Tech notes go on the first line only
            content.append(line(split[0], split[1], datasetId, file, i == 0 ? techNotes : null));
            i++;
        }
        File mapfile = mapfilePath(datasetId);
        FileUtils.writeStringToFile(mapfile, content.toString(), StandardCharsets.UTF_8);
        LOG.debug("Wrote {} lines to {}", i, mapfile);
        return mapfile;
    }

    public File mapfilePath(String datasetId) {
        List<String> facets = Arrays.asList(datasetId.split("\\."));
        File dir = outputDir;
        for (int i = 0; i < Math.min(depth, facets.size()); i++) {
            dir = new File(dir, facets.get(i));
        }
        return new File(dir, datasetId);
    }

    /**
     * @param techNotes url and title, or null
     */
    public String line(String unversionedId, String version, String datasetId, JsonNode file, String[] techNotes) {
        List<String> parts = new ArrayList<>();
        parts.add(unversionedId + "#" + version);
        parts.add(DatasetJson.text(datasetId, file, "path"));
        parts.add(DatasetJson.text(datasetId, file, "size"));
        parts.add(String.format(Locale.ROOT, "mod_time=%.5f", Double.parseDouble(DatasetJson.text(datasetId, file, "mtime"))));
        parts.add("checksum=" + DatasetJson.text(datasetId, file, "sha256"));
        parts.add("checksum_type=SHA256");
        if ( techNotes != null ) {
            parts.add("dataset_tech_notes=" + techNotes[0]);
            parts.add("dataset_tech_notes_title=" + techNotes[1]);
        }
        return StringUtils.join(parts, " | ") + "\n";
    }

    /**
     * @return unversioned id and version
     */
    public static String[] splitVersionedId(String datasetId) {
        Matcher matcher = VERSIONED_ID.matcher(datasetId);
        if ( !matcher.matches() ) {
            throw new IllegalArgumentException("Dataset ID '" + datasetId + "' does not contain a version number");
        }
        return new String[] {matcher.group(1), matcher.group(2)};
    }
}
