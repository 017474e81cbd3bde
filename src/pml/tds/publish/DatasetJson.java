package pml.tds.publish;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.File;
import java.io.IOException;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Reads the dataset description document shared by the publication tools:
 * a JSON object keyed by dataset id, e.g.
 * <pre>
 * {
 *   "esacci.OC.day.L3S.CHLOR_A.multi-sensor.multi-platform.MERGED.3-1.sinusoidal.v20170101": {
 *     "generate_aggregation": true,
 *     "include_in_wms": false,
 *     "tech_note_url": "...",
 *     "tech_note_title": "...",
 *     "files": [ {"path": "...", "sha256": "...", "mtime": 1234.5, "size": 100}, ... ]
 *   }
 * }
 * </pre>
 */
public class DatasetJson {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    /**
     * @return dataset id to description, in document order
     */
    public static Map<String, JsonNode> read(File file) throws IOException {
        JsonNode root = MAPPER.readTree(file);
        if ( root == null || !root.isObject() ) {
            throw new IOException("Expected a JSON object of datasets in " + file);
        }
        Map<String, JsonNode> datasets = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
        while ( fields.hasNext() ) {
            Map.Entry<String, JsonNode> field = fields.next();
            datasets.put(field.getKey(), field.getValue());
        }
        return datasets;
    }

    static String text(String datasetId, JsonNode node, String key) {
        JsonNode value = node.get(key);
        if ( value == null || value.isNull() ) {
            throw new IllegalArgumentException("Missing key for dataset '" + datasetId + "': " + key);
        }
        return value.asText();
    }

    static boolean flag(JsonNode node, String key) {
        JsonNode value = node.get(key);
        return value != null && value.asBoolean();
    }
}
