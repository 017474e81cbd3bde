package pml.tds.catalog;

import org.apache.commons.io.FilenameUtils;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Translates THREDDS {@code urlPath}s into paths on disk using the server's
 * dataset roots.
 */
public class DatasetRoots {

    private final Map<String, String> roots = new LinkedHashMap<>();

    public DatasetRoots(Map<String, String> roots) {
        this.roots.putAll(roots);
    }

    /**
     * The first path component of the urlPath names the dataset root.
     *
     * @throws IllegalArgumentException if the root is unknown
     */
    public String pathOnDisk(String urlPath) {
        int pos = urlPath.indexOf('/');
        if ( pos < 0 ) {
            throw new IllegalArgumentException("urlPath '" + urlPath + "' does not start with a dataset root");
        }
        String root = urlPath.substring(0, pos);
        String location = roots.get(root);
        if ( location == null ) {
            throw new IllegalArgumentException("Unknown dataset root '" + root + "' in urlPath '" + urlPath + "'");
        }
        return FilenameUtils.normalizeNoEndSeparator(location + "/" + urlPath.substring(pos + 1), true);
    }

    /**
     * Replace the first dataset root the path starts with, leaving other paths as they are.
     */
    public String replaceRoot(String urlPath) {
        for (Map.Entry<String, String> entry : roots.entrySet()) {
            if ( urlPath.startsWith(entry.getKey()) ) {
                return entry.getValue() + urlPath.substring(entry.getKey().length());
            }
        }
        return urlPath;
    }

    public Map<String, String> getRoots() {
        return roots;
    }
}
