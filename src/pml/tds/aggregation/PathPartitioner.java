package pml.tds.aggregation;

import org.apache.commons.lang3.StringUtils;

import java.io.File;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Splits a list of file paths into groups whose members differ only by
 * numeric (date or version) directory components.
 * <p>
 * Two assumptions are made: every file in a directory can be aggregated with
 * the others, and a directory name made only of digits is a date (or version).
 * The file name itself never takes part in the grouping.
 */
public class PathPartitioner {

    public static final char PLACEHOLDER = 'x';

    private final String separator;

    public PathPartitioner() {
        this(File.separator);
    }

    public PathPartitioner(String separator) {
        this.separator = separator;
    }

    /**
     * @return partition key to paths, keys in order of first appearance and
     * paths in input order
     */
    public Map<String, List<String>> partition(List<String> paths) {
        Map<String, List<String>> groups = new LinkedHashMap<>();
        for (int i = 0; i < paths.size(); i++) {
            String path = paths.get(i);
            String key = key(path);
            List<String> group = groups.get(key);
            if ( group == null ) {
                group = new ArrayList<>();
                groups.put(key, group);
            }
            group.add(path);
        }
        return groups;
    }

    /**
     * The directory part of the path with every all-digit component replaced
     * by the same number of placeholder characters.
     */
    public String key(String path) {
        String[] components = path.split(Pattern.quote(separator), -1);
        List<String> directories = new ArrayList<>();
        for (int i = 0; i < components.length - 1; i++) {
            String component = components[i];
            if ( StringUtils.isNumeric(component) ) {
                directories.add(StringUtils.repeat(PLACEHOLDER, component.length()));
            } else {
                directories.add(component);
            }
        }
        return StringUtils.join(directories, separator);
    }
}
