package pml.tds.jdo;

import java.util.ArrayList;
import java.util.List;

/**
 * One entry of the override table: a test on the dataset id and the
 * overrides it selects.
 */
public class OverrideRule {

    public enum Match {
        PREFIX, EQUALS, CONTAINS
    }

    private final Match match;
    private final String value;
    private final List<String> unlessContains = new ArrayList<>();
    private final DatasetOverrides overrides;

    public OverrideRule(Match match, String value, DatasetOverrides overrides) {
        this.match = match;
        this.value = value;
        this.overrides = overrides;
    }

    public void addUnlessContains(String text) {
        unlessContains.add(text);
    }

    public boolean matches(String datasetId) {
        boolean matched;
        switch (match) {
            case PREFIX:
                matched = datasetId.startsWith(value);
                break;
            case EQUALS:
                matched = datasetId.equals(value);
                break;
            default:
                matched = datasetId.contains(value);
                break;
        }
        if ( !matched ) {
            return false;
        }
        for (int i = 0; i < unlessContains.size(); i++) {
            if ( datasetId.contains(unlessContains.get(i)) ) {
                return false;
            }
        }
        return true;
    }

    public Match getMatch() {
        return match;
    }

    public String getValue() {
        return value;
    }

    public DatasetOverrides getOverrides() {
        return overrides;
    }

    @Override
    public String toString() {
        return match.name().toLowerCase() + " '" + value + "'" + (unlessContains.isEmpty() ? "" : " unless " + unlessContains);
    }
}
