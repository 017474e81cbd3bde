package pml.tds.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pml.tds.jdo.DatasetOverrides;
import pml.tds.jdo.OverrideRule;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Ordered table of dataset overrides. The first rule matching a dataset id
 * decides; a dataset no rule matches gets the defaults.
 */
public class OverrideRules {

    private static final Logger LOG = LoggerFactory.getLogger(OverrideRules.class);

    private final List<OverrideRule> rules = new ArrayList<>();

    public void add(OverrideRule rule) {
        rules.add(rule);
    }

    public DatasetOverrides resolve(String datasetId) {
        for (int i = 0; i < rules.size(); i++) {
            OverrideRule rule = rules.get(i);
            if ( rule.matches(datasetId) ) {
                LOG.debug("Dataset {} matches override rule {}", datasetId, rule);
                return rule.getOverrides();
            }
        }
        return DatasetOverrides.DEFAULTS;
    }

    public List<OverrideRule> getRules() {
        return Collections.unmodifiableList(rules);
    }
}
