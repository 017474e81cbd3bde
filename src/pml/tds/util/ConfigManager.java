package pml.tds.util;

import org.jdom2.Document;
import org.jdom2.Element;
import org.jdom2.JDOMException;
import pml.tds.aggregation.AggregationType;
import pml.tds.jdo.DatasetOverrides;
import pml.tds.jdo.OverrideRule;
import pml.tds.jdom.JDOMUtils;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Loads the settings file, by default {@code resources/tds.xml} from the class path.
 */
public class ConfigManager {

    public static final String DEFAULT_RESOURCE = "resources/tds.xml";

    public InputStream getConfig() {
        return getConfig(DEFAULT_RESOURCE);
    }

    public InputStream getConfig(String resource) {
        ClassLoader classLoader = getClass().getClassLoader();
        return classLoader.getResourceAsStream(resource);
    }

    public TdsConfig load() throws IOException, JDOMException {
        return load(DEFAULT_RESOURCE);
    }

    public TdsConfig load(String resource) throws IOException, JDOMException {
        InputStream in = getConfig(resource);
        if ( in == null ) {
            throw new IOException("Configuration resource " + resource + " not found on the class path");
        }
        Document doc = new Document();
        try {
            JDOMUtils.XML2JDOM(new InputStreamReader(in, StandardCharsets.UTF_8), doc);
        } finally {
            in.close();
        }
        return parse(doc);
    }

    public TdsConfig load(File file) throws IOException, JDOMException {
        Document doc = new Document();
        JDOMUtils.XML2JDOM(file, doc);
        return parse(doc);
    }

    TdsConfig parse(Document doc) {
        TdsConfig config = new TdsConfig();
        Element root = doc.getRootElement();

        List<Element> roots = root.getChildren("datasetRoot");
        for (int i = 0; i < roots.size(); i++) {
            Element datasetRoot = roots.get(i);
            String path = datasetRoot.getAttributeValue("path");
            String location = datasetRoot.getAttributeValue("location");
            if ( path == null || location == null ) {
                throw new IllegalArgumentException("datasetRoot needs both path and location");
            }
            config.getDatasetRoots().put(path, location);
        }

        String authority = root.getChildTextTrim("authority");
        if ( authority != null ) {
            config.setAuthority(authority);
        }
        String viewer = root.getChildTextTrim("viewer");
        if ( viewer != null ) {
            config.setViewer(viewer);
        }
        String history = root.getChildTextTrim("history");
        if ( history != null ) {
            config.setHistoryText(history);
        }

        Element overrides = root.getChild("overrides");
        if ( overrides != null ) {
            List<Element> ruleEls = overrides.getChildren("rule");
            for (int i = 0; i < ruleEls.size(); i++) {
                config.getOverrideRules().add(parseRule(ruleEls.get(i)));
            }
        }
        return config;
    }

    private OverrideRule parseRule(Element ruleE) {
        String match = ruleE.getAttributeValue("match", "prefix");
        String value = ruleE.getAttributeValue("value");
        if ( value == null ) {
            throw new IllegalArgumentException("Override rule without a value");
        }
        OverrideRule.Match kind;
        try {
            kind = OverrideRule.Match.valueOf(match.toUpperCase());
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown rule match '" + match + "' for " + value, e);
        }
        AggregationType joinType = AggregationType.fromNcmlName(
                ruleE.getAttributeValue("joinType", AggregationType.JOIN_EXISTING.getNcmlName()));
        DatasetOverrides overrides = new DatasetOverrides(
                ruleE.getAttributeValue("filePattern"),
                joinType,
                ruleE.getAttributeValue("coordinates", DatasetOverrides.VARIABLE_COORDINATES));

        OverrideRule rule = new OverrideRule(kind, value, overrides);
        List<Element> unless = ruleE.getChildren("unless");
        for (int i = 0; i < unless.size(); i++) {
            String contains = unless.get(i).getAttributeValue("contains");
            if ( contains != null ) {
                rule.addUnlessContains(contains);
            }
        }
        return rule;
    }
}
