package pml.tds.attributes;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The global attributes computed for an aggregation, the attributes that
 * should be removed from it, and which naming schemes the values came from.
 */
public class MergedAttributes {

    private final Map<String, MergedAttribute> attributes = new LinkedHashMap<>();
    private final List<String> removals = new ArrayList<>();
    private TimeCoverageSchema timeCoverageSchema;
    private BoundingBoxSchema boundingBoxSchema;

    public void put(String name, String value) {
        put(name, value, MergedAttribute.STRING);
    }

    public void put(String name, String value, String type) {
        attributes.put(name, new MergedAttribute(name, value, type));
    }

    public void remove(String name) {
        removals.add(name);
    }

    public MergedAttribute get(String name) {
        return attributes.get(name);
    }

    /**
     * @return the value of the named attribute, or null
     */
    public String getValue(String name) {
        MergedAttribute attribute = attributes.get(name);
        return attribute == null ? null : attribute.getValue();
    }

    public boolean contains(String name) {
        return attributes.containsKey(name);
    }

    public Collection<MergedAttribute> getAttributes() {
        return Collections.unmodifiableCollection(attributes.values());
    }

    public List<String> getRemovals() {
        return Collections.unmodifiableList(removals);
    }

    /**
     * @return the scheme the time coverage was taken from, or null if none was found
     */
    public TimeCoverageSchema getTimeCoverageSchema() {
        return timeCoverageSchema;
    }

    void setTimeCoverageSchema(TimeCoverageSchema timeCoverageSchema) {
        this.timeCoverageSchema = timeCoverageSchema;
    }

    /**
     * @return the scheme the bounding box was taken from, or null if none was found
     */
    public BoundingBoxSchema getBoundingBoxSchema() {
        return boundingBoxSchema;
    }

    void setBoundingBoxSchema(BoundingBoxSchema boundingBoxSchema) {
        this.boundingBoxSchema = boundingBoxSchema;
    }
}
