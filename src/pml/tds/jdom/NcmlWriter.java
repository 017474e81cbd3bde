package pml.tds.jdom;

import org.jdom2.Document;
import org.jdom2.Element;
import pml.tds.aggregation.AggregationDescriptor;
import pml.tds.aggregation.NcmlVariable;
import pml.tds.attributes.MergedAttribute;
import pml.tds.attributes.MergedAttributes;

import java.util.List;
import java.util.Map;

/**
 * Renders an aggregation, and optionally its merged global attributes, as an
 * NcML document.
 */
public class NcmlWriter {

    public Element toElement(AggregationDescriptor descriptor) {
        return toElement(descriptor, null);
    }

    public Element toElement(AggregationDescriptor descriptor, MergedAttributes attributes) {
        Element netcdf = new Element("netcdf", ThreddsXml.netcdfns);

        if ( attributes != null ) {
            for (MergedAttribute attribute : attributes.getAttributes()) {
                Element a = new Element("attribute", ThreddsXml.netcdfns);
                a.setAttribute("name", attribute.getName());
                a.setAttribute("value", attribute.getValue());
                a.setAttribute("type", attribute.getType());
                netcdf.addContent(a);
            }
            List<String> removals = attributes.getRemovals();
            for (int i = 0; i < removals.size(); i++) {
                Element remove = new Element("remove", ThreddsXml.netcdfns);
                remove.setAttribute("name", removals.get(i));
                remove.setAttribute("type", "attribute");
                netcdf.addContent(remove);
            }
        }

        NcmlVariable variable = descriptor.getCoordinateVariable();
        if ( variable != null ) {
            Element v = new Element("variable", ThreddsXml.netcdfns);
            v.setAttribute("name", variable.getName());
            v.setAttribute("type", variable.getType());
            v.setAttribute("shape", variable.getShape());
            for (Map.Entry<String, String> entry : variable.getAttributes().entrySet()) {
                Element a = new Element("attribute", ThreddsXml.netcdfns);
                a.setAttribute("name", entry.getKey());
                a.setAttribute("value", entry.getValue());
                v.addContent(a);
            }
            netcdf.addContent(v);
        }

        Element aggregation = new Element("aggregation", ThreddsXml.netcdfns);
        aggregation.setAttribute("dimName", descriptor.getDimension());
        aggregation.setAttribute("type", descriptor.getType().getNcmlName());
        if ( descriptor.isTimeUnitsChange() ) {
            aggregation.setAttribute("timeUnitsChange", "true");
        }
        List<String> variableAgg = descriptor.getVariableAgg();
        for (int i = 0; i < variableAgg.size(); i++) {
            Element agg = new Element("variableAgg", ThreddsXml.netcdfns);
            agg.setAttribute("name", variableAgg.get(i));
            aggregation.addContent(agg);
        }
        List<AggregationDescriptor.Entry> entries = descriptor.getEntries();
        for (int i = 0; i < entries.size(); i++) {
            AggregationDescriptor.Entry entry = entries.get(i);
            Element file = new Element("netcdf", ThreddsXml.netcdfns);
            file.setAttribute("location", entry.getLocation());
            if ( entry.getCoordValue() != null ) {
                file.setAttribute("coordValue", entry.getCoordValue());
            }
            aggregation.addContent(file);
        }
        netcdf.addContent(aggregation);
        return netcdf;
    }

    public Document toDocument(AggregationDescriptor descriptor, MergedAttributes attributes) {
        return new Document(toElement(descriptor, attributes));
    }
}
