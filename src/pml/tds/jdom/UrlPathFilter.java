package pml.tds.jdom;

import org.jdom2.Element;
import org.jdom2.filter.ElementFilter;

/**
 * Matches {@code <dataset>} elements carrying a {@code urlPath} attribute,
 * optionally only those served by a named service.
 */
public class UrlPathFilter extends ElementFilter {

    private final String serviceName;

    public UrlPathFilter() {
        this(null);
    }

    public UrlPathFilter(String serviceName) {
        super("dataset");
        this.serviceName = serviceName;
    }

    @Override
    public Element filter(Object content) {
        Element element = super.filter(content);
        if ( element == null || element.getAttributeValue("urlPath") == null ) {
            return null;
        }
        if ( serviceName != null && !serviceName.equals(element.getAttributeValue("serviceName")) ) {
            return null;
        }
        return element;
    }
}
