package pml.tds.catalog;

import org.jdom2.Document;
import org.jdom2.Element;
import org.jdom2.JDOMException;
import org.jdom2.util.IteratorIterable;
import pml.tds.jdom.JDOMUtils;
import pml.tds.jdom.UrlPathFilter;

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Lists the data files a catalog refers to.
 */
public class NetcdfReferenceFinder {

    private final DatasetRoots roots;

    public NetcdfReferenceFinder(DatasetRoots roots) {
        this.roots = roots;
    }

    public List<String> find(File catalog) throws IOException, JDOMException {
        Document doc = new Document();
        JDOMUtils.XML2JDOM(catalog, doc);
        return find(doc);
    }

    /**
     * @return the urlPath of every dataset in the document, with known
     * dataset roots replaced by their directories
     */
    public List<String> find(Document doc) {
        return find(doc, null);
    }

    /**
     * As {@link #find(Document)}, only datasets served by {@code serviceName}
     * (all datasets when null).
     */
    public List<String> find(Document doc, String serviceName) {
        List<String> paths = new ArrayList<>();
        IteratorIterable<Element> datasets = doc.getRootElement().getDescendants(new UrlPathFilter(serviceName));
        for (Element dataset : datasets) {
            paths.add(roots.replaceRoot(dataset.getAttributeValue("urlPath")));
        }
        return paths;
    }
}
