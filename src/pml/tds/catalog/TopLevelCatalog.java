package pml.tds.catalog;

import org.jdom2.Document;
import org.jdom2.Element;
import org.jdom2.JDOMException;
import pml.tds.jdom.ThreddsXml;

import java.io.File;
import java.io.IOException;

/**
 * The catalog that links to every dataset catalog with a catalogRef.
 */
public class TopLevelCatalog {

    private final ThreddsXml xml;

    public TopLevelCatalog() {
        Element root = new Element("catalog", ThreddsXml.ns);
        root.setAttribute("name", "THREDDS Server Default Catalog");
        this.xml = new ThreddsXml(new Document(root));
    }

    /**
     * Start from an existing catalog, e.g. one that already declares services.
     */
    public TopLevelCatalog(File template) throws IOException, JDOMException {
        this.xml = ThreddsXml.read(template);
    }

    public Element addRef(String href, String name) {
        return addRef(href, name, null);
    }

    public Element addRef(String href, String name, String title) {
        if ( title == null ) {
            title = name;
        }
        Element ref = xml.child(xml.getRoot(), "catalogRef", "name", name);
        ref.setAttribute("title", title, ThreddsXml.xlink);
        ref.setAttribute("href", href, ThreddsXml.xlink);
        return ref;
    }

    public Document getDocument() {
        return xml.getDocument();
    }

    public void write(File file) throws IOException {
        xml.write(file);
    }
}
