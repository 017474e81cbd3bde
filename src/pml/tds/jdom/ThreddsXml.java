package pml.tds.jdom;

import org.jdom2.Document;
import org.jdom2.Element;
import org.jdom2.JDOMException;
import org.jdom2.Namespace;

import java.io.File;
import java.io.IOException;
import java.util.List;

/**
 * Generic editing of a THREDDS catalog document: creating elements in the
 * catalog namespace and placing them in the tree.
 */
public class ThreddsXml {

    public static final Namespace ns = Namespace.getNamespace("http://www.unidata.ucar.edu/namespaces/thredds/InvCatalog/v1.0");
    public static final Namespace netcdfns = Namespace.getNamespace("http://www.unidata.ucar.edu/namespaces/netcdf/ncml-2.2");
    public static final Namespace xlink = Namespace.getNamespace("xlink", "http://www.w3.org/1999/xlink");

    private final Document document;
    private final File source;

    public ThreddsXml(Document document) {
        this(document, null);
    }

    private ThreddsXml(Document document, File source) {
        this.document = document;
        this.source = source;
        document.getRootElement().addNamespaceDeclaration(xlink);
    }

    public static ThreddsXml read(File file) throws IOException, JDOMException {
        Document doc = new Document();
        JDOMUtils.XML2JDOM(file, doc);
        return new ThreddsXml(doc, file);
    }

    public Document getDocument() {
        return document;
    }

    public Element getRoot() {
        return document.getRootElement();
    }

    /**
     * @return the file the catalog was read from, or null
     */
    public File getSource() {
        return source;
    }

    /**
     * A new catalog element. {@code attributes} are name/value pairs.
     */
    public Element element(String name, String... attributes) {
        Element element = new Element(name, ns);
        if ( attributes.length % 2 != 0 ) {
            throw new IllegalArgumentException("Attributes must come in name/value pairs");
        }
        for (int i = 0; i < attributes.length; i += 2) {
            element.setAttribute(attributes[i], attributes[i + 1]);
        }
        return element;
    }

    public Element textElement(String name, String text) {
        Element element = element(name);
        element.setText(text);
        return element;
    }

    public Element child(Element parent, String name, String... attributes) {
        Element child = element(name, attributes);
        parent.addContent(child);
        return child;
    }

    public Element textChild(Element parent, String name, String text) {
        Element child = textElement(name, text);
        parent.addContent(child);
        return child;
    }

    /**
     * Insert the child before the first existing child with a different tag,
     * so that it joins any leading run of elements like it.
     */
    public void insertBeforeSimilar(Element parent, Element newChild) {
        List<Element> children = parent.getChildren();
        for (int i = 0; i < children.size(); i++) {
            Element child = children.get(i);
            if ( !child.getName().equals(newChild.getName()) ) {
                parent.addContent(parent.indexOf(child), newChild);
                return;
            }
        }
        parent.addContent(newChild);
    }

    public List<Element> children(Element parent, String name) {
        return parent.getChildren(name, ns);
    }

    /**
     * @return the first child with the given name, or null
     */
    public Element firstChild(Element parent, String name) {
        return parent.getChild(name, ns);
    }

    public void write(File file) throws IOException {
        JDOMUtils.write(document, file);
    }
}
