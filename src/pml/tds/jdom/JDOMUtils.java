package pml.tds.jdom;

import org.jdom2.Document;
import org.jdom2.JDOMException;
import org.jdom2.input.SAXBuilder;
import org.jdom2.output.Format;
import org.jdom2.output.XMLOutputter;

import java.io.File;
import java.io.IOException;
import java.io.OutputStream;
import java.io.PrintStream;
import java.io.Reader;

public class JDOMUtils {

    private JDOMUtils() {
    }

    public static void XML2JDOM(File file, Document doc) throws IOException, JDOMException {
        SAXBuilder builder = new SAXBuilder();
        Document parsed = builder.build(file);
        doc.setRootElement(parsed.detachRootElement());
    }

    public static void XML2JDOM(Reader reader, Document doc) throws IOException, JDOMException {
        SAXBuilder builder = new SAXBuilder();
        Document parsed = builder.build(reader);
        doc.setRootElement(parsed.detachRootElement());
    }

    public static String toString(Document doc) {
        return outputter().outputString(doc);
    }

    public static void write(Document doc, OutputStream out) throws IOException {
        outputter().output(doc, out);
    }

    /**
     * Write the document pretty printed, creating parent directories as needed.
     */
    public static void write(Document doc, File file) throws IOException {
        File parent = file.getAbsoluteFile().getParentFile();
        if ( parent != null && !parent.isDirectory() && !parent.mkdirs() ) {
            throw new IOException("Could not create directory " + parent);
        }
        PrintStream fout = new PrintStream(file, "UTF-8");
        try {
            outputter().output(doc, fout);
        } finally {
            fout.close();
        }
    }

    private static XMLOutputter outputter() {
        XMLOutputter xout = new XMLOutputter();
        Format format = Format.getPrettyFormat();
        format.setLineSeparator(System.getProperty("line.separator"));
        xout.setFormat(format);
        return xout;
    }
}
