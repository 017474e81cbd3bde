package pml.tds.catalog;

import org.apache.commons.io.FileUtils;

import java.io.File;
import java.io.IOException;
import java.net.URL;

final class CatalogFixtures {

    static final String TEST_CATALOG = "esacci.TEST.day.L3S.CHL.v1.xml";
    static final String TEST_ID = "esacci.TEST.day.L3S.CHL.v1";
    static final String MIXED_CATALOG = "esacci.TEST.mon.L3S.MIXED.v1.xml";
    static final String MIXED_ID = "esacci.TEST.mon.L3S.MIXED.v1";

    private CatalogFixtures() {
    }

    /**
     * Copy a catalog from the test resources into {@code dir}.
     */
    static File copy(String name, File dir) throws IOException {
        URL url = CatalogFixtures.class.getClassLoader().getResource("resources/catalogs/" + name);
        if ( url == null ) {
            throw new IOException("Missing test catalog " + name);
        }
        File file = new File(dir, name);
        FileUtils.copyURLToFile(url, file);
        return file;
    }
}
