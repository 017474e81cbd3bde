package pml.tds.catalog;

import org.apache.commons.io.filefilter.FileFilterUtils;
import org.apache.commons.io.filefilter.IOFileFilter;
import org.apache.commons.lang3.StringUtils;
import org.jdom2.JDOMException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pml.tds.jdom.ThreddsXml;
import pml.tds.util.TdsConfig;

import java.io.File;
import java.io.FileFilter;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Runs the catalog transformation over a list of catalog files. A catalog
 * that fails is reported and the batch moves on to the next one.
 */
public class CatalogBatch {

    private static final Logger LOG = LoggerFactory.getLogger(CatalogBatch.class);

    public static final String CATALOG_PREFIX = "esacci";

    private final TdsConfig config;
    private final File outputDir;
    private final File ncmlDir;
    private final String remoteAggregationsDir;

    private boolean createAggregations = true;
    private boolean addWms = false;
    private boolean doWcs = true;
    private File topLevelCatalog;
    private File topLevelTemplate;
    private String refPrefix = "";

    public CatalogBatch(TdsConfig config, File outputDir, File ncmlDir, String remoteAggregationsDir) {
        this.config = config;
        this.outputDir = outputDir;
        this.ncmlDir = ncmlDir;
        this.remoteAggregationsDir = remoteAggregationsDir;
    }

    /**
     * @return the number of catalogs written
     */
    public int processAll(List<File> catalogs) throws IOException, JDOMException {
        int processed = 0;
        for (int i = 0; i < catalogs.size(); i++) {
            File catalog = catalogs.get(i);
            LOG.info("Processing {}", catalog.getName());
            try {
                process(catalog);
                processed++;
            } catch (IOException | JDOMException | RuntimeException e) {
                LOG.warn("{} failed", catalog.getName(), e);
            }
        }
        LOG.info("Processed {} of {} catalogs", processed, catalogs.size());

        if ( topLevelCatalog != null ) {
            writeTopLevelCatalog();
        }
        return processed;
    }

    public CatalogTransformer process(File catalog) throws IOException, JDOMException {
        CatalogTransformer transformer = new CatalogTransformer(ThreddsXml.read(catalog), config, remoteAggregationsDir);
        transformer.setDoWcs(doWcs);
        transformer.allChanges(createAggregations, addWms);
        transformer.write(new File(outputDir, catalog.getName()), ncmlDir);
        return transformer;
    }

    /**
     * Link every catalog in the output directory from the top level catalog.
     */
    public void writeTopLevelCatalog() throws IOException, JDOMException {
        TopLevelCatalog top = topLevelTemplate == null ? new TopLevelCatalog() : new TopLevelCatalog(topLevelTemplate);
        List<File> written = listCatalogs(outputDir);
        for (int i = 0; i < written.size(); i++) {
            String filename = written.get(i).getName();
            String name = filename.substring(0, filename.length() - ".xml".length());
            top.addRef(refPrefix.isEmpty() ? filename : refPrefix + "/" + filename, name);
        }
        top.write(topLevelCatalog);
        LOG.info("Wrote top level catalog {} with {} references", topLevelCatalog, written.size());
    }

    /**
     * @return the dataset catalogs in a directory, sorted by name
     */
    public static List<File> listCatalogs(File dir) {
        IOFileFilter filter = FileFilterUtils.and(
                FileFilterUtils.fileFileFilter(),
                FileFilterUtils.prefixFileFilter(CATALOG_PREFIX),
                FileFilterUtils.suffixFileFilter(".xml"));
        File[] files = dir.listFiles((FileFilter) filter);
        if ( files == null ) {
            return new ArrayList<>();
        }
        Arrays.sort(files);
        return new ArrayList<>(Arrays.asList(files));
    }

    public void setCreateAggregations(boolean createAggregations) {
        this.createAggregations = createAggregations;
    }

    public void setAddWms(boolean addWms) {
        this.addWms = addWms;
    }

    public void setDoWcs(boolean doWcs) {
        this.doWcs = doWcs;
    }

    public void setTopLevelCatalog(File topLevelCatalog) {
        this.topLevelCatalog = topLevelCatalog;
    }

    public void setTopLevelTemplate(File topLevelTemplate) {
        this.topLevelTemplate = topLevelTemplate;
    }

    /**
     * @param refPrefix directory the catalogs are served from, relative to the top level catalog
     */
    public void setRefPrefix(String refPrefix) {
        this.refPrefix = StringUtils.removeEnd(refPrefix, "/");
    }
}
