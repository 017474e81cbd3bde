package pml.tds.catalog;

import org.apache.commons.io.FilenameUtils;
import org.apache.commons.lang3.StringUtils;
import org.jdom2.Document;
import org.jdom2.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pml.tds.aggregation.AggregationBuilder;
import pml.tds.aggregation.AggregationDescriptor;
import pml.tds.aggregation.AggregationException;
import pml.tds.aggregation.PathPartitioner;
import pml.tds.attributes.GlobalAttributeMerger;
import pml.tds.attributes.MergedAttributes;
import pml.tds.attributes.NetcdfGlobalAttributeReader;
import pml.tds.jdo.AggregationInfo;
import pml.tds.jdo.DatasetOverrides;
import pml.tds.jdom.JDOMUtils;
import pml.tds.jdom.NcmlWriter;
import pml.tds.jdom.ThreddsXml;
import pml.tds.util.TdsConfig;

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Rewrites the catalog of one dataset: removes access restrictions, adds
 * inherited metadata and, on request, an NcML time aggregation of the
 * dataset's files with OPeNDAP (and WMS/WCS) access.
 */
public class CatalogTransformer {

    private static final Logger LOG = LoggerFactory.getLogger(CatalogTransformer.class);

    public static final String DIMENSION = "time";
    public static final String FILE_SERVICE = "HTTPServer";
    public static final String OPENDAP_SERVICE = "OpenDAPServer";

    private final ThreddsXml xml;
    private final TdsConfig config;
    private final DatasetRoots roots;
    private final String aggregationsDir;
    private final PathPartitioner partitioner = new PathPartitioner();
    private final NcmlWriter ncmlWriter = new NcmlWriter();

    private final Element topLevelDataset;
    private final String datasetId;
    private final List<AggregationInfo> aggregations = new ArrayList<>();

    private boolean doWcs = true;
    private boolean cache = true;

    /**
     * @param aggregationsDir directory the NcML files will live in on the THREDDS server
     */
    public CatalogTransformer(ThreddsXml xml, TdsConfig config, String aggregationsDir) {
        this.xml = xml;
        this.config = config;
        this.roots = new DatasetRoots(config.getDatasetRoots());
        this.aggregationsDir = aggregationsDir;

        this.topLevelDataset = xml.firstChild(xml.getRoot(), "dataset");
        if ( topLevelDataset == null ) {
            throw new IllegalArgumentException("Catalog has no top level dataset");
        }
        this.datasetId = topLevelDataset.getAttributeValue("ID");
        if ( datasetId == null ) {
            throw new IllegalArgumentException("Top level dataset has no ID");
        }
    }

    public void allChanges(boolean createAggregations, boolean addWms) {
        stripRestrictAccess();
        insertMetadata();

        if ( createAggregations ) {
            addAggregations(addWms);
        }

        if ( addWms ) {
            insertService("wms", "WMS", "/thredds/wms/");
            if ( doWcs ) {
                insertService("wcs", "WCS", "/thredds/wcs/");
            }
        }
    }

    public void stripRestrictAccess() {
        topLevelDataset.removeAttribute("restrictAccess");
    }

    public void insertMetadata() {
        Element mt = xml.element("metadata", "inherited", "true");
        xml.textChild(mt, "serviceName", "all");
        xml.textChild(mt, "authority", config.getAuthority());
        xml.textChild(mt, "dataType", "Grid");
        xml.insertBeforeSimilar(topLevelDataset, mt);
    }

    public void insertService(String name, String serviceType, String base) {
        Element sv = xml.element("service", "name", name, "serviceType", serviceType, "base", base);
        xml.getRoot().addContent(0, sv);
    }

    public List<Element> secondLevelDatasets() {
        return xml.children(topLevelDataset, "dataset");
    }

    /**
     * @return the files of the datasets served over HTTP, as paths on disk
     */
    public List<String> netcdfFiles() {
        List<String> files = new ArrayList<>();
        List<Element> datasets = secondLevelDatasets();
        for (int i = 0; i < datasets.size(); i++) {
            Element dataset = datasets.get(i);
            String urlPath = dataset.getAttributeValue("urlPath");
            if ( FILE_SERVICE.equals(dataset.getAttributeValue("serviceName")) && urlPath != null ) {
                files.add(roots.pathOnDisk(urlPath));
            }
        }
        return files;
    }

    /**
     * Aggregate the dataset's files and link the aggregations into the
     * catalog. Files that look like they belong to different products end up
     * in separate aggregations, numbered from 1. A group that cannot be
     * aggregated is reported and left out.
     *
     * @return the number of aggregations added
     */
    public int addAggregations(boolean addWms) {
        DatasetOverrides overrides = config.getOverrideRules().resolve(datasetId);

        List<String> files = new ArrayList<>();
        List<String> all = netcdfFiles();
        for (int i = 0; i < all.size(); i++) {
            if ( overrides.accepts(all.get(i)) ) {
                files.add(all.get(i));
            }
        }
        if ( files.isEmpty() ) {
            LOG.warn("No files to aggregate for dataset '{}'", datasetId);
            return 0;
        }

        Map<String, List<String>> groups = partitioner.partition(files);
        if ( groups.size() > 1 ) {
            LOG.warn("File list for dataset '{}' may contain heterogeneous files (found {} potential groups)",
                    datasetId, groups.size());
        }

        List<String> services = new ArrayList<>(Collections.singletonList(OPENDAP_SERVICE));
        if ( addWms ) {
            services.add("wms");
            if ( doWcs ) {
                services.add("wcs");
            }
        }

        AggregationBuilder builder = new AggregationBuilder(overrides.coordinateReader(), overrides.getJoinType());
        GlobalAttributeMerger merger = new GlobalAttributeMerger(new NetcdfGlobalAttributeReader(), config.getHistoryText());
        String subDir = subDir();

        int added = 0;
        int index = 0;
        for (List<String> group : groups.values()) {
            index++;
            String id = groups.size() == 1 ? datasetId : datasetId + "." + index;
            LOG.info("Creating aggregation '{}' from {} files", id, group.size());

            AggregationDescriptor descriptor;
            try {
                descriptor = builder.build(group, DIMENSION, cache);
            } catch (AggregationException e) {
                LOG.warn("Failed to create aggregation '{}': {}", id, e.getMessage());
                continue;
            }
            MergedAttributes merged = merger.merge(descriptor.getLocations(), id);

            Element ds = xml.element("dataset", "name", id, "ID", id, "urlPath", id);
            for (int i = 0; i < services.size(); i++) {
                Element access = xml.element("access", "serviceName", services.get(i), "urlPath", id);
                ds.addContent(access);
                // The publisher picks up endpoints from the top level dataset
                topLevelDataset.addContent(access.clone());
            }

            String basename = id + ".ncml";
            AggregationInfo info = new AggregationInfo(id, ncmlWriter.toDocument(descriptor, merged), basename, subDir);
            aggregations.add(info);

            Element netcdf = new Element("netcdf", ThreddsXml.netcdfns);
            netcdf.setAttribute("location", StringUtils.removeEnd(aggregationsDir, "/") + "/" + info.getRelativePath());
            ds.addContent(netcdf);

            if ( addWms ) {
                xml.child(ds, "property", "name", "viewer", "value", config.getViewer());
            }
            topLevelDataset.addContent(ds);
            added++;
        }
        return added;
    }

    /**
     * Aggregations are stored in one sub-directory per facet of the catalog
     * name, e.g. esacci.OC.day.L3S.xml goes to OC/day/L3S.
     */
    public String subDir() {
        String name = xml.getSource() == null ? datasetId + ".xml" : xml.getSource().getName();
        List<String> components = new ArrayList<>(Arrays.asList(name.split("\\.")));
        if ( !components.isEmpty() && components.get(0).equals("esacci") ) {
            components.remove(0);
        }
        if ( !components.isEmpty() && components.get(components.size() - 1).equals("xml") ) {
            components.remove(components.size() - 1);
        }
        return StringUtils.join(components, "/");
    }

    /**
     * Write the catalog, and any aggregations under {@code ncmlDir}.
     */
    public void write(File catalogFile, File ncmlDir) throws IOException {
        xml.write(catalogFile);
        for (int i = 0; i < aggregations.size(); i++) {
            AggregationInfo info = aggregations.get(i);
            File out = new File(FilenameUtils.concat(ncmlDir.getPath(), info.getRelativePath()));
            JDOMUtils.write(info.getNcml(), out);
            LOG.debug("Wrote {}", out);
        }
    }

    public List<AggregationInfo> getAggregations() {
        return Collections.unmodifiableList(aggregations);
    }

    public Element getTopLevelDataset() {
        return topLevelDataset;
    }

    public String getDatasetId() {
        return datasetId;
    }

    public Document getDocument() {
        return xml.getDocument();
    }

    public void setDoWcs(boolean doWcs) {
        this.doWcs = doWcs;
    }

    public void setCache(boolean cache) {
        this.cache = cache;
    }
}
