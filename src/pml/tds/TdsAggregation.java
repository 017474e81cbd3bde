package pml.tds;

import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.CommandLineParser;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.ParseException;
import org.apache.commons.io.IOUtils;
import org.jdom2.JDOMException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pml.tds.aggregation.AggregationBuilder;
import pml.tds.aggregation.AggregationDescriptor;
import pml.tds.aggregation.AggregationException;
import pml.tds.aggregation.PathPartitioner;
import pml.tds.attributes.GlobalAttributeMerger;
import pml.tds.attributes.MergedAttributes;
import pml.tds.attributes.NetcdfGlobalAttributeReader;
import pml.tds.catalog.CatalogBatch;
import pml.tds.catalog.DatasetRoots;
import pml.tds.catalog.NetcdfReferenceFinder;
import pml.tds.cli.TdsAggregationOptions;
import pml.tds.jdo.DatasetOverrides;
import pml.tds.jdom.JDOMUtils;
import pml.tds.jdom.NcmlWriter;
import pml.tds.publish.AggregationCacher;
import pml.tds.publish.MapfileWriter;
import pml.tds.util.ConfigManager;
import pml.tds.util.TdsConfig;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

public class TdsAggregation {

    private static final Logger LOG = LoggerFactory.getLogger(TdsAggregation.class);

    public static final String DEFAULT_OUTPUT_DIR = "output_catalogs";
    public static final String DEFAULT_NCML_DIR = "aggregations";
    public static final String DEFAULT_REMOTE_AGG_DIR = "/usr/local/aggregations";

    public static void main(String[] args) {
        System.exit(run(args, System.in, System.out));
    }

    /**
     * @return the process exit code
     */
    public static int run(String[] args, InputStream in, PrintStream out) {
        CommandLineParser parser = new DefaultParser();
        TdsAggregationOptions options = new TdsAggregationOptions();
        CommandLine commandLine;
        try {
            commandLine = parser.parse(options, args);
        } catch (ParseException e) {
            System.err.println(e.getMessage());
            HelpFormatter formatter = new HelpFormatter();
            formatter.printHelp("tds-aggregation", "", options, "", true);
            return 2;
        }

        try {
            TdsConfig config = loadConfig(commandLine);
            List<String> arguments = commandLine.getArgList();

            if ( commandLine.hasOption("a") ) {
                return aggregate(commandLine, config, readPaths(in), out);
            } else if ( commandLine.hasOption("p") ) {
                Map<String, List<String>> groups = new PathPartitioner().partition(readPaths(in));
                for (String key : groups.keySet()) {
                    out.println(key);
                }
                return 0;
            } else if ( commandLine.hasOption("m") ) {
                return modify(commandLine, config, arguments);
            } else if ( commandLine.hasOption("f") ) {
                if ( arguments.size() != 1 ) {
                    System.err.println("Please give exactly one catalog to search.");
                    return 2;
                }
                NetcdfReferenceFinder finder = new NetcdfReferenceFinder(new DatasetRoots(config.getDatasetRoots()));
                List<String> paths = finder.find(new File(arguments.get(0)));
                for (int i = 0; i < paths.size(); i++) {
                    out.println(paths.get(i));
                }
                return 0;
            } else if ( commandLine.hasOption("M") ) {
                if ( arguments.size() != 2 ) {
                    System.err.println("Usage: -M <input json> <output dir>");
                    return 2;
                }
                List<File> written = new MapfileWriter(new File(arguments.get(1))).writeAll(new File(arguments.get(0)));
                for (int i = 0; i < written.size(); i++) {
                    out.println(written.get(i).getPath());
                }
                return 0;
            } else {
                if ( arguments.size() != 2 ) {
                    System.err.println("Usage: -C <input json> <base THREDDS url>");
                    return 2;
                }
                new AggregationCacher(arguments.get(1)).cacheAll(new File(arguments.get(0)));
                return 0;
            }
        } catch (AggregationException e) {
            LOG.error("Aggregation failed: {}", e.getMessage());
        } catch (JDOMException e) {
            LOG.error("Error parsing XML: {}", e.getMessage());
        } catch (IOException e) {
            LOG.error("I/O error: {}", e.getMessage());
        } catch (IllegalArgumentException e) {
            LOG.error(e.getMessage());
        }
        return 1;
    }

    private static int aggregate(CommandLine commandLine, TdsConfig config, List<String> paths, PrintStream out)
            throws AggregationException, IOException {
        String dimension = commandLine.getOptionValue("d", "time");
        boolean cache = commandLine.hasOption("c");
        String id = commandLine.getOptionValue("i");

        DatasetOverrides overrides = id == null ? DatasetOverrides.DEFAULTS : config.getOverrideRules().resolve(id);
        AggregationBuilder builder = new AggregationBuilder(overrides.coordinateReader(), overrides.getJoinType());
        AggregationDescriptor descriptor = builder.build(paths, dimension, cache);

        MergedAttributes attributes = null;
        if ( id != null ) {
            GlobalAttributeMerger merger = new GlobalAttributeMerger(new NetcdfGlobalAttributeReader(), config.getHistoryText());
            attributes = merger.merge(descriptor.getLocations(), id);
        }
        JDOMUtils.write(new NcmlWriter().toDocument(descriptor, attributes), out);
        out.flush();
        return 0;
    }

    private static int modify(CommandLine commandLine, TdsConfig config, List<String> arguments)
            throws IOException, JDOMException {
        List<File> catalogs = new ArrayList<>();
        for (int i = 0; i < arguments.size(); i++) {
            File file = new File(arguments.get(i));
            if ( file.isDirectory() ) {
                catalogs.addAll(CatalogBatch.listCatalogs(file));
            } else {
                catalogs.add(file);
            }
        }
        if ( catalogs.isEmpty() ) {
            System.err.println("No catalogs to modify.");
            return 2;
        }

        File outputDir = new File(commandLine.getOptionValue("o", DEFAULT_OUTPUT_DIR));
        File ncmlDir = new File(commandLine.getOptionValue("n", DEFAULT_NCML_DIR));
        String remoteAggDir = commandLine.getOptionValue("remote-agg-dir", DEFAULT_REMOTE_AGG_DIR);

        CatalogBatch batch = new CatalogBatch(config, outputDir, ncmlDir, remoteAggDir);
        batch.setAddWms(commandLine.hasOption("w"));
        batch.setDoWcs(!commandLine.hasOption("no-wcs"));
        batch.setCreateAggregations(!commandLine.hasOption("no-aggregations"));
        if ( commandLine.hasOption("t") ) {
            batch.setTopLevelCatalog(new File(commandLine.getOptionValue("t")));
        }
        if ( commandLine.hasOption("top-level-template") ) {
            batch.setTopLevelTemplate(new File(commandLine.getOptionValue("top-level-template")));
        }
        if ( commandLine.hasOption("ref-prefix") ) {
            batch.setRefPrefix(commandLine.getOptionValue("ref-prefix"));
        }

        int processed = batch.processAll(catalogs);
        return processed > 0 ? 0 : 1;
    }

    private static TdsConfig loadConfig(CommandLine commandLine) throws IOException, JDOMException {
        ConfigManager manager = new ConfigManager();
        if ( commandLine.hasOption("config") ) {
            return manager.load(new File(commandLine.getOptionValue("config")));
        }
        return manager.load();
    }

    static List<String> readPaths(InputStream in) throws IOException {
        List<String> lines = IOUtils.readLines(in, StandardCharsets.UTF_8);
        List<String> paths = new ArrayList<>();
        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i).trim();
            if ( !line.isEmpty() ) {
                paths.add(line);
            }
        }
        return paths;
    }
}
