package pml.tds.cli;

import org.apache.commons.cli.Option;
import org.apache.commons.cli.OptionGroup;
import org.apache.commons.cli.Options;

public class TdsAggregationOptions extends Options {
    OptionGroup modes = new OptionGroup();
    Option aggregate = new Option("a", "aggregate", false, "Read NetCDF paths from stdin and write an NcML aggregation to stdout.");
    Option partition = new Option("p", "partition", false, "Read NetCDF paths from stdin and write one line per partition of them to stdout.");
    Option modify = new Option("m", "modify", false, "Rewrite the catalog files (or directories of catalogs) given as arguments.");
    Option findNetcdf = new Option("f", "find-netcdf", false, "Print the paths on disk of the datasets in the catalog given as argument.");
    Option mapfiles = new Option("M", "mapfiles", false, "Write mapfiles from a dataset JSON file into an output directory: <json> <dir>.");
    Option cacheRemote = new Option("C", "cache-remote", false, "Request every aggregation on a THREDDS server: <json> <base url>.");

    Option dimension = new Option("d", "dimension", true, "Dimension to aggregate along. Default \"time\".");
    Option cache = new Option("c", "cache", false, "Open the files and cache coordinate values in the NcML.");
    Option id = new Option("i", "id", true, "Dataset id; adds global attributes merged from the files.");
    Option outputDir = new Option("o", "output-dir", true, "Output directory for modified catalogs. Default \"output_catalogs\".");
    Option ncmlDir = new Option("n", "ncml-dir", true, "Local directory to write NcML aggregations in. Default \"aggregations\".");
    Option remoteAggDir = Option.builder().longOpt("remote-agg-dir").hasArg()
            .desc("Directory the NcML aggregations live in on the THREDDS server. Default \"/usr/local/aggregations\".").build();
    Option wms = new Option("w", "wms", false, "Add WMS and WCS access to the aggregations.");
    Option noWcs = Option.builder().longOpt("no-wcs")
            .desc("With --wms, leave out WCS access.").build();
    Option noAggregations = Option.builder().longOpt("no-aggregations")
            .desc("Only strip access restrictions and add metadata.").build();
    Option topLevel = new Option("t", "top-level", true, "Write a top level catalog referencing every output catalog to this file.");
    Option template = Option.builder().longOpt("top-level-template").hasArg()
            .desc("Existing catalog to start the top level catalog from.").build();
    Option refPrefix = Option.builder().longOpt("ref-prefix").hasArg()
            .desc("Directory of the catalogs relative to the top level catalog, e.g. \"1\". Default none.").build();
    Option config = Option.builder().longOpt("config").hasArg()
            .desc("Settings file to use instead of the built in resources/tds.xml.").build();

    public TdsAggregationOptions() {
        modes.addOption(aggregate);
        modes.addOption(partition);
        modes.addOption(modify);
        modes.addOption(findNetcdf);
        modes.addOption(mapfiles);
        modes.addOption(cacheRemote);
        modes.setRequired(true);

        addOptionGroup(modes);
        addOption(dimension);
        addOption(cache);
        addOption(id);
        addOption(outputDir);
        addOption(ncmlDir);
        addOption(remoteAggDir);
        addOption(wms);
        addOption(noWcs);
        addOption(noAggregations);
        addOption(topLevel);
        addOption(template);
        addOption(refPrefix);
        addOption(config);
    }
}
