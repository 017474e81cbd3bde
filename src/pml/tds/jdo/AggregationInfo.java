package pml.tds.jdo;

import org.jdom2.Document;

/**
 * An NcML aggregation waiting to be written: the document, the name of the
 * file and the sub-directory of the aggregations directory it goes in.
 */
public class AggregationInfo {

    private final Document ncml;

    private final String basename;

    private final String subDir;

    private final String datasetId;

    public AggregationInfo(String datasetId, Document ncml, String basename, String subDir) {
        super();
        this.datasetId = datasetId;
        this.ncml = ncml;
        this.basename = basename;
        this.subDir = subDir;
    }

    public Document getNcml() {
        return ncml;
    }

    public String getBasename() {
        return basename;
    }

    public String getSubDir() {
        return subDir;
    }

    public String getDatasetId() {
        return datasetId;
    }

    public String getRelativePath() {
        return subDir.isEmpty() ? basename : subDir + "/" + basename;
    }

    @Override
    public String toString() {
        return getRelativePath();
    }
}
