package pml.tds.util;

import pml.tds.attributes.GlobalAttributeMerger;

import java.util.LinkedHashMap;
import java.util.Map;

public class TdsConfig {

    // THREDDS dataset root -> directory on disk
    private final Map<String, String> datasetRoots = new LinkedHashMap<>();
    private final OverrideRules overrideRules = new OverrideRules();
    private String authority = "pml.ac.uk:";
    private String viewer = "http://jasmin.eofrom.space/?wms_url={WMS}?service=WMS&version=1.3.0&request=GetCapabilities,GISportal Viewer";
    private String historyText = GlobalAttributeMerger.DEFAULT_HISTORY_TEXT;

    public Map<String, String> getDatasetRoots() {
        return datasetRoots;
    }

    public OverrideRules getOverrideRules() {
        return overrideRules;
    }

    public String getAuthority() {
        return authority;
    }

    public void setAuthority(String authority) {
        this.authority = authority;
    }

    public String getViewer() {
        return viewer;
    }

    public void setViewer(String viewer) {
        this.viewer = viewer;
    }

    public String getHistoryText() {
        return historyText;
    }

    public void setHistoryText(String historyText) {
        this.historyText = historyText;
    }
}
