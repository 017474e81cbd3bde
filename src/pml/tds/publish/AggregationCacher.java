package pml.tds.publish;

import com.fasterxml.jackson.databind.JsonNode;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.io.InterruptedIOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Requests the OPeNDAP or WMS endpoint of every aggregated dataset on a
 * remote THREDDS server so the server builds and caches the aggregation.
 * Responses are not waited for; the read timeout is tiny.
 */
public class AggregationCacher {

    private static final Logger LOG = LoggerFactory.getLogger(AggregationCacher.class);

    private final String baseUrl;
    private final OkHttpClient client;

    public AggregationCacher(String baseUrl) {
        this(baseUrl, new OkHttpClient.Builder()
                .connectTimeout(10, TimeUnit.SECONDS)
                .readTimeout(1, TimeUnit.MILLISECONDS)
                .build());
    }

    public AggregationCacher(String baseUrl, OkHttpClient client) {
        this.baseUrl = StringUtils.removeEnd(baseUrl, "/");
        this.client = client;
    }

    public String aggregationUrl(String datasetId, boolean wms) {
        if ( wms ) {
            return baseUrl + "/wms/" + datasetId + "?service=WMS&version=1.3.0&request=GetCapabilities";
        }
        return baseUrl + "/dodsC/" + datasetId + ".dds";
    }

    public List<String> urls(Map<String, JsonNode> datasets) {
        List<String> urls = new ArrayList<>();
        for (Map.Entry<String, JsonNode> entry : datasets.entrySet()) {
            if ( DatasetJson.flag(entry.getValue(), "generate_aggregation") ) {
                urls.add(aggregationUrl(entry.getKey(), DatasetJson.flag(entry.getValue(), "include_in_wms")));
            }
        }
        return urls;
    }

    public int cacheAll(File json) throws IOException {
        return cacheAll(urls(DatasetJson.read(json)));
    }

    /**
     * @return the number of requests that reached the server
     */
    public int cacheAll(List<String> urls) {
        int sent = 0;
        for (int i = 0; i < urls.size(); i++) {
            String url = urls.get(i);
            LOG.info(url);
            Request request = new Request.Builder()
                    .url(url)
                    .build();
            try (Response response = client.newCall(request).execute()) {
                LOG.debug("{} answered {}", url, response.code());
                sent++;
            } catch (InterruptedIOException e) {
                // Read timed out: the server is busy building the aggregation
                LOG.debug("No response yet from {}", url);
                sent++;
            } catch (IOException e) {
                LOG.warn("Request to {} failed: {}", url, e.getMessage());
            }
        }
        return sent;
    }
}
