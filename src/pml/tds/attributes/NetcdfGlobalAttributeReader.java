package pml.tds.attributes;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ucar.nc2.Attribute;
import ucar.nc2.NetcdfFile;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class NetcdfGlobalAttributeReader implements GlobalAttributeReader {

    private static final Logger LOG = LoggerFactory.getLogger(NetcdfGlobalAttributeReader.class);

    @Override
    public Map<String, Object> read(String file) throws IOException {
        Map<String, Object> attributes = new LinkedHashMap<>();
        NetcdfFile ncfile = NetcdfFile.open(file);
        try {
            List<Attribute> globals = ncfile.getGlobalAttributes();
            for (int i = 0; i < globals.size(); i++) {
                Attribute attribute = globals.get(i);
                if ( attribute.isString() ) {
                    attributes.put(attribute.getShortName(), attribute.getStringValue());
                } else if ( attribute.getLength() > 0 ) {
                    attributes.put(attribute.getShortName(), attribute.getNumericValue());
                }
            }
        } finally {
            try {
                ncfile.close();
            } catch (IOException e) {
                LOG.debug("Error closing {}", file, e);
            }
        }
        return attributes;
    }
}
