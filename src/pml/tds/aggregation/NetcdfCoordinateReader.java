package pml.tds.aggregation;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ucar.ma2.DataType;
import ucar.nc2.Attribute;
import ucar.nc2.NetcdfFile;
import ucar.nc2.Variable;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Reads the coordinate variable named after the aggregation dimension.
 */
public class NetcdfCoordinateReader implements CoordinateReader {

    private static final Logger LOG = LoggerFactory.getLogger(NetcdfCoordinateReader.class);

    @Override
    public CoordinateSample read(String file, String dimension) throws AggregationException {
        NetcdfFile ncfile = open(file);
        try {
            Variable var = ncfile.findVariable(dimension);
            if ( var == null ) {
                throw new AggregationException("Variable '" + dimension + "' not found in file '" + file + "'");
            }
            int[] shape = var.getShape();
            if ( shape.length != 1 || shape[0] != 1 ) {
                throw new AggregationException("Shape of variable '" + dimension + "' in file '" + file + "' is "
                        + Arrays.toString(shape) + " - should be [1]");
            }
            DataType type = var.getDataType();
            if ( !type.isNumeric() ) {
                throw new AggregationException("Variable '" + dimension + "' in file '" + file + "' is not numeric (" + type + ")");
            }
            Number value;
            if ( type.isIntegral() ) {
                value = var.readScalarLong();
            } else if ( type == DataType.FLOAT ) {
                value = var.readScalarFloat();
            } else {
                value = var.readScalarDouble();
            }
            String units = null;
            Attribute unitsAttribute = var.findAttribute("units");
            if ( unitsAttribute != null && unitsAttribute.isString() ) {
                units = unitsAttribute.getStringValue();
            }
            return new CoordinateSample(units, value);
        } catch (IOException e) {
            throw new AggregationException("Could not read '" + dimension + "' from file '" + file + "': " + e.getMessage(), e);
        } finally {
            close(ncfile);
        }
    }

    @Override
    public List<String> dataVariables(String file) throws AggregationException {
        List<String> names = new ArrayList<>();
        NetcdfFile ncfile = open(file);
        try {
            List<Variable> variables = ncfile.getVariables();
            for (int i = 0; i < variables.size(); i++) {
                Variable var = variables.get(i);
                if ( !var.isCoordinateVariable() ) {
                    names.add(var.getShortName());
                }
            }
        } finally {
            close(ncfile);
        }
        return names;
    }

    @Override
    public NcmlVariable coordinateVariable(String dimension) {
        return null;
    }

    protected NetcdfFile open(String file) throws AggregationException {
        try {
            return NetcdfFile.open(file);
        } catch (IOException e) {
            throw new AggregationException("Could not open file '" + file + "': " + e.getMessage(), e);
        }
    }

    protected void close(NetcdfFile ncfile) {
        try {
            ncfile.close();
        } catch (IOException e) {
            LOG.debug("Error closing {}", ncfile.getLocation(), e);
        }
    }
}
