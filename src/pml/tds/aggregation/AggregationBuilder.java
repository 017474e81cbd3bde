package pml.tds.aggregation;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Builds the aggregation for one group of files.
 */
public class AggregationBuilder {

    private static final Logger LOG = LoggerFactory.getLogger(AggregationBuilder.class);

    private final CoordinateReader reader;
    private final AggregationType type;

    public AggregationBuilder() {
        this(new NetcdfCoordinateReader(), AggregationType.JOIN_EXISTING);
    }

    public AggregationBuilder(CoordinateReader reader, AggregationType type) {
        this.reader = reader;
        this.type = type;
    }

    /**
     * Create the aggregation of {@code files} along {@code dimension}.
     * <p>
     * Without {@code cache} the files are listed in the order given and none of
     * them is opened (a joinNew aggregation still reads the variable names of
     * its first file). With {@code cache} every file's coordinate is read, files
     * that cannot be read are left out, and the rest are sorted by coordinate
     * value with the value attached to each file, unless the files disagree on
     * the units of the coordinate.
     *
     * @throws AggregationException if caching and no file gave a coordinate
     */
    public AggregationDescriptor build(List<String> files, String dimension, boolean cache) throws AggregationException {
        List<AggregationDescriptor.Entry> entries = new ArrayList<>();
        boolean multipleUnits = false;

        if ( cache ) {
            List<Sampled> sampled = new ArrayList<>();
            Set<String> foundUnits = new LinkedHashSet<>();
            for (int i = 0; i < files.size(); i++) {
                String file = files.get(i);
                CoordinateSample sample;
                try {
                    sample = reader.read(file, dimension);
                } catch (AggregationException e) {
                    LOG.warn(e.getMessage());
                    continue;
                }
                sampled.add(new Sampled(file, sample));
                if ( sample.getUnits() != null ) {
                    foundUnits.add(sample.getUnits());
                }
            }
            if ( sampled.isEmpty() ) {
                throw new AggregationException("No aggregation could be created");
            }

            // Collections.sort is stable, so equal values keep the input order
            Collections.sort(sampled, BY_VALUE);

            multipleUnits = foundUnits.size() > 1;
            if ( multipleUnits ) {
                LOG.warn("Files disagree on the units of '{}' {}; coordinate values are not cached", dimension, foundUnits);
            }
            for (int i = 0; i < sampled.size(); i++) {
                Sampled s = sampled.get(i);
                String coordValue = multipleUnits ? null : s.sample.getValueString();
                entries.add(new AggregationDescriptor.Entry(s.file, coordValue));
            }
        } else {
            for (int i = 0; i < files.size(); i++) {
                entries.add(new AggregationDescriptor.Entry(files.get(i), null));
            }
        }

        NcmlVariable coordinateVariable = null;
        List<String> variableAgg = new ArrayList<>();
        if ( type == AggregationType.JOIN_NEW && !entries.isEmpty() ) {
            coordinateVariable = reader.coordinateVariable(dimension);
            variableAgg.addAll(reader.dataVariables(entries.get(0).getLocation()));
        }

        return new AggregationDescriptor(dimension, type, entries, multipleUnits, coordinateVariable, variableAgg);
    }

    private static final Comparator<Sampled> BY_VALUE = new Comparator<Sampled>() {
        @Override
        public int compare(Sampled a, Sampled b) {
            return Double.compare(a.sample.getValue().doubleValue(), b.sample.getValue().doubleValue());
        }
    };

    private static class Sampled {
        final String file;
        final CoordinateSample sample;

        Sampled(String file, CoordinateSample sample) {
            this.file = file;
            this.sample = sample;
        }
    }
}
