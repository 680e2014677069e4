package canvas.tally;

import java.util.Arrays;
import java.util.HashSet;
import java.util.Set;

/**
 * Record layout: which column carries the timestamp and which dimensions are
 * tallied. The column set is configuration; it is bound to a concrete header
 * with {@link #bind(String[])}.
 */
public final class Schema {
    private final String timestamp;
    private final Dimension[] dimensions;

    public Schema(final String timestamp, final Dimension... dimensions) {
        if (timestamp == null || timestamp.isEmpty())
            throw new IllegalArgumentException("timestamp column");
        this.timestamp = timestamp;
        this.dimensions = dimensions == null ? new Dimension[0] : dimensions.clone();
    }

    /**
     * Most placed color and most placed coordinate, as in the canvas analyses
     */
    public static Schema place() {
        return new Schema("timestamp", Dimension.column("pixel_color"), Dimension.column("coordinate"));
    }

    public String timestamp() {
        return timestamp;
    }

    public Dimension[] dimensions() {
        return dimensions.clone();
    }

    public String[] names() {
        final String[] a = new String[dimensions.length];
        for (int i = 0; i < a.length; i++)
            a[i] = dimensions[i].name();
        return a;
    }

    /**
     * Check the schema itself, independent of any input
     *
     * @throws TallyException CONFIGURATION_ERROR on no or duplicate dimensions
     */
    void validate() throws TallyException {
        if (dimensions.length == 0)
            throw new TallyException(ErrorCode.CONFIGURATION_ERROR, "no dimensions to tally");
        final Set<String> names = new HashSet<>();
        for (final Dimension d : dimensions) {
            if (!names.add(d.name()))
                throw new TallyException(ErrorCode.CONFIGURATION_ERROR, "duplicate dimension " + d.name());
        }
    }

    /**
     * Resolve column names against a header
     *
     * @param header column names as read from the source
     * @return decoder for rows of that source
     * @throws TallyException CONFIGURATION_ERROR if a column is missing
     */
    public RecordDecoder bind(final String[] header) throws TallyException {
        validate();
        final int ts = indexOf(header, timestamp);
        final int[][] index = new int[dimensions.length][];
        for (int i = 0; i < dimensions.length; i++) {
            final String[] cols = dimensions[i].columns();
            index[i] = new int[cols.length];
            for (int k = 0; k < cols.length; k++)
                index[i][k] = indexOf(header, cols[k]);
        }
        return new RecordDecoder(ts, dimensions, index);
    }

    private static int indexOf(final String[] header, final String column) throws TallyException {
        for (int i = 0; i < header.length; i++) {
            if (header[i] != null && header[i].trim().equals(column))
                return i;
        }
        for (int i = 0; i < header.length; i++) {
            if (header[i] != null && header[i].trim().equalsIgnoreCase(column))
                return i;
        }
        throw new TallyException(ErrorCode.CONFIGURATION_ERROR,
                "column '" + column + "' not in header " + Arrays.toString(header));
    }

    @Override
    public String toString() {
        return "Schema{timestamp=" + timestamp + ", dimensions=" + Arrays.toString(dimensions) + "}";
    }
}
