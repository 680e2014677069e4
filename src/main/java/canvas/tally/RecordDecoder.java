package canvas.tally;

import java.time.Instant;

/**
 * Turns one raw row into an {@link Event}, or rejects it.
 *
 * A row is rejected with MALFORMED_RECORD when it is shorter than the schema
 * needs or a categorical value is empty, and with
 * UNRECOGNIZED_TIMESTAMP_FORMAT when the timestamp does not parse. Window
 * filtering is not done here. Instances are immutable and shared by all
 * workers.
 */
public final class RecordDecoder {
	private final int timestamp;
	private final Dimension[] dimensions;
	private final String[] names;
	private final int[][] index;
	private final int width;

	RecordDecoder(final int timestamp, final Dimension[] dimensions, final int[][] index) {
		this.timestamp = timestamp;
		this.dimensions = dimensions;
		this.index = index;
		this.names = new String[dimensions.length];
		int w = timestamp;
		for (int i = 0; i < dimensions.length; i++) {
			names[i] = dimensions[i].name();
			for (final int k : index[i])
				w = Math.max(w, k);
		}
		this.width = w + 1;
	}

	/**
	 * @return dimension names in schema order
	 */
	public String[] names() {
		return names.clone();
	}

	/**
	 * Minimum number of fields a row must have
	 */
	public int width() {
		return width;
	}

	public Event decode(final String[] row) throws TallyException {
		if (row == null || row.length < width)
			throw new TallyException(ErrorCode.MALFORMED_RECORD,
					"expected " + width + " fields, got " + (row == null ? 0 : row.length));

		final Instant instant = TimestampParser.parse(row[timestamp]);
		final String[] values = new String[dimensions.length];
		for (int i = 0; i < dimensions.length; i++) {
			final String v = dimensions[i].handler().get(row, index[i], instant);
			if (v == null || v.isEmpty())
				throw new TallyException(ErrorCode.MALFORMED_RECORD, "empty " + names[i]);
			values[i] = v;
		}
		return new Event(instant, names, values);
	}
}
