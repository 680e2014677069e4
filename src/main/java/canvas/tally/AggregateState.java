package canvas.tally;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Running frequency tables and counters of one engine run.
 *
 * Only the merging step mutates it, on the orchestrating thread.
 */
public final class AggregateState {
	private final String[] names;
	private final FrequencyTable[] tables;
	long rows;
	long malformed;
	long excluded;
	long chunks;
	long lastMergedChunk = -1;

	public AggregateState(final String[] names) {
		this.names = names.clone();
		this.tables = new FrequencyTable[names.length];
		for (int i = 0; i < tables.length; i++)
			tables[i] = new FrequencyTable();
	}

	public String[] names() {
		return names.clone();
	}

	int indexOf(final String dimension) {
		for (int i = 0; i < names.length; i++)
			if (names[i].equals(dimension))
				return i;
		return -1;
	}

	/**
	 * @throws IllegalArgumentException if the dimension is not tracked
	 */
	public FrequencyTable table(final String dimension) {
		final int i = indexOf(dimension);
		if (i < 0)
			throw new IllegalArgumentException("dimension not tracked: " + dimension);
		return tables[i];
	}

	FrequencyTable[] tables() {
		return tables;
	}

	/**
	 * @return tables keyed by dimension name, in tracking order
	 */
	public Map<String, FrequencyTable> asMap() {
		final LinkedHashMap<String, FrequencyTable> m = new LinkedHashMap<>();
		for (int i = 0; i < names.length; i++)
			m.put(names[i], tables[i]);
		return m;
	}

	public long rows() {
		return rows;
	}

	public long malformed() {
		return malformed;
	}

	public long excluded() {
		return excluded;
	}

	public long tallied() {
		return rows - malformed - excluded;
	}

	public long chunks() {
		return chunks;
	}

	/**
	 * @return index of the last chunk folded in, -1 before the first
	 */
	public long lastMergedChunk() {
		return lastMergedChunk;
	}

	@Override
	public String toString() {
		return "AggregateState{rows=" + rows + ", malformed=" + malformed + ", excluded=" + excluded + ", chunks="
				+ chunks + ", tables=" + asMap() + "}";
	}
}
