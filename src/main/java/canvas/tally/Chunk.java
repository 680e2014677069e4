package canvas.tally;

import java.util.List;

/**
 * A bounded batch of raw rows read in one step, in source order.
 */
public final class Chunk {
	private final long index;
	private final List<String[]> rows;

	public Chunk(final long index, final List<String[]> rows) {
		this.index = index;
		this.rows = rows;
	}

	/**
	 * @return 0-based position of this chunk in the stream
	 */
	public long index() {
		return index;
	}

	public List<String[]> rows() {
		return rows;
	}

	public int size() {
		return rows.size();
	}

	@Override
	public String toString() {
		return "Chunk{index=" + index + ", rows=" + rows.size() + "}";
	}
}
