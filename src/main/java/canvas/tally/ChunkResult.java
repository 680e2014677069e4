package canvas.tally;

/**
 * Frequency tables and row counters produced by one worker from one
 * sub-chunk. Consumed once by the merger, then discarded.
 */
public final class ChunkResult {
	private final long chunk;
	private final int part;
	private final FrequencyTable[] tables;
	private final long rows;
	private final long malformed;
	private final long excluded;
	private final String firstError;

	ChunkResult(final long chunk, final int part, final FrequencyTable[] tables, final long rows,
			final long malformed, final long excluded, final String firstError) {
		this.chunk = chunk;
		this.part = part;
		this.tables = tables;
		this.rows = rows;
		this.malformed = malformed;
		this.excluded = excluded;
		this.firstError = firstError;
	}

	public long chunk() {
		return chunk;
	}

	public int part() {
		return part;
	}

	public FrequencyTable[] tables() {
		return tables;
	}

	/**
	 * @return rows seen by the worker
	 */
	public long rows() {
		return rows;
	}

	public long malformed() {
		return malformed;
	}

	/**
	 * @return decoded rows outside the window
	 */
	public long excluded() {
		return excluded;
	}

	public long tallied() {
		return rows - malformed - excluded;
	}

	/**
	 * @return message of the first malformed row, or null
	 */
	public String firstError() {
		return firstError;
	}

	@Override
	public String toString() {
		return "ChunkResult{chunk=" + chunk + ", part=" + part + ", rows=" + rows + ", malformed=" + malformed
				+ ", excluded=" + excluded + "}";
	}
}
