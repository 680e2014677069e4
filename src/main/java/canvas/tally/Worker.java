package canvas.tally;

import java.util.List;
import java.util.concurrent.Callable;

/**
 * Processes one sub-chunk: decode, filter and tally into local tables.
 *
 * Malformed rows are counted and skipped. Any other exception escapes
 * {@link #call()} and is handled by the engine as a worker failure.
 */
public final class Worker implements Callable<ChunkResult> {
	private final long chunk;
	private final int part;
	private final List<String[]> rows;
	private final Tally tally;

	public Worker(final long chunk, final int part, final List<String[]> rows, final Tally tally) {
		this.chunk = chunk;
		this.part = part;
		this.rows = rows;
		this.tally = tally;
	}

	@Override
	public ChunkResult call() throws Exception {
		final String[] names = tally.dimensions();
		final FrequencyTable[] tables = new FrequencyTable[names.length];
		for (int i = 0; i < tables.length; i++)
			tables[i] = new FrequencyTable();

		long malformed = 0;
		long excluded = 0;
		String firstError = null;
		for (final String[] row : rows) {
			final Event e;
			try {
				e = tally.decode(row);
			} catch (TallyException ex) {
				if (!ex.isMalformed())
					throw ex;
				malformed++;
				if (firstError == null)
					firstError = ex.getMessage();
				continue;
			}
			if (!tally.accept(e)) {
				excluded++;
				continue;
			}
			tally.tally(e, tables);
		}
		return new ChunkResult(chunk, part, tables, rows.size(), malformed, excluded, firstError);
	}

	@Override
	public String toString() {
		return "Worker{chunk=" + chunk + ", part=" + part + ", rows=" + rows.size() + "}";
	}
}
