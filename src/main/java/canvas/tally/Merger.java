package canvas.tally;

import java.util.BitSet;
import java.util.List;

/**
 * Folds the worker results of one chunk into the running state
 */
public final class Merger {

	private Merger() {
	}

	/**
	 * Fold every result of one chunk into the state, each exactly once.
	 *
	 * Table merge is associative and commutative, so the order of
	 * {@code results} does not change the outcome.
	 *
	 * @param state   running aggregate
	 * @param chunk   index of the chunk the results belong to
	 * @param results one result per sub-chunk
	 * @throws TallyException INTERNAL_ERROR if a result belongs to another chunk or is repeated
	 */
	public static void fold(final AggregateState state, final long chunk, final List<ChunkResult> results)
			throws TallyException {
		final FrequencyTable[] tables = state.tables();
		final BitSet seen = new BitSet();
		for (final ChunkResult r : results) {
			if (r.chunk() != chunk || seen.get(r.part()))
				throw new TallyException(ErrorCode.INTERNAL_ERROR, (Object) r);
			seen.set(r.part());
			if (r.tables().length != tables.length)
				throw new TallyException(ErrorCode.INTERNAL_ERROR, "expected " + tables.length + " tables in " + r);
		}

		long rows = 0;
		for (final ChunkResult r : results) {
			final FrequencyTable[] t = r.tables();
			for (int i = 0; i < tables.length; i++)
				tables[i].merge(t[i]);
			rows += r.rows();
			state.malformed += r.malformed();
			state.excluded += r.excluded();
		}
		state.rows += rows;
		state.chunks++;
		state.lastMergedChunk = chunk;
	}
}
