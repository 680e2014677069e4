package canvas.tally;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits the rows of one chunk into sub-chunks for parallel processing.
 */
public interface Partitioner {

	/**
	 * @param rows  rows of one chunk
	 * @param parts requested number of sub-chunks
	 * @return non-empty sub-chunks covering every row exactly once, in order
	 */
	List<List<String[]>> partition(List<String[]> rows, int parts);

	/**
	 * Contiguous near-equal split: the first {@code size % parts} sub-chunks get
	 * one extra row. Sub-chunks are views of the input list.
	 */
	Partitioner EVEN = (final List<String[]> rows, final int parts) -> {
		final int n = Math.max(1, Math.min(parts, rows.size()));
		final List<List<String[]>> a = new ArrayList<>(n);
		final int base = rows.size() / n;
		final int extra = rows.size() % n;
		int from = 0;
		for (int i = 0; i < n; i++) {
			final int to = from + base + (i < extra ? 1 : 0);
			if (to > from)
				a.add(rows.subList(from, to));
			from = to;
		}
		return a;
	};
}
