package canvas.tally;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.PriorityQueue;
import java.util.TreeMap;

/**
 * Mapping from categorical value to occurrence count for one dimension.
 *
 * <p>Tables combine by key-wise addition over the union of their keys
 * ({@link #combine(FrequencyTable, FrequencyTable)}); the operation is
 * associative and commutative with the empty table as identity, so partial
 * tables can be merged in any grouping and order.</p>
 *
 * <p>Not thread-safe: a table is owned by one worker or by the merging step.</p>
 */
public final class FrequencyTable {

	/**
	 * Ranking order: count descending, then UTF-8 bytes ascending (unsigned)
	 */
	public static final Comparator<Map.Entry<String, Long>> RANK = (a, b) -> {
		final int c = Long.compare(b.getValue(), a.getValue());
		return c != 0 ? c : compareBytes(a.getKey(), b.getKey());
	};

	private final HashMap<String, long[]> counts;

	public FrequencyTable() {
		this.counts = new HashMap<>();
	}

	public FrequencyTable(final int expected) {
		this.counts = new HashMap<>(Math.max(16, expected));
	}

	/**
	 * Lexicographic comparison of the UTF-8 encodings, bytes read unsigned
	 */
	static int compareBytes(final String a, final String b) {
		return Arrays.compareUnsigned(a.getBytes(StandardCharsets.UTF_8), b.getBytes(StandardCharsets.UTF_8));
	}

	public void add(final String value) {
		final long[] c = counts.get(value);
		if (c != null) {
			c[0]++;
		} else {
			counts.put(value, new long[] { 1L });
		}
	}

	public void add(final String value, final long n) {
		if (n < 0)
			throw new IllegalArgumentException("negative count " + n + " for " + value);
		final long[] c = counts.get(value);
		if (c != null) {
			c[0] += n;
		} else {
			counts.put(value, new long[] { n });
		}
	}

	public long count(final String value) {
		final long[] c = counts.get(value);
		return c == null ? 0L : c[0];
	}

	/**
	 * @return number of distinct values
	 */
	public int size() {
		return counts.size();
	}

	public boolean isEmpty() {
		return counts.isEmpty();
	}

	/**
	 * @return sum of all counts
	 */
	public long total() {
		long t = 0;
		for (final long[] c : counts.values())
			t += c[0];
		return t;
	}

	/**
	 * Fold another table into this one
	 *
	 * @param other table to add; left unchanged
	 * @return this
	 */
	public FrequencyTable merge(final FrequencyTable other) {
		for (final Map.Entry<String, long[]> e : other.counts.entrySet())
			add(e.getKey(), e.getValue()[0]);
		return this;
	}

	/**
	 * Key-wise sum of two tables; keys absent from one input count as zero
	 *
	 * @return a new table, inputs unchanged
	 */
	public static FrequencyTable combine(final FrequencyTable a, final FrequencyTable b) {
		final FrequencyTable t = new FrequencyTable(a.size() + b.size());
		return t.merge(a).merge(b);
	}

	/**
	 * Highest-count value, ties resolved to the smallest UTF-8 byte sequence
	 *
	 * @param dimension name carried into the result
	 * @return ranked result, or {@link RankedResult#empty(String)} if the table is empty
	 */
	public RankedResult top(final String dimension) {
		String best = null;
		long max = -1;
		for (final Map.Entry<String, long[]> e : counts.entrySet()) {
			final long c = e.getValue()[0];
			if (c > max || (c == max && compareBytes(e.getKey(), best) < 0)) {
				best = e.getKey();
				max = c;
			}
		}
		return best == null ? RankedResult.empty(dimension) : new RankedResult(dimension, best, max);
	}

	/**
	 * Top {@code k} values in {@link #RANK} order
	 *
	 * @param dimension name carried into the results
	 * @param k         maximum number of results
	 * @return at most k results; a single empty result if the table is empty
	 */
	public List<RankedResult> top(final String dimension, final int k) {
		if (k <= 0)
			throw new IllegalArgumentException("k " + k);
		if (counts.isEmpty())
			return Collections.singletonList(RankedResult.empty(dimension));
		if (k == 1)
			return Collections.singletonList(top(dimension));

		// min-heap on rank, worst kept entry at the head
		final PriorityQueue<Map.Entry<String, Long>> heap = new PriorityQueue<>(k + 1, RANK.reversed());
		for (final Map.Entry<String, long[]> e : counts.entrySet()) {
			heap.add(Map.entry(e.getKey(), e.getValue()[0]));
			if (heap.size() > k)
				heap.poll();
		}
		final List<Map.Entry<String, Long>> sorted = new ArrayList<>(heap);
		sorted.sort(RANK);
		final List<RankedResult> a = new ArrayList<>(sorted.size());
		for (final Map.Entry<String, Long> e : sorted)
			a.add(new RankedResult(dimension, e.getKey(), e.getValue()));
		return a;
	}

	/**
	 * @return sorted snapshot of the counts
	 */
	public Map<String, Long> asMap() {
		final TreeMap<String, Long> m = new TreeMap<>();
		for (final Map.Entry<String, long[]> e : counts.entrySet())
			m.put(e.getKey(), e.getValue()[0]);
		return m;
	}

	@Override
	public boolean equals(final Object o) {
		if (this == o)
			return true;
		if (!(o instanceof FrequencyTable))
			return false;
		return asMap().equals(((FrequencyTable) o).asMap());
	}

	@Override
	public int hashCode() {
		return asMap().hashCode();
	}

	@Override
	public String toString() {
		return asMap().toString();
	}
}
