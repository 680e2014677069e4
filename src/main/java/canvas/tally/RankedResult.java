package canvas.tally;

import java.util.Objects;

/**
 * A value of maximal (or top-k) count for one dimension.
 *
 * When no event was tallied the result is the "no data" sentinel: value
 * {@value #NONE}, count 0, {@link #isEmpty()} true.
 */
public final class RankedResult {
	public static final String NONE = "None";

	private final String dimension;
	private final String value;
	private final long count;

	public RankedResult(final String dimension, final String value, final long count) {
		this.dimension = dimension;
		this.value = value;
		this.count = count;
	}

	public static RankedResult empty(final String dimension) {
		return new RankedResult(dimension, null, 0L);
	}

	public String dimension() {
		return dimension;
	}

	/**
	 * @return the value, or {@value #NONE} for the empty result
	 */
	public String value() {
		return value == null ? NONE : value;
	}

	public long count() {
		return count;
	}

	public boolean isEmpty() {
		return value == null;
	}

	@Override
	public boolean equals(final Object o) {
		if (this == o)
			return true;
		if (!(o instanceof RankedResult))
			return false;
		final RankedResult r = (RankedResult) o;
		return count == r.count && Objects.equals(dimension, r.dimension) && Objects.equals(value, r.value);
	}

	@Override
	public int hashCode() {
		return Objects.hash(dimension, value, count);
	}

	@Override
	public String toString() {
		return dimension + "=" + value() + " (" + count + ")";
	}
}
