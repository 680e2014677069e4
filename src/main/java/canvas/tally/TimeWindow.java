package canvas.tally;

import java.time.Instant;
import java.util.Objects;

/**
 * Half-open time range {@code [start, end)} used as the inclusion predicate
 * over events. {@code end} is strictly after {@code start}; this is checked
 * once, when the window is built.
 */
public final class TimeWindow {
	private final Instant start;
	private final Instant end;

	private TimeWindow(final Instant start, final Instant end) {
		this.start = start;
		this.end = end;
	}

	/**
	 * @throws TallyException CONFIGURATION_ERROR if end is not after start
	 */
	public static TimeWindow of(final Instant start, final Instant end) throws TallyException {
		if (start == null || end == null)
			throw new TallyException(ErrorCode.CONFIGURATION_ERROR, "window bounds required");
		if (!end.isAfter(start))
			throw new TallyException(ErrorCode.CONFIGURATION_ERROR,
					"End time should be after start time. (" + start + " >= " + end + ")");
		return new TimeWindow(start, end);
	}

	/**
	 * Window from two {@code yyyy-MM-dd HH} strings
	 *
	 * @throws TallyException CONFIGURATION_ERROR on bad format or ordering
	 */
	public static TimeWindow parse(final String start, final String end) throws TallyException {
		return of(TimestampParser.parseHour(start), TimestampParser.parseHour(end));
	}

	/**
	 * Window that accepts every instant
	 */
	public static TimeWindow unbounded() {
		return new TimeWindow(Instant.MIN, Instant.MAX);
	}

	public Instant start() {
		return start;
	}

	public Instant end() {
		return end;
	}

	public boolean contains(final Instant instant) {
		return !instant.isBefore(start) && instant.isBefore(end);
	}

	@Override
	public boolean equals(final Object o) {
		if (this == o)
			return true;
		if (!(o instanceof TimeWindow))
			return false;
		final TimeWindow w = (TimeWindow) o;
		return start.equals(w.start) && end.equals(w.end);
	}

	@Override
	public int hashCode() {
		return Objects.hash(start, end);
	}

	@Override
	public String toString() {
		return "[" + start + ", " + end + ")";
	}
}
