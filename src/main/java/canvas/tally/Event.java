package canvas.tally;

import java.time.Instant;
import java.util.Arrays;
import java.util.Objects;

/**
 * One decoded record: an instant and one categorical value per tracked
 * dimension. Immutable.
 */
public final class Event {
	private final Instant instant;
	private final String[] names;
	private final String[] values;

	Event(final Instant instant, final String[] names, final String[] values) {
		this.instant = instant;
		this.names = names;
		this.values = values;
	}

	public Instant instant() {
		return instant;
	}

	public int size() {
		return values.length;
	}

	/**
	 * @param i dimension position in the schema
	 */
	public String value(final int i) {
		return values[i];
	}

	/**
	 * @param dimension dimension name
	 * @return value, or null if the dimension is not tracked
	 */
	public String get(final String dimension) {
		for (int i = 0; i < names.length; i++) {
			if (names[i].equals(dimension))
				return values[i];
		}
		return null;
	}

	@Override
	public boolean equals(final Object o) {
		if (this == o)
			return true;
		if (!(o instanceof Event))
			return false;
		final Event e = (Event) o;
		return instant.equals(e.instant) && Arrays.equals(names, e.names) && Arrays.equals(values, e.values);
	}

	@Override
	public int hashCode() {
		return Objects.hash(instant, Arrays.hashCode(names), Arrays.hashCode(values));
	}

	@Override
	public String toString() {
		final StringBuilder s = new StringBuilder("Event{").append(instant);
		for (int i = 0; i < names.length; i++)
			s.append(", ").append(names[i]).append('=').append(values[i]);
		return s.append('}').toString();
	}
}
