package canvas.tally;

import java.time.Instant;
import java.util.Arrays;
import java.util.Locale;

/**
 * A tracked dimension: a named categorical value extracted from each record.
 *
 * <ul>
 * <li>column: the value of one column, optionally normalized (trim, lower-case)</li>
 * <li>hour: the record instant truncated to the hour ({@code yyyy-MM-dd HH})</li>
 * <li>composite: several columns joined with {@code |}</li>
 * </ul>
 */
public final class Dimension {
	public static final String HOUR = "hour";
	public static final String COMPOSITE_DELIM = "|";

	/**
	 * Handler interface for value extraction
	 */
	public interface Handler {
		/**
		 * Extracts the dimension value of a row
		 * @param row raw fields
		 * @param index resolved column indexes of this dimension
		 * @param instant decoded record instant
		 * @return value, or null/empty when the row has none
		 */
		String get(final String[] row, final int[] index, final Instant instant);
	}

	/** Default handler - the raw value of the single column */
	public static final Handler DEFAULT = (final String[] row, final int[] index, final Instant instant) -> row[index[0]];

	/** Trimmed and lower-cased value of the single column */
	public static final Handler NORMALIZED = (final String[] row, final int[] index, final Instant instant) -> {
		final String v = row[index[0]];
		return v == null ? null : v.trim().toLowerCase(Locale.ROOT);
	};

	/** Record instant truncated to the hour */
	public static final Handler TRUNCATED_HOUR = (final String[] row, final int[] index,
			final Instant instant) -> TimestampParser.formatHour(instant);

	/**
	 * Handler joining several columns; any empty part makes the whole value empty
	 */
	public static final class Composite implements Handler {
		private final boolean normalize;

		public Composite(final boolean normalize) {
			this.normalize = normalize;
		}

		@Override
		public String get(final String[] row, final int[] index, final Instant instant) {
			final StringBuilder s = new StringBuilder();
			for (int i = 0; i < index.length; i++) {
				String v = row[index[i]];
				if (v == null)
					return null;
				if (normalize)
					v = v.trim().toLowerCase(Locale.ROOT);
				if (v.isEmpty())
					return null;
				if (i > 0)
					s.append(COMPOSITE_DELIM);
				s.append(v);
			}
			return s.toString();
		}
	}

	private final String name;
	private final String[] columns;
	private final Handler handler;

	public Dimension(final String name, final String[] columns, final Handler handler) {
		if (name == null || name.isEmpty())
			throw new IllegalArgumentException("dimension name");
		this.name = name;
		this.columns = columns == null ? new String[0] : columns.clone();
		this.handler = handler != null ? handler : DEFAULT;
	}

	public static Dimension column(final String column) {
		return column(column, column, false);
	}

	public static Dimension column(final String name, final String column, final boolean normalize) {
		return new Dimension(name, new String[] { column }, normalize ? NORMALIZED : DEFAULT);
	}

	public static Dimension hour() {
		return new Dimension(HOUR, null, TRUNCATED_HOUR);
	}

	public static Dimension composite(final String name, final boolean normalize, final String... columns) {
		if (columns == null || columns.length < 2)
			throw new IllegalArgumentException("composite needs two or more columns");
		return new Dimension(name, columns, new Composite(normalize));
	}

	/**
	 * Parse a command-line dimension: {@code hour}, {@code a|b}, or a column name
	 */
	public static Dimension parse(final String text, final boolean normalize) {
		final String s = text.trim();
		if (HOUR.equalsIgnoreCase(s))
			return hour();
		if (s.contains(COMPOSITE_DELIM)) {
			final String[] a = s.split("\\" + COMPOSITE_DELIM);
			for (int i = 0; i < a.length; i++) {
				a[i] = a[i].trim();
				if (a[i].isEmpty())
					throw new IllegalArgumentException("empty column in " + s);
			}
			return composite(s, normalize, a);
		}
		return column(s, s, normalize);
	}

	public String name() {
		return name;
	}

	/**
	 * @return source columns read by this dimension (empty for hour)
	 */
	public String[] columns() {
		return columns.clone();
	}

	Handler handler() {
		return handler;
	}

	@Override
	public String toString() {
		return columns.length == 0 || (columns.length == 1 && columns[0].equals(name)) //
				? name
				: name + Arrays.toString(columns);
	}
}
