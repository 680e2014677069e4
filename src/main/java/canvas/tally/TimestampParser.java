package canvas.tally;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.time.temporal.ChronoField;

/**
 * Converts textual timestamps into UTC instants.
 *
 * Formats are tried in a fixed priority order, most specific first, and the
 * first one that matches wins. Sub-second precision is tried before second
 * precision and the explicit " UTC" suffix before the bare form, so an input
 * matching a narrower pattern is never read by a looser one.
 */
public final class TimestampParser {

	/**
	 * Recognized timestamp encodings, in priority order
	 */
	public enum Format {
		/** yyyy-MM-dd HH:mm:ss.f UTC */
		SUBSECOND_UTC(true, true), //
		/** yyyy-MM-dd HH:mm:ss UTC */
		SECOND_UTC(false, true), //
		/** yyyy-MM-dd HH:mm:ss.f */
		SUBSECOND(true, false), //
		/** yyyy-MM-dd HH:mm:ss */
		SECOND(false, false);

		private final DateTimeFormatter formatter;

		Format(final boolean fraction, final boolean utcSuffix) {
			final DateTimeFormatterBuilder b = new DateTimeFormatterBuilder() //
					.appendPattern("uuuu-MM-dd HH:mm:ss");
			if (fraction)
				b.appendFraction(ChronoField.NANO_OF_SECOND, 1, 9, true);
			if (utcSuffix)
				b.appendLiteral(" UTC");
			this.formatter = b.toFormatter().withResolverStyle(ResolverStyle.STRICT);
		}

		Instant parse(final CharSequence s) {
			return LocalDateTime.parse(s, formatter).toInstant(ZoneOffset.UTC);
		}
	}

	static final DateTimeFormatter HOUR_FORMAT = new DateTimeFormatterBuilder() //
			.appendPattern("uuuu-MM-dd HH") //
			.toFormatter() //
			.withResolverStyle(ResolverStyle.STRICT);

	private static final Format[] FORMATS = Format.values();

	private TimestampParser() {
	}

	/**
	 * Parse a record timestamp
	 *
	 * @param text e.g. "2022-04-01 12:44:10.315 UTC"
	 * @return UTC instant
	 * @throws TallyException UNRECOGNIZED_TIMESTAMP_FORMAT if no format matches
	 */
	public static Instant parse(final String text) throws TallyException {
		return parse(text, null);
	}

	/**
	 * Parse a record timestamp, reporting which format matched
	 *
	 * @param text    timestamp text
	 * @param matched if not null, receives the matching format at index 0
	 * @return UTC instant
	 * @throws TallyException UNRECOGNIZED_TIMESTAMP_FORMAT if no format matches
	 */
	public static Instant parse(final String text, final Format[] matched) throws TallyException {
		if (text == null || text.isEmpty())
			throw new TallyException(ErrorCode.UNRECOGNIZED_TIMESTAMP_FORMAT, (Object) text);

		final String s = text.trim();
		for (final Format f : FORMATS) {
			try {
				final Instant instant = f.parse(s);
				if (matched != null && matched.length > 0)
					matched[0] = f;
				return instant;
			} catch (DateTimeParseException ex) {
				// next format
			}
		}
		throw new TallyException(ErrorCode.UNRECOGNIZED_TIMESTAMP_FORMAT, (Object) text);
	}

	/**
	 * Parse a window bound in the form {@code yyyy-MM-dd HH}
	 *
	 * @param text e.g. "2022-04-01 00"
	 * @return UTC instant at the start of that hour
	 * @throws TallyException CONFIGURATION_ERROR on any other form
	 */
	public static Instant parseHour(final String text) throws TallyException {
		if (text == null)
			throw new TallyException(ErrorCode.CONFIGURATION_ERROR, "Invalid format: null");
		try {
			return LocalDateTime.parse(text.trim() + ":00:00", HOUR_FORMAT_FULL).toInstant(ZoneOffset.UTC);
		} catch (DateTimeParseException ex) {
			throw new TallyException(ErrorCode.CONFIGURATION_ERROR, "Invalid format: " + text, ex);
		}
	}

	/**
	 * Format an instant truncated to its hour, the inverse of {@link #parseHour(String)}
	 */
	public static String formatHour(final Instant instant) {
		return LocalDateTime.ofInstant(instant, ZoneOffset.UTC).format(HOUR_FORMAT);
	}

	private static final DateTimeFormatter HOUR_FORMAT_FULL = new DateTimeFormatterBuilder() //
			.appendPattern("uuuu-MM-dd HH:mm:ss") //
			.toFormatter() //
			.withResolverStyle(ResolverStyle.STRICT);
}
