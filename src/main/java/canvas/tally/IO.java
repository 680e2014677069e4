/**
 * IO.java
 */
package canvas.tally;

import java.io.EOFException;
import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.text.DecimalFormat;
import java.util.zip.GZIPInputStream;
import java.util.zip.ZipEntry;
import java.util.zip.ZipInputStream;

/**
 * Utility class for file and stream operations: path resolution, compressed
 * input streams and timing.
 */
public final class IO {

	static final int GZIP_BUFSZ = 8192;

	private IO() {
	}

	public static File path(final String path) {
		final String s = path //
				.replace("~", System.getProperty("user.home")) //
				.replace("${HOME}", System.getProperty("user.home")) //
		;
		return new File(s);
	}

	/**
	 * Create input stream for file with compression support
	 *
	 * @param file File to create stream for (.gz, .gzip, .zip or plain)
	 * @return InputStream with appropriate decompression
	 * @throws IOException if stream creation fails
	 */
	static InputStream stream(final File file) throws IOException {
		final String name = file.getName().toLowerCase();
		try {
			if (name.endsWith(".gz") || name.endsWith(".gzip")) {
				return new GZIPInputStream(new FileInputStream(file), GZIP_BUFSZ);
			} else if (name.endsWith(".zip")) {
				final ZipInputStream instream = new ZipInputStream(new FileInputStream(file));
				final ZipEntry e = instream.getNextEntry();
				if (e == null) {
					instream.close();
					throw new EOFException("empty zip " + file.getCanonicalPath());
				}
				return instream;
			} else {
				return new FileInputStream(file);
			}
		} catch (EOFException ex) {
			throw new EOFException("EOF " + file.getCanonicalPath());
		}
	}

	/**
	 * File name without compression suffix, lower-cased ("a.csv.gz" -> "a.csv")
	 */
	static String plainName(final File file) {
		String name = file.getName().toLowerCase();
		for (final String ext : new String[] { ".gz", ".gzip", ".zip" }) {
			if (name.endsWith(ext))
				return name.substring(0, name.length() - ext.length());
		}
		return name;
	}

	public static String readableBytesSize(final long bytes) {
		long v = bytes;
		if (v <= 0)
			return "0";

		final String[] units = new String[] { "B", "K", "M", "G", "T" };

		int digitGroups = (int) (Math.log10(v) / Math.log10(1024));
		return new DecimalFormat("#,##0.#").format(v / Math.pow(1024, digitGroups)) + "" + units[digitGroups];
	}

	/**
	 * Wall-clock timer in milliseconds
	 */
	public static final class StopWatch {
		private long start;

		public StopWatch() {
			reset();
		}

		public void reset() {
			start = System.currentTimeMillis();
		}

		public long elapsed() {
			return System.currentTimeMillis() - start;
		}

		/**
		 * @return operations per second
		 */
		public static long ops(final long count, final long ms) {
			return Math.round(count / (Math.max(1, ms) / 1000.0d));
		}

		public long ops(final long count) {
			return ops(count, elapsed());
		}
	}
}
