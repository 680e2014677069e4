package canvas.tally;

import java.io.File;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.zip.GZIPOutputStream;

/**
 * Small canvas files for tests
 */
final class Fixtures {

	static final String PLACE_HEADER = "timestamp,user_id,pixel_color,coordinate";

	static final String[] COLORS = { "#FFFFFF", "#000000", "#FF4500", "#2450A4", "#FFD635", "#00A368" };

	private Fixtures() {
	}

	/**
	 * Write lines to a file, gzip-compressed when the name ends with .gz or .gzip
	 */
	static File write(final File file, final String... lines) throws IOException {
		final String name = file.getName();
		try (OutputStream os = name.endsWith(".gz") || name.endsWith(".gzip")
				? new GZIPOutputStream(new FileOutputStream(file))
				: new FileOutputStream(file); //
				Writer w = new OutputStreamWriter(os, StandardCharsets.UTF_8)) {
			for (final String l : lines) {
				w.write(l);
				w.write('\n');
			}
		}
		return file;
	}

	static File write(final File file, final List<String> lines) throws IOException {
		return write(file, lines.toArray(String[]::new));
	}

	/**
	 * Three rows of the reference scenario: red twice, a coordinate tie
	 */
	static File scenario(final File dir) throws IOException {
		return write(new File(dir, "scenario.csv.gzip"), //
				"timestamp,color,coordinate", //
				"2022-04-01 00:00:01 UTC,red,\"0,0\"", //
				"2022-04-01 00:00:02 UTC,red,\"1,1\"", //
				"2022-04-01 00:00:03 UTC,blue,\"0,0\"");
	}

	/**
	 * Pseudo-random placements over 2022-04-01 00:00 to 05:59, header first
	 */
	static List<String> placements(final int rows, final long seed) {
		final Random r = new Random(seed);
		final List<String> a = new ArrayList<>(rows + 1);
		a.add(PLACE_HEADER);
		for (int i = 0; i < rows; i++) {
			final int h = r.nextInt(6);
			final int m = r.nextInt(60);
			final int s = r.nextInt(60);
			final String ts = r.nextBoolean() //
					? String.format("2022-04-01 %02d:%02d:%02d.%03d UTC", h, m, s, r.nextInt(1000))
					: String.format("2022-04-01 %02d:%02d:%02d UTC", h, m, s);
			a.add(ts + ",user" + r.nextInt(50) + "," + COLORS[r.nextInt(COLORS.length)] + ",\"" + r.nextInt(20)
					+ "," + r.nextInt(20) + "\"");
		}
		return a;
	}

	static Engine.Builder engine(final File file) {
		return Engine.builder(file).logger(new Logger.NullLogger());
	}
}
