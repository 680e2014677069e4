package canvas.tally;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.io.File;
import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

public class TestcaseChunkReader {

	@TempDir
	File dir;

	@Test
	void gzipChunking() throws Exception {
		final File f = Fixtures.write(new File(dir, "place.csv.gzip"), Fixtures.placements(25, 1L));
		final List<Chunk> chunks = new ArrayList<>();
		try (ChunkSource source = ChunkSource.open(f, 10)) {
			assertArrayEquals(Fixtures.PLACE_HEADER.split(","), source.columns());
			for (Chunk c; (c = source.next()) != null;)
				chunks.add(c);
			assertNull(source.next());
			assertEquals(25, source.rows());
		}
		assertEquals(3, chunks.size());
		assertEquals(10, chunks.get(0).size());
		assertEquals(10, chunks.get(1).size());
		assertEquals(5, chunks.get(2).size());
		for (int i = 0; i < chunks.size(); i++)
			assertEquals(i, chunks.get(i).index());
		assertEquals(4, chunks.get(0).rows().get(0).length);
	}

	@Test
	void quotedFields() throws Exception {
		final File f = Fixtures.write(new File(dir, "quoted.csv"), //
				"timestamp,user_id,pixel_color,coordinate", //
				"2022-04-01 00:00:01 UTC,u1,#FFFFFF,\"1,2\"", //
				"", //
				"2022-04-01 00:00:02 UTC,\"u\"\"2\",#000000,\"3,", //
				"4\"");
		try (ChunkSource source = ChunkSource.open(f, 100)) {
			final Chunk c = source.next();
			assertEquals(2, c.size());
			assertArrayEquals(new String[] { "2022-04-01 00:00:01 UTC", "u1", "#FFFFFF", "1,2" }, c.rows().get(0));
			assertArrayEquals(new String[] { "2022-04-01 00:00:02 UTC", "u\"2", "#000000", "3,\n4" }, c.rows().get(1));
			assertNull(source.next());
		}
	}

	@Test
	void tabSeparated() throws Exception {
		final File f = Fixtures.write(new File(dir, "place.tsv.gz"), //
				"timestamp\tpixel_color", //
				"2022-04-01 00:00:01\t#FFFFFF", //
				"2022-04-01 00:00:02\t\\N");
		try (ChunkSource source = ChunkSource.open(f, 100)) {
			final Chunk c = source.next();
			assertEquals("#FFFFFF", c.rows().get(0)[1]);
			assertNull(c.rows().get(1)[1]);
		}
	}

	@Test
	void headerOnly() throws Exception {
		final File f = Fixtures.write(new File(dir, "empty.csv.gz"), Fixtures.PLACE_HEADER);
		try (ChunkSource source = ChunkSource.open(f, 100)) {
			assertEquals(4, source.columns().length);
			assertNull(source.next());
		}
	}

	@Test
	void unreadableInput() {
		TallyException ex = assertThrows(TallyException.class, () -> ChunkSource.open(new File(dir, "missing.csv.gz"), 10));
		assertEquals(ErrorCode.INPUT_NOT_READABLE, ex.getErrorCode());

		ex = assertThrows(TallyException.class, () -> ChunkSource.open(dir, 10));
		assertEquals(ErrorCode.INPUT_NOT_READABLE, ex.getErrorCode());
	}
}
