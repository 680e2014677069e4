package canvas.tally;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.File;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

public class TestcaseEngine {

	@TempDir
	File dir;

	@Test
	void mostFrequentWithTieBreak() throws Exception {
		final File f = Fixtures.scenario(dir);
		try (Engine engine = Fixtures.engine(f) //
				.dimensions(Dimension.column("color"), Dimension.column("coordinate")) //
				.window("2022-04-01 00", "2022-04-01 01") //
				.threads(2) //
				.build()) {
			final Report report = engine.run();
			assertEquals(Engine.State.COMPLETED, engine.state());
			assertEquals(new RankedResult("color", "red", 2), engine.top("color"));
			assertEquals(new RankedResult("coordinate", "0,0", 2), engine.top("coordinate"));
			assertEquals(engine.top("color"), report.top("color"));
			assertEquals(3, report.rows());
			assertEquals(0, report.malformed());
			assertEquals(3, report.tallied());
			assertEquals(0, engine.lastMergedChunk());
		}
	}

	@Test
	void coordinateTieResolvedToSmallestValue() throws Exception {
		final File g = Fixtures.write(new File(dir, "tie.csv.gz"), //
				"timestamp,color,coordinate", //
				"2022-04-01 00:00:01 UTC,red,\"1,1\"", //
				"2022-04-01 00:00:02 UTC,red,\"0,0\"", //
				"2022-04-01 00:00:03 UTC,blue,\"2,2\"");
		for (final int threads : new int[] { 1, 3 }) {
			try (Engine engine = Fixtures.engine(g) //
					.dimensions(Dimension.column("color"), Dimension.column("coordinate")) //
					.window("2022-04-01 00", "2022-04-01 01") //
					.threads(threads) //
					.chunkSize(1) //
					.build()) {
				final Report report = engine.run();
				assertEquals(new RankedResult("color", "red", 2), report.top("color"));
				assertEquals(new RankedResult("coordinate", "0,0", 1), report.top("coordinate"));
				assertEquals(3, report.chunks());
				assertEquals(2, engine.lastMergedChunk());
			}
		}
	}

	@Test
	void emptyWindowGivesSentinel() throws Exception {
		final File f = Fixtures.scenario(dir);
		try (Engine engine = Fixtures.engine(f) //
				.dimensions(Dimension.column("color"), Dimension.column("coordinate")) //
				.window("2022-04-02 00", "2022-04-02 01") //
				.build()) {
			final Report report = engine.run();
			assertEquals(Engine.State.COMPLETED, engine.state());
			assertEquals(3, report.rows());
			assertEquals(3, report.excluded());
			assertEquals(0, report.tallied());
			for (final String d : new String[] { "color", "coordinate" }) {
				assertTrue(report.top(d).isEmpty());
				assertEquals("None", report.top(d).value());
				assertEquals(0, report.top(d).count());
			}
			assertTrue(report.text().contains("Most placed color: None"));
		}
	}

	@Test
	void endNotAfterStartFailsBeforeReading() throws Exception {
		final File f = Fixtures.scenario(dir);
		for (final String[] w : new String[][] { { "2022-04-01 01", "2022-04-01 01" },
				{ "2022-04-01 02", "2022-04-01 01" } }) {
			try (Engine engine = Fixtures.engine(f).window(w[0], w[1]).build()) {
				final TallyException ex = assertThrows(TallyException.class, engine::run);
				assertEquals(ErrorCode.CONFIGURATION_ERROR, ex.getErrorCode());
				assertEquals(Engine.State.FAILED, engine.state());
				assertEquals(-1, engine.lastMergedChunk());
				assertThrows(IllegalStateException.class, () -> engine.top("pixel_color"));
			}
		}
	}

	@Test
	void invalidSettingsAreConfigurationErrors() throws Exception {
		final File f = Fixtures.scenario(dir);
		final Dimension color = Dimension.column("color");

		TallyException ex = assertThrows(TallyException.class, () -> run(Fixtures.engine(new File(dir, "nope.csv.gz"))));
		assertEquals(ErrorCode.INPUT_NOT_READABLE, ex.getErrorCode());
		assertTrue(ex.getErrorCode().configuration());

		ex = assertThrows(TallyException.class, () -> run(Fixtures.engine(f).dimensions()));
		assertEquals(ErrorCode.CONFIGURATION_ERROR, ex.getErrorCode());

		ex = assertThrows(TallyException.class, () -> run(Fixtures.engine(f).dimensions(color).chunkSize(0)));
		assertEquals(ErrorCode.CONFIGURATION_ERROR, ex.getErrorCode());

		ex = assertThrows(TallyException.class, () -> run(Fixtures.engine(f).dimensions(color).threads(0)));
		assertEquals(ErrorCode.CONFIGURATION_ERROR, ex.getErrorCode());

		ex = assertThrows(TallyException.class, () -> run(Fixtures.engine(f).dimensions(color).top(0)));
		assertEquals(ErrorCode.CONFIGURATION_ERROR, ex.getErrorCode());

		// place schema against a file without pixel_color
		ex = assertThrows(TallyException.class, () -> run(Fixtures.engine(f)));
		assertEquals(ErrorCode.CONFIGURATION_ERROR, ex.getErrorCode());

		ex = assertThrows(TallyException.class, () -> Fixtures.engine(f).window("2022-04-01", "2022-04-02"));
		assertEquals(ErrorCode.CONFIGURATION_ERROR, ex.getErrorCode());
	}

	static Report run(final Engine.Builder b) throws TallyException {
		try (Engine engine = b.build()) {
			return engine.run();
		}
	}

	@Test
	void sameResultForOneAndEightThreads() throws Exception {
		final File f = Fixtures.write(new File(dir, "place.csv.gzip"), Fixtures.placements(5000, 42L));
		Report one = null;
		for (final int threads : new int[] { 1, 8 }) {
			try (Engine engine = Fixtures.engine(f) //
					.dimensions(Dimension.column("pixel_color"), Dimension.column("coordinate"), Dimension.hour(),
							Dimension.parse("coordinate|pixel_color", false)) //
					.window("2022-04-01 01", "2022-04-01 05") //
					.chunkSize(700) //
					.threads(threads) //
					.top(5) //
					.build()) {
				final Report r = engine.run();
				assertEquals(8, r.chunks());
				if (one == null) {
					one = r;
				} else {
					assertEquals(one.top(), r.top());
					assertEquals(one.tallied(), r.tallied());
					assertEquals(one.excluded(), r.excluded());
				}
			}
		}
		assertEquals(5000, one.rows());
		assertTrue(one.excluded() > 0);
		assertEquals(4, one.top().get(Dimension.HOUR).size());
	}

	@Test
	void malformedRowIsIsolated() throws Exception {
		final List<String> lines = Fixtures.placements(200, 3L);
		final File clean = Fixtures.write(new File(dir, "clean.csv.gz"), lines);
		lines.add(100, "2022-04-01 99:00:00 UTC,user1,#FFFFFF,\"1,1\"");
		final File dirty = Fixtures.write(new File(dir, "dirty.csv.gz"), lines);

		final AggregateState[] states = new AggregateState[2];
		final Report[] reports = new Report[2];
		final File[] files = { clean, dirty };
		for (int i = 0; i < 2; i++) {
			try (Engine engine = Fixtures.engine(files[i]).chunkSize(64).threads(4).build()) {
				reports[i] = engine.run();
				states[i] = engine.aggregate();
			}
		}
		assertEquals(reports[0].malformed() + 1, reports[1].malformed());
		assertEquals(reports[0].rows() + 1, reports[1].rows());
		assertEquals(states[0].asMap(), states[1].asMap());
	}

	@Test
	void malformedLimit() throws Exception {
		final File f = Fixtures.write(new File(dir, "bad.csv.gz"), //
				Fixtures.PLACE_HEADER, //
				"2022-04-01 00:00:01 UTC,u,#FFFFFF,\"0,0\"", //
				"not a time,u,#FFFFFF,\"0,0\"", //
				"2022-04-01 00:00:01 UTC,u,,\"0,0\"", //
				"2022-04-01 00:00:01 UTC,u");
		assertEquals(3, run(Fixtures.engine(f).maxMalformed(3)).malformed());

		try (Engine engine = Fixtures.engine(f).maxMalformed(2).chunkSize(2).build()) {
			final TallyException ex = assertThrows(TallyException.class, engine::run);
			assertEquals(ErrorCode.TOO_MANY_MALFORMED, ex.getErrorCode());
			assertEquals(1, engine.lastMergedChunk());
		}
	}

	/**
	 * Tally that throws on one value, a given number of times
	 */
	static Tally.Factory failing(final String value, final int failures, final AtomicInteger calls) {
		return (decoder, window) -> new Tally.EventTally(decoder, window) {
			@Override
			public void tally(final Event event, final FrequencyTable[] tables) {
				if (value.equals(event.value(0)) && calls.incrementAndGet() <= failures)
					throw new IllegalStateException("injected fault on " + value);
				super.tally(event, tables);
			}
		};
	}

	@Test
	void failedSubChunkIsRetriedOnce() throws Exception {
		final File f = Fixtures.write(new File(dir, "place.csv.gz"), Fixtures.placements(300, 11L));
		final Report expected = run(Fixtures.engine(f).chunkSize(50).threads(4));

		final AtomicInteger calls = new AtomicInteger();
		final Report r = run(Fixtures.engine(f).chunkSize(50).threads(4).tally(failing("#FF4500", 1, calls)));
		assertTrue(calls.get() > 1);
		assertEquals(expected.top(), r.top());
		assertEquals(expected.tallied(), r.tallied());
	}

	@Test
	void failedRetryFailsTheRun() throws Exception {
		final File f = Fixtures.write(new File(dir, "place.csv.gz"), //
				Fixtures.PLACE_HEADER, //
				"2022-04-01 00:00:01 UTC,u,#FFFFFF,\"0,0\"", //
				"2022-04-01 00:00:02 UTC,u,#FFFFFF,\"0,0\"", //
				"2022-04-01 00:00:03 UTC,u,#000000,\"0,0\"", //
				"2022-04-01 00:00:04 UTC,u,#FF4500,\"0,0\"");
		try (Engine engine = Fixtures.engine(f) //
				.chunkSize(2) //
				.threads(2) //
				.tally(failing("#FF4500", Integer.MAX_VALUE, new AtomicInteger())) //
				.build()) {
			final TallyException ex = assertThrows(TallyException.class, engine::run);
			assertEquals(ErrorCode.WORKER_FAILURE, ex.getErrorCode());
			assertEquals(Engine.State.FAILED, engine.state());
			assertEquals(0, engine.lastMergedChunk());

			final Engine.Failure failure = (Engine.Failure) ex.getContext();
			assertEquals(1, failure.chunk());
			assertEquals(1, failure.part());
			assertTrue(ex.getCause() instanceof IllegalStateException);
			assertThrows(IllegalStateException.class, () -> engine.top("pixel_color"));
		}
	}

	@Test
	void cancelStopsAtChunkBoundary() throws Exception {
		final File f = Fixtures.write(new File(dir, "place.csv.gz"), Fixtures.placements(100, 5L));
		final Engine[] holder = new Engine[1];
		try (Engine engine = Fixtures.engine(f) //
				.chunkSize(10) //
				.threads(2) //
				.tally((decoder, window) -> new Tally.EventTally(decoder, window) {
					@Override
					public boolean accept(final Event event) {
						holder[0].cancel();
						return super.accept(event);
					}
				}) //
				.build()) {
			holder[0] = engine;
			final TallyException ex = assertThrows(TallyException.class, engine::run);
			assertEquals(ErrorCode.CANCELLED, ex.getErrorCode());
			assertEquals(0, engine.lastMergedChunk());
			assertEquals(Engine.State.FAILED, engine.state());
		}
	}

	@Test
	void timeoutCheckedBetweenChunks() throws Exception {
		final File f = Fixtures.write(new File(dir, "place.csv.gz"), Fixtures.placements(40, 9L));
		try (Engine engine = Fixtures.engine(f) //
				.chunkSize(10) //
				.threads(1) //
				.timeout(Duration.ofMillis(200)) //
				.tally((decoder, window) -> new Tally.EventTally(decoder, window) {
					@Override
					public boolean accept(final Event event) {
						try {
							Thread.sleep(25);
						} catch (InterruptedException e) {
							Thread.currentThread().interrupt();
						}
						return super.accept(event);
					}
				}) //
				.build()) {
			final TallyException ex = assertThrows(TallyException.class, engine::run);
			assertEquals(ErrorCode.TIMEOUT, ex.getErrorCode());
			assertTrue(engine.lastMergedChunk() >= 0);
			assertTrue(engine.lastMergedChunk() < 3);
		}
	}

	@Test
	void poolIsReusedAcrossRuns() throws Exception {
		final File f = Fixtures.scenario(dir);
		try (Engine engine = Fixtures.engine(f).dimensions(Dimension.column("color")).threads(2).build()) {
			final RankedResult first = engine.run().top("color");
			assertEquals(first, engine.run().top("color"));
			engine.close();
			final TallyException ex = assertThrows(TallyException.class, engine::run);
			assertEquals(ErrorCode.CONFIGURATION_ERROR, ex.getErrorCode());
		}
	}

	@Test
	void normalizedValuesMerge() throws Exception {
		final File f = Fixtures.write(new File(dir, "mixed.csv"), //
				Fixtures.PLACE_HEADER, //
				"2022-04-01 00:00:01 UTC,u,#ffffff,\"0,0\"", //
				"2022-04-01 00:00:02 UTC,u, #FFFFFF,\"0,0\"", //
				"2022-04-01 00:00:03 UTC,u,#000000,\"0,0\"");
		final Report r = run(Fixtures.engine(f).dimensions(Dimension.column("pixel_color", "pixel_color", true)));
		assertEquals(new RankedResult("pixel_color", "#ffffff", 2), r.top("pixel_color"));
	}
}
