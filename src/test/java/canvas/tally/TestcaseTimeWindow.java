package canvas.tally;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Instant;

import org.junit.jupiter.api.Test;

public class TestcaseTimeWindow {

	@Test
	void startIncludedEndExcluded() throws Exception {
		final TimeWindow w = TimeWindow.parse("2022-04-01 00", "2022-04-01 01");
		assertTrue(w.contains(Instant.parse("2022-04-01T00:00:00Z")));
		assertTrue(w.contains(Instant.parse("2022-04-01T00:59:59.999999999Z")));
		assertFalse(w.contains(Instant.parse("2022-04-01T01:00:00Z")));
		assertFalse(w.contains(Instant.parse("2022-03-31T23:59:59.999Z")));
	}

	@Test
	void endMustFollowStart() {
		final Instant t = Instant.parse("2022-04-01T00:00:00Z");
		TallyException ex = assertThrows(TallyException.class, () -> TimeWindow.of(t, t));
		assertEquals(ErrorCode.CONFIGURATION_ERROR, ex.getErrorCode());
		assertTrue(ex.getMessage().contains("End time should be after start time"));

		ex = assertThrows(TallyException.class, () -> TimeWindow.parse("2022-04-02 00", "2022-04-01 00"));
		assertEquals(ErrorCode.CONFIGURATION_ERROR, ex.getErrorCode());
	}

	@Test
	void unboundedAcceptsEverything() throws Exception {
		final TimeWindow w = TimeWindow.unbounded();
		assertTrue(w.contains(Instant.EPOCH));
		assertTrue(w.contains(TimestampParser.parse("2022-04-05 00:14:00.207 UTC")));
	}

	@Test
	void equality() throws Exception {
		assertEquals(TimeWindow.parse("2022-04-01 00", "2022-04-01 01"),
				TimeWindow.of(Instant.parse("2022-04-01T00:00:00Z"), Instant.parse("2022-04-01T01:00:00Z")));
	}
}
