package canvas.tally;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.File;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;

public class TestcaseReport {

	@TempDir
	File dir;

	Report scenario(final int k) throws Exception {
		try (Engine engine = Fixtures.engine(Fixtures.scenario(dir)) //
				.dimensions(Dimension.column("color"), Dimension.column("coordinate")) //
				.window("2022-04-01 00", "2022-04-01 01") //
				.top(k) //
				.build()) {
			return engine.run();
		}
	}

	@Test
	void text() throws Exception {
		final String s = scenario(1).text();
		assertTrue(s.contains("Most placed color: red (2)"), s);
		assertTrue(s.contains("Most placed coordinate: 0,0 (2)"), s);
		assertTrue(s.contains("rows=3, malformed=0"), s);
		assertTrue(s.contains("Execution time: "), s);

		final String t = scenario(2).text();
		assertTrue(t.contains("Top 2 color:"), t);
		assertTrue(t.contains("1. red (2)"), t);
		assertTrue(t.contains("2. blue (1)"), t);
	}

	@Test
	void json() throws Exception {
		final Report r = scenario(2);
		final JsonObject o = JsonParser.parseString(r.json()).getAsJsonObject();
		assertEquals("scenario.csv.gzip", o.get("input").getAsString());
		assertEquals(3, o.get("rows").getAsLong());
		assertEquals(0, o.get("malformed").getAsLong());
		assertEquals(3, o.get("tallied").getAsLong());
		assertEquals("2022-04-01T00:00:00Z", o.getAsJsonObject("window").get("start").getAsString());

		final JsonArray colors = o.getAsJsonObject("top").getAsJsonArray("color");
		assertEquals(2, colors.size());
		assertEquals("red", colors.get(0).getAsJsonObject().get("value").getAsString());
		assertEquals(2, colors.get(0).getAsJsonObject().get("count").getAsLong());

		assertEquals(JsonParser.parseString(r.json(true)), JsonParser.parseString(r.json(false)));
	}

	@Test
	void unknownDimension() throws Exception {
		final Report r = scenario(1);
		assertThrows(IllegalArgumentException.class, () -> r.top("pixel_color"));
	}
}
