package canvas.tally;

import java.lang.reflect.Type;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonSerializationContext;
import com.google.gson.JsonSerializer;

/**
 * Outcome of a successful run: row counters, elapsed time and the ranked
 * values of every tracked dimension.
 */
public final class Report {
	private final String input;
	private final TimeWindow window;
	private final long rows;
	private final long malformed;
	private final long excluded;
	private final long chunks;
	private final int threads;
	private final long elapsed;
	private final Map<String, List<RankedResult>> top;

	Report(final String input, final TimeWindow window, final AggregateState state, final int k, final int threads,
			final long elapsed) {
		this.input = input;
		this.window = window;
		this.rows = state.rows();
		this.malformed = state.malformed();
		this.excluded = state.excluded();
		this.chunks = state.chunks();
		this.threads = threads;
		this.elapsed = elapsed;
		final LinkedHashMap<String, List<RankedResult>> m = new LinkedHashMap<>();
		for (final Map.Entry<String, FrequencyTable> e : state.asMap().entrySet())
			m.put(e.getKey(), Collections.unmodifiableList(e.getValue().top(e.getKey(), k)));
		this.top = Collections.unmodifiableMap(m);
	}

	public String input() {
		return input;
	}

	public TimeWindow window() {
		return window;
	}

	/**
	 * @return total rows seen
	 */
	public long rows() {
		return rows;
	}

	/**
	 * @return rows skipped as malformed
	 */
	public long malformed() {
		return malformed;
	}

	/**
	 * @return rows decoded but outside the window
	 */
	public long excluded() {
		return excluded;
	}

	public long tallied() {
		return rows - malformed - excluded;
	}

	public long chunks() {
		return chunks;
	}

	public int threads() {
		return threads;
	}

	/**
	 * @return elapsed wall-clock milliseconds
	 */
	public long elapsed() {
		return elapsed;
	}

	/**
	 * @return ranked values per dimension, at least one entry each
	 */
	public Map<String, List<RankedResult>> top() {
		return top;
	}

	/**
	 * @return first ranked value of the dimension, the empty result if nothing was tallied
	 * @throws IllegalArgumentException if the dimension is not tracked
	 */
	public RankedResult top(final String dimension) {
		final List<RankedResult> a = top.get(dimension);
		if (a == null)
			throw new IllegalArgumentException("dimension not tracked: " + dimension);
		return a.get(0);
	}

	/**
	 * Plain text rendering, one {@code Most placed <dimension>: <value>} line per dimension
	 */
	public String text() {
		final StringBuilder s = new StringBuilder();
		for (final Map.Entry<String, List<RankedResult>> e : top.entrySet()) {
			final List<RankedResult> a = e.getValue();
			if (a.size() == 1) {
				final RankedResult r = a.get(0);
				s.append("Most placed ").append(e.getKey()).append(": ").append(r.value());
				if (!r.isEmpty())
					s.append(" (").append(r.count()).append(")");
				s.append('\n');
			} else {
				s.append("Top ").append(a.size()).append(' ').append(e.getKey()).append(":\n");
				for (int i = 0; i < a.size(); i++)
					s.append(String.format("  %d. %s (%d)%n", i + 1, a.get(i).value(), a.get(i).count()));
			}
		}
		s.append(String.format("rows=%,d, malformed=%,d, excluded=%,d, tallied=%,d, chunks=%d%n", rows, malformed,
				excluded, tallied(), chunks));
		s.append(String.format("Execution time: %.3f seconds%n", elapsed / 1000.0));
		return s.toString();
	}

	public String json() {
		return json(true);
	}

	public String json(final boolean pretty) {
		final GsonBuilder gb = new GsonBuilder() //
				.registerTypeAdapter(RankedResult.class, new JsonSerializer<RankedResult>() {
					@Override
					public JsonElement serialize(RankedResult r, Type typeOfSrc, JsonSerializationContext context) {
						final JsonObject o = new JsonObject();
						o.addProperty("value", r.value());
						o.addProperty("count", r.count());
						return o;
					}
				}) //
				.registerTypeAdapter(TimeWindow.class, new JsonSerializer<TimeWindow>() {
					@Override
					public JsonElement serialize(TimeWindow w, Type typeOfSrc, JsonSerializationContext context) {
						final JsonObject o = new JsonObject();
						o.addProperty("start", w.start().toString());
						o.addProperty("end", w.end().toString());
						return o;
					}
				}) //
		;
		if (pretty)
			gb.setPrettyPrinting();
		final Gson g = gb.create();

		final JsonObject o = new JsonObject();
		o.addProperty("input", input);
		if (window != null)
			o.add("window", g.toJsonTree(window, TimeWindow.class));
		o.addProperty("rows", rows);
		o.addProperty("malformed", malformed);
		o.addProperty("excluded", excluded);
		o.addProperty("tallied", tallied());
		o.addProperty("chunks", chunks);
		o.addProperty("threads", threads);
		o.addProperty("elapsed_ms", elapsed);
		final JsonObject t = new JsonObject();
		for (final Map.Entry<String, List<RankedResult>> e : top.entrySet()) {
			final JsonArray a = new JsonArray();
			for (final RankedResult r : e.getValue())
				a.add(g.toJsonTree(r, RankedResult.class));
			t.add(e.getKey(), a);
		}
		o.add("top", t);
		return g.toJson(o);
	}

	@Override
	public String toString() {
		return "Report{input=" + input + ", rows=" + rows + ", malformed=" + malformed + ", excluded=" + excluded
				+ ", chunks=" + chunks + ", top=" + top + "}";
	}
}
