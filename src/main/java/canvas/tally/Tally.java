package canvas.tally;

/**
 * What a worker does with each raw row: decode it, filter it, count it.
 *
 * Implementations are shared by all workers and must not keep mutable state.
 */
public interface Tally {

	/**
	 * @return tracked dimension names; one frequency table is kept per name
	 */
	String[] dimensions();

	/**
	 * @throws TallyException with a malformed error code to skip the row
	 */
	Event decode(String[] row) throws TallyException;

	/**
	 * @return false to exclude a decoded event (e.g. outside the time window)
	 */
	boolean accept(Event event);

	/**
	 * Count an accepted event into the worker's tables
	 *
	 * @param tables one table per dimension, in {@link #dimensions()} order
	 */
	void tally(Event event, FrequencyTable[] tables);

	/**
	 * Builds the tally of one run once the input header is known
	 */
	@FunctionalInterface
	public interface Factory {
		Tally create(RecordDecoder decoder, TimeWindow window);

		Factory DEFAULT = EventTally::new;
	}

	/**
	 * Decode with a {@link RecordDecoder}, keep events inside a {@link TimeWindow},
	 * count each dimension value once. Subclasses may override single steps.
	 */
	public static class EventTally implements Tally {
		private final RecordDecoder decoder;
		private final TimeWindow window;
		private final String[] names;

		public EventTally(final RecordDecoder decoder, final TimeWindow window) {
			this.decoder = decoder;
			this.window = window;
			this.names = decoder.names();
		}

		@Override
		public String[] dimensions() {
			return names.clone();
		}

		@Override
		public Event decode(final String[] row) throws TallyException {
			return decoder.decode(row);
		}

		@Override
		public boolean accept(final Event event) {
			return window.contains(event.instant());
		}

		@Override
		public void tally(final Event event, final FrequencyTable[] tables) {
			for (int i = 0; i < tables.length; i++)
				tables[i].add(event.value(i));
		}
	}
}
