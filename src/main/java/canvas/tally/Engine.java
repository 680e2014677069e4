package canvas.tally;

import java.io.File;
import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Chunked, parallel frequency aggregation over one input.
 *
 * <pre>
 * try (Engine engine = Engine.builder(new File("2022_place_canvas_history.csv.gzip"))
 *         .window("2022-04-01 12", "2022-04-01 18")
 *         .dimensions(Dimension.column("pixel_color"), Dimension.column("coordinate"))
 *         .threads(8)
 *         .build()) {
 *     Report report = engine.run();
 *     System.out.print(report.text());
 * }
 * </pre>
 *
 * Each chunk is split into sub-chunks, tallied on a fixed pool that lives as
 * long as the engine, and merged into one running state once every sub-chunk
 * of that chunk has finished. A failed sub-chunk is retried once on a fresh
 * worker. Cancellation and the timeout are checked between chunks.
 */
public final class Engine implements AutoCloseable {

	public static final int DEFAULT_THREADS = Integer.getInteger("TALLY_THREADS",
			Runtime.getRuntime().availableProcessors());

	public enum State {
		IDLE, VALIDATING, RUNNING, MERGING, COMPLETED, FAILED
	}

	/**
	 * Where a run failed
	 */
	public static final class Failure {
		private final long chunk;
		private final int part;

		Failure(final long chunk, final int part) {
			this.chunk = chunk;
			this.part = part;
		}

		public long chunk() {
			return chunk;
		}

		/**
		 * @return sub-chunk index within the chunk
		 */
		public int part() {
			return part;
		}

		@Override
		public String toString() {
			return "chunk " + chunk + ", sub-chunk " + part;
		}
	}

	private final File input;
	private final Schema schema;
	private final Instant start;
	private final Instant end;
	private final int chunkSize;
	private final int threads;
	private final int top;
	private final long maxMalformed;
	private final Duration timeout;
	private final Tally.Factory factory;
	private final Partitioner partitioner;
	private final Logger logger;
	private final ExecutorService pool;

	private volatile State state = State.IDLE;
	private volatile boolean cancelled;
	private volatile long lastMergedChunk = -1;
	private volatile boolean closed;
	private AggregateState aggregate;

	private Engine(final Builder b) {
		this.input = b.input;
		this.schema = b.schema != null ? b.schema : new Schema(b.timestamp, b.dimensions);
		this.start = b.start;
		this.end = b.end;
		this.chunkSize = b.chunkSize;
		this.threads = b.threads;
		this.top = b.top;
		this.maxMalformed = b.maxMalformed;
		this.timeout = b.timeout;
		this.factory = b.factory;
		this.partitioner = b.partitioner;
		this.logger = b.logger;
		this.pool = threads > 0 ? Executors.newFixedThreadPool(threads, new WorkerThreadFactory()) : null;
	}

	public static Builder builder(final File input) {
		return new Builder(input);
	}

	public State state() {
		return state;
	}

	/**
	 * @return index of the last chunk merged by the current or last run, -1 if none
	 */
	public long lastMergedChunk() {
		return lastMergedChunk;
	}

	public Schema schema() {
		return schema;
	}

	public int threads() {
		return threads;
	}

	/**
	 * Request cancellation of the run in progress. The run stops at the next
	 * chunk boundary; sub-chunks already submitted finish first.
	 */
	public void cancel() {
		cancelled = true;
	}

	/**
	 * Run the aggregation over the whole input
	 *
	 * @return report of the completed run
	 * @throws TallyException CONFIGURATION_ERROR or INPUT_NOT_READABLE before any row is read;
	 *                        WORKER_FAILURE, TOO_MANY_MALFORMED, CANCELLED, TIMEOUT or
	 *                        STORAGE_READ_ERROR during the run. Partial results are discarded.
	 */
	public synchronized Report run() throws TallyException {
		cancelled = false;
		lastMergedChunk = -1;
		aggregate = null;
		final IO.StopWatch watch = new IO.StopWatch();
		try {
			state = State.VALIDATING;
			final TimeWindow window = validate();
			logger.log("[VALIDATE] input=%s (%s), window=%s, schema=%s, chunk=%d, threads=%d", input.getName(),
					IO.readableBytesSize(input.length()), window, schema, chunkSize, threads);

			state = State.RUNNING;
			final AggregateState agg = execute(window, watch);

			aggregate = agg;
			state = State.COMPLETED;
			final Report report = new Report(input.getName(), window, agg, top, threads, watch.elapsed());
			logger.log("[DONE] rows=%,d, malformed=%,d, excluded=%,d, chunks=%d, %,d ms, %,d rows/s", agg.rows(),
					agg.malformed(), agg.excluded(), agg.chunks(), watch.elapsed(), watch.ops(agg.rows()));
			return report;
		} catch (TallyException ex) {
			state = State.FAILED;
			logger.error("[FAIL] %s, last merged chunk %d", ex.getMessage(), lastMergedChunk);
			throw ex;
		} catch (RuntimeException ex) {
			state = State.FAILED;
			logger.error("[FAIL] %s, last merged chunk %d", ex, lastMergedChunk);
			throw new TallyException(ErrorCode.INTERNAL_ERROR, ex.toString(), ex);
		}
	}

	private TimeWindow validate() throws TallyException {
		if (closed)
			throw new TallyException(ErrorCode.CONFIGURATION_ERROR, "engine closed");
		final TimeWindow window = start == null && end == null ? TimeWindow.unbounded() : TimeWindow.of(start, end);
		if (input == null || !input.isFile() || !input.canRead())
			throw new TallyException(ErrorCode.INPUT_NOT_READABLE, (Object) input);
		schema.validate();
		if (chunkSize <= 0)
			throw new TallyException(ErrorCode.CONFIGURATION_ERROR, "chunk size " + chunkSize);
		if (threads <= 0)
			throw new TallyException(ErrorCode.CONFIGURATION_ERROR, "threads " + threads);
		if (top <= 0)
			throw new TallyException(ErrorCode.CONFIGURATION_ERROR, "top " + top);
		if (timeout != null && (timeout.isNegative() || timeout.isZero()))
			throw new TallyException(ErrorCode.CONFIGURATION_ERROR, "timeout " + timeout);
		return window;
	}

	private AggregateState execute(final TimeWindow window, final IO.StopWatch watch) throws TallyException {
		final long deadline = timeout == null ? Long.MAX_VALUE : timeout.toMillis();
		try (final ChunkSource source = ChunkSource.open(input, chunkSize, logger)) {
			final RecordDecoder decoder = schema.bind(source.columns());
			final Tally tally = factory.create(decoder, window);
			final AggregateState agg = new AggregateState(tally.dimensions());

			for (;;) {
				if (cancelled)
					throw new TallyException(ErrorCode.CANCELLED, "after chunk " + lastMergedChunk);
				if (watch.elapsed() > deadline)
					throw new TallyException(ErrorCode.TIMEOUT, timeout.toMillis() + " ms, after chunk " + lastMergedChunk);

				final Chunk chunk = source.next();
				if (chunk == null)
					break;

				final List<List<String[]>> parts = partitioner.partition(chunk.rows(), threads);
				final List<Future<ChunkResult>> futures = new ArrayList<>(parts.size());
				for (int i = 0; i < parts.size(); i++)
					futures.add(pool.submit(new Worker(chunk.index(), i, parts.get(i), tally)));

				final List<ChunkResult> results = new ArrayList<>(parts.size());
				try {
					for (int i = 0; i < futures.size(); i++)
						results.add(await(futures.get(i), chunk.index(), i, parts.get(i), tally));
				} catch (TallyException ex) {
					for (final Future<ChunkResult> f : futures)
						f.cancel(false);
					throw ex;
				}

				state = State.MERGING;
				Merger.fold(agg, chunk.index(), results);
				lastMergedChunk = chunk.index();
				state = State.RUNNING;

				long malformed = 0;
				for (final ChunkResult r : results) {
					malformed += r.malformed();
					if (r.firstError() != null)
						logger.log("[CHUNK %d] malformed row in sub-chunk %d: %s", chunk.index(), r.part(), r.firstError());
				}
				logger.log("[CHUNK %d] rows=%,d, malformed=%,d, sub-chunks=%d, total=%,d, %,d ms", chunk.index(),
						chunk.size(), malformed, parts.size(), agg.rows(), watch.elapsed());

				if (maxMalformed >= 0 && agg.malformed() > maxMalformed)
					throw new TallyException(ErrorCode.TOO_MANY_MALFORMED,
							agg.malformed() + " > " + maxMalformed + " at chunk " + chunk.index());
			}
			return agg;
		} catch (TallyException ex) {
			throw ex;
		} catch (IOException ex) {
			throw new TallyException(ErrorCode.STORAGE_READ_ERROR, input.getPath(), ex);
		}
	}

	/**
	 * Result of one sub-chunk, retrying once on a fresh worker if the first attempt failed
	 */
	private ChunkResult await(final Future<ChunkResult> future, final long chunk, final int part,
			final List<String[]> rows, final Tally tally) throws TallyException {
		try {
			return future.get();
		} catch (ExecutionException ex) {
			logger.log("[RETRY] chunk %d, sub-chunk %d: %s", chunk, part, ex.getCause());
		} catch (InterruptedException ex) {
			Thread.currentThread().interrupt();
			throw new TallyException(ErrorCode.CANCELLED, "interrupted at chunk " + chunk, ex);
		}

		try {
			return pool.submit(new Worker(chunk, part, rows, tally)).get();
		} catch (ExecutionException ex) {
			throw new TallyException(ErrorCode.WORKER_FAILURE, (Object) new Failure(chunk, part), ex.getCause());
		} catch (InterruptedException ex) {
			Thread.currentThread().interrupt();
			throw new TallyException(ErrorCode.CANCELLED, "interrupted at chunk " + chunk, ex);
		}
	}

	private AggregateState completed() {
		final AggregateState agg = aggregate;
		if (state != State.COMPLETED || agg == null)
			throw new IllegalStateException("no completed run, state " + state);
		return agg;
	}

	/**
	 * @return most frequent value of the dimension in the last completed run
	 * @throws IllegalStateException if the last run did not complete
	 */
	public RankedResult top(final String dimension) {
		return completed().table(dimension).top(dimension);
	}

	/**
	 * @return up to k most frequent values of the dimension in the last completed run
	 * @throws IllegalStateException if the last run did not complete
	 */
	public List<RankedResult> top(final String dimension, final int k) {
		return completed().table(dimension).top(dimension, k);
	}

	/**
	 * @return merged state of the last completed run
	 * @throws IllegalStateException if the last run did not complete
	 */
	public AggregateState aggregate() {
		return completed();
	}

	@Override
	public void close() {
		if (closed)
			return;
		closed = true;
		if (pool == null)
			return;
		pool.shutdown();
		try {
			if (!pool.awaitTermination(1, TimeUnit.MINUTES))
				pool.shutdownNow();
		} catch (InterruptedException ex) {
			pool.shutdownNow();
			Thread.currentThread().interrupt();
		}
	}

	@Override
	public String toString() {
		return "Engine{input=" + input + ", schema=" + schema + ", threads=" + threads + ", state=" + state + "}";
	}

	static final class WorkerThreadFactory implements ThreadFactory {
		private static final AtomicInteger ENGINES = new AtomicInteger();
		private final int engine = ENGINES.incrementAndGet();
		private final AtomicInteger count = new AtomicInteger();

		@Override
		public Thread newThread(final Runnable r) {
			final Thread t = new Thread(r, "tally-" + engine + "-" + count.incrementAndGet());
			t.setDaemon(true);
			return t;
		}
	}

	/**
	 * Fluent engine configuration
	 */
	public static final class Builder {
		private final File input;
		private Schema schema;
		private String timestamp = "timestamp";
		private Dimension[] dimensions = Schema.place().dimensions();
		private Instant start;
		private Instant end;
		private int chunkSize = ChunkSource.DEFAULT_CHUNK_SIZE;
		private int threads = DEFAULT_THREADS;
		private int top = 1;
		private long maxMalformed = -1;
		private Duration timeout;
		private Tally.Factory factory = Tally.Factory.DEFAULT;
		private Partitioner partitioner = Partitioner.EVEN;
		private Logger logger = new Logger.DefaultLogger(Engine.class.getName());

		Builder(final File input) {
			this.input = input;
		}

		/**
		 * Replace timestamp column and dimensions at once
		 */
		public Builder schema(final Schema schema) {
			this.schema = schema;
			return this;
		}

		public Builder timestamp(final String column) {
			this.timestamp = column;
			return this;
		}

		public Builder dimensions(final Dimension... dimensions) {
			this.dimensions = dimensions == null ? new Dimension[0] : Arrays.copyOf(dimensions, dimensions.length);
			return this;
		}

		/**
		 * Half-open window {@code [start, end)}; checked when the run starts
		 */
		public Builder window(final Instant start, final Instant end) {
			this.start = start;
			this.end = end;
			return this;
		}

		/**
		 * @param start inclusive hour, {@code yyyy-MM-dd HH}
		 * @param end   exclusive hour, {@code yyyy-MM-dd HH}
		 * @throws TallyException CONFIGURATION_ERROR if either hour does not parse
		 */
		public Builder window(final String start, final String end) throws TallyException {
			return window(TimestampParser.parseHour(start), TimestampParser.parseHour(end));
		}

		public Builder chunkSize(final int chunkSize) {
			this.chunkSize = chunkSize;
			return this;
		}

		public Builder threads(final int threads) {
			this.threads = threads;
			return this;
		}

		/**
		 * Number of ranked values kept per dimension in the report, 1 by default
		 */
		public Builder top(final int k) {
			this.top = k;
			return this;
		}

		/**
		 * Fail the run once more rows than this are malformed; negative means unlimited
		 */
		public Builder maxMalformed(final long maxMalformed) {
			this.maxMalformed = maxMalformed;
			return this;
		}

		public Builder timeout(final Duration timeout) {
			this.timeout = timeout;
			return this;
		}

		public Builder tally(final Tally.Factory factory) {
			this.factory = factory;
			return this;
		}

		public Builder partitioner(final Partitioner partitioner) {
			this.partitioner = partitioner;
			return this;
		}

		public Builder logger(final Logger logger) {
			this.logger = logger;
			return this;
		}

		public Engine build() {
			if (factory == null || partitioner == null || logger == null)
				throw new IllegalArgumentException("tally, partitioner and logger are required");
			return new Engine(this);
		}
	}
}
