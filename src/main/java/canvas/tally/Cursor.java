/**
 * Forward-only iteration with automatic resource management.
 */
package canvas.tally;

/**
 * Interface for iterating over a source in a forward-only manner.
 * Implements AutoCloseable for proper resource management and cleanup.
 *
 * <p><strong>Usage:</strong></p>
 * <pre>{@code
 * try (ChunkSource source = ChunkSource.open(file, 100_000)) {
 *     for (Chunk chunk; (chunk = source.next()) != null;) {
 *         // process chunk.rows()
 *     }
 * }
 * }</pre>
 *
 * @param <T> the type of objects returned by this cursor
 */
public interface Cursor<T> extends AutoCloseable {
	/**
	 * Advances the cursor to the next element.
	 *
	 * <p>The cursor starts before the first element, so the first call to
	 * {@code next()} returns the first element. There is no way back.</p>
	 *
	 * @return the next element, or null when the source is exhausted
	 * @throws TallyException if the underlying source cannot be read
	 */
	T next() throws TallyException;
}
