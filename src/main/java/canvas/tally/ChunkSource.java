/**
 *
 */
package canvas.tally;

import java.io.File;
import java.io.IOException;

/**
 * Lazy, finite, non-restartable sequence of chunks read from one input.
 *
 * {@link #next()} returns chunks of at most {@code chunkSize} rows in source
 * order and null after the last one. A source holds at most one chunk; there
 * is no seeking and no re-reading.
 */
public interface ChunkSource extends Cursor<Chunk> {

    int DEFAULT_CHUNK_SIZE = Integer.getInteger("TALLY_CHUNK_SIZE", 100_000);

    /**
     * @return column names of the input, in row order
     * @throws TallyException if the header cannot be read
     */
    String[] columns() throws TallyException;

    /**
     * @return rows handed out so far
     */
    long rows();

    @Override
    void close() throws IOException;

    /**
     * Open a source for the file, choosing the reader from its name: Parquet
     * for {@code .parquet}, delimited text otherwise (CSV or TSV, plain,
     * gzip or zip).
     *
     * @param file      input file
     * @param chunkSize maximum rows per chunk
     * @param logger    logger for open/close lines
     * @return opened source
     * @throws TallyException INPUT_NOT_READABLE if the file cannot be opened
     */
    static ChunkSource open(final File file, final int chunkSize, final Logger logger) throws TallyException {
        if (file == null || !file.isFile() || !file.canRead())
            throw new TallyException(ErrorCode.INPUT_NOT_READABLE, (Object) file);
        if (chunkSize <= 0)
            throw new TallyException(ErrorCode.CONFIGURATION_ERROR, "chunk size " + chunkSize);
        if (ParquetChunkReader.supports(file))
            return new ParquetChunkReader(file, chunkSize, logger);
        return ChunkReader.open(file, null, chunkSize, logger);
    }

    static ChunkSource open(final File file, final int chunkSize) throws TallyException {
        return open(file, chunkSize, new Logger.NullLogger());
    }
}
