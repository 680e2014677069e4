package canvas.tally;

import java.io.EOFException;
import java.io.File;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;

import org.apache.avro.generic.GenericRecord;
import org.apache.parquet.avro.AvroParquetReader;
import org.apache.parquet.hadoop.ParquetFileReader;
import org.apache.parquet.hadoop.ParquetReader;
import org.apache.parquet.hadoop.metadata.ParquetMetadata;
import org.apache.parquet.io.InputFile;
import org.apache.parquet.io.SeekableInputStream;
import org.apache.parquet.schema.MessageType;
import org.apache.parquet.schema.Type;

/**
 * Chunk reader for Parquet files (using parquet-avro)
 *
 * Reads the typed, column-pruned dataset written by {@link ParquetConverter}
 * (or any flat Parquet file) and renders each record as a text row in footer
 * column order, so the same decoder and engine run over either
 * representation.
 */
public final class ParquetChunkReader implements ChunkSource {

    private final File file;
    private final int chunkSize;
    private final Logger logger;
    private final String[] header;
    private ParquetReader<GenericRecord> reader;
    private long chunks = 0;
    private long rows = 0;
    private boolean finished = false;

    static boolean supports(final File file) {
        return file.getName().toLowerCase().endsWith(".parquet");
    }

    public ParquetChunkReader(final File file, final int chunkSize, final Logger logger) throws TallyException {
        if (chunkSize <= 0)
            throw new TallyException(ErrorCode.CONFIGURATION_ERROR, "chunk size " + chunkSize);
        this.file = file;
        this.chunkSize = chunkSize;
        this.logger = (logger != null ? logger : new Logger.NullLogger());
        this.header = readHeader(file);
        this.logger.log("open %s, format : PARQUET, columns : %d, rows : %,d, file size : %s", file.getName(),
                header.length, rows(file), IO.readableBytesSize(file.length()));
    }

    /**
     * Row count from the footer, -1 if unreadable
     */
    public static long rows(final File parquetFile) {
        try (ParquetFileReader fr = ParquetFileReader.open(new NioInputFile(parquetFile))) {
            final ParquetMetadata footer = fr.getFooter();
            return footer.getBlocks().stream().mapToLong(b -> b.getRowCount()).sum();
        } catch (IOException ex) {
            return -1;
        }
    }

    private static String[] readHeader(final File file) throws TallyException {
        try (ParquetFileReader fr = ParquetFileReader.open(new NioInputFile(file))) {
            final MessageType mt = fr.getFooter().getFileMetaData().getSchema();
            final List<String> names = new ArrayList<>();
            for (final Type t : mt.getFields())
                names.add(t.getName());
            return names.toArray(String[]::new);
        } catch (IOException ex) {
            throw new TallyException(ErrorCode.INPUT_NOT_READABLE, file, ex);
        }
    }

    @Override
    public String[] columns() {
        return header.clone();
    }

    @Override
    public Chunk next() throws TallyException {
        if (finished)
            return null;
        final List<String[]> a = new ArrayList<>(Math.min(chunkSize, 1 << 16));
        try {
            if (reader == null)
                reader = AvroParquetReader.<GenericRecord>builder(new NioInputFile(file)).build();
            GenericRecord rec;
            while (a.size() < chunkSize && (rec = reader.read()) != null)
                a.add(toRow(rec));
        } catch (IOException ex) {
            finished = true;
            throw new TallyException(ErrorCode.STORAGE_READ_ERROR, file, ex);
        }
        if (a.isEmpty()) {
            finished = true;
            return null;
        }
        rows += a.size();
        return new Chunk(chunks++, a);
    }

    private String[] toRow(final GenericRecord rec) {
        final String[] row = new String[header.length];
        for (int i = 0; i < header.length; i++) {
            final Object v = rec.get(header[i]);
            // Avro returns Utf8 for strings
            row[i] = v == null ? null : v.toString();
        }
        return row;
    }

    @Override
    public long rows() {
        return rows;
    }

    @Override
    public void close() throws IOException {
        finished = true;
        if (reader != null) {
            try {
                reader.close();
            } finally {
                reader = null;
            }
        }
        logger.log("closed %s, rows : %,d, chunks : %,d", file.getName(), rows, chunks);
    }

    @Override
    public String toString() {
        return file.toString();
    }
}

// ---------- Minimal NIO-backed Parquet input (no Hadoop filesystem) ----------

final class NioInputFile implements InputFile {
    private final File file;

    NioInputFile(final File file) {
        this.file = file;
    }

    @Override
    public long getLength() throws IOException {
        return file.length();
    }

    @Override
    public SeekableInputStream newStream() throws IOException {
        return new NioSeekableInputStream(file);
    }

    @Override
    public String toString() {
        return file.toString();
    }
}

final class NioSeekableInputStream extends SeekableInputStream {
    private final FileChannel ch;
    private long pos = 0L;

    NioSeekableInputStream(final File file) throws IOException {
        this.ch = FileChannel.open(file.toPath(), StandardOpenOption.READ);
    }

    @Override
    public int read() throws IOException {
        final ByteBuffer one = ByteBuffer.allocate(1);
        int n = ch.read(one, pos);
        if (n <= 0)
            return -1;
        pos += n;
        one.flip();
        return one.get() & 0xFF;
    }

    @Override
    public int read(byte[] b, int off, int len) throws IOException {
        final ByteBuffer bb = ByteBuffer.wrap(b, off, len);
        int n = ch.read(bb, pos);
        if (n > 0)
            pos += n;
        return n;
    }

    @Override
    public int read(ByteBuffer dst) throws IOException {
        int n = ch.read(dst, pos);
        if (n > 0)
            pos += n;
        return n;
    }

    @Override
    public void readFully(byte[] bytes) throws IOException {
        readFully(bytes, 0, bytes.length);
    }

    @Override
    public void readFully(byte[] bytes, int off, int len) throws IOException {
        int read = 0;
        while (read < len) {
            int n = read(bytes, off + read, len - read);
            if (n < 0)
                throw new EOFException("Unexpected EOF");
            read += n;
        }
    }

    @Override
    public void readFully(ByteBuffer dst) throws IOException {
        while (dst.hasRemaining()) {
            int n = read(dst);
            if (n < 0)
                throw new EOFException("Unexpected EOF");
        }
    }

    @Override
    public long getPos() {
        return pos;
    }

    @Override
    public void seek(long newPos) {
        this.pos = newPos;
    }

    @Override
    public int available() throws IOException {
        long rem = ch.size() - pos;
        return (rem > Integer.MAX_VALUE) ? Integer.MAX_VALUE : (int) rem;
    }

    @Override
    public void close() throws IOException {
        ch.close();
    }
}
