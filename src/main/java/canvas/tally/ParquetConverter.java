package canvas.tally;

import java.io.File;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.apache.avro.Schema;
import org.apache.avro.Schema.Field;
import org.apache.avro.Schema.Type;
import org.apache.avro.generic.GenericData;
import org.apache.avro.generic.GenericRecord;
import org.apache.parquet.avro.AvroParquetWriter;
import org.apache.parquet.hadoop.ParquetWriter;
import org.apache.parquet.hadoop.metadata.CompressionCodecName;
import org.apache.parquet.io.OutputFile;
import org.apache.parquet.io.PositionOutputStream;

/**
 * Text to Parquet preprocessing (using parquet-avro)
 *
 * Streams a (compressed) delimited file into a Parquet file that keeps only
 * the requested columns. Values are written as nullable strings; one column
 * may be re-mapped to dense integer ids in first-seen order (e.g. the long
 * hashed {@code user_id} of the canvas export). Memory is bounded by the
 * chunk size plus the id map.
 *
 * <pre>
 * long rows = ParquetConverter.builder(new File("2022_place_canvas_history.csv.gzip"),
 *         new File("2022_place_canvas_history.parquet"))
 *     .columns("timestamp", "pixel_color", "coordinate")
 *     .build()
 *     .convert();
 * </pre>
 */
public final class ParquetConverter {

    private final File input;
    private final File output;
    private final String[] columns;
    private final String remap;
    private final int chunkSize;
    private final CompressionCodecName codec;
    private final Logger logger;

    private ParquetConverter(final Builder b) {
        this.input = b.input;
        this.output = b.output;
        this.columns = b.columns;
        this.remap = b.remap;
        this.chunkSize = b.chunkSize;
        this.codec = b.codec;
        this.logger = b.logger;
    }

    public static Builder builder(final File input, final File output) {
        return new Builder(input, output);
    }

    /**
     * Run the conversion
     *
     * @return rows written
     * @throws TallyException INPUT_NOT_READABLE, CONFIGURATION_ERROR (unknown
     *                        column), STORAGE_WRITE_ERROR
     */
    public long convert() throws TallyException {
        final IO.StopWatch watch = new IO.StopWatch();
        long written = 0;
        try (ChunkSource source = ChunkReader.open(input, null, chunkSize, logger)) {
            final String[] header = source.columns();
            final String[] names = (columns == null || columns.length == 0) ? header : columns;
            final int[] index = new int[names.length];
            for (int i = 0; i < names.length; i++)
                index[i] = indexOf(header, names[i]);
            final int remapped = remap == null ? -1 : Arrays.asList(names).indexOf(remap);
            if (remap != null && remapped < 0)
                throw new TallyException(ErrorCode.CONFIGURATION_ERROR, "remap column '" + remap + "' not converted");

            final Schema schema = avroSchema(names, remapped);
            final Map<String, Long> ids = new HashMap<>();
            logger.log("[CONVERT] %s -> %s, columns=%s, remap=%s, codec=%s", input.getName(), output.getName(),
                    Arrays.toString(names), remap, codec);

            try (ParquetWriter<GenericRecord> writer = AvroParquetWriter.<GenericRecord>builder(new NioOutputFile(output))
                    .withSchema(schema)
                    .withCompressionCodec(codec)
                    .build()) {
                for (Chunk chunk; (chunk = source.next()) != null;) {
                    for (final String[] row : chunk.rows()) {
                        final GenericRecord rec = new GenericData.Record(schema);
                        for (int i = 0; i < names.length; i++) {
                            final String v = index[i] < row.length ? row[index[i]] : null;
                            if (i == remapped) {
                                // empty stays null, like a missing field
                                rec.put(i, v == null || v.isEmpty() ? null : ids.computeIfAbsent(v, k -> (long) ids.size()));
                            } else {
                                rec.put(i, v);
                            }
                        }
                        writer.write(rec);
                        written++;
                    }
                    logger.log("[CONVERT] chunk %d, rows %,d", chunk.index(), written);
                }
            }
            logger.log("[CONVERT] done %,d rows in %,d ms (%s)", written, watch.elapsed(),
                    IO.readableBytesSize(output.length()));
            return written;
        } catch (TallyException ex) {
            throw ex;
        } catch (IOException ex) {
            throw new TallyException(ErrorCode.STORAGE_WRITE_ERROR, output, ex);
        }
    }

    private static int indexOf(final String[] header, final String column) throws TallyException {
        for (int i = 0; i < header.length; i++) {
            if (header[i].trim().equals(column))
                return i;
        }
        throw new TallyException(ErrorCode.CONFIGURATION_ERROR,
                "column '" + column + "' not in header " + Arrays.toString(header));
    }

    static Schema avroSchema(final String[] names, final int remapped) {
        final List<Field> fields = new ArrayList<>();
        for (int i = 0; i < names.length; i++) {
            final Type t = (i == remapped) ? Type.LONG : Type.STRING;
            fields.add(new Field(safeName(names[i]), nullable(Schema.create(t)), null, (Object) null));
        }
        final Schema rec = Schema.createRecord("canvas", null, ParquetConverter.class.getPackageName(), false);
        rec.setFields(fields);
        return rec;
    }

    private static Schema nullable(final Schema s) {
        final List<Schema> u = new ArrayList<>(2);
        u.add(Schema.create(Type.NULL));
        u.add(s);
        return Schema.createUnion(u);
    }

    private static String safeName(final String n) {
        final String s = n.trim().replaceAll("[^A-Za-z0-9_]", "_");
        return s.isEmpty() || Character.isDigit(s.charAt(0)) ? "_" + s : s;
    }

    public static final class Builder {
        private final File input;
        private final File output;
        private String[] columns;
        private String remap;
        private int chunkSize = ChunkSource.DEFAULT_CHUNK_SIZE;
        private CompressionCodecName codec = CompressionCodecName.SNAPPY;
        private Logger logger = new Logger.NullLogger();

        private Builder(final File input, final File output) {
            this.input = input;
            this.output = output;
        }

        /**
         * Columns to keep, in output order; all columns when not set
         */
        public Builder columns(final String... columns) {
            this.columns = columns;
            return this;
        }

        /**
         * Column to replace by dense integer ids
         */
        public Builder remap(final String column) {
            this.remap = column;
            return this;
        }

        public Builder chunkSize(final int chunkSize) {
            this.chunkSize = chunkSize;
            return this;
        }

        public Builder codec(final CompressionCodecName codec) {
            this.codec = codec;
            return this;
        }

        public Builder logger(final Logger logger) {
            this.logger = logger;
            return this;
        }

        public ParquetConverter build() {
            if (input == null || output == null)
                throw new IllegalArgumentException("input and output required");
            return new ParquetConverter(this);
        }
    }
}

// ---------- Minimal NIO-backed Parquet output (no Hadoop filesystem) ----------

final class NioOutputFile implements OutputFile {
    private final File file;

    NioOutputFile(final File file) {
        this.file = file;
    }

    @Override
    public PositionOutputStream create(long blockSizeHint) throws IOException {
        return createOrOverwrite(blockSizeHint);
    }

    @Override
    public PositionOutputStream createOrOverwrite(long blockSizeHint) throws IOException {
        final File parent = file.getAbsoluteFile().getParentFile();
        if (parent != null && !parent.isDirectory())
            Files.createDirectories(parent.toPath());
        final FileChannel ch = FileChannel.open(
                file.toPath(),
                StandardOpenOption.WRITE,
                StandardOpenOption.CREATE,
                StandardOpenOption.TRUNCATE_EXISTING);
        return new NioPositionOutputStream(ch);
    }

    @Override
    public boolean supportsBlockSize() {
        return false;
    }

    @Override
    public long defaultBlockSize() {
        return 0;
    }
}

final class NioPositionOutputStream extends PositionOutputStream {
    private final FileChannel ch;
    private long pos = 0L;

    NioPositionOutputStream(final FileChannel ch) {
        this.ch = ch;
    }

    @Override
    public long getPos() {
        return pos;
    }

    @Override
    public void write(int b) throws IOException {
        final ByteBuffer bb = ByteBuffer.allocate(1);
        bb.put((byte) b);
        bb.flip();
        int n = ch.write(bb, pos);
        if (n > 0)
            pos += n;
    }

    @Override
    public void write(byte[] b, int off, int len) throws IOException {
        final ByteBuffer bb = ByteBuffer.wrap(b, off, len);
        while (bb.hasRemaining()) {
            int n = ch.write(bb, pos);
            if (n > 0)
                pos += n;
        }
    }

    @Override
    public void close() throws IOException {
        ch.close();
    }
}
