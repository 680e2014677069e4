/**
 * Delimited text chunk reader
 *
 * Reads Comma-Separated Values (CSV) and Tab-Separated Values (TSV) files,
 * plain or compressed, in bounded batches of raw rows.
 */
package canvas.tally;

import java.io.BufferedReader;
import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Chunk reader for delimited text files
 *
 * Supports:
 * - Compressed input (gzip, zip) decoded on the fly
 * - CSV quoting, doubled quotes and quoted multi-line records
 * - TSV backslash escapes
 * - A header row, read once and skipped
 *
 * Only the rows of the current chunk are held in memory.
 */
public final class ChunkReader implements ChunkSource {

    static final int READ_BUFSZ = 1 << 20;

    /**
     * Format configuration for delimited files
     *
     * Defines delimiter, quote character and null value representation.
     */
    public static final class Format {
        private String NULL = null;
        private char delimiter = '\t';
        private char quote = 0;
        private String name = "";

        public static final Format TSV = new Format() //
                .setDelimiter('\t') //
                .setNull("\\N") //
                .setName("TSV");

        public static final Format CSV = new Format() //
                .setDelimiter(',') //
                .setQuote('\"') //
                .setName("CSV");

        /**
         * Pick the format from the file name, CSV unless it says .tsv
         */
        static Format of(final File file) {
            return IO.plainName(file).endsWith(".tsv") ? TSV : CSV;
        }

        public Format setName(String name) {
            this.name = name;
            return this;
        }

        /**
         * Set null value representation
         *
         * @param NULL unquoted field text read as null, or null to disable
         * @return This format instance for chaining
         */
        public Format setNull(String NULL) {
            this.NULL = NULL;
            return this;
        }

        public Format setDelimiter(char delimiter) {
            this.delimiter = delimiter;
            return this;
        }

        public Format setQuote(char quote) {
            this.quote = quote;
            return this;
        }

        String Null() {
            return NULL;
        }

        char delimiter() {
            return delimiter;
        }

        char quote() {
            return quote;
        }

        @Override
        public String toString() {
            return (name != null && !"".equals(name)) ? name : super.toString();
        }
    }

    /**
     * Splits one text record into fields
     */
    static final class Splitter {
        private final String NULL;
        private final char DELIM;
        private final char QUOTE;

        Splitter(final Format format) {
            this.NULL = format.Null();
            this.DELIM = format.delimiter();
            this.QUOTE = format.quote();
        }

        String[] split(final CharSequence raw) {
            final ArrayList<String> array = new ArrayList<>();
            final int L = raw.length();
            final char[] s = new char[L + 1];
            final char BSLASH = '\\';
            int n = 0;
            int qoute = 0;
            int q = 0;

            for (int i = 0; i < L; i++) {
                final char ch = raw.charAt(i);
                final char next = ((i + 1) < L) ? raw.charAt(i + 1) : '\0';

                // outside quotes CR/LF terminate the record
                if (qoute == 0 && (ch == '\n' || ch == '\r')) {
                    break;
                }

                if (qoute > 0 && QUOTE == ch && QUOTE == next) {
                    s[n++] = ch;
                    i++;
                } else if (qoute > 0 && QUOTE == ch) {
                    qoute = 0;
                } else if (QUOTE != 0 && QUOTE == ch) {
                    qoute = 1;
                    q = 1;
                } else if (qoute > 0) {
                    s[n++] = ch;
                } else if (QUOTE == 0 && BSLASH == ch) {
                    if (DELIM == next) {
                        s[n++] = DELIM;
                        i++;
                    } else if (BSLASH == next) {
                        s[n++] = BSLASH;
                        i++;
                    } else if ('n' == next) {
                        s[n++] = '\n';
                        i++;
                    } else if ('r' == next) {
                        s[n++] = '\r';
                        i++;
                    } else if ('t' == next) {
                        s[n++] = '\t';
                        i++;
                    } else {
                        s[n++] = ch;
                    }
                } else if (DELIM == ch) {
                    array.add(field(s, n, q));
                    n = 0;
                    q = 0;
                } else {
                    s[n++] = ch;
                }
            }
            array.add(field(s, n, q));
            return array.toArray(String[]::new);
        }

        private String field(final char[] s, final int n, final int quoted) {
            final String v = new String(s, 0, n);
            return (quoted == 0 && NULL != null && NULL.equals(v)) ? null : v;
        }

        /**
         * Check if a CSV record is complete (handles multi-line quoted fields)
         *
         * @param raw record text so far (may be a partial record)
         * @return true when not inside a quoted section at the end of the buffer
         */
        boolean completed(final CharSequence raw) {
            if (QUOTE == 0)
                return true;
            int qoute = 0;
            final int len = raw.length();
            for (int i = 0; i < len; i++) {
                final char ch = raw.charAt(i);
                final char next = (i + 1) < len ? raw.charAt(i + 1) : '\0';
                if (qoute > 0 && QUOTE == ch && QUOTE == next) {
                    i++;
                } else if (qoute > 0 && QUOTE == ch) {
                    qoute = 0;
                } else if (QUOTE == ch) {
                    qoute = 1;
                }
            }
            return qoute == 0;
        }
    }

    /**
     * Open a delimited file
     *
     * @param file      input file (.csv, .tsv, optionally .gz/.gzip/.zip)
     * @param format    format, or null to pick it from the file name
     * @param chunkSize maximum rows per chunk
     * @param logger    logger for open/close lines
     * @return reader positioned before the first chunk
     * @throws TallyException INPUT_NOT_READABLE if the file cannot be opened
     */
    public static ChunkReader open(final File file, final Format format, final int chunkSize, final Logger logger)
            throws TallyException {
        if (chunkSize <= 0)
            throw new TallyException(ErrorCode.CONFIGURATION_ERROR, "chunk size " + chunkSize);
        final ChunkReader r = new ChunkReader(file, format != null ? format : Format.of(file), chunkSize,
                logger != null ? logger : new Logger.NullLogger());
        r.openStream();
        return r;
    }

    public static ChunkReader open(final File file, final int chunkSize) throws TallyException {
        return open(file, null, chunkSize, null);
    }

    private final File file;
    private final Format format;
    private final Splitter splitter;
    private final int chunkSize;
    private final Logger logger;
    private final StringBuilder sb = new StringBuilder();
    private BufferedReader reader;
    private String[] header;
    private long chunks = 0;
    private long rows = 0;
    private boolean finished = false;

    private ChunkReader(final File file, final Format format, final int chunkSize, final Logger logger) {
        this.file = file;
        this.format = format;
        this.splitter = new Splitter(format);
        this.chunkSize = chunkSize;
        this.logger = logger;
    }

    private void openStream() throws TallyException {
        try {
            final InputStream istream = IO.stream(file);
            this.reader = new BufferedReader(new InputStreamReader(istream, StandardCharsets.UTF_8), READ_BUFSZ);
        } catch (IOException ex) {
            throw new TallyException(ErrorCode.INPUT_NOT_READABLE, file, ex);
        }
        logger.log("open %s, format : %s, file size : %s", file.getName(), format,
                IO.readableBytesSize(file.length()));
    }

    @Override
    public String[] columns() throws TallyException {
        if (header != null)
            return header.clone();
        try {
            final String[] head = record();
            if (head == null)
                throw new TallyException(ErrorCode.INPUT_NOT_READABLE, "No header - " + file);
            header = head;
            return header.clone();
        } catch (IOException ex) {
            if (ex instanceof TallyException)
                throw (TallyException) ex;
            throw new TallyException(ErrorCode.STORAGE_READ_ERROR, file, ex);
        }
    }

    @Override
    public Chunk next() throws TallyException {
        if (finished)
            return null;
        columns(); // skips the header on the first call

        final List<String[]> a = new ArrayList<>(Math.min(chunkSize, 1 << 16));
        try {
            String[] row;
            while (a.size() < chunkSize && (row = record()) != null)
                a.add(row);
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

    /**
     * Read one logical record, joining physical lines of quoted multi-line fields
     *
     * @return fields, or null at end of stream
     */
    private String[] record() throws IOException {
        String l;
        while ((l = reader.readLine()) != null) {
            if (sb.length() == 0 && l.isEmpty())
                continue; // blank line
            sb.append(l);
            if (!splitter.completed(sb)) {
                sb.append('\n');
                continue;
            }
            final String[] a = splitter.split(sb);
            sb.setLength(0);
            return a;
        }
        if (sb.length() > 0) {
            // unterminated quote at end of stream
            final String[] a = splitter.split(sb);
            sb.setLength(0);
            return a;
        }
        return null;
    }

    @Override
    public long rows() {
        return rows;
    }

    @Override
    public void close() throws IOException {
        finished = true;
        if (reader != null) {
            reader.close();
            reader = null;
            logger.log("closed %s, rows : %,d, chunks : %,d", file.getName(), rows, chunks);
        }
    }

    @Override
    public String toString() {
        return file.toString();
    }
}
