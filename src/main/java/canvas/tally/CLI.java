/**
 * canvas-tally command line interface
 *
 */
package canvas.tally;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

public final class CLI {
    static final String VERSION = "0.1.0";

    public static void main(String[] args) {
        final int ec = execute(System.out, System.err, System.in, args);
        if (ec != 0)
            System.exit(ec);
    }

    /**
     * @return process exit code: 0 on success, 1 on a failed run, 2 on bad arguments
     */
    static int execute(final PrintStream out, final PrintStream err, final InputStream in, final String[] args) {
        final Options o;
        try {
            o = Options.parse(args);
        } catch (IllegalArgumentException e) {
            err.println("Error: " + e.getMessage());
            usage(err);
            return 2;
        }
        if (o.help || args.length == 0) {
            usage(out);
            return 0;
        }
        if (o.version) {
            out.println("canvas-tally version " + VERSION);
            return 0;
        }
        if (o.file == null) {
            err.println("Error: input file must be specified");
            return 2;
        }

        final Logger logger = o.log ? new Logger.ConsoleLogger(CLI.class.getName()) : new Logger.NullLogger(err);
        final IO.StopWatch watch = new IO.StopWatch();
        try {
            if (o.convert != null) {
                final long rows = ParquetConverter.builder(IO.path(o.file), IO.path(o.convert)) //
                        .columns(o.columns) //
                        .remap(o.remap) //
                        .chunkSize(o.chunk) //
                        .logger(logger) //
                        .build() //
                        .convert();
                out.printf("Converted %,d rows to %s%n", rows, o.convert);
                out.printf("Execution time: %.3f seconds%n", watch.elapsed() / 1000.0);
                return 0;
            }
            return tally(out, err, in, o, logger);
        } catch (TallyException e) {
            err.println("Error (" + e.getErrorCode().getCode() + " " + e.getErrorCode() + "): " + e.getMessage());
            if (o.log)
                e.printStackTrace(err);
            return 1;
        }
    }

    private static int tally(final PrintStream out, final PrintStream err, final InputStream in, final Options o,
            final Logger logger) throws TallyException {
        String start = o.start;
        String end = o.end;
        if (start == null || end == null) {
            final BufferedReader r = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8));
            if (start == null)
                start = prompt(out, r, "Enter start hour (YYYY-MM-DD HH): ");
            if (end == null)
                end = prompt(out, r, "Enter end hour (YYYY-MM-DD HH): ");
        }

        final Engine built;
        try {
            final List<Dimension> dims = new ArrayList<>();
            for (final String d : o.dims.split(","))
                if (!d.isBlank())
                    dims.add(Dimension.parse(d, o.normalize));

            final Engine.Builder b = Engine.builder(IO.path(o.file)) //
                    .timestamp(o.ts) //
                    .dimensions(dims.toArray(Dimension[]::new)) //
                    .window(start, end) //
                    .top(o.top) //
                    .chunkSize(o.chunk) //
                    .threads(o.threads) //
                    .maxMalformed(o.maxMalformed) //
                    .logger(logger);
            if (o.timeout > 0)
                b.timeout(Duration.ofMillis(o.timeout));
            built = b.build();
        } catch (IllegalArgumentException e) {
            err.println("Error: " + e.getMessage());
            usage(err);
            return 2;
        }

        try (final Engine engine = built) {
            try {
                final Report report = engine.run();
                out.print(o.json ? report.json() + System.lineSeparator() : report.text());
                return 0;
            } catch (TallyException e) {
                err.println("Error (" + e.getErrorCode().getCode() + " " + e.getErrorCode() + "): " + e.getMessage());
                err.println("Last merged chunk: " + engine.lastMergedChunk());
                if (o.log)
                    e.printStackTrace(err);
                return 1;
            }
        }
    }

    private static String prompt(final PrintStream out, final BufferedReader r, final String message)
            throws TallyException {
        out.print(message);
        out.flush();
        try {
            final String line = r.readLine();
            if (line == null)
                throw new TallyException(ErrorCode.CONFIGURATION_ERROR, "no input for: " + message.trim());
            return line.trim();
        } catch (IOException e) {
            throw new TallyException(ErrorCode.CONFIGURATION_ERROR, message.trim(), e);
        }
    }

    static final class Options {
        String file;
        String start;
        String end;
        String dims = "pixel_color,coordinate";
        String ts = "timestamp";
        int top = 1;
        int chunk = ChunkSource.DEFAULT_CHUNK_SIZE;
        int threads = Engine.DEFAULT_THREADS;
        boolean normalize;
        long maxMalformed = -1;
        long timeout;
        boolean json;
        boolean log;
        String convert;
        String[] columns;
        String remap;
        boolean help;
        boolean version;

        static Options parse(final String[] args) {
            final Options o = new Options();
            for (int i = 0; i < args.length; i++) {
                final String s = args[i];
                if ("-help".equals(s)) {
                    o.help = true;
                } else if ("-version".equals(s)) {
                    o.version = true;
                } else if ("-log".equals(s)) {
                    o.log = true;
                } else if ("-json".equals(s)) {
                    o.json = true;
                } else if ("-normalize".equals(s)) {
                    o.normalize = true;
                } else if ("-start".equals(s)) {
                    o.start = value(args, ++i, s);
                } else if ("-end".equals(s)) {
                    o.end = value(args, ++i, s);
                } else if ("-dims".equals(s)) {
                    o.dims = value(args, ++i, s);
                } else if ("-ts".equals(s)) {
                    o.ts = value(args, ++i, s);
                } else if ("-top".equals(s)) {
                    o.top = number(args, ++i, s);
                } else if ("-chunk".equals(s)) {
                    o.chunk = number(args, ++i, s);
                } else if ("-threads".equals(s)) {
                    o.threads = number(args, ++i, s);
                } else if ("-max-malformed".equals(s)) {
                    o.maxMalformed = number(args, ++i, s);
                } else if ("-timeout".equals(s)) {
                    o.timeout = number(args, ++i, s);
                } else if ("-convert".equals(s)) {
                    o.convert = value(args, ++i, s);
                } else if ("-columns".equals(s)) {
                    o.columns = value(args, ++i, s).split(",");
                } else if ("-remap".equals(s)) {
                    o.remap = value(args, ++i, s);
                } else if (s.startsWith("-") && s.length() > 1) {
                    throw new IllegalArgumentException("unknown option " + s);
                } else if (o.file == null) {
                    o.file = s;
                } else {
                    throw new IllegalArgumentException("only one input file may be given: " + s);
                }
            }
            return o;
        }

        private static String value(final String[] args, final int i, final String flag) {
            if (i >= args.length)
                throw new IllegalArgumentException(flag + " requires an argument");
            return args[i];
        }

        private static int number(final String[] args, final int i, final String flag) {
            final String v = value(args, i, flag);
            try {
                return Integer.parseInt(v.replace("_", ""));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException(flag + " expects a number: " + v);
            }
        }
    }

    static void usage(final PrintStream out) {
        out.println("Usage: java canvas.tally.CLI [options] <file>");
        out.println("  Most frequent values per dimension within [start, end) over a gzip CSV or Parquet file.");
        out.println("Options:");
        out.println("  -start <yyyy-MM-dd HH>  Window start, inclusive (prompted when absent)");
        out.println("  -end <yyyy-MM-dd HH>    Window end, exclusive (prompted when absent)");
        out.println("  -dims <list>            Comma separated dimensions: column, hour, or a|b (default pixel_color,coordinate)");
        out.println("  -ts <column>            Timestamp column (default timestamp)");
        out.println("  -top <k>                Ranked values per dimension (default 1)");
        out.println("  -chunk <rows>           Rows per chunk (default " + ChunkSource.DEFAULT_CHUNK_SIZE + ")");
        out.println("  -threads <n>            Worker threads (default " + Engine.DEFAULT_THREADS + ")");
        out.println("  -normalize              Trim and lower-case dimension values");
        out.println("  -max-malformed <n>      Fail when more rows than this are malformed");
        out.println("  -timeout <ms>           Fail when the run exceeds this time, checked between chunks");
        out.println("  -json                   Print the report as JSON");
        out.println("  -log                    Print progress lines and stack traces");
        out.println("  -convert <out.parquet>  Convert the input to Parquet instead of tallying");
        out.println("  -columns <list>         Columns kept by -convert (default all)");
        out.println("  -remap <column>         Replace a column by dense integer ids in -convert");
        out.println("  -help                   Show this help");
        out.println("  -version                Show version");
    }
}
