package canvas.tally;

import java.io.PrintStream;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.logging.ConsoleHandler;
import java.util.logging.Formatter;
import java.util.logging.Level;
import java.util.logging.LogRecord;

/**
 * Logger interface for aggregation runs
 *
 * Progress lines of the engine and the converter go through this interface so
 * callers can silence them or route them to java.util.logging.
 */
public interface Logger {
    /**
     * Log informational message
     *
     * @param fmt  printf-style format
     * @param args format arguments
     */
    void log(String fmt, Object... args);

    /**
     * Log error message
     *
     * @param fmt  printf-style format
     * @param args format arguments
     */
    void error(String fmt, Object... args);

    /**
     * Null logger that discards log messages but prints errors, to stderr
     * unless another stream is given
     */
    public static final class NullLogger implements Logger {
        private final PrintStream err;

        public NullLogger() {
            this(System.err);
        }

        public NullLogger(PrintStream err) {
            this.err = err;
        }

        @Override
        public void log(String fmt, Object... args) {
        }

        @Override
        public void error(String fmt, Object... args) {
            err.printf(fmt, args);
            err.println();
        }
    }

    public static final class DefaultLogger implements Logger {
        private final java.util.logging.Logger LOGGER;

        public DefaultLogger(String name) {
            LOGGER = java.util.logging.Logger.getLogger(name);
        }

        @Override
        public void log(String fmt, Object... args) {
            if (LOGGER.isLoggable(Level.FINE))
                LOGGER.log(Level.FINE, String.format(fmt, args));
        }

        @Override
        public void error(String fmt, Object... args) {
            LOGGER.log(Level.SEVERE, String.format(fmt, args));
        }
    }

    /**
     * Console logger writing every message to stderr as
     * {@code yyyy-MM-dd HH:mm:ss [thread] message}.
     */
    public static final class ConsoleLogger implements Logger {
        private final java.util.logging.Logger LOGGER;

        public ConsoleLogger(String name) {
            LOGGER = java.util.logging.Logger.getLogger(name + ".console");
            LOGGER.setUseParentHandlers(false);
            if (LOGGER.getHandlers().length == 0) {
                final ConsoleHandler handler = new ConsoleHandler();
                handler.setLevel(Level.ALL);
                handler.setFormatter(new Formatter() {
                    private final DateTimeFormatter df = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

                    @Override
                    public String format(LogRecord record) {
                        final String timestamp = LocalDateTime.now().format(df);
                        final String threadName = Thread.currentThread().getName();
                        return String.format("%s [%s] %s%n", timestamp, threadName, record.getMessage());
                    }
                });
                LOGGER.addHandler(handler);
            }
            LOGGER.setLevel(Level.INFO);
        }

        @Override
        public void log(String fmt, Object... args) {
            LOGGER.info(String.format(fmt, args));
        }

        @Override
        public void error(String fmt, Object... args) {
            LOGGER.severe(String.format(fmt, args));
        }
    }
}
