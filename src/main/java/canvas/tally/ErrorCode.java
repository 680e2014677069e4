/**
 *
 */
package canvas.tally;

/**
 * Error codes for aggregation runs
 */
public enum ErrorCode {
    // Configuration errors (-1000 to -1999)
    CONFIGURATION_ERROR(-1000, "Invalid configuration"),
    INPUT_NOT_READABLE(-1001, "Input file not readable"),

    // Record errors (-2000 to -2999)
    MALFORMED_RECORD(-2000, "Malformed record"),
    UNRECOGNIZED_TIMESTAMP_FORMAT(-2001, "Unrecognized timestamp format"),
    TOO_MANY_MALFORMED(-2002, "Malformed record limit exceeded"),

    // Execution errors (-3000 to -3999)
    WORKER_FAILURE(-3000, "Worker failure"),
    CANCELLED(-3001, "Run cancelled"),
    TIMEOUT(-3002, "Run timed out"),

    // Storage errors (-4000 to -4999)
    STORAGE_READ_ERROR(-4000, "Storage read error"),
    STORAGE_WRITE_ERROR(-4001, "Storage write error"),

    // General errors (-9000 to -9999)
    INTERNAL_ERROR(-9002, "Internal error");

    private final int code;
    private final String message;

    ErrorCode(int code, String message) {
        this.code = code;
        this.message = message;
    }

    public int getCode() {
        return code;
    }

    public String getMessage() {
        return message;
    }

    /**
     * Row-local decode failures, recovered by skipping the row
     * @return true for MALFORMED_RECORD and its timestamp specialization
     */
    public boolean malformed() {
        return this == MALFORMED_RECORD || this == UNRECOGNIZED_TIMESTAMP_FORMAT;
    }

    /**
     * Fatal before processing starts; fixed only by changing the input or settings
     * @return true for the -1000 range
     */
    public boolean configuration() {
        return code <= -1000 && code > -2000;
    }
}
