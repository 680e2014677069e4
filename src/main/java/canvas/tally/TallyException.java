/**
 *
 */
package canvas.tally;

import java.io.IOException;

/**
 * Aggregation exception with error code classification.
 * This allows callers to distinguish configuration errors, row-local decode
 * failures and run failures.
 */
public class TallyException extends IOException {

    private final ErrorCode errorCode;
    private final Object context;

    public TallyException(ErrorCode errorCode) {
        super(errorCode.getMessage());
        this.errorCode = errorCode;
        this.context = null;
    }

    public TallyException(ErrorCode errorCode, String additionalMessage) {
        super(errorCode.getMessage() + " - " + additionalMessage);
        this.errorCode = errorCode;
        this.context = null;
    }

    public TallyException(ErrorCode errorCode, Object context) {
        super(errorCode.getMessage() + " - " + context);
        this.errorCode = errorCode;
        this.context = context;
    }

    public TallyException(ErrorCode errorCode, String additionalMessage, Throwable cause) {
        super(errorCode.getMessage() + " - " + additionalMessage, cause);
        this.errorCode = errorCode;
        this.context = null;
    }

    public TallyException(ErrorCode errorCode, Object context, Throwable cause) {
        super(errorCode.getMessage() + " - " + context, cause);
        this.errorCode = errorCode;
        this.context = context;
    }

    /**
     * Get the error code for this exception
     * @return the error code
     */
    public ErrorCode getErrorCode() {
        return errorCode;
    }

    /**
     * Get the context object associated with this exception
     * @return the context object, or null if not available
     */
    public Object getContext() {
        return context;
    }

    /**
     * Check if this exception has a specific error code
     * @param code the error code to check
     * @return true if the error code matches
     */
    public boolean isErrorCode(ErrorCode code) {
        return this.errorCode == code;
    }

    /**
     * @return true when the failure is local to one row
     */
    public boolean isMalformed() {
        return errorCode.malformed();
    }

    public String toString() {
        return "TallyException{" +
                "errorCode=" + errorCode +
                ", context=" + context +
                '}';
    }
}
