package software.amazon.multihash;

/**
 * Thrown for unexpected or error conditions while computing digests.
 * The {@link Reason} identifies which precondition or run-time step failed.
 */
public class MultiHashException extends RuntimeException {
    private static final long serialVersionUID = 1L;

    public enum Reason {
        UNSUPPORTED_ALGORITHM,
        NO_ALGORITHM_SPECIFIED,
        NO_STATE_PROVIDED,
        ALGORITHM_SET_MISMATCH,
        STATE_IMPORT_FAILED,
        STATE_EXPORT_UNSUPPORTED,
        SOURCE_READ_ERROR,
        CONSUMER_PROTOCOL_VIOLATION,
    }

    private final Reason reason;

    public MultiHashException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public MultiHashException(Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    public MultiHashException(Reason reason, Throwable cause) {
        super(cause);
        this.reason = reason;
    }

    public Reason getReason() {
        return reason;
    }
}
