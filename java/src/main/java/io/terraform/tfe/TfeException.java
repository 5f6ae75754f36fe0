package io.terraform.tfe;

/**
 * Base exception thrown by the TFE Java SDK.
 *
 * <p>
 * Conditions callers are expected to branch on carry a {@link TfeError} sentinel; compare it by identity via
 * {@link #is(TfeError)} rather than matching message text.
 * </p>
 */
public class TfeException extends Exception {

    private static final long serialVersionUID = 1L;

    private final TfeError error;

    public TfeException(String message) {
        super(message);
        this.error = null;
    }

    public TfeException(String message, Throwable cause) {
        super(message, cause);
        this.error = null;
    }

    public TfeException(TfeError error) {
        super(error.message());
        this.error = error;
    }

    public TfeException(TfeError error, Throwable cause) {
        super(error.message(), cause);
        this.error = error;
    }

    protected TfeException(TfeError error, String message) {
        super(message);
        this.error = error;
    }

    /**
     * @return the sentinel describing this failure, or {@code null} for composed server messages and transport errors.
     */
    public TfeError getError() {
        return error;
    }

    public boolean is(TfeError candidate) {
        return error != null && error == candidate;
    }
}
