package io.defcheck.core.error;

/**
 * Abstract base for all defcheck exceptions. Never thrown directly: use the concrete
 * subclasses. Structural validation itself never throws; these cover setting up a run.
 */
public abstract class DefcheckException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final String source;

    protected DefcheckException(String message, String source) {
        super(message);
        this.source = source;
    }

    protected DefcheckException(String message, Throwable cause, String source) {
        super(message, cause);
        this.source = source;
    }

    /** The schema file, URL or resource that caused the error, or {@code null} if unknown. */
    public String source() {
        return source;
    }

    /** Human-readable error description (alias for {@link #getMessage()}). */
    public String detail() {
        return getMessage();
    }
}
