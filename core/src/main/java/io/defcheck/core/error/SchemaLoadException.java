package io.defcheck.core.error;

/** Thrown when a Swagger document has no usable {@code definitions} block. */
public final class SchemaLoadException extends DefcheckException {

    private static final long serialVersionUID = 1L;

    public SchemaLoadException(String message, String source) {
        super(message, source);
    }

    public SchemaLoadException(String message, Throwable cause, String source) {
        super(message, cause, source);
    }
}
