package io.defcheck.cli.source;

/**
 * Thrown when the set of documents to validate cannot be determined: the
 * documents directory is missing, no documents were found, or a file could not
 * be read.
 */
public class DocumentSourceException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public DocumentSourceException(String message) {
        super(message);
    }

    public DocumentSourceException(String message, Throwable cause) {
        super(message, cause);
    }
}
