package io.defcheck.cli.fetch;

/**
 * Thrown when a Swagger document cannot be obtained: the download failed or
 * returned a non-2xx status, or the cache file could not be read or written.
 */
public class SchemaFetchException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final String url;

    public SchemaFetchException(String message, String url) {
        super(message);
        this.url = url;
    }

    public SchemaFetchException(String message, String url, Throwable cause) {
        super(message, cause);
        this.url = url;
    }

    /** The schema URL involved. */
    public String url() {
        return url;
    }
}
