package io.defcheck.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.Objects;

/**
 * A document handed to the runner by the document source. Exactly one of
 * {@code content} and {@code parseError} is non-null.
 *
 * @param id         document identifier (file name)
 * @param content    parsed JSON, or null if parsing failed
 * @param parseError parser message, or null if parsing succeeded
 */
public record SourceDocument(String id, JsonNode content, String parseError) {

    public SourceDocument {
        Objects.requireNonNull(id, "id must not be null");
        if ((content == null) == (parseError == null)) {
            throw new IllegalArgumentException("Exactly one of content and parseError must be set for " + id);
        }
    }

    /** A document that parsed successfully. */
    public static SourceDocument parsed(String id, JsonNode content) {
        return new SourceDocument(id, Objects.requireNonNull(content, "content must not be null"), null);
    }

    /** A document that could not be parsed as JSON. */
    public static SourceDocument unparseable(String id, String parseError) {
        return new SourceDocument(id, null, parseError == null ? "unparseable document" : parseError);
    }

    public boolean isParsed() {
        return content != null;
    }
}
