package io.defcheck.core.model;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * One discrepancy between a document and its schema.
 *
 * @param category kind of discrepancy
 * @param path     dotted/bracketed path from the validation root, e.g.
 *                 {@code TradeItem.Items[3].Code}; empty for document-level issues
 * @param message  human-readable description
 */
public record Issue(IssueCategory category, String path, String message) {

    /** Wildcard that replaces numeric array indices in {@link #normalizedPath()}. */
    public static final String INDEX_WILDCARD = "[*]";

    private static final Pattern ARRAY_INDEX = Pattern.compile("\\[\\d+]");

    public Issue {
        Objects.requireNonNull(category, "category must not be null");
        Objects.requireNonNull(path, "path must not be null");
        Objects.requireNonNull(message, "message must not be null");
    }

    /**
     * The path with every {@code [n]} index replaced by {@code [*]}. Used to group
     * the same problem across array entries and documents.
     */
    public String normalizedPath() {
        return normalize(path);
    }

    /** Grouping key: {@code "{category} {normalizedPath}: {message}"}. */
    public String patternKey() {
        return category + " " + normalizedPath() + ": " + message;
    }

    /** Replaces numeric array indices with {@link #INDEX_WILDCARD}. Idempotent. */
    public static String normalize(String path) {
        return ARRAY_INDEX.matcher(path).replaceAll("[*]");
    }

    @Override
    public String toString() {
        return category + " " + path + ": " + message;
    }
}
