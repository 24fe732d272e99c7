package io.defcheck.core.model;

/**
 * A recurring issue shape across a run: the same category, normalized path and
 * message, with the number of documents it occurs in.
 *
 * @param category       issue category
 * @param normalizedPath path with array indices replaced by {@code [*]}
 * @param message        issue message
 * @param documentCount  number of documents containing this pattern at least once
 */
public record IssuePattern(IssueCategory category, String normalizedPath, String message, int documentCount) {

    /** Same format as {@link Issue#patternKey()}. */
    public String key() {
        return category + " " + normalizedPath + ": " + message;
    }
}
