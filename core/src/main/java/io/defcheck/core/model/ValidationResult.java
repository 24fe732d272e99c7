package io.defcheck.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Outcome of one validation run: every document id mapped to its issues, in the
 * order the documents were supplied. An empty issue list means the document is
 * valid.
 *
 * <p>
 * Thread-safe: all fields are final and collections are unmodifiable.
 */
public final class ValidationResult {

    private final Map<String, List<Issue>> issuesByDocument;

    /**
     * Creates a result from the given per-document issues. The map and the lists
     * are defensively copied.
     */
    public ValidationResult(Map<String, List<Issue>> issuesByDocument) {
        Map<String, List<Issue>> copy = new LinkedHashMap<>();
        issuesByDocument.forEach((id, issues) -> copy.put(id, List.copyOf(issues)));
        this.issuesByDocument = Collections.unmodifiableMap(copy);
    }

    /** Per-document issues in input order. */
    public Map<String, List<Issue>> issuesByDocument() {
        return issuesByDocument;
    }

    /** Issues of one document, or an empty list if the id is unknown. */
    public List<Issue> issuesFor(String documentId) {
        return issuesByDocument.getOrDefault(documentId, List.of());
    }

    public int documentCount() {
        return issuesByDocument.size();
    }

    public int validCount() {
        return (int) issuesByDocument.values().stream().filter(List::isEmpty).count();
    }

    public int invalidCount() {
        return documentCount() - validCount();
    }

    /** Returns {@code true} only if every document produced zero issues. */
    public boolean isSuccess() {
        return invalidCount() == 0;
    }

    /**
     * Aggregates issues into recurring patterns. Each pattern is counted at most
     * once per document. Sorted by document count descending; equal counts keep
     * first-seen order.
     *
     * @param limit maximum number of patterns to return
     * @return the most frequent patterns
     */
    public List<IssuePattern> issuePatterns(int limit) {
        Map<String, Issue> firstByKey = new LinkedHashMap<>();
        Map<String, Integer> counts = new LinkedHashMap<>();
        for (List<Issue> issues : issuesByDocument.values()) {
            Set<String> seen = new HashSet<>();
            for (Issue issue : issues) {
                String key = issue.patternKey();
                if (seen.add(key)) {
                    firstByKey.putIfAbsent(key, issue);
                    counts.merge(key, 1, Integer::sum);
                }
            }
        }

        List<IssuePattern> patterns = new ArrayList<>(counts.size());
        counts.forEach((key, count) -> {
            Issue first = firstByKey.get(key);
            patterns.add(new IssuePattern(first.category(), first.normalizedPath(), first.message(), count));
        });
        // List.sort is stable, so ties keep insertion order
        patterns.sort(Comparator.comparingInt(IssuePattern::documentCount).reversed());
        return patterns.size() > limit ? List.copyOf(patterns.subList(0, limit)) : List.copyOf(patterns);
    }

    @Override
    public String toString() {
        return "ValidationResult[documents=" + documentCount() + ", invalid=" + invalidCount() + "]";
    }
}
