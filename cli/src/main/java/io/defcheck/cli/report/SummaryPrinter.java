package io.defcheck.cli.report;

import io.defcheck.core.model.Issue;
import io.defcheck.core.model.IssuePattern;
import io.defcheck.core.model.ValidationResult;
import java.io.PrintStream;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Prints the validation summary of one schema: document counts, optionally the
 * per-document results, and the most frequent issue patterns.
 */
public final class SummaryPrinter {

    static final String HEAVY_RULE = "=".repeat(66);
    static final String LIGHT_RULE = "─".repeat(66);

    private final PrintStream out;

    public SummaryPrinter(PrintStream out) {
        this.out = out;
    }

    /**
     * Prints the summary.
     *
     * @param label       schema label for the header
     * @param result      the run result
     * @param verbose     also print every document with its issues
     * @param topPatterns maximum number of patterns to print
     * @return {@code true} if every document passed
     */
    public boolean print(String label, ValidationResult result, boolean verbose, int topPatterns) {
        out.println();
        out.println(HEAVY_RULE);
        out.println("  " + label);
        out.println(HEAVY_RULE);
        out.println("Files validated : " + result.documentCount());
        out.println("Valid           : " + result.validCount());
        out.println("With issues     : " + result.invalidCount());

        if (verbose) {
            out.println();
            out.println(LIGHT_RULE);
            Map<String, List<Issue>> sorted = new TreeMap<>(result.issuesByDocument());
            sorted.forEach((id, issues) -> {
                out.println("  [" + (issues.isEmpty() ? "PASS" : "FAIL") + "] " + id);
                for (Issue issue : issues) {
                    out.println("    " + issue);
                }
            });
        }

        List<IssuePattern> patterns = result.issuePatterns(topPatterns);
        if (!patterns.isEmpty()) {
            out.println();
            out.println(LIGHT_RULE);
            out.println("ISSUE PATTERNS (unique path + message, count = files affected):");
            out.println(LIGHT_RULE);
            for (IssuePattern pattern : patterns) {
                out.println(String.format("  %4dx  %s", pattern.documentCount(), pattern.key()));
            }
        } else if (result.isSuccess()) {
            out.println();
            out.println("All " + result.documentCount() + " files passed validation.");
        }

        return result.isSuccess();
    }
}
