package io.github.eutro.flowlint.lint;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Collects diagnostics from any number of threads, and hands them out in a deterministic order.
 */
public final class Reporter {
    private final List<Diagnostic> diagnostics = new ArrayList<>();

    public synchronized void add(Diagnostic diagnostic) {
        diagnostics.add(diagnostic);
    }

    public synchronized void addAll(Collection<Diagnostic> diagnostics) {
        this.diagnostics.addAll(diagnostics);
    }

    /**
     * Get everything reported so far, stably sorted by position, ties broken by rule identifier.
     *
     * @return The sorted diagnostics.
     */
    public synchronized List<Diagnostic> finish() {
        List<Diagnostic> sorted = new ArrayList<>(diagnostics);
        sorted.sort(Diagnostic.ORDER);
        return sorted;
    }

    /**
     * Format a diagnostic as {@code file:line:col: message (ID)}.
     *
     * @param diagnostic The diagnostic.
     * @return The formatted diagnostic.
     */
    public static String format(Diagnostic diagnostic) {
        return diagnostic.getPosition() + ": " + diagnostic.getMessage() + " (" + diagnostic.getRuleId() + ")";
    }
}
