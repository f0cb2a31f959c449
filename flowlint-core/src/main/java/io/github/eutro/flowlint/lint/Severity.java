package io.github.eutro.flowlint.lint;

/**
 * How serious a diagnostic is.
 */
public enum Severity {
    /**
     * The analysis itself went wrong, e.g. a rule crashed.
     */
    ERROR,
    WARNING,
}
