package io.github.eutro.flowlint.lint;

import java.util.stream.Stream;

/**
 * A check over one compilation unit.
 * <p>
 * Rules are stateless, must not modify the program, and must not depend on the output of other rules.
 * When a fact they need is not statically known they skip the site.
 */
@FunctionalInterface
public interface Rule {
    /**
     * Check a compilation unit.
     *
     * @param pass The unit and the analysis state of the current run.
     * @return The findings, produced lazily.
     */
    Stream<Diagnostic> check(Pass pass);
}
