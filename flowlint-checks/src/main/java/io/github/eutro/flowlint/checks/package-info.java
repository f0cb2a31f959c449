/**
 * Checks built on the flow-sensitive analyses of {@link io.github.eutro.flowlint.analysis}.
 * <p>
 * Every check is a stateless singleton; {@link io.github.eutro.flowlint.checks.Checks#registry()}
 * registers them all under their identifiers.
 */
package io.github.eutro.flowlint.checks;
