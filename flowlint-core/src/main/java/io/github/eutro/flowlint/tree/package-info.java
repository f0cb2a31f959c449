/**
 * The syntax tree of the analysed code, as far as the checks need it.
 * <p>
 * Nodes are built by the front end through the factories on {@link io.github.eutro.flowlint.tree.Stmt}
 * and {@link io.github.eutro.flowlint.tree.Expr}. Identifiers carry the
 * {@link io.github.eutro.flowlint.tree.Symbol} they resolve to, so labels and variables are matched
 * by what they refer to rather than by how they are spelled.
 */
package io.github.eutro.flowlint.tree;
