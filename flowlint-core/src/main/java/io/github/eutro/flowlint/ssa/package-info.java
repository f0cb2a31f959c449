/**
 * This package defines the static single assignment (SSA) form analysed by the checks.
 * <p>
 * A {@link io.github.eutro.flowlint.ssa.Function} is a list of
 * {@link io.github.eutro.flowlint.ssa.BasicBlock basic blocks}, each a list of
 * {@link io.github.eutro.flowlint.ssa.Effect effects} followed by one
 * {@link io.github.eutro.flowlint.ssa.Control control} instruction.
 * Each {@link io.github.eutro.flowlint.ssa.Var} is assigned by exactly one effect;
 * {@link io.github.eutro.flowlint.ssa.Insn.Phi phis} merge values at join points.
 * <p>
 * The front end builds functions with an {@link io.github.eutro.flowlint.ssa.IRBuilder}.
 * Once a {@link io.github.eutro.flowlint.source.Program} has been handed to the linter the
 * representation is treated as read-only: nothing in the analysis or the checks mutates it, and
 * derived facts live in a {@link io.github.eutro.flowlint.analysis.FunctionAnalysis} instead.
 */
package io.github.eutro.flowlint.ssa;
