/**
 * The flow-sensitive primitives rules are built from: dominance and reachability over the control flow
 * graph, def-use chains, constant propagation, and receiver alias tracing.
 * <p>
 * Facts are requested through {@link io.github.eutro.flowlint.analysis.FunctionAnalysis}, which computes
 * each once per run.
 */
package io.github.eutro.flowlint.analysis;
