/**
 * {@link io.github.eutro.flowlint.passes.IRPass IR passes} that compute facts about a function, without changing it.
 * <p>
 * Each attaches its result to the {@link io.github.eutro.flowlint.analysis.FunctionAnalysis} it is run on.
 */
package io.github.eutro.flowlint.passes.meta;
