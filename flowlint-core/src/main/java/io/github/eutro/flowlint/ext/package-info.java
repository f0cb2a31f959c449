/**
 * Exts are typed keys under which facts are stored in an {@link io.github.eutro.flowlint.ext.ExtContainer}.
 * <p>
 * The program representation itself is read-only once built. Facts derived from it, the
 * dominator tree and the def-use chains, are attached as exts to a
 * {@link io.github.eutro.flowlint.analysis.FunctionAnalysis}, which is owned by a single analysis
 * request. They are computed on first use by a {@link io.github.eutro.flowlint.passes.IRPass pass}
 * (see {@link io.github.eutro.flowlint.ext.ExtContainer#getExtOrRun(Ext, Object, io.github.eutro.flowlint.passes.IRPass)})
 * and never shared between requests.
 * <p>
 * The keys used by the analysis are declared in {@link io.github.eutro.flowlint.ext.AnalysisExts}.
 */
package io.github.eutro.flowlint.ext;
