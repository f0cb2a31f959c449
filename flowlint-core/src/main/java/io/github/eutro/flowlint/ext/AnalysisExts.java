package io.github.eutro.flowlint.ext;

import io.github.eutro.flowlint.analysis.DefUse;
import io.github.eutro.flowlint.analysis.DomTree;
import io.github.eutro.flowlint.analysis.FunctionAnalysis;
import io.github.eutro.flowlint.passes.meta.ComputeDoms;
import io.github.eutro.flowlint.passes.meta.ComputeUses;

/**
 * The {@link Ext}s attached to a {@link FunctionAnalysis}.
 */
public final class AnalysisExts {
    private AnalysisExts() {
    }

    /**
     * The <a href="https://en.wikipedia.org/wiki/Dominator_(graph_theory)">dominator tree</a> of the function.
     * <p>
     * Computed by {@link ComputeDoms}.
     */
    public static final Ext<DomTree> DOMS = Ext.create(DomTree.class, "DOMS");

    /**
     * The def-use chains of the function.
     * <p>
     * Computed by {@link ComputeUses}.
     */
    public static final Ext<DefUse> USES = Ext.create(DefUse.class, "USES");
}
