package io.github.eutro.flowlint.analysis;

import io.github.eutro.flowlint.ext.AnalysisExts;
import io.github.eutro.flowlint.ext.Ext;
import io.github.eutro.flowlint.ext.ExtHolder;
import io.github.eutro.flowlint.passes.meta.ComputeDoms;
import io.github.eutro.flowlint.passes.meta.ComputeUses;
import io.github.eutro.flowlint.ssa.BasicBlock;
import io.github.eutro.flowlint.ssa.Function;
import io.github.eutro.flowlint.ssa.Insn;
import org.jetbrains.annotations.Nullable;

import java.util.Collection;

/**
 * The memoized facts about one function, for one analysis request.
 * <p>
 * Each fact is computed by its pass the first time it is asked for. All access is synchronized,
 * so rules running concurrently over the same function compute each fact once.
 */
public final class FunctionAnalysis extends ExtHolder {
    /**
     * The function analysed.
     */
    public final Function function;

    FunctionAnalysis(Function function) {
        if (function.isExternal()) throw new IllegalArgumentException(function.name + " has no body");
        this.function = function;
    }

    @Override
    public synchronized <T> void attachExt(Ext<T> ext, T value) {
        super.attachExt(ext, value);
    }

    @Override
    public synchronized <T> @Nullable T getNullable(Ext<T> ext) {
        return super.getNullable(ext);
    }

    public synchronized DomTree doms() {
        return getExtOrRun(AnalysisExts.DOMS, this, ComputeDoms.INSTANCE);
    }

    public synchronized DefUse uses() {
        return getExtOrRun(AnalysisExts.USES, this, ComputeUses.INSTANCE);
    }

    /**
     * See {@link Reachability#reachable(BasicBlock, Insn, Collection)}.
     *
     * @param from     The block to start at.
     * @param to       The instruction to reach.
     * @param avoiding The blocks paths may not pass through.
     * @return Whether {@code to} is reachable.
     */
    public boolean reachable(BasicBlock from, Insn to, Collection<BasicBlock> avoiding) {
        return Reachability.reachable(from, to, avoiding);
    }

    @Override
    public String toString() {
        return "FunctionAnalysis(" + function.name + ")";
    }
}
