package io.github.eutro.flowlint.passes.meta;

import io.github.eutro.flowlint.analysis.DefUse;
import io.github.eutro.flowlint.analysis.FunctionAnalysis;
import io.github.eutro.flowlint.ext.AnalysisExts;
import io.github.eutro.flowlint.passes.InPlaceIRPass;
import io.github.eutro.flowlint.ssa.BasicBlock;
import io.github.eutro.flowlint.ssa.Function;
import io.github.eutro.flowlint.ssa.Insn;
import io.github.eutro.flowlint.ssa.Var;

import java.util.ArrayList;
import java.util.List;

/**
 * Computes {@link AnalysisExts#USES} for a function.
 */
public final class ComputeUses implements InPlaceIRPass<FunctionAnalysis> {
    /**
     * A singleton instance of this pass.
     */
    public static final ComputeUses INSTANCE = new ComputeUses();

    private ComputeUses() {
    }

    @Override
    public void runInPlace(FunctionAnalysis fa) {
        Function func = fa.function;
        List<List<Insn>> uses = new ArrayList<>(func.varCount());
        for (int i = 0; i < func.varCount(); i++) {
            uses.add(new ArrayList<>());
        }
        for (BasicBlock block : func.getBlocks()) {
            for (Insn insn : block.insns()) {
                for (Var arg : insn.args()) {
                    // closures may capture variables of other functions
                    if (arg.getFunction() != func) continue;
                    List<Insn> argUses = uses.get(arg.index);
                    if (argUses.isEmpty() || argUses.get(argUses.size() - 1) != insn) {
                        argUses.add(insn);
                    }
                }
            }
        }
        fa.attachExt(AnalysisExts.USES, new DefUse(func, uses));
    }
}
