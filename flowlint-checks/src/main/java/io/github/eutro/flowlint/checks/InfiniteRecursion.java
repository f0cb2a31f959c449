package io.github.eutro.flowlint.checks;

import io.github.eutro.flowlint.analysis.DomTree;
import io.github.eutro.flowlint.lint.Diagnostic;
import io.github.eutro.flowlint.lint.Pass;
import io.github.eutro.flowlint.lint.Rule;
import io.github.eutro.flowlint.ssa.BasicBlock;
import io.github.eutro.flowlint.ssa.Control;
import io.github.eutro.flowlint.ssa.Function;
import io.github.eutro.flowlint.ssa.Insn;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

/**
 * Flags calls of a function to itself after which it can never return.
 * <p>
 * A function can only return past a self-call through a return in a block not dominated by the
 * call's block; if there is none, every path through the call recurses again.
 */
public final class InfiniteRecursion implements Rule {
    public static final InfiniteRecursion INSTANCE = new InfiniteRecursion();

    private InfiniteRecursion() {
    }

    @Override
    public Stream<Diagnostic> check(Pass pass) {
        return pass.functions().stream().flatMap(fn -> checkFunc(pass, fn).stream());
    }

    private static List<Diagnostic> checkFunc(Pass pass, Function fn) {
        DomTree doms = pass.analysis(fn).doms();
        List<Diagnostic> diagnostics = new ArrayList<>();
        for (BasicBlock block : doms.preorder()) {
            for (Insn insn : block.insns()) {
                if (!(insn instanceof Insn.Call)) continue;
                Insn.Call call = (Insn.Call) insn;
                if (call.kind != Insn.CallKind.STATIC || call.target != fn || call.deferred) continue;
                if (!canReturn(doms, block)) {
                    diagnostics.add(pass.report(call, "infinite recursive call"));
                }
            }
        }
        return diagnostics;
    }

    private static boolean canReturn(DomTree doms, BasicBlock callBlock) {
        for (BasicBlock block : doms.preorder()) {
            if (doms.dominates(callBlock, block)) continue;
            Control control = block.getControl();
            if (control != null && control.insn() instanceof Insn.Return) return true;
        }
        return false;
    }
}
