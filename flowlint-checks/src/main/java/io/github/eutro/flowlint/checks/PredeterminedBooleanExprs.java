package io.github.eutro.flowlint.checks;

import io.github.eutro.flowlint.analysis.Constants;
import io.github.eutro.flowlint.lint.Diagnostic;
import io.github.eutro.flowlint.lint.Pass;
import io.github.eutro.flowlint.lint.Rule;
import io.github.eutro.flowlint.ssa.Insn;
import io.github.eutro.flowlint.ssa.Var;
import io.github.eutro.flowlint.tree.*;
import org.jetbrains.annotations.Nullable;

import java.util.*;
import java.util.stream.Stream;

/**
 * Flags comparisons with the same outcome for every combination of the constants their operands may hold.
 */
public final class PredeterminedBooleanExprs implements Rule {
    public static final PredeterminedBooleanExprs INSTANCE = new PredeterminedBooleanExprs();

    private PredeterminedBooleanExprs() {
    }

    @Override
    public Stream<Diagnostic> check(Pass pass) {
        return pass.funcDecls().stream()
                .filter(decl -> decl.body != null)
                .flatMap(decl -> checkFunc(pass, decl).stream());
    }

    private static List<Diagnostic> checkFunc(Pass pass, FuncDecl decl) {
        List<Diagnostic> diagnostics = new ArrayList<>();
        Inspector.inspect(Objects.requireNonNull(decl.body), node -> {
            if (node instanceof Expr.Binary && ((Expr.Binary) node).op.isComparison()) {
                Diagnostic diagnostic = checkComparison(pass, (Expr.Binary) node);
                if (diagnostic != null) diagnostics.add(diagnostic);
            }
            return Walk.CONTINUE;
        });
        return diagnostics;
    }

    @Nullable
    private static Diagnostic checkComparison(Pass pass, Expr.Binary binary) {
        Var value = pass.valueOf(binary);
        if (value == null || !(value.definition() instanceof Insn.BinOp)) return null;
        Insn.BinOp op = (Insn.BinOp) value.definition();
        if (!op.op.isComparison()) return null;
        Optional<Set<Object>> xs = Constants.constantsOf(op.x);
        Optional<Set<Object>> ys = Constants.constantsOf(op.y);
        if (!xs.isPresent() || !ys.isPresent() || xs.get().isEmpty() || ys.get().isEmpty()) return null;

        int trues = 0;
        for (Object x : xs.get()) {
            for (Object y : ys.get()) {
                Optional<Boolean> outcome = Constants.compare(op.op, x, y);
                if (!outcome.isPresent()) return null;
                if (outcome.get()) trues++;
            }
        }
        if (trues != 0 && trues != xs.get().size() * ys.get().size()) return null;
        return pass.report(binary, "%s is always %b for all possible values (%s %s %s)",
                pass.render(binary), trues != 0,
                Constants.render(xs.get()), op.op, Constants.render(ys.get()));
    }
}
