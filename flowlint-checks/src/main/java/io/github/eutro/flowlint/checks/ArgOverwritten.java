package io.github.eutro.flowlint.checks;

import io.github.eutro.flowlint.lint.Diagnostic;
import io.github.eutro.flowlint.lint.Pass;
import io.github.eutro.flowlint.lint.Rule;
import io.github.eutro.flowlint.ssa.Insn;
import io.github.eutro.flowlint.ssa.Var;
import io.github.eutro.flowlint.tree.*;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.stream.Stream;

/**
 * Flags parameters that are assigned to before their incoming value is ever read.
 */
public final class ArgOverwritten implements Rule {
    public static final ArgOverwritten INSTANCE = new ArgOverwritten();

    private ArgOverwritten() {
    }

    @Override
    public Stream<Diagnostic> check(Pass pass) {
        return pass.funcDecls().stream()
                .filter(decl -> decl.body != null && decl.ssa != null && !decl.params.isEmpty())
                .flatMap(decl -> checkFunc(pass, decl).stream());
    }

    private static List<Diagnostic> checkFunc(Pass pass, FuncDecl decl) {
        List<Diagnostic> diagnostics = new ArrayList<>();
        for (Expr.Ident param : decl.params) {
            Symbol symbol = param.symbol;
            if (symbol == null || param.isBlank()) continue;
            Var value = pass.valueOf(param);
            if (value == null || !(value.definition() instanceof Insn.Param)) continue;
            if (!pass.analysis(value.getFunction()).uses().realUses(value).isEmpty()) continue;
            boolean assigned = Inspector.inspect(Objects.requireNonNull(decl.body), node -> {
                if (!(node instanceof Stmt.Assign)) return Walk.CONTINUE;
                for (Expr lhs : ((Stmt.Assign) node).lhs) {
                    if (lhs instanceof Expr.Ident && ((Expr.Ident) lhs).symbol == symbol) return Walk.STOP;
                }
                return Walk.CONTINUE;
            });
            if (assigned) {
                diagnostics.add(pass.report(param, "argument %s is overwritten before first use", param.name));
            }
        }
        return diagnostics;
    }
}
