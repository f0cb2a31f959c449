package io.github.eutro.flowlint.checks;

import io.github.eutro.flowlint.lint.Diagnostic;
import io.github.eutro.flowlint.lint.Pass;
import io.github.eutro.flowlint.lint.Rule;
import io.github.eutro.flowlint.ssa.Var;
import io.github.eutro.flowlint.tree.*;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.stream.Stream;

/**
 * Flags assignments of values that nothing reads.
 */
public final class UnreadVariableValues implements Rule {
    public static final UnreadVariableValues INSTANCE = new UnreadVariableValues();

    private UnreadVariableValues() {
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
            if (!(node instanceof Stmt.Assign)) return Walk.CONTINUE;
            Stmt.Assign assign = (Stmt.Assign) node;
            if (assign.lhs.size() != assign.rhs.size()) return Walk.CONTINUE;
            for (int i = 0; i < assign.lhs.size(); i++) {
                Expr lhs = assign.lhs.get(i);
                if (!(lhs instanceof Expr.Ident) || ((Expr.Ident) lhs).isBlank()) continue;
                Var value = pass.valueOf(assign.rhs.get(i));
                if (value == null) continue;
                if (pass.analysis(value.getFunction()).uses().realUses(value).isEmpty()) {
                    diagnostics.add(pass.report(assign, "this value of %s is never used", pass.render(lhs)));
                }
            }
            return Walk.CONTINUE;
        });
        return diagnostics;
    }
}
