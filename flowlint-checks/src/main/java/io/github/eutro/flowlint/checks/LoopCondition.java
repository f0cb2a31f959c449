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
 * Flags {@code for i := x; i < n; i++} loops where the {@code i} the condition reads never changes.
 * <p>
 * A loop variable that is really updated reaches the condition through a phi, or through memory if
 * it is captured; any other value is the same on every iteration.
 */
public final class LoopCondition implements Rule {
    public static final LoopCondition INSTANCE = new LoopCondition();

    private LoopCondition() {
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
            if (node instanceof Stmt.For) {
                Stmt.For loop = (Stmt.For) node;
                if (isStuck(pass, loop)) {
                    diagnostics.add(pass.report(Objects.requireNonNull(loop.cond),
                            "variable in loop condition never changes"));
                }
            }
            return Walk.CONTINUE;
        });
        return diagnostics;
    }

    private static boolean isStuck(Pass pass, Stmt.For loop) {
        if (!(loop.init instanceof Stmt.Assign) || !(loop.cond instanceof Expr.Binary)
                || !(loop.post instanceof Stmt.IncDec)) {
            return false;
        }
        Stmt.Assign init = (Stmt.Assign) loop.init;
        if (init.lhs.size() != 1 || init.rhs.size() != 1 || !(init.lhs.get(0) instanceof Expr.Ident)) return false;
        Expr x = ((Expr.Binary) loop.cond).x;
        if (!(x instanceof Expr.Ident)) return false;
        Symbol symbol = ((Expr.Ident) x).symbol;
        if (symbol == null || symbol != ((Expr.Ident) init.lhs.get(0)).symbol) return false;

        Var value = pass.valueOf(x);
        if (value == null) return false;
        Insn def = value.definition();
        return def != null
                && !(def instanceof Insn.Phi)
                && !(def instanceof Insn.Load)
                && !(def instanceof Insn.Alloc);
    }
}
