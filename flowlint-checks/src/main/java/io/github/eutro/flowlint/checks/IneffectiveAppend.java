package io.github.eutro.flowlint.checks;

import io.github.eutro.flowlint.analysis.Analysis;
import io.github.eutro.flowlint.lint.Diagnostic;
import io.github.eutro.flowlint.lint.Pass;
import io.github.eutro.flowlint.lint.Rule;
import io.github.eutro.flowlint.ssa.Insn;
import io.github.eutro.flowlint.ssa.Var;
import io.github.eutro.flowlint.tree.*;

import java.util.*;
import java.util.stream.Stream;

/**
 * Flags {@code x = append(...)} where the result only ever flows into further appends.
 */
public final class IneffectiveAppend implements Rule {
    public static final IneffectiveAppend INSTANCE = new IneffectiveAppend();

    private IneffectiveAppend() {
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
            if (assign.lhs.size() != 1 || assign.rhs.size() != 1) return Walk.CONTINUE;
            if (!(assign.lhs.get(0) instanceof Expr.Ident) || !(assign.rhs.get(0) instanceof Expr.Call)) {
                return Walk.CONTINUE;
            }
            Expr.Ident ident = (Expr.Ident) assign.lhs.get(0);
            Expr.Call call = (Expr.Call) assign.rhs.get(0);
            if (ident.isBlank() || !isAppend(call)) return Walk.CONTINUE;
            // the caller sees named results
            if (decl.isNamedResult(ident.symbol)) return Walk.CONTINUE;
            Var value = pass.valueOf(call);
            if (value == null) return Walk.CONTINUE;
            if (!isUsed(pass.getAnalysis(), value)) {
                diagnostics.add(pass.report(assign, "this result of append is never used, except maybe in other appends"));
            }
            return Walk.CONTINUE;
        });
        return diagnostics;
    }

    private static boolean isAppend(Expr.Call call) {
        if (!(call.fun instanceof Expr.Ident)) return false;
        Expr.Ident fun = (Expr.Ident) call.fun;
        if (!"append".equals(fun.name)) return false;
        return fun.symbol == null || fun.symbol.kind == Symbol.Kind.BUILTIN;
    }

    private static boolean isUsed(Analysis analysis, Var value) {
        Set<Insn> visited = new HashSet<>();
        Deque<Var> worklist = new ArrayDeque<>();
        worklist.push(value);
        while (!worklist.isEmpty()) {
            Var var = worklist.pop();
            for (Insn use : analysis.of(var.getFunction()).uses().uses(var)) {
                if (!visited.add(use) || use instanceof Insn.DebugRef) continue;
                boolean grows = use instanceof Insn.Phi
                        || use instanceof Insn.Call && ((Insn.Call) use).isBuiltin("append");
                if (!grows) return true;
                Var result = use.result();
                if (result != null) worklist.push(result);
            }
        }
        return false;
    }
}
