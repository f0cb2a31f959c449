package io.github.eutro.flowlint.checks;

import io.github.eutro.flowlint.lint.Diagnostic;
import io.github.eutro.flowlint.lint.Pass;
import io.github.eutro.flowlint.lint.Rule;
import io.github.eutro.flowlint.tree.*;
import io.github.eutro.flowlint.types.Type;
import org.jetbrains.annotations.Nullable;

import java.util.*;
import java.util.stream.Stream;

/**
 * Flags loops whose body always exits on the first iteration.
 * <p>
 * The exit must be a return or a break of the loop itself, directly in a body of two or more
 * statements that also branches. The loop is left alone if any continue in its body can resume it,
 * or if its body contains a goto, which might jump over the exit.
 */
public final class IneffectiveLoop implements Rule {
    public static final IneffectiveLoop INSTANCE = new IneffectiveLoop();

    static final String MESSAGE = "the surrounding loop is unconditionally terminated";

    private IneffectiveLoop() {
    }

    @Override
    public Stream<Diagnostic> check(Pass pass) {
        return pass.funcDecls().stream()
                .filter(decl -> decl.body != null)
                .flatMap(decl -> checkFunc(pass, decl).stream());
    }

    private static List<Diagnostic> checkFunc(Pass pass, FuncDecl decl) {
        Map<Symbol, Stmt> labels = new HashMap<>();
        Inspector.inspect(Objects.requireNonNull(decl.body), node -> {
            if (node instanceof Stmt.Labeled) {
                Stmt.Labeled labeled = (Stmt.Labeled) node;
                if (labeled.label.symbol != null) labels.put(labeled.label.symbol, labeled.stmt);
            }
            return Walk.CONTINUE;
        });

        List<Diagnostic> diagnostics = new ArrayList<>();
        Inspector.inspect(decl.body, node -> {
            Stmt.Block body;
            if (node instanceof Stmt.For) {
                body = ((Stmt.For) node).body;
            } else if (node instanceof Stmt.Range) {
                Stmt.Range range = (Stmt.Range) node;
                Type type = pass.types().typeOf(range.x);
                // looping once over a map is how you get an arbitrary element
                if (type == null || type.is(Type.Kind.MAP)) return Walk.CONTINUE;
                body = range.body;
            } else {
                return Walk.CONTINUE;
            }
            TreeNode exit = unconditionalExit((Stmt) node, body, labels);
            if (exit != null) diagnostics.add(pass.report(exit, MESSAGE));
            return Walk.CONTINUE;
        });
        return diagnostics;
    }

    @Nullable
    private static TreeNode unconditionalExit(Stmt loop, Stmt.Block body, Map<Symbol, Stmt> labels) {
        // a loop over a single statement is the usual way to take the first element
        if (body.stmts.size() < 2) return null;
        TreeNode exit = null;
        boolean branching = false;
        for (Stmt stmt : body.stmts) {
            Stmt unlabeled = stmt;
            while (unlabeled instanceof Stmt.Labeled) {
                unlabeled = ((Stmt.Labeled) unlabeled).stmt;
            }
            if (unlabeled instanceof Stmt.Branch) {
                Stmt.Branch branch = (Stmt.Branch) unlabeled;
                boolean ours = branch.label == null || targetOf(branch.label, labels) == loop;
                if (branch.kind == Stmt.BranchKind.BREAK && ours) {
                    if (exit == null) exit = branch;
                } else if (branch.kind == Stmt.BranchKind.CONTINUE
                        && (ours || branch.label.symbol == null)) {
                    return null;
                }
            } else if (unlabeled instanceof Stmt.Return) {
                if (exit == null) exit = unlabeled;
            } else if (unlabeled instanceof Stmt.If
                    || unlabeled instanceof Stmt.For
                    || unlabeled instanceof Stmt.Range
                    || unlabeled instanceof Stmt.Switch
                    || unlabeled instanceof Stmt.Select) {
                branching = true;
            }
        }
        if (exit == null || !branching) return null;
        for (Stmt stmt : body.stmts) {
            if (mayResume(stmt, loop, labels, false)) return null;
        }
        return exit;
    }

    /**
     * Whether anything under {@code root} may resume {@code loop} or jump past its exit.
     *
     * @param nested Whether {@code root} is inside a loop nested in {@code loop}, which is then
     *               the target of unlabeled continues.
     */
    private static boolean mayResume(TreeNode root, Stmt loop, Map<Symbol, Stmt> labels, boolean nested) {
        return Inspector.inspect(root, node -> {
            if (node instanceof Expr.FuncLit) return Walk.SKIP;
            if (node instanceof Stmt.For || node instanceof Stmt.Range) {
                for (TreeNode child : node.children()) {
                    if (mayResume(child, loop, labels, true)) return Walk.STOP;
                }
                return Walk.SKIP;
            }
            if (node instanceof Stmt.Branch) {
                Stmt.Branch branch = (Stmt.Branch) node;
                switch (branch.kind) {
                    case GOTO:
                        return Walk.STOP;
                    case CONTINUE:
                        if (branch.label == null) return nested ? Walk.CONTINUE : Walk.STOP;
                        if (branch.label.symbol == null) return Walk.STOP;
                        return targetOf(branch.label, labels) == loop ? Walk.STOP : Walk.CONTINUE;
                    default:
                        return Walk.CONTINUE;
                }
            }
            return Walk.CONTINUE;
        });
    }

    @Nullable
    private static Stmt targetOf(Expr.Ident label, Map<Symbol, Stmt> labels) {
        return label.symbol == null ? null : labels.get(label.symbol);
    }
}
