package io.github.eutro.flowlint.tree;

import io.github.eutro.flowlint.source.Position;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * A statement.
 */
public abstract class Stmt extends TreeNode {
    Stmt(Position position) {
        super(position);
    }

    private static List<TreeNode> nonNull(TreeNode... nodes) {
        List<TreeNode> list = new ArrayList<>(nodes.length);
        for (TreeNode node : nodes) {
            if (node != null) list.add(node);
        }
        return list;
    }

    private static <T> List<T> copy(List<T> list) {
        return Collections.unmodifiableList(new ArrayList<>(list));
    }

    public static Block block(Position position, Stmt... stmts) {
        return new Block(position, Arrays.asList(stmts));
    }

    public static If ifStmt(Position position, Expr cond, Block then, @Nullable Stmt els) {
        return new If(position, cond, then, els);
    }

    public static For forStmt(Position position, @Nullable Stmt init, @Nullable Expr cond, @Nullable Stmt post, Block body) {
        return new For(position, init, cond, post, body);
    }

    public static Range range(Position position, Expr x, Block body) {
        return new Range(position, x, body);
    }

    public static Switch switchStmt(Position position, @Nullable Expr tag, Block... clauses) {
        return new Switch(position, tag, Arrays.asList(clauses));
    }

    public static Select select(Position position, Block... clauses) {
        return new Select(position, Arrays.asList(clauses));
    }

    public static Labeled labeled(Position position, Expr.Ident label, Stmt stmt) {
        return new Labeled(position, label, stmt);
    }

    public static Branch branch(Position position, BranchKind kind, @Nullable Expr.Ident label) {
        return new Branch(position, kind, label);
    }

    public static Return ret(Position position, Expr... results) {
        return new Return(position, Arrays.asList(results));
    }

    public static Assign assign(Position position, Expr lhs, Expr rhs) {
        return new Assign(position, Collections.singletonList(lhs), Collections.singletonList(rhs), false);
    }

    public static Assign define(Position position, Expr lhs, Expr rhs) {
        return new Assign(position, Collections.singletonList(lhs), Collections.singletonList(rhs), true);
    }

    public static ExprStmt expr(Position position, Expr x) {
        return new ExprStmt(position, x);
    }

    public static IncDec incDec(Position position, Expr x, boolean inc) {
        return new IncDec(position, x, inc);
    }

    public static Defer defer(Position position, Expr.Call call) {
        return new Defer(position, call);
    }

    /**
     * A block of statements.
     */
    public static final class Block extends Stmt {
        public final List<Stmt> stmts;

        public Block(Position position, List<Stmt> stmts) {
            super(position);
            this.stmts = copy(stmts);
        }

        @Override
        public List<TreeNode> children() {
            return new ArrayList<>(stmts);
        }

        @Override
        public String toString() {
            return stmts.stream().map(Stmt::toString).collect(Collectors.joining("; ", "{ ", " }"));
        }
    }

    /**
     * An if statement, with an optional else branch (a block or another if).
     */
    public static final class If extends Stmt {
        public final Expr cond;
        public final Block then;
        @Nullable
        public final Stmt els;

        public If(Position position, Expr cond, Block then, @Nullable Stmt els) {
            super(position);
            this.cond = cond;
            this.then = then;
            this.els = els;
        }

        @Override
        public List<TreeNode> children() {
            return nonNull(cond, then, els);
        }

        @Override
        public String toString() {
            return "if " + cond + " " + then + (els == null ? "" : " else " + els);
        }
    }

    /**
     * A three-clause (or condition-only, or infinite) for loop.
     */
    public static final class For extends Stmt {
        @Nullable
        public final Stmt init;
        @Nullable
        public final Expr cond;
        @Nullable
        public final Stmt post;
        public final Block body;

        public For(Position position, @Nullable Stmt init, @Nullable Expr cond, @Nullable Stmt post, Block body) {
            super(position);
            this.init = init;
            this.cond = cond;
            this.post = post;
            this.body = body;
        }

        @Override
        public List<TreeNode> children() {
            return nonNull(init, cond, post, body);
        }

        @Override
        public String toString() {
            return "for " + (init == null ? "" : init) + "; " + (cond == null ? "" : cond) + "; "
                    + (post == null ? "" : post) + " " + body;
        }
    }

    /**
     * A loop over the elements of a collection.
     */
    public static final class Range extends Stmt {
        public final Expr x;
        public final Block body;

        public Range(Position position, Expr x, Block body) {
            super(position);
            this.x = x;
            this.body = body;
        }

        @Override
        public List<TreeNode> children() {
            return nonNull(x, body);
        }

        @Override
        public String toString() {
            return "for range " + x + " " + body;
        }
    }

    /**
     * A switch, each clause being a block.
     */
    public static final class Switch extends Stmt {
        @Nullable
        public final Expr tag;
        public final List<Block> clauses;

        public Switch(Position position, @Nullable Expr tag, List<Block> clauses) {
            super(position);
            this.tag = tag;
            this.clauses = copy(clauses);
        }

        @Override
        public List<TreeNode> children() {
            List<TreeNode> children = nonNull(tag);
            children.addAll(clauses);
            return children;
        }

        @Override
        public String toString() {
            return "switch " + (tag == null ? "" : tag + " ") + clauses;
        }
    }

    /**
     * A select over channel operations, each clause being a block.
     */
    public static final class Select extends Stmt {
        public final List<Block> clauses;

        public Select(Position position, List<Block> clauses) {
            super(position);
            this.clauses = copy(clauses);
        }

        @Override
        public List<TreeNode> children() {
            return new ArrayList<>(clauses);
        }

        @Override
        public String toString() {
            return "select " + clauses;
        }
    }

    /**
     * A labeled statement. The label's symbol identifies the statement for branches.
     */
    public static final class Labeled extends Stmt {
        public final Expr.Ident label;
        public final Stmt stmt;

        public Labeled(Position position, Expr.Ident label, Stmt stmt) {
            super(position);
            this.label = label;
            this.stmt = stmt;
        }

        @Override
        public List<TreeNode> children() {
            return nonNull(label, stmt);
        }

        @Override
        public String toString() {
            return label + ": " + stmt;
        }
    }

    public enum BranchKind {
        BREAK("break"),
        CONTINUE("continue"),
        GOTO("goto"),
        FALLTHROUGH("fallthrough"),
        ;

        public final String token;

        BranchKind(String token) {
            this.token = token;
        }
    }

    /**
     * A break, continue, goto or fallthrough, with an optional label.
     */
    public static final class Branch extends Stmt {
        public final BranchKind kind;
        @Nullable
        public final Expr.Ident label;

        public Branch(Position position, BranchKind kind, @Nullable Expr.Ident label) {
            super(position);
            this.kind = kind;
            this.label = label;
        }

        @Override
        public List<TreeNode> children() {
            return nonNull(label);
        }

        @Override
        public String toString() {
            return kind.token + (label == null ? "" : " " + label);
        }
    }

    public static final class Return extends Stmt {
        public final List<Expr> results;

        public Return(Position position, List<Expr> results) {
            super(position);
            this.results = copy(results);
        }

        @Override
        public List<TreeNode> children() {
            return new ArrayList<>(results);
        }

        @Override
        public String toString() {
            return results.isEmpty() ? "return" : results.stream().map(Expr::toString)
                    .collect(Collectors.joining(", ", "return ", ""));
        }
    }

    /**
     * An assignment, or a short variable declaration if {@code define} is set.
     */
    public static final class Assign extends Stmt {
        public final List<Expr> lhs;
        public final List<Expr> rhs;
        public final boolean define;

        public Assign(Position position, List<Expr> lhs, List<Expr> rhs, boolean define) {
            super(position);
            this.lhs = copy(lhs);
            this.rhs = copy(rhs);
            this.define = define;
        }

        @Override
        public List<TreeNode> children() {
            List<TreeNode> children = new ArrayList<>(lhs);
            children.addAll(rhs);
            return children;
        }

        @Override
        public String toString() {
            return lhs.stream().map(Expr::toString).collect(Collectors.joining(", "))
                    + (define ? " := " : " = ")
                    + rhs.stream().map(Expr::toString).collect(Collectors.joining(", "));
        }
    }

    public static final class ExprStmt extends Stmt {
        public final Expr x;

        public ExprStmt(Position position, Expr x) {
            super(position);
            this.x = x;
        }

        @Override
        public List<TreeNode> children() {
            return Collections.singletonList(x);
        }

        @Override
        public String toString() {
            return x.toString();
        }
    }

    public static final class IncDec extends Stmt {
        public final Expr x;
        public final boolean inc;

        public IncDec(Position position, Expr x, boolean inc) {
            super(position);
            this.x = x;
            this.inc = inc;
        }

        @Override
        public List<TreeNode> children() {
            return Collections.singletonList(x);
        }

        @Override
        public String toString() {
            return x + (inc ? "++" : "--");
        }
    }

    public static final class Defer extends Stmt {
        public final Expr.Call call;

        public Defer(Position position, Expr.Call call) {
            super(position);
            this.call = call;
        }

        @Override
        public List<TreeNode> children() {
            return Collections.singletonList(call);
        }

        @Override
        public String toString() {
            return "defer " + call;
        }
    }
}
