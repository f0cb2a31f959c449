package io.github.eutro.flowlint.tree;

import io.github.eutro.flowlint.source.Operator;
import io.github.eutro.flowlint.source.Position;
import io.github.eutro.flowlint.ssa.Function;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * An expression. {@link #toString()} renders it as source.
 */
public abstract class Expr extends TreeNode {
    Expr(Position position) {
        super(position);
    }

    public static Ident ident(Position position, String name, @Nullable Symbol symbol) {
        return new Ident(position, name, symbol);
    }

    public static Call call(Position position, Expr fun, Expr... args) {
        return new Call(position, fun, Arrays.asList(args));
    }

    public static Lit lit(Position position, String text) {
        return new Lit(position, text);
    }

    public static Binary binary(Position position, Operator op, Expr x, Expr y) {
        return new Binary(position, op, x, y);
    }

    public static Selector selector(Position position, Expr x, Ident sel) {
        return new Selector(position, x, sel);
    }

    public static FuncLit funcLit(Position position, Stmt.Block body, @Nullable Function ssa) {
        return new FuncLit(position, body, ssa);
    }

    /**
     * An identifier, resolved to a symbol if the front end could resolve it.
     */
    public static final class Ident extends Expr {
        public final String name;
        @Nullable
        public final Symbol symbol;

        public Ident(Position position, String name, @Nullable Symbol symbol) {
            super(position);
            this.name = name;
            this.symbol = symbol;
        }

        /**
         * Whether this is the blank identifier {@code _}.
         *
         * @return Whether it is.
         */
        public boolean isBlank() {
            return "_".equals(name);
        }

        @Override
        public List<TreeNode> children() {
            return Collections.emptyList();
        }

        @Override
        public String toString() {
            return name;
        }
    }

    /**
     * A function call.
     */
    public static final class Call extends Expr {
        public final Expr fun;
        public final List<Expr> args;

        public Call(Position position, Expr fun, List<Expr> args) {
            super(position);
            this.fun = fun;
            this.args = Collections.unmodifiableList(new ArrayList<>(args));
        }

        @Override
        public List<TreeNode> children() {
            List<TreeNode> children = new ArrayList<>(args.size() + 1);
            children.add(fun);
            children.addAll(args);
            return children;
        }

        @Override
        public String toString() {
            return args.stream().map(Expr::toString)
                    .collect(Collectors.joining(", ", fun + "(", ")"));
        }
    }

    /**
     * A literal, kept as its source text.
     */
    public static final class Lit extends Expr {
        public final String text;

        public Lit(Position position, String text) {
            super(position);
            this.text = text;
        }

        @Override
        public List<TreeNode> children() {
            return Collections.emptyList();
        }

        @Override
        public String toString() {
            return text;
        }
    }

    /**
     * A binary expression.
     */
    public static final class Binary extends Expr {
        public final Operator op;
        public final Expr x;
        public final Expr y;

        public Binary(Position position, Operator op, Expr x, Expr y) {
            super(position);
            this.op = op;
            this.x = x;
            this.y = y;
        }

        @Override
        public List<TreeNode> children() {
            return Arrays.asList(x, y);
        }

        @Override
        public String toString() {
            return x + " " + op + " " + y;
        }
    }

    /**
     * A selector, {@code x.sel}.
     */
    public static final class Selector extends Expr {
        public final Expr x;
        public final Ident sel;

        public Selector(Position position, Expr x, Ident sel) {
            super(position);
            this.x = x;
            this.sel = sel;
        }

        @Override
        public List<TreeNode> children() {
            return Arrays.asList(x, sel);
        }

        @Override
        public String toString() {
            return x + "." + sel;
        }
    }

    /**
     * A function literal, whose body is its own function.
     */
    public static final class FuncLit extends Expr {
        public final Stmt.Block body;
        @Nullable
        public final Function ssa;

        public FuncLit(Position position, Stmt.Block body, @Nullable Function ssa) {
            super(position);
            this.body = body;
            this.ssa = ssa;
        }

        @Override
        public List<TreeNode> children() {
            return Collections.singletonList(body);
        }

        @Override
        public String toString() {
            return "func() {...}";
        }
    }
}
