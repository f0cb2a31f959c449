package io.github.eutro.flowlint.tree;

import io.github.eutro.flowlint.source.Position;
import io.github.eutro.flowlint.ssa.Function;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A function or method declaration, linked to its SSA form when the front end built one.
 */
public final class FuncDecl extends TreeNode {
    public final Expr.Ident name;
    @Nullable
    public final Expr.Ident recv;
    public final List<Expr.Ident> params;
    /**
     * The named results, empty if the results are unnamed.
     */
    public final List<Expr.Ident> results;
    @Nullable
    public final Stmt.Block body;
    @Nullable
    public final Function ssa;

    public FuncDecl(Position position, Expr.Ident name, @Nullable Expr.Ident recv, List<Expr.Ident> params,
                    List<Expr.Ident> results, @Nullable Stmt.Block body, @Nullable Function ssa) {
        super(position);
        this.name = name;
        this.recv = recv;
        this.params = Collections.unmodifiableList(new ArrayList<>(params));
        this.results = Collections.unmodifiableList(new ArrayList<>(results));
        this.body = body;
        this.ssa = ssa;
    }

    /**
     * Whether the given symbol is one of the named results of this function.
     *
     * @param symbol The symbol.
     * @return Whether it is.
     */
    public boolean isNamedResult(@Nullable Symbol symbol) {
        if (symbol == null) return false;
        for (Expr.Ident result : results) {
            if (result.symbol == symbol) return true;
        }
        return false;
    }

    @Override
    public List<TreeNode> children() {
        List<TreeNode> children = new ArrayList<>();
        children.add(name);
        if (recv != null) children.add(recv);
        children.addAll(params);
        children.addAll(results);
        if (body != null) children.add(body);
        return children;
    }

    @Override
    public String toString() {
        return "func " + (recv == null ? "" : "(" + recv + ") ") + name + "(...)";
    }
}
