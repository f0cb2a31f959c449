package io.github.eutro.flowlint.types;

import io.github.eutro.flowlint.ssa.Var;
import io.github.eutro.flowlint.tree.Expr;
import org.jetbrains.annotations.Nullable;

/**
 * Resolved type information, supplied by the front end.
 * <p>
 * A {@code null} result means the type could not be resolved; checks treat that as
 * "cannot conclude" and skip the site.
 */
public interface TypeOracle {
    /**
     * An oracle that knows nothing.
     */
    TypeOracle NONE = new TypeOracle() {
        @Override
        public @Nullable Type typeOf(Var value) {
            return null;
        }

        @Override
        public @Nullable Type typeOf(Expr expr) {
            return null;
        }
    };

    @Nullable
    Type typeOf(Var value);

    @Nullable
    Type typeOf(Expr expr);
}
