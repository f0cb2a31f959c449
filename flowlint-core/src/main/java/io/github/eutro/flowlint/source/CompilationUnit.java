package io.github.eutro.flowlint.source;

import io.github.eutro.flowlint.ssa.Function;
import io.github.eutro.flowlint.ssa.Var;
import io.github.eutro.flowlint.tree.Expr;
import io.github.eutro.flowlint.tree.FuncDecl;
import io.github.eutro.flowlint.types.Type;
import io.github.eutro.flowlint.types.TypeOracle;
import org.jetbrains.annotations.Nullable;

import java.util.*;

/**
 * A single file of the analysed program, as handed over by the front end.
 * <p>
 * Units are immutable once built.
 */
public final class CompilationUnit {
    private final String file;
    private final List<FuncDecl> decls;
    private final List<Function> functions;
    private final Map<Expr, Var> values;
    private final TypeOracle types;
    private final Renderer renderer;

    private CompilationUnit(Builder builder) {
        this.file = builder.file;
        this.decls = Collections.unmodifiableList(new ArrayList<>(builder.decls));
        LinkedHashSet<Function> functions = new LinkedHashSet<>();
        for (FuncDecl decl : decls) {
            if (decl.ssa != null) functions.add(decl.ssa);
        }
        functions.addAll(builder.extraFunctions);
        functions.removeIf(Function::isExternal);
        this.functions = Collections.unmodifiableList(new ArrayList<>(functions));
        this.values = new IdentityHashMap<>(builder.values);
        this.types = builder.types == null ? new MapTypeOracle(builder) : builder.types;
        this.renderer = builder.renderer;
    }

    public static Builder builder(String file) {
        return new Builder(file);
    }

    public String getFile() {
        return file;
    }

    /**
     * Get the function declarations of this unit, in source order.
     *
     * @return The declarations.
     */
    public List<FuncDecl> getDecls() {
        return decls;
    }

    /**
     * Get every function with a body in this unit: those of the declarations,
     * followed by anonymous functions.
     *
     * @return The functions.
     */
    public List<Function> functions() {
        return functions;
    }

    /**
     * Get the SSA value the front end computed for an expression.
     *
     * @param expr The expression.
     * @return The value, or null if the expression has none.
     */
    @Nullable
    public Var valueOf(Expr expr) {
        return values.get(expr);
    }

    public TypeOracle types() {
        return types;
    }

    public String render(Node node) {
        return renderer.render(node);
    }

    @Override
    public String toString() {
        return file;
    }

    private static final class MapTypeOracle implements TypeOracle {
        private final Map<Var, Type> varTypes;
        private final Map<Expr, Type> exprTypes;

        MapTypeOracle(Builder builder) {
            varTypes = new HashMap<>(builder.varTypes);
            exprTypes = new IdentityHashMap<>(builder.exprTypes);
        }

        @Override
        public @Nullable Type typeOf(Var value) {
            return varTypes.get(value);
        }

        @Override
        public @Nullable Type typeOf(Expr expr) {
            return exprTypes.get(expr);
        }
    }

    /**
     * Builds a {@link CompilationUnit}.
     * <p>
     * Types are either recorded one by one with {@link #type(Var, Type)} and {@link #type(Expr, Type)},
     * or supplied wholesale with {@link #types(TypeOracle)}, but not both.
     */
    public static final class Builder {
        private final String file;
        private final List<FuncDecl> decls = new ArrayList<>();
        private final List<Function> extraFunctions = new ArrayList<>();
        private final Map<Expr, Var> values = new IdentityHashMap<>();
        private final Map<Var, Type> varTypes = new HashMap<>();
        private final Map<Expr, Type> exprTypes = new IdentityHashMap<>();
        private TypeOracle types = null;
        private Renderer renderer = Renderer.DEFAULT;

        private Builder(String file) {
            this.file = Objects.requireNonNull(file, "file");
        }

        public Builder decl(FuncDecl decl) {
            decls.add(decl);
            return this;
        }

        /**
         * Add a function that has no declaration of its own, such as a function literal.
         *
         * @param function The function.
         * @return This builder.
         */
        public Builder function(Function function) {
            extraFunctions.add(function);
            return this;
        }

        public Builder bind(Expr expr, Var value) {
            values.put(expr, value);
            return this;
        }

        public Builder type(Var value, Type type) {
            checkNoOracle();
            varTypes.put(value, type);
            return this;
        }

        public Builder type(Expr expr, Type type) {
            checkNoOracle();
            exprTypes.put(expr, type);
            return this;
        }

        public Builder types(TypeOracle types) {
            if (!varTypes.isEmpty() || !exprTypes.isEmpty()) {
                throw new IllegalStateException("types already recorded individually");
            }
            this.types = Objects.requireNonNull(types, "types");
            return this;
        }

        public Builder renderer(Renderer renderer) {
            this.renderer = Objects.requireNonNull(renderer, "renderer");
            return this;
        }

        private void checkNoOracle() {
            if (types != null) throw new IllegalStateException("a type oracle is already set");
        }

        public CompilationUnit build() {
            return new CompilationUnit(this);
        }
    }
}
