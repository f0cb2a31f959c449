package io.github.eutro.flowlint.lint;

import io.github.eutro.flowlint.analysis.Analysis;
import io.github.eutro.flowlint.analysis.FunctionAnalysis;
import io.github.eutro.flowlint.source.CompilationUnit;
import io.github.eutro.flowlint.source.Node;
import io.github.eutro.flowlint.ssa.Function;
import io.github.eutro.flowlint.ssa.Var;
import io.github.eutro.flowlint.tree.Expr;
import io.github.eutro.flowlint.tree.FuncDecl;
import io.github.eutro.flowlint.types.TypeOracle;
import org.jetbrains.annotations.Nullable;

import java.util.List;
import java.util.Objects;

/**
 * What a {@link Rule} sees of a run: the unit to check, the analysis state of the run,
 * and a way to make diagnostics under its own identifier.
 */
public final class Pass {
    private final String ruleId;
    private final Severity severity;
    private final CompilationUnit unit;
    private final Analysis analysis;

    public Pass(String ruleId, Severity severity, CompilationUnit unit, Analysis analysis) {
        this.ruleId = Objects.requireNonNull(ruleId, "ruleId");
        this.severity = Objects.requireNonNull(severity, "severity");
        this.unit = Objects.requireNonNull(unit, "unit");
        this.analysis = Objects.requireNonNull(analysis, "analysis");
    }

    public String getRuleId() {
        return ruleId;
    }

    public CompilationUnit getUnit() {
        return unit;
    }

    public Analysis getAnalysis() {
        return analysis;
    }

    /**
     * Get the memoized facts about a function for this run.
     *
     * @param function The function, which must have a body.
     * @return The analysis.
     */
    public FunctionAnalysis analysis(Function function) {
        return analysis.of(function);
    }

    public List<FuncDecl> funcDecls() {
        return unit.getDecls();
    }

    public List<Function> functions() {
        return unit.functions();
    }

    public TypeOracle types() {
        return unit.types();
    }

    @Nullable
    public Var valueOf(Expr expr) {
        return unit.valueOf(expr);
    }

    public String render(Node node) {
        return unit.render(node);
    }

    /**
     * Make a diagnostic at a node.
     *
     * @param node   The node.
     * @param format The message, a {@link String#format(String, Object...) format string}.
     * @param args   The format arguments.
     * @return The diagnostic.
     */
    public Diagnostic report(Node node, String format, Object... args) {
        return new Diagnostic(node.position(), String.format(format, args), ruleId, severity);
    }
}
