package io.github.eutro.flowlint.test;

import io.github.eutro.flowlint.checks.Checks;
import io.github.eutro.flowlint.lint.Diagnostic;
import io.github.eutro.flowlint.lint.LintConfig;
import io.github.eutro.flowlint.lint.Linter;
import io.github.eutro.flowlint.source.CompilationUnit;
import io.github.eutro.flowlint.source.Position;
import io.github.eutro.flowlint.source.Program;
import io.github.eutro.flowlint.tree.Expr;
import io.github.eutro.flowlint.tree.Symbol;

import java.util.List;

final class Utils {
    static final String FILE = "a.go";

    private Utils() {
    }

    static Position pos(int line, int column) {
        return Position.of(FILE, line, column);
    }

    static Symbol var(String name) {
        return new Symbol(name, Symbol.Kind.VAR);
    }

    static Expr.Ident ident(int line, int column, Symbol symbol) {
        return Expr.ident(pos(line, column), symbol.name, symbol);
    }

    static List<Diagnostic> lint(String check, CompilationUnit... units) {
        return new Linter(Checks.registry(), LintConfig.builder().check(check).build()).run(Program.of(units));
    }
}
