package io.github.eutro.flowlint.test;

import io.github.eutro.flowlint.lint.Diagnostic;
import io.github.eutro.flowlint.source.CompilationUnit;
import io.github.eutro.flowlint.ssa.Function;
import io.github.eutro.flowlint.ssa.IRBuilder;
import io.github.eutro.flowlint.ssa.Var;
import io.github.eutro.flowlint.tree.*;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static io.github.eutro.flowlint.test.Utils.*;
import static org.junit.jupiter.api.Assertions.*;

public class UnreadVariableValuesTest {
    private final Symbol x = var("x");
    private final Symbol compute = new Symbol("compute", Symbol.Kind.FUNC);
    private final Function fn = new Function("g");
    private final IRBuilder ib = new IRBuilder(fn);

    private FuncDecl decl(Stmt... stmts) {
        return new FuncDecl(pos(1, 1),
                Expr.ident(pos(1, 6), "g", new Symbol("g", Symbol.Kind.FUNC)),
                null,
                Collections.emptyList(),
                Collections.emptyList(),
                Stmt.block(pos(1, 10), stmts),
                fn);
    }

    private Expr.Call callCompute(int line) {
        return Expr.call(pos(line, 7), ident(line, 7, compute));
    }

    @Test
    void testOverwrittenBeforeRead() {
        // x := compute(); x = 2; return x
        Expr.Call first = callCompute(2);
        Expr two = Expr.lit(pos(3, 6), "2");
        Stmt.Assign define = Stmt.define(pos(2, 2), ident(2, 2, x), first);
        Stmt.Assign assign = Stmt.assign(pos(3, 2), ident(3, 2, x), two);
        Var t1 = ib.callExternal("compute");
        Var t2 = ib.constant(2);
        ib.debugRef(t1);
        ib.ret(t2);
        CompilationUnit unit = CompilationUnit.builder(FILE)
                .decl(decl(define, assign, Stmt.ret(pos(4, 2), ident(4, 9, x))))
                .bind(first, t1)
                .bind(two, t2)
                .build();

        List<Diagnostic> diagnostics = lint("SA4006", unit);
        assertEquals(1, diagnostics.size());
        assertEquals("this value of x is never used", diagnostics.get(0).getMessage());
        assertEquals(pos(2, 2), diagnostics.get(0).getPosition());
        assertEquals(diagnostics, lint("SA4006", unit));
    }

    @Test
    void testBlankAndTuples() {
        Expr.Call call = callCompute(2);
        Expr.Call pair = callCompute(3);
        Stmt.Assign blank = Stmt.assign(pos(2, 2), Expr.ident(pos(2, 2), "_", null), call);
        Stmt.Assign tuple = new Stmt.Assign(pos(3, 2),
                Arrays.asList(ident(3, 2, x), ident(3, 5, var("y"))),
                Collections.singletonList(pair),
                true);
        Var t1 = ib.callExternal("compute");
        Var t2 = ib.callExternal("compute");
        ib.ret();
        CompilationUnit unit = CompilationUnit.builder(FILE)
                .decl(decl(blank, tuple))
                .bind(call, t1)
                .bind(pair, t2)
                .build();

        assertTrue(lint("SA4006", unit).isEmpty());
    }

    @Test
    void testRead() {
        Expr.Call call = callCompute(2);
        Stmt.Assign define = Stmt.define(pos(2, 2), ident(2, 2, x), call);
        Var t1 = ib.callExternal("compute");
        ib.ret(t1);
        CompilationUnit unit = CompilationUnit.builder(FILE)
                .decl(decl(define, Stmt.ret(pos(3, 2), ident(3, 9, x))))
                .bind(call, t1)
                .build();

        assertTrue(lint("SA4006", unit).isEmpty());
    }
}
