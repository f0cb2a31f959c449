package io.github.eutro.flowlint.test;

import io.github.eutro.flowlint.lint.Diagnostic;
import io.github.eutro.flowlint.source.CompilationUnit;
import io.github.eutro.flowlint.source.Operator;
import io.github.eutro.flowlint.ssa.BasicBlock;
import io.github.eutro.flowlint.ssa.Function;
import io.github.eutro.flowlint.ssa.IRBuilder;
import io.github.eutro.flowlint.ssa.Insn;
import io.github.eutro.flowlint.ssa.Var;
import io.github.eutro.flowlint.tree.*;
import org.junit.jupiter.api.Test;

import java.util.Collections;
import java.util.List;

import static io.github.eutro.flowlint.test.Utils.*;
import static org.junit.jupiter.api.Assertions.*;

public class PredeterminedBooleanExprsTest {
    private final Symbol x = var("x");
    private final Function fn = new Function("g");
    private final IRBuilder ib = new IRBuilder(fn);

    private List<Diagnostic> lintComparison(Expr.Binary binary, Var value) {
        FuncDecl decl = new FuncDecl(pos(1, 1),
                Expr.ident(pos(1, 6), "g", new Symbol("g", Symbol.Kind.FUNC)),
                null,
                Collections.emptyList(),
                Collections.emptyList(),
                Stmt.block(pos(1, 10), Stmt.ret(pos(2, 2), binary)),
                fn);
        return lint("SA4007", CompilationUnit.builder(FILE).decl(decl).bind(binary, value).build());
    }

    /**
     * Make {@code x} either 1 or 2, depending on a parameter.
     */
    private Var oneOrTwo() {
        BasicBlock left = fn.newBb();
        BasicBlock join = fn.newBb();
        BasicBlock entry = ib.getBlock();
        Var c = ib.param("c");
        Var one = ib.constant(1);
        ib.branch(c, left, join);
        ib.setBlock(left);
        Var two = ib.constant(2);
        ib.jump(join);
        ib.setBlock(join);
        Insn.Phi phi = ib.phi("x").addEdge(entry, one).addEdge(left, two);
        return phi.result();
    }

    @Test
    void testSelfComparison() {
        Var five = ib.constant(5);
        Var cmp = ib.binOp(Operator.EQL, five, five);
        ib.ret(cmp);
        Expr.Binary binary = Expr.binary(pos(2, 9), Operator.EQL, ident(2, 9, x), ident(2, 14, x));

        List<Diagnostic> diagnostics = lintComparison(binary, cmp);
        assertEquals(1, diagnostics.size());
        assertEquals("x == x is always true for all possible values ([5] == [5])", diagnostics.get(0).getMessage());
        assertEquals(pos(2, 9), diagnostics.get(0).getPosition());
    }

    @Test
    void testAlwaysFalse() {
        Var xs = oneOrTwo();
        Var cmp = ib.binOp(Operator.GTR, xs, ib.constant(3));
        ib.ret(cmp);
        Expr.Binary binary = Expr.binary(pos(2, 9), Operator.GTR, ident(2, 9, x), Expr.lit(pos(2, 13), "3"));

        List<Diagnostic> diagnostics = lintComparison(binary, cmp);
        assertEquals(1, diagnostics.size());
        assertEquals("x > 3 is always false for all possible values ([1 2] > [3])", diagnostics.get(0).getMessage());
    }

    @Test
    void testMixedOutcome() {
        Var xs = oneOrTwo();
        Var cmp = ib.binOp(Operator.LSS, xs, ib.constant(2));
        ib.ret(cmp);
        Expr.Binary binary = Expr.binary(pos(2, 9), Operator.LSS, ident(2, 9, x), Expr.lit(pos(2, 13), "2"));

        assertTrue(lintComparison(binary, cmp).isEmpty());
    }

    @Test
    void testNotConstant() {
        Var p = ib.param("p");
        Var cmp = ib.binOp(Operator.EQL, p, ib.constant(1));
        ib.ret(cmp);
        Expr.Binary binary = Expr.binary(pos(2, 9), Operator.EQL, ident(2, 9, var("p")), Expr.lit(pos(2, 14), "1"));

        assertTrue(lintComparison(binary, cmp).isEmpty());
    }

    @Test
    void testIncomparable() {
        Var s = ib.constant("a");
        Var cmp = ib.binOp(Operator.LSS, s, ib.constant(true));
        ib.ret(cmp);
        Expr.Binary binary = Expr.binary(pos(2, 9), Operator.LSS, Expr.lit(pos(2, 9), "\"a\""), Expr.lit(pos(2, 15), "true"));

        assertTrue(lintComparison(binary, cmp).isEmpty());
    }
}
