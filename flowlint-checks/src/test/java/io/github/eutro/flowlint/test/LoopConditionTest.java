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

public class LoopConditionTest {
    private final Symbol i = var("i");
    private final Symbol n = var("n");
    private final Expr.Ident condI = ident(2, 15, i);
    private final Expr.Binary cond = Expr.binary(pos(2, 15), Operator.LSS, condI, ident(2, 19, n));

    private CompilationUnit unit(Stmt.For loop, Var condValue) {
        FuncDecl decl = new FuncDecl(pos(1, 1),
                Expr.ident(pos(1, 6), "g", new Symbol("g", Symbol.Kind.FUNC)),
                null,
                Collections.emptyList(),
                Collections.emptyList(),
                Stmt.block(pos(1, 10), loop),
                condValue.getFunction());
        return CompilationUnit.builder(FILE).decl(decl).bind(condI, condValue).build();
    }

    private Stmt.For loop(Stmt post) {
        return Stmt.forStmt(pos(2, 2),
                Stmt.define(pos(2, 6), ident(2, 6, i), Expr.lit(pos(2, 11), "0")),
                cond,
                post,
                Stmt.block(pos(2, 25)));
    }

    @Test
    void testNeverChanges() {
        Function fn = new Function("g");
        IRBuilder ib = new IRBuilder(fn);
        Var zero = ib.constant(0);
        ib.ret();

        List<Diagnostic> diagnostics = lint("SA4008", unit(loop(Stmt.incDec(pos(2, 22), ident(2, 22, i), true)), zero));
        assertEquals(1, diagnostics.size());
        assertEquals("variable in loop condition never changes", diagnostics.get(0).getMessage());
        assertEquals(pos(2, 15), diagnostics.get(0).getPosition());
    }

    @Test
    void testUpdatedThroughPhi() {
        Function fn = new Function("g");
        IRBuilder ib = new IRBuilder(fn);
        BasicBlock entry = ib.getBlock();
        BasicBlock header = fn.newBb();
        BasicBlock body = fn.newBb();
        BasicBlock done = fn.newBb();
        Var limit = ib.param("n");
        Var zero = ib.constant(0);
        ib.jump(header);
        ib.setBlock(header);
        Insn.Phi phi = ib.phi("i");
        ib.branch(ib.binOp(Operator.LSS, phi.result(), limit), body, done);
        ib.setBlock(body);
        Var next = ib.binOp(Operator.ADD, phi.result(), ib.constant(1));
        ib.jump(header);
        phi.addEdge(entry, zero).addEdge(body, next);
        ib.setBlock(done).ret();

        assertTrue(lint("SA4008", unit(loop(Stmt.incDec(pos(2, 22), ident(2, 22, i), true)), phi.result())).isEmpty());
    }

    @Test
    void testOtherShapes() {
        Function fn = new Function("g");
        IRBuilder ib = new IRBuilder(fn);
        Var zero = ib.constant(0);
        ib.ret();

        Stmt post = Stmt.assign(pos(2, 22), ident(2, 22, i), Expr.lit(pos(2, 26), "1"));
        assertTrue(lint("SA4008", unit(loop(post), zero)).isEmpty());
    }
}
