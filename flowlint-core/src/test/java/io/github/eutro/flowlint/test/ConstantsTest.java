package io.github.eutro.flowlint.test;

import io.github.eutro.flowlint.analysis.Constants;
import io.github.eutro.flowlint.source.Operator;
import io.github.eutro.flowlint.ssa.BasicBlock;
import io.github.eutro.flowlint.ssa.Function;
import io.github.eutro.flowlint.ssa.IRBuilder;
import io.github.eutro.flowlint.ssa.Insn;
import io.github.eutro.flowlint.ssa.Var;
import io.github.eutro.flowlint.types.Type;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.*;

import static org.junit.jupiter.api.Assertions.*;

public class ConstantsTest {
    private static Set<Object> setOf(Object... values) {
        return new LinkedHashSet<>(Arrays.asList(values));
    }

    @Test
    void testConstant() {
        Function fn = new Function("f");
        IRBuilder ib = new IRBuilder(fn);
        Var five = ib.constant(5);
        Var converted = ib.convert(five, Type.basic("int64"));
        ib.ret();

        assertEquals(Optional.of(setOf(5L)), Constants.constantsOf(five));
        assertEquals(Optional.of(setOf(5L)), Constants.constantsOf(converted));
        assertEquals(Optional.of(true), Constants.compare(Operator.EQL, 5L, 5L));
    }

    @Test
    void testPhiOfConstants() {
        Function fn = new Function("f");
        IRBuilder ib = new IRBuilder(fn);
        BasicBlock left = fn.newBb();
        BasicBlock right = fn.newBb();
        BasicBlock join = fn.newBb();
        Var c = ib.param("c");
        ib.branch(c, left, right);
        ib.setBlock(left);
        Var one = ib.constant(1);
        ib.jump(join);
        ib.setBlock(right);
        Var two = ib.constant(2L);
        ib.jump(join);
        ib.setBlock(join);
        Insn.Phi phi = ib.phi("x").addEdge(left, one).addEdge(right, two);
        ib.ret();

        Set<Object> xs = Constants.constantsOf(phi.result()).orElseThrow(AssertionError::new);
        assertEquals(setOf(1L, 2L), xs);
        assertEquals("[1 2]", Constants.render(xs));
        for (Object x : xs) {
            assertEquals(Optional.of(false), Constants.compare(Operator.EQL, x, 3L));
        }
        assertEquals(Optional.empty(), Constants.constantsOf(c));
    }

    @Test
    void testDuplicatesNormalized() {
        Function fn = new Function("f");
        IRBuilder ib = new IRBuilder(fn);
        BasicBlock left = fn.newBb();
        BasicBlock join = fn.newBb();
        Var c = ib.param("c");
        Var a = ib.constant(7);
        ib.branch(c, left, join);
        ib.setBlock(left);
        Var b = ib.constant(BigInteger.valueOf(7));
        ib.jump(join);
        ib.setBlock(join);
        Insn.Phi phi = ib.phi("x").addEdge(fn.getEntry(), a).addEdge(left, b);
        ib.ret();

        assertEquals(Optional.of(setOf(7L)), Constants.constantsOf(phi.result()));
    }

    @Test
    void testUnresolvedOperand() {
        Function fn = new Function("f");
        IRBuilder ib = new IRBuilder(fn);
        BasicBlock left = fn.newBb();
        BasicBlock join = fn.newBb();
        Var c = ib.param("c");
        Var a = ib.constant(1);
        ib.branch(c, left, join);
        ib.setBlock(left);
        Var b = ib.binOp(Operator.ADD, a, a);
        ib.jump(join);
        ib.setBlock(join);
        Insn.Phi phi = ib.phi("x").addEdge(fn.getEntry(), a).addEdge(left, b);
        ib.ret();

        assertFalse(Constants.constantsOf(phi.result()).isPresent());
    }

    @Test
    void testPhiCycle() {
        Function fn = new Function("loop");
        IRBuilder ib = new IRBuilder(fn);
        BasicBlock entry = ib.getBlock();
        BasicBlock header = fn.newBb();
        BasicBlock body = fn.newBb();
        BasicBlock done = fn.newBb();
        Var c = ib.param("c");
        Var zero = ib.constant(0);
        ib.jump(header);
        ib.setBlock(header);
        Insn.Phi phi = ib.phi("i");
        ib.branch(c, body, done);
        ib.setBlock(body);
        Var same = ib.convert(phi.result(), null);
        ib.jump(header);
        phi.addEdge(entry, zero).addEdge(body, same);
        ib.setBlock(done).ret();

        assertEquals(Optional.of(setOf(0L)), Constants.constantsOf(phi.result()));
    }

    private static Insn.Phi diamondPhi(Function fn, java.util.function.Function<IRBuilder, Var> left, Object right) {
        IRBuilder ib = new IRBuilder(fn);
        BasicBlock l = fn.newBb();
        BasicBlock r = fn.newBb();
        BasicBlock join = fn.newBb();
        ib.branch(ib.param("c"), l, r);
        ib.setBlock(l);
        Var lv = left.apply(ib);
        ib.jump(join);
        ib.setBlock(r);
        Var rv = ib.constant(right);
        ib.jump(join);
        ib.setBlock(join);
        Insn.Phi phi = ib.phi("x").addEdge(l, lv).addEdge(r, rv);
        ib.ret();
        return phi;
    }

    @Test
    void testPhiOperandFromEnclosingFunction() {
        Insn.Phi outer = diamondPhi(new Function("outer"), ib -> ib.constant(1), 2);
        Insn.Phi inner = diamondPhi(new Function("inner"), ib -> ib.convert(outer.result(), null), 3);
        // same shape, so the same per-function id
        assertEquals(outer.id(), inner.id());

        assertEquals(Optional.of(setOf(1L, 2L, 3L)), Constants.constantsOf(inner.result()));
    }

    @Test
    void testNil() {
        Function fn = new Function("f");
        IRBuilder ib = new IRBuilder(fn);
        Var nil = ib.constant(null);
        ib.ret();

        Set<Object> xs = Constants.constantsOf(nil).orElseThrow(AssertionError::new);
        assertEquals(Collections.singleton(Constants.NULL_SENTINEL), xs);
        assertEquals("[nil]", Constants.render(xs));
        assertNull(Constants.takeNull(Constants.fillNull(null)));
        Object nilC = Constants.NULL_SENTINEL;
        assertEquals(Optional.of(true), Constants.compare(Operator.EQL, nilC, nilC));
        assertEquals(Optional.of(true), Constants.compare(Operator.NEQ, nilC, 1L));
        assertEquals(Optional.empty(), Constants.compare(Operator.LSS, nilC, nilC));
    }

    @Test
    void testCompare() {
        assertEquals(Optional.of(true), Constants.compare(Operator.LSS, "a", "b"));
        assertEquals(Optional.of(true), Constants.compare(Operator.GTR, 1.5, 1L));
        assertEquals(Optional.of(false), Constants.compare(Operator.EQL, Double.NaN, Double.NaN));
        assertEquals(Optional.of(true), Constants.compare(Operator.NEQ, Double.NaN, Double.NaN));
        assertEquals(Optional.of(true), Constants.compare(Operator.LEQ,
                BigInteger.ONE.shiftLeft(70), BigInteger.ONE.shiftLeft(70)));
        assertEquals(Optional.of(false), Constants.compare(Operator.EQL, true, false));
        assertEquals(Optional.empty(), Constants.compare(Operator.LSS, true, false));
        assertEquals(Optional.empty(), Constants.compare(Operator.EQL, 1L, "1"));
        assertThrows(IllegalArgumentException.class, () -> Constants.compare(Operator.ADD, 1L, 1L));
    }

    @Test
    void testNormalize() {
        assertEquals(97L, Constants.normalize('a'));
        assertEquals(3L, Constants.normalize((short) 3));
        assertEquals(0.5, Constants.normalize(0.5f));
        assertEquals(BigInteger.ONE.shiftLeft(64), Constants.normalize(BigInteger.ONE.shiftLeft(64)));
        assertSame(Constants.NULL_SENTINEL, Constants.normalize(null));
    }
}
