package io.github.eutro.flowlint.test;

import io.github.eutro.flowlint.analysis.Analysis;
import io.github.eutro.flowlint.analysis.DefUse;
import io.github.eutro.flowlint.source.Operator;
import io.github.eutro.flowlint.ssa.BasicBlock;
import io.github.eutro.flowlint.ssa.Function;
import io.github.eutro.flowlint.ssa.IRBuilder;
import io.github.eutro.flowlint.ssa.Insn;
import io.github.eutro.flowlint.ssa.Var;
import org.junit.jupiter.api.Test;

import java.util.Collections;

import static org.junit.jupiter.api.Assertions.*;

public class DefUseTest {
    @Test
    void testUses() {
        Function fn = new Function("f");
        IRBuilder ib = new IRBuilder(fn);
        Var x = ib.param("x");
        Var one = ib.constant(1);
        Var sum = ib.binOp(Operator.ADD, x, one);
        Var twice = ib.binOp(Operator.MUL, x, x);
        Insn.DebugRef ref = ib.debugRef(x);
        Var slot = ib.alloc("s");
        Insn.Store store = ib.store(slot, sum);
        Var t = ib.load(slot);
        Insn.Return ret = ib.ret(t, twice);

        DefUse uses = new Analysis().of(fn).uses();
        assertEquals(3, uses.uses(x).size());
        assertTrue(uses.uses(x).contains(ref));
        assertEquals(2, uses.realUses(x).size());
        assertFalse(uses.realUses(x).contains(ref));
        assertSame(twice.definition(), uses.realUses(x).get(1));
        assertEquals(Collections.singletonList(store), uses.uses(sum));
        assertEquals(1, uses.loadsFrom(slot).size());
        assertEquals(Collections.singletonList(store), uses.storesTo(slot));
        assertTrue(uses.storesTo(sum).isEmpty());
        assertEquals(Collections.singletonList(ret), uses.uses(t));
    }

    @Test
    void testSelfReferentialPhi() {
        Function fn = new Function("loop");
        IRBuilder ib = new IRBuilder(fn);
        BasicBlock entry = ib.getBlock();
        BasicBlock header = fn.newBb();
        BasicBlock done = fn.newBb();
        Var c = ib.param("c");
        Var zero = ib.constant(0);
        ib.jump(header);
        ib.setBlock(header);
        Insn.Phi phi = ib.phi("i");
        Var i = phi.result();
        phi.addEdge(entry, zero).addEdge(header, i);
        ib.branch(c, header, done);
        ib.setBlock(done).ret();

        DefUse uses = new Analysis().of(fn).uses();
        assertEquals(Collections.singletonList(phi), uses.uses(i));
        assertTrue(uses.realUses(i).isEmpty());
        assertEquals(Collections.singletonList(phi), uses.realUses(zero));
    }

    @Test
    void testReachesRead() {
        Function fn = new Function("f");
        IRBuilder ib = new IRBuilder(fn);
        BasicBlock reads = fn.newBb();
        BasicBlock skips = fn.newBb();
        Var c = ib.param("c");
        Var slot = ib.alloc("s");
        Insn.Store first = ib.store(slot, ib.constant(1));
        ib.branch(c, reads, skips);
        ib.setBlock(reads);
        ib.load(slot);
        ib.ret();
        ib.setBlock(skips);
        Insn.Store second = ib.store(slot, ib.constant(2));
        ib.ret();

        DefUse uses = new Analysis().of(fn).uses();
        assertTrue(uses.reachesRead(first, insn -> insn instanceof Insn.Load));
        assertFalse(uses.reachesRead(second, insn -> insn instanceof Insn.Load));
        assertTrue(uses.reachesRead(second, insn -> insn == second));
    }

    @Test
    void testForeignVar() {
        Function fn = new Function("f");
        new IRBuilder(fn).ret();
        Function other = new Function("g");
        IRBuilder ib = new IRBuilder(other);
        Var x = ib.param("x");
        ib.ret();
        DefUse uses = new Analysis().of(fn).uses();
        assertThrows(IllegalArgumentException.class, () -> uses.uses(x));
    }
}
