package io.github.eutro.flowlint.test;

import io.github.eutro.flowlint.analysis.Analysis;
import io.github.eutro.flowlint.analysis.FunctionAnalysis;
import io.github.eutro.flowlint.analysis.ReceiverAliases;
import io.github.eutro.flowlint.ssa.Function;
import io.github.eutro.flowlint.ssa.IRBuilder;
import io.github.eutro.flowlint.ssa.Insn;
import io.github.eutro.flowlint.ssa.Var;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;

import static org.junit.jupiter.api.Assertions.*;

public class ReceiverAliasesTest {
    @Test
    void testFieldStores() {
        Function fn = new Function("T.set");
        IRBuilder ib = new IRBuilder(fn);
        Var recv = ib.receiver("t");
        Var slot = ib.alloc("t");
        ib.store(slot, recv);
        Var copy = ib.alloc("u");
        ib.store(copy, ib.load(slot));
        Var name = ib.fieldAddr(slot, 0, "Name");
        Insn.Store first = ib.store(name, ib.constant("a"));
        Var age = ib.fieldAddr(slot, 1, "Age");
        Insn.Store second = ib.store(age, ib.constant(1));
        ib.load(age);
        ib.ret();

        FunctionAnalysis fa = new Analysis().of(fn);
        ReceiverAliases aliases = ReceiverAliases.trace(fa);
        assertFalse(aliases.isEscaped());
        assertSame(recv, aliases.getReceiver());
        assertEquals(Collections.singleton(slot), aliases.slots());
        assertTrue(aliases.isSlot(slot));
        assertFalse(aliases.isSlot(copy));
        assertTrue(aliases.isField(name));
        assertTrue(aliases.isField(age));
        assertEquals(Arrays.asList(first, second), aliases.fieldStores(fa.uses()));
    }

    @Test
    void testSlotCopiedToSlot() {
        Function fn = new Function("T.alias");
        IRBuilder ib = new IRBuilder(fn);
        Var recv = ib.receiver("t");
        Var slot = ib.alloc("t");
        ib.store(slot, recv);
        Var other = ib.alloc("p");
        ib.store(other, slot);
        ib.ret();

        ReceiverAliases aliases = ReceiverAliases.trace(new Analysis().of(fn));
        assertFalse(aliases.isEscaped());
        assertEquals(2, aliases.slots().size());
    }

    @Test
    void testEscapes() {
        Function passed = new Function("T.passed");
        IRBuilder ib = new IRBuilder(passed);
        Var slot = ib.alloc("t");
        ib.store(slot, ib.receiver("t"));
        ib.callExternal("consume", slot);
        ib.ret();
        assertTrue(ReceiverAliases.trace(new Analysis().of(passed)).isEscaped());

        Function heap = new Function("T.heap");
        ib = new IRBuilder(heap);
        Var cell = ib.heapAlloc("t");
        ib.store(cell, ib.receiver("t"));
        ib.ret();
        assertTrue(ReceiverAliases.trace(new Analysis().of(heap)).isEscaped());

        Function fieldRef = new Function("T.fieldRef");
        ib = new IRBuilder(fieldRef);
        Var local = ib.alloc("t");
        ib.store(local, ib.receiver("t"));
        ib.ret(ib.fieldAddr(local, 0, "Name"));
        assertTrue(ReceiverAliases.trace(new Analysis().of(fieldRef)).isEscaped());
    }

    @Test
    void testNotAMethod() {
        Function fn = new Function("f");
        new IRBuilder(fn).ret();
        assertThrows(IllegalArgumentException.class, () -> ReceiverAliases.trace(new Analysis().of(fn)));
    }
}
