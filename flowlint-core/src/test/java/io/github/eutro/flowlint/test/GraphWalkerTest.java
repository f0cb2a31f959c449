package io.github.eutro.flowlint.test;

import io.github.eutro.flowlint.ssa.BasicBlock;
import io.github.eutro.flowlint.ssa.Function;
import io.github.eutro.flowlint.ssa.IRBuilder;
import io.github.eutro.flowlint.ssa.Var;
import io.github.eutro.flowlint.util.GraphWalker;
import org.junit.jupiter.api.Test;

import java.util.*;

import static org.junit.jupiter.api.Assertions.*;

public class GraphWalkerTest {
    @Test
    void testBlockOrders() {
        Function fn = new Function("diamond");
        IRBuilder ib = new IRBuilder(fn);
        BasicBlock entry = ib.getBlock();
        BasicBlock left = fn.newBb();
        BasicBlock right = fn.newBb();
        BasicBlock join = fn.newBb();
        BasicBlock dead = fn.newBb();
        Var c = ib.param("c");
        ib.branch(c, left, right);
        ib.setBlock(left).jump(join);
        ib.setBlock(right).jump(join);
        ib.setBlock(join).ret();
        ib.setBlock(dead).jump(join);

        GraphWalker<BasicBlock> walker = GraphWalker.blockWalker(fn);
        assertEquals(Arrays.asList(entry, left, join, right), walker.preOrder());
        assertEquals(Arrays.asList(join, left, right, entry), walker.postOrder());
    }

    @Test
    void testCycle() {
        Map<String, List<String>> graph = new HashMap<>();
        graph.put("a", Arrays.asList("b", "c"));
        graph.put("b", Collections.singletonList("a"));
        graph.put("c", Arrays.asList("c", "b"));
        GraphWalker<String> walker = new GraphWalker<>("a", graph::get);
        assertEquals(Arrays.asList("a", "b", "c"), walker.preOrder());
        assertEquals(Arrays.asList("b", "c", "a"), walker.postOrder());
    }

    @Test
    void testNoBody() {
        assertThrows(IllegalArgumentException.class, () -> GraphWalker.blockWalker(new Function("external")));
    }
}
