package io.github.eutro.flowlint.analysis;

import io.github.eutro.flowlint.ssa.BasicBlock;
import io.github.eutro.flowlint.ssa.Insn;

import java.util.*;

/**
 * Control-flow reachability queries over the blocks of a function.
 */
public final class Reachability {
    private Reachability() {
    }

    /**
     * Whether some path leads from {@code from} to the block containing {@code to}, entering none of the
     * {@code avoiding} blocks.
     * <p>
     * An avoided block is never entered, so if {@code from} itself is avoided nothing is reachable.
     * The instruction's own block counts as reached even if it lies earlier in {@code from}.
     *
     * @param from     The block to start at.
     * @param to       The instruction to reach.
     * @param avoiding The blocks paths may not pass through.
     * @return Whether {@code to} is reachable.
     */
    public static boolean reachable(BasicBlock from, Insn to, Collection<BasicBlock> avoiding) {
        BasicBlock target = to.block();
        if (target == null) throw new IllegalArgumentException(to + " is not inserted");
        return reachable(from, target, avoiding);
    }

    public static boolean reachable(BasicBlock from, Insn to) {
        return reachable(from, to, Collections.emptySet());
    }

    /**
     * Whether some path leads from {@code from} to {@code target}, entering none of the
     * {@code avoiding} blocks.
     *
     * @param from     The block to start at.
     * @param target   The block to reach.
     * @param avoiding The blocks paths may not pass through.
     * @return Whether {@code target} is reachable.
     */
    public static boolean reachable(BasicBlock from, BasicBlock target, Collection<BasicBlock> avoiding) {
        if (from.getFunction() != target.getFunction()) {
            throw new IllegalArgumentException("blocks of different functions");
        }
        BitSet seen = new BitSet(from.getFunction().blockCount());
        for (BasicBlock avoided : avoiding) {
            if (avoided.getFunction() == from.getFunction()) seen.set(avoided.index());
        }
        if (seen.get(from.index())) return false;
        Deque<BasicBlock> stack = new ArrayDeque<>();
        stack.push(from);
        seen.set(from.index());
        while (!stack.isEmpty()) {
            BasicBlock block = stack.pop();
            if (block == target) return true;
            for (BasicBlock succ : block.successors()) {
                if (!seen.get(succ.index())) {
                    seen.set(succ.index());
                    stack.push(succ);
                }
            }
        }
        return false;
    }

    /**
     * Collect every block reachable from {@code from}, including itself.
     *
     * @param from The block to start at.
     * @return The reachable blocks.
     */
    public static BitSet reachableFrom(BasicBlock from) {
        BitSet seen = new BitSet(from.getFunction().blockCount());
        Deque<BasicBlock> stack = new ArrayDeque<>();
        stack.push(from);
        seen.set(from.index());
        while (!stack.isEmpty()) {
            for (BasicBlock succ : stack.pop().successors()) {
                if (!seen.get(succ.index())) {
                    seen.set(succ.index());
                    stack.push(succ);
                }
            }
        }
        return seen;
    }
}
