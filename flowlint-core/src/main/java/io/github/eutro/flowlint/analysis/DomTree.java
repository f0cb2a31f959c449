package io.github.eutro.flowlint.analysis;

import io.github.eutro.flowlint.ssa.BasicBlock;
import io.github.eutro.flowlint.ssa.Function;
import org.jetbrains.annotations.Nullable;

import java.util.*;

/**
 * The dominator tree of a function.
 * <p>
 * Only blocks reachable from the entry are part of the tree. An unreachable block dominates nothing
 * and is dominated by nothing, not even itself.
 * <p>
 * Dominance queries are answered in constant time from pre- and post-order numbers of the tree.
 */
public final class DomTree {
    private final Function function;
    private final int[] idom;
    private final int[] pre;
    private final int[] post;
    private final List<List<BasicBlock>> children;
    private final List<BasicBlock> preorder;

    /**
     * Construct the tree from the immediate dominator of each block.
     *
     * @param function The function.
     * @param idom     The index of the immediate dominator of each block, by block index.
     *                 {@code -1} for the entry block, {@code -2} for unreachable blocks.
     */
    public DomTree(Function function, int[] idom) {
        int n = function.blockCount();
        if (idom.length != n) throw new IllegalArgumentException("expected " + n + " dominators, got " + idom.length);
        this.function = function;
        this.idom = idom.clone();
        this.pre = new int[n];
        this.post = new int[n];
        List<List<BasicBlock>> children = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            children.add(new ArrayList<>());
        }
        List<BasicBlock> blocks = function.getBlocks();
        for (int i = 0; i < n; i++) {
            if (idom[i] >= 0) children.get(idom[i]).add(blocks.get(i));
        }
        for (int i = 0; i < n; i++) {
            children.set(i, Collections.unmodifiableList(children.get(i)));
        }
        this.children = Collections.unmodifiableList(children);

        Arrays.fill(pre, -1);
        Arrays.fill(post, -1);
        List<BasicBlock> preorder = new ArrayList<>();
        if (n != 0) {
            int preCounter = 0;
            int postCounter = 0;
            Deque<int[]> stack = new ArrayDeque<>(); // {block, next child}
            stack.push(new int[]{0, 0});
            pre[0] = preCounter++;
            preorder.add(blocks.get(0));
            while (!stack.isEmpty()) {
                int[] top = stack.peek();
                List<BasicBlock> kids = children.get(top[0]);
                if (top[1] < kids.size()) {
                    BasicBlock kid = kids.get(top[1]++);
                    pre[kid.index()] = preCounter++;
                    preorder.add(kid);
                    stack.push(new int[]{kid.index(), 0});
                } else {
                    post[top[0]] = postCounter++;
                    stack.pop();
                }
            }
        }
        this.preorder = Collections.unmodifiableList(preorder);
    }

    private int check(BasicBlock block) {
        if (block.getFunction() != function) {
            throw new IllegalArgumentException(block.toTargetString() + " is not in " + function.name);
        }
        return block.index();
    }

    public Function getFunction() {
        return function;
    }

    /**
     * Whether the block is reachable from the entry of the function.
     *
     * @param block The block.
     * @return Whether it is reachable.
     */
    public boolean isReachable(BasicBlock block) {
        return pre[check(block)] >= 0;
    }

    /**
     * Get the immediate dominator of a block.
     *
     * @param block The block.
     * @return The immediate dominator, or null for the entry block and unreachable blocks.
     */
    @Nullable
    public BasicBlock idom(BasicBlock block) {
        int d = idom[check(block)];
        return d < 0 ? null : function.getBlocks().get(d);
    }

    /**
     * Whether {@code a} dominates {@code b}, that is, whether every path from the entry to {@code b}
     * passes through {@code a}. A reachable block dominates itself.
     *
     * @param a The dominator.
     * @param b The dominated block.
     * @return Whether {@code a} dominates {@code b}.
     */
    public boolean dominates(BasicBlock a, BasicBlock b) {
        int ai = check(a);
        int bi = check(b);
        if (pre[ai] < 0 || pre[bi] < 0) return false;
        return pre[ai] <= pre[bi] && post[bi] <= post[ai];
    }

    public boolean strictlyDominates(BasicBlock a, BasicBlock b) {
        return a != b && dominates(a, b);
    }

    /**
     * Get the blocks immediately dominated by a block.
     *
     * @param block The block.
     * @return The children of the block in the tree.
     */
    public List<BasicBlock> children(BasicBlock block) {
        return children.get(check(block));
    }

    /**
     * Get the reachable blocks of the function, each preceding the blocks it dominates.
     *
     * @return The blocks in a pre-order of the tree.
     */
    public List<BasicBlock> preorder() {
        return preorder;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("DomTree(").append(function.name).append(')');
        for (BasicBlock block : preorder) {
            BasicBlock d = idom(block);
            sb.append(' ').append(block.toTargetString()).append("<-").append(d == null ? "entry" : d.toTargetString());
        }
        return sb.toString();
    }
}
