package io.github.eutro.flowlint.util;

import io.github.eutro.flowlint.ssa.BasicBlock;
import io.github.eutro.flowlint.ssa.Function;

import java.util.*;

/**
 * Walks a graph depth-first from a root, in pre- or post-order. Nodes not reachable from the root
 * are never visited.
 *
 * @param <T> The type of a node in the graph.
 */
public final class GraphWalker<T> {
    private final T root;
    private final F<? super T, ? extends Iterable<? extends T>> getChildren;

    /**
     * Construct a graph walker from a root node and a successor function.
     *
     * @param root        The root of the graph to walk from.
     * @param getChildren The successor function of the graph.
     */
    public GraphWalker(T root, F<? super T, ? extends Iterable<? extends T>> getChildren) {
        this.root = root;
        this.getChildren = getChildren;
    }

    /**
     * Create a graph walker over the control flow graph of a function, starting at its entry.
     *
     * @param func The function, which must have a body.
     * @return The graph walker.
     */
    public static GraphWalker<BasicBlock> blockWalker(Function func) {
        BasicBlock entry = func.getEntry();
        if (entry == null) throw new IllegalArgumentException(func.name + " has no body");
        return new GraphWalker<>(entry, BasicBlock::successors);
    }

    /**
     * Collect every node reachable from the root, each visited before its children.
     *
     * @return The nodes in pre-order.
     */
    public List<T> preOrder() {
        List<T> order = new ArrayList<>();
        Deque<T> stack = new ArrayDeque<>();
        Set<T> seen = new HashSet<>();
        stack.push(root);
        seen.add(root);
        while (!stack.isEmpty()) {
            T top = stack.pop();
            order.add(top);
            List<T> children = new ArrayList<>();
            for (T child : getChildren.apply(top)) {
                if (seen.add(child)) children.add(child);
            }
            // first child on top
            for (ListIterator<T> it = children.listIterator(children.size()); it.hasPrevious(); ) {
                stack.push(it.previous());
            }
        }
        return order;
    }

    /**
     * Collect every node reachable from the root, each visited after all the children it discovered.
     *
     * @return The nodes in post-order.
     */
    public List<T> postOrder() {
        List<T> order = new ArrayList<>();
        Deque<Iterator<? extends T>> iters = new ArrayDeque<>();
        Deque<T> path = new ArrayDeque<>();
        Set<T> seen = new HashSet<>();
        seen.add(root);
        path.push(root);
        iters.push(getChildren.apply(root).iterator());
        while (!path.isEmpty()) {
            Iterator<? extends T> it = iters.peek();
            if (it.hasNext()) {
                T next = it.next();
                if (seen.add(next)) {
                    path.push(next);
                    iters.push(getChildren.apply(next).iterator());
                }
            } else {
                iters.pop();
                order.add(path.pop());
            }
        }
        return order;
    }
}
