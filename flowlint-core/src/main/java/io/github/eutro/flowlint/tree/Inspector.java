package io.github.eutro.flowlint.tree;

import io.github.eutro.flowlint.util.F;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/**
 * Pre-order traversal of a syntax tree, using an explicit stack rather than recursion.
 */
public final class Inspector {
    private Inspector() {
    }

    /**
     * Visit {@code root} and its descendants in source order.
     *
     * @param root    The root.
     * @param visitor Called on each node, deciding how the traversal proceeds.
     * @return Whether the traversal was stopped by the visitor.
     */
    public static boolean inspect(TreeNode root, F<TreeNode, Walk> visitor) {
        Deque<TreeNode> stack = new ArrayDeque<>();
        stack.push(root);
        while (!stack.isEmpty()) {
            TreeNode node = stack.pop();
            switch (visitor.apply(node)) {
                case STOP:
                    return true;
                case SKIP:
                    break;
                case CONTINUE:
                    List<TreeNode> children = node.children();
                    for (int i = children.size() - 1; i >= 0; i--) {
                        stack.push(children.get(i));
                    }
                    break;
            }
        }
        return false;
    }
}
