package io.github.eutro.flowlint.tree;

import io.github.eutro.flowlint.source.Node;
import io.github.eutro.flowlint.source.Position;

import java.util.List;
import java.util.Objects;

/**
 * A node of the syntax tree.
 */
public abstract class TreeNode implements Node {
    private final Position position;

    TreeNode(Position position) {
        this.position = Objects.requireNonNull(position, "position");
    }

    @Override
    public Position position() {
        return position;
    }

    /**
     * Get the direct children of this node, in source order.
     *
     * @return The children.
     */
    public abstract List<TreeNode> children();
}
