package io.github.eutro.flowlint.tree;

/**
 * What an {@link Inspector} should do after visiting a node.
 */
public enum Walk {
    /**
     * Visit the children of the node, then carry on.
     */
    CONTINUE,
    /**
     * Do not visit the children of the node, but carry on with its siblings.
     */
    SKIP,
    /**
     * Stop the traversal.
     */
    STOP,
}
