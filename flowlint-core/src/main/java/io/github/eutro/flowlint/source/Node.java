package io.github.eutro.flowlint.source;

/**
 * Anything a diagnostic can be anchored to: syntax tree nodes and instructions.
 */
public interface Node {
    /**
     * Get the position of this node.
     *
     * @return The position.
     */
    Position position();
}
