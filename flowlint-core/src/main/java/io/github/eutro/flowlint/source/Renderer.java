package io.github.eutro.flowlint.source;

/**
 * Renders a node as source-like text.
 * <p>
 * Only used to build diagnostic messages, never to make decisions.
 */
@FunctionalInterface
public interface Renderer {
    /**
     * A renderer using {@link Object#toString()}.
     */
    Renderer DEFAULT = Object::toString;

    /**
     * Render a node.
     *
     * @param node The node.
     * @return The text.
     */
    String render(Node node);
}
