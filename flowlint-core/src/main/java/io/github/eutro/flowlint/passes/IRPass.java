package io.github.eutro.flowlint.passes;

/**
 * A pass over some part of the program representation, producing a result.
 *
 * @param <A> The type of the input.
 * @param <B> The type of the result.
 */
public interface IRPass<A, B> {
    /**
     * Run the pass.
     *
     * @param a The input.
     * @return The result.
     */
    B run(A a);

    /**
     * Whether this pass returns its own input, recording its results on it.
     *
     * @return Whether the pass is in-place.
     */
    default boolean isInPlace() {
        return false;
    }
}
