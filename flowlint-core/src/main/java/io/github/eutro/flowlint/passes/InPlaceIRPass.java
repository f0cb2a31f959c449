package io.github.eutro.flowlint.passes;

/**
 * An IR pass which is {@link #isInPlace() in-place}.
 * <p>
 * The analysis passes in {@link io.github.eutro.flowlint.passes.meta} are of this kind: they read the
 * function of a {@link io.github.eutro.flowlint.analysis.FunctionAnalysis} and attach what they computed
 * to it as an ext.
 *
 * @param <T> The type of the object this pass operates on.
 */
public interface InPlaceIRPass<T> extends IRPass<T, T> {
    /**
     * Run the pass.
     *
     * @param t The object to run this pass on.
     */
    void runInPlace(T t);

    @Override
    default T run(T t) {
        runInPlace(t);
        return t;
    }

    /**
     * {@inheritDoc}
     *
     * @return {@code true}
     */
    @Override
    default boolean isInPlace() {
        return true;
    }
}
