package io.github.eutro.flowlint.ext;

import io.github.eutro.flowlint.passes.IRPass;
import org.jetbrains.annotations.Nullable;

/**
 * Something facts can be attached to, keyed by {@link Ext}.
 */
public interface ExtContainer {
    /**
     * Attach a fact, replacing any previous one for the same ext.
     *
     * @param ext   The ext.
     * @param value The fact.
     * @param <T>   The type of the fact.
     */
    <T> void attachExt(Ext<T> ext, T value);

    /**
     * Get the fact attached for {@code ext}.
     *
     * @param ext The ext.
     * @param <T> The type of the fact.
     * @return The fact, or null if none is attached.
     */
    <T> @Nullable T getNullable(Ext<T> ext);

    /**
     * Get the fact attached for {@code ext}, running {@code pass} on {@code o} first if there is none.
     * The pass must attach it.
     *
     * @param ext  The ext.
     * @param o    The input of the pass.
     * @param pass The pass computing the fact.
     * @param <T>  The type of the fact.
     * @param <O>  The input type of the pass.
     * @return The fact.
     * @throws IllegalStateException If the pass did not attach the fact.
     */
    default <T, O> T getExtOrRun(Ext<T> ext, O o, IRPass<O, ?> pass) {
        T value = getNullable(ext);
        if (value != null) return value;
        pass.run(o);
        value = getNullable(ext);
        if (value == null) throw new IllegalStateException(pass + " did not compute " + ext);
        return value;
    }
}
