package io.github.eutro.flowlint.ext;

/**
 * A typed key for a fact stored in an {@link ExtContainer}.
 * <p>
 * Exts compare by identity.
 *
 * @param <T> The type of the fact.
 */
public final class Ext<T> {
    private final Class<?> type;
    private final String name;

    private Ext(Class<?> type, String name) {
        this.type = type;
        this.name = name;
    }

    /**
     * Create a new ext. The class is only used in {@link #toString()}, so it may be
     * the raw class of a parameterised type.
     *
     * @param type The class of the fact.
     * @param name The name of the ext.
     * @param <T>  The class.
     * @param <R>  The type of the fact.
     * @return The new ext.
     */
    public static <T, R extends T> Ext<R> create(Class<T> type, String name) {
        return new Ext<>(type, name);
    }

    @Override
    public String toString() {
        return name + ": " + type.getName();
    }
}
