package io.github.eutro.flowlint.ext;

import org.jetbrains.annotations.Nullable;

import java.util.IdentityHashMap;
import java.util.Map;

/**
 * An {@link ExtContainer} backed by a map.
 */
public class ExtHolder implements ExtContainer {
    private final Map<Ext<?>, Object> facts = new IdentityHashMap<>();

    @Override
    public <T> void attachExt(Ext<T> ext, T value) {
        facts.put(ext, value);
    }

    @SuppressWarnings("unchecked")
    @Override
    public <T> @Nullable T getNullable(Ext<T> ext) {
        return (T) facts.get(ext);
    }
}
