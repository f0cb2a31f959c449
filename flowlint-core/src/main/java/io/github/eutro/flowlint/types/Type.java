package io.github.eutro.flowlint.types;

import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * A type descriptor, as resolved by the front end.
 * <p>
 * Only the structure the checks need is modelled: names, pointers, structs and their
 * fields, and the element types of collections.
 */
public final class Type {
    /**
     * The kind of a type.
     */
    public enum Kind {
        BASIC,
        NAMED,
        POINTER,
        STRUCT,
        SLICE,
        MAP,
        FUNC,
        INTERFACE,
    }

    /**
     * A field of a struct type.
     */
    public static final class Field {
        public final String name;
        public final Type type;

        public Field(String name, Type type) {
            this.name = name;
            this.type = type;
        }

        @Override
        public String toString() {
            return name + " " + type;
        }
    }

    private final Kind kind;
    private final String pkg;
    private final String name;
    @Nullable
    private final Type elem;
    @Nullable
    private final Type key;
    private final List<Field> fields;
    private final boolean unsigned;
    // named types may be declared before their underlying type is known
    @Nullable
    private Type underlying;

    private Type(Kind kind, String pkg, String name, @Nullable Type elem, @Nullable Type key,
                 List<Field> fields, boolean unsigned, @Nullable Type underlying) {
        this.kind = kind;
        this.pkg = pkg;
        this.name = name;
        this.elem = elem;
        this.key = key;
        this.fields = fields;
        this.unsigned = unsigned;
        this.underlying = underlying;
    }

    public static Type basic(String name) {
        return new Type(Kind.BASIC, "", name, null, null, Collections.emptyList(), false, null);
    }

    public static Type unsigned(String name) {
        return new Type(Kind.BASIC, "", name, null, null, Collections.emptyList(), true, null);
    }

    public static Type named(String pkg, String name, @Nullable Type underlying) {
        return new Type(Kind.NAMED, pkg, name, null, null, Collections.emptyList(), false, underlying);
    }

    public static Type pointer(Type elem) {
        return new Type(Kind.POINTER, "", "", elem, null, Collections.emptyList(), false, null);
    }

    public static Type struct(Field... fields) {
        return new Type(Kind.STRUCT, "", "", null, null,
                Collections.unmodifiableList(new ArrayList<>(Arrays.asList(fields))), false, null);
    }

    public static Type slice(Type elem) {
        return new Type(Kind.SLICE, "", "", elem, null, Collections.emptyList(), false, null);
    }

    public static Type map(Type key, Type elem) {
        return new Type(Kind.MAP, "", "", elem, key, Collections.emptyList(), false, null);
    }

    public static Type func() {
        return new Type(Kind.FUNC, "", "", null, null, Collections.emptyList(), false, null);
    }

    public static Type iface() {
        return new Type(Kind.INTERFACE, "", "", null, null, Collections.emptyList(), false, null);
    }

    /**
     * Set the underlying type of a named type declared without one.
     *
     * @param underlying The underlying type.
     */
    public void setUnderlying(Type underlying) {
        if (kind != Kind.NAMED) throw new IllegalStateException("not a named type: " + this);
        if (this.underlying != null) throw new IllegalStateException("underlying type already set: " + this);
        this.underlying = underlying;
    }

    public Kind getKind() {
        return kind;
    }

    public String getName() {
        return name;
    }

    public String getPkg() {
        return pkg;
    }

    /**
     * Get the underlying type: the type itself, unless it is named.
     *
     * @return The underlying type, or null if a named type was never completed.
     */
    @Nullable
    public Type underlying() {
        Type ty = this;
        while (ty != null && ty.kind == Kind.NAMED) {
            ty = ty.underlying;
        }
        return ty;
    }

    /**
     * Get the element type of a pointer, slice or map.
     *
     * @return The element type, or null.
     */
    @Nullable
    public Type elem() {
        return elem;
    }

    @Nullable
    public Type key() {
        return key;
    }

    public List<Field> fields() {
        return fields;
    }

    public boolean isUnsigned() {
        return unsigned;
    }

    /**
     * Whether the underlying type has the given kind.
     *
     * @param kind The kind.
     * @return Whether it does.
     */
    public boolean is(Kind kind) {
        Type u = underlying();
        return u != null && u.kind == kind;
    }

    /**
     * Get the type this points to, if it is a pointer, or itself otherwise.
     *
     * @return The dereferenced type.
     */
    public Type deref() {
        Type u = underlying();
        if (u != null && u.kind == Kind.POINTER && u.elem != null) return u.elem;
        return this;
    }

    /**
     * Whether this is the named type {@code pkg.name}.
     *
     * @param pkg  The package.
     * @param name The name.
     * @return Whether it is.
     */
    public boolean isNamed(String pkg, String name) {
        return kind == Kind.NAMED && this.pkg.equals(pkg) && this.name.equals(name);
    }

    /**
     * Get the name of the {@code index}th field of the underlying struct type.
     *
     * @param index The field index.
     * @return The field name, or null if this is not a struct or has no such field.
     */
    @Nullable
    public String fieldName(int index) {
        Type u = underlying();
        if (u == null || u.kind != Kind.STRUCT || index < 0 || index >= u.fields.size()) return null;
        return u.fields.get(index).name;
    }

    @Override
    public String toString() {
        switch (kind) {
            case BASIC:
                return name;
            case NAMED:
                return pkg.isEmpty() ? name : pkg + "." + name;
            case POINTER:
                return "*" + elem;
            case STRUCT:
                return fields.stream().map(Field::toString)
                        .collect(Collectors.joining("; ", "struct{", "}"));
            case SLICE:
                return "[]" + elem;
            case MAP:
                return "map[" + key + "]" + elem;
            case FUNC:
                return "func";
            case INTERFACE:
                return "interface{}";
            default:
                throw new IllegalStateException();
        }
    }
}
