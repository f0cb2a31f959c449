package io.github.eutro.flowlint.tree;

/**
 * A resolved object an identifier refers to: a variable, a label, a function.
 * <p>
 * Symbols are compared by identity, so two identifiers spelled the same may refer to different symbols.
 */
public final class Symbol {
    public enum Kind {
        VAR,
        LABEL,
        FUNC,
        BUILTIN,
        TYPE,
        PACKAGE,
    }

    public final String name;
    public final Kind kind;

    public Symbol(String name, Kind kind) {
        this.name = name;
        this.kind = kind;
    }

    @Override
    public String toString() {
        return kind.name().toLowerCase() + " " + name;
    }
}
