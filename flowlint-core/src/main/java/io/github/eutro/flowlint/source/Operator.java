package io.github.eutro.flowlint.source;

import org.jetbrains.annotations.Nullable;

/**
 * Binary operators, shared by the syntax tree and the SSA form.
 */
public enum Operator {
    ADD("+"),
    SUB("-"),
    MUL("*"),
    QUO("/"),
    REM("%"),
    AND("&"),
    OR("|"),
    XOR("^"),
    SHL("<<"),
    SHR(">>"),
    LAND("&&"),
    LOR("||"),
    EQL("=="),
    NEQ("!="),
    LSS("<"),
    LEQ("<="),
    GTR(">"),
    GEQ(">="),
    ;

    public final String token;

    Operator(String token) {
        this.token = token;
    }

    /**
     * Whether this is a relational or equality comparison.
     *
     * @return Whether it is.
     */
    public boolean isComparison() {
        switch (this) {
            case EQL:
            case NEQ:
            case LSS:
            case LEQ:
            case GTR:
            case GEQ:
                return true;
            default:
                return false;
        }
    }

    /**
     * Look up an operator by its token.
     *
     * @param token The token, e.g. {@code "=="}.
     * @return The operator, or null if there is none.
     */
    @Nullable
    public static Operator ofToken(String token) {
        for (Operator op : values()) {
            if (op.token.equals(token)) return op;
        }
        return null;
    }

    @Override
    public String toString() {
        return token;
    }
}
