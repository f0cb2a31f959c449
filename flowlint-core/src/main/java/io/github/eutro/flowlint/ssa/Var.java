package io.github.eutro.flowlint.ssa;

import org.jetbrains.annotations.Nullable;

/**
 * A variable, an SSA value.
 * <p>
 * Each variable is assigned by exactly one {@link Effect}. Constants and parameters are
 * variables too, assigned by {@link Insn.Const} and {@link Insn.Param} instructions.
 */
public final class Var {
    /**
     * The name of the variable. Not necessarily unique.
     */
    public final String name;
    /**
     * The index of the variable, unique within its function and dense from zero.
     */
    public final int index;
    private final Function function;
    private Effect assignedAt = null;

    Var(Function function, String name, int index) {
        this.function = function;
        this.name = name;
        this.index = index;
    }

    /**
     * Get the function this variable belongs to.
     *
     * @return The function.
     */
    public Function getFunction() {
        return function;
    }

    /**
     * Get the effect that assigns this variable.
     *
     * @return The effect, or null if the variable was never assigned.
     */
    @Nullable
    public Effect getAssignedAt() {
        return assignedAt;
    }

    /**
     * Get the instruction that defines this variable.
     *
     * @return The instruction, or null if the variable was never assigned.
     */
    @Nullable
    public Insn definition() {
        return assignedAt == null ? null : assignedAt.insn();
    }

    void setAssignedAt(Effect effect) {
        if (assignedAt != null && assignedAt != effect) {
            throw new IllegalStateException(this + " is assigned more than once");
        }
        assignedAt = effect;
    }

    @Override
    public String toString() {
        return '$' + name + '.' + index;
    }
}
