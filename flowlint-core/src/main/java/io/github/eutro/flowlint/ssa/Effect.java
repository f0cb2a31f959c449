package io.github.eutro.flowlint.ssa;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * An effect, encapsulating a non-terminator {@link Insn instruction}, and the
 * variables its results are assigned to.
 */
public final class Effect {
    private final List<Var> assignsTo;
    private final Insn insn;
    private BasicBlock owner = null;

    Effect(List<Var> assignsTo, Insn insn) {
        if (insn.isTerminator()) {
            throw new IllegalArgumentException("terminator used as an effect: " + insn);
        }
        this.assignsTo = Collections.unmodifiableList(new ArrayList<>(assignsTo));
        this.insn = insn;
        for (Var var : this.assignsTo) {
            var.setAssignedAt(this);
        }
    }

    /**
     * Get the list of variables this effect assigns to.
     *
     * @return The list.
     */
    public List<Var> getAssignsTo() {
        return assignsTo;
    }

    /**
     * Get the {@link Insn underlying instruction} of this effect.
     *
     * @return The instruction.
     */
    public Insn insn() {
        return insn;
    }

    /**
     * Get the block this effect is in.
     *
     * @return The block, or null if it was never inserted.
     */
    public BasicBlock getBlock() {
        return owner;
    }

    void setOwner(BasicBlock block) {
        if (owner != null) throw new IllegalStateException("effect already inserted: " + this);
        owner = block;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        switch (assignsTo.size()) {
            case 0:
                break;
            case 1:
                sb.append(assignsTo.get(0)).append(" = ");
                break;
            default:
                sb.append(assignsTo.stream()
                        .map(Objects::toString)
                        .collect(Collectors.joining(", ", "", " = ")));
                break;
        }
        sb.append(insn);
        return sb.toString();
    }
}
