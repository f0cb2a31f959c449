package io.github.eutro.flowlint.ssa;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A control instruction, encapsulating a terminator {@link Insn instruction}
 * and the jump targets.
 */
public final class Control {
    private final Insn insn;
    /**
     * The jump targets of this instruction. For {@link Insn.If} the first target
     * is taken when the condition is true, the second when it is false.
     */
    public final List<BasicBlock> targets;
    private BasicBlock owner = null;

    Control(Insn insn, List<BasicBlock> targets) {
        if (!insn.isTerminator()) {
            throw new IllegalArgumentException("not a terminator: " + insn);
        }
        int expected = insn.targetCount();
        if (targets.size() != expected) {
            throw new IllegalArgumentException(insn + " expects " + expected + " targets, got " + targets.size());
        }
        this.insn = insn;
        this.targets = Collections.unmodifiableList(new ArrayList<>(targets));
    }

    /**
     * Get the {@link Insn underlying instruction} of this control instruction.
     *
     * @return The instruction.
     */
    public Insn insn() {
        return insn;
    }

    /**
     * Get the block this control instruction ends.
     *
     * @return The block, or null if it was never inserted.
     */
    public BasicBlock getBlock() {
        return owner;
    }

    void setOwner(BasicBlock block) {
        if (owner != null) throw new IllegalStateException("control already inserted: " + this);
        owner = block;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append(insn);
        if (!targets.isEmpty()) {
            sb.append(" ->");
            for (BasicBlock target : targets) {
                sb.append(' ').append(target.toTargetString());
            }
        }
        return sb.toString();
    }
}
