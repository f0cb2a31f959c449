package io.github.eutro.flowlint.ssa;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A basic block, encapsulating a list of {@link Effect} instructions,
 * followed by exactly one {@link Control} instruction at the end.
 */
public final class BasicBlock {
    private final Function function;
    private final int index;
    private final List<Effect> effects = new ArrayList<>();
    private Control control;

    BasicBlock(Function function, int index) {
        this.function = function;
        this.index = index;
    }

    /**
     * Get the index of this block in its function. The entry block has index 0.
     *
     * @return The index.
     */
    public int index() {
        return index;
    }

    public Function getFunction() {
        return function;
    }

    /**
     * Format this block as a jump target, for debugging.
     *
     * @return The jump target string.
     */
    public String toTargetString() {
        return "@" + index;
    }

    /**
     * Get the list of {@link Effect effects} in this basic block.
     *
     * @return The list.
     */
    public List<Effect> getEffects() {
        return Collections.unmodifiableList(effects);
    }

    /**
     * Add an {@link Effect effect} to the end of this basic block.
     *
     * @param effect The effect to add.
     */
    public void addEffect(Effect effect) {
        if (control != null) throw new IllegalStateException(toTargetString() + " is already terminated");
        effect.setOwner(this);
        effect.insn().register(effect, function.nextInsnId());
        effects.add(effect);
    }

    /**
     * Get the control instruction of this block.
     *
     * @return The control instruction, or null if the block is not yet terminated.
     */
    public Control getControl() {
        return control;
    }

    /**
     * Set the control instruction of this block.
     *
     * @param control The control instruction.
     */
    public void setControl(Control control) {
        if (this.control != null) throw new IllegalStateException(toTargetString() + " is already terminated");
        for (BasicBlock target : control.targets) {
            if (target.function != function) {
                throw new IllegalArgumentException("jump to a block of another function");
            }
        }
        control.setOwner(this);
        control.insn().register(control, function.nextInsnId());
        this.control = control;
    }

    /**
     * Get the successors of this block, in the order of the control instruction's targets.
     *
     * @return The successors.
     */
    public List<BasicBlock> successors() {
        return control == null ? Collections.emptyList() : control.targets;
    }

    /**
     * Get every instruction of this block, in order, ending with the control instruction.
     *
     * @return The instructions.
     */
    public List<Insn> insns() {
        List<Insn> insns = new ArrayList<>(effects.size() + 1);
        for (Effect effect : effects) {
            insns.add(effect.insn());
        }
        if (control != null) insns.add(control.insn());
        return insns;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append(toTargetString()).append("\n{\n");
        for (Effect effect : effects) {
            sb.append(' ').append(effect).append('\n');
        }
        sb.append(' ').append(control);
        sb.append("\n}");
        return sb.toString();
    }
}
